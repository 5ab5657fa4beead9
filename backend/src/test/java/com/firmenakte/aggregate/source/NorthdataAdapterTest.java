package com.firmenakte.aggregate.source;

import com.firmenakte.aggregate.http.SourceHttpClient;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.RawPayload;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.config.AggregatorProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NorthdataAdapterTest {
    private MockWebServer server;
    private ExecutorService executor;
    private NorthdataAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        AggregatorProperties properties = new AggregatorProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(2);
        properties.source(SourceId.NORTHDATA).setBaseUrl(server.url("/").toString());
        executor = Executors.newFixedThreadPool(1);
        adapter = new NorthdataAdapter(new SourceHttpClient(properties, executor), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void searchLandingOnCompanyPageIsUsedDirectly() throws Exception {
        server.enqueue(new MockResponse().setBody(
            "<html><body><h1 class=\"heading\">MAGNA Powertrain GmbH, Berlin</h1><p>Umsatz 12 Mio. EUR</p></body></html>"));

        RawPayload payload = adapter.fetch(new CompanyIdentity("MAGNA Powertrain GmbH", null, null), null);

        assertThat(payload.documents()).hasSize(1);
        assertThat(payload.documents().get(0).artifactField()).isEqualTo(CanonicalField.HTML_FILEPATH);
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(server.takeRequest().getRequestUrl().queryParameter("query")).isEqualTo("MAGNA Powertrain GmbH");
    }

    @Test
    void picksResultMatchingRegisterNumber() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            <html><body><h1>Suchergebnisse</h1>
              <div class="event" data-uri="/MAGNA+Steyr,+Graz/FN+1">MAGNA Steyr FN 1</div>
              <div class="event" data-uri="/MAGNA+Powertrain+GmbH,+Berlin/HRB+12345">MAGNA Powertrain HRB 12345</div>
            </body></html>
            """));
        server.enqueue(new MockResponse().setBody("<html><body><h1>MAGNA Powertrain GmbH</h1></body></html>"));

        RawPayload payload = adapter.fetch(new CompanyIdentity("MAGNA", "HRB12345", null), null);

        assertThat(payload.documents()).extracting(RawDocument::artifactField)
            .containsExactly(CanonicalField.HTML_FILEPATH, CanonicalField.SEARCH_RESULTS_HTML);
        server.takeRequest();
        assertThat(server.takeRequest().getPath()).isEqualTo("/MAGNA+Powertrain+GmbH,+Berlin/HRB+12345");
    }

    @Test
    void noResultsIsRecordNotFound() {
        server.enqueue(new MockResponse().setBody("<html><body><h1>Suche</h1><p>Keine Treffer</p></body></html>"));

        assertThatThrownBy(() -> adapter.fetch(new CompanyIdentity("Unbekannt GmbH", null, null), null))
            .isInstanceOf(SourceFetchException.class)
            .extracting(e -> ((SourceFetchException) e).getKind())
            .isEqualTo(FailureKind.RECORD_NOT_FOUND);
    }

    @Test
    void throttledSearchIsRateLimited() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThatThrownBy(() -> adapter.fetch(new CompanyIdentity("MAGNA", null, null), null))
            .isInstanceOf(SourceFetchException.class)
            .extracting(e -> ((SourceFetchException) e).getKind())
            .isEqualTo(FailureKind.RATE_LIMITED);
    }
}
