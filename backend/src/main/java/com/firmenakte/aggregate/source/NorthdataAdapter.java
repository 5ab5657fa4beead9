package com.firmenakte.aggregate.source;

import com.firmenakte.aggregate.http.HttpFetchResult;
import com.firmenakte.aggregate.http.SourceHttpClient;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.RawPayload;
import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.config.AggregatorProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class NorthdataAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(NorthdataAdapter.class);
    static final String DEFAULT_BASE_URL = "https://www.northdata.de";
    static final String SEARCH_PATH = "/search";

    private final SourceHttpClient httpClient;
    private final AggregatorProperties properties;

    public NorthdataAdapter(SourceHttpClient httpClient, AggregatorProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public SourceId source() {
        return SourceId.NORTHDATA;
    }

    @Override
    public boolean requiresSession() {
        return false;
    }

    @Override
    public boolean supports(CompanyIdentity identity) {
        return identity.hasCompanyName() || identity.hasRegisternummer();
    }

    @Override
    public RawPayload fetch(CompanyIdentity identity, SessionState session) throws SourceFetchException {
        String term = identity.hasCompanyName() ? identity.companyName() : identity.registernummer();
        String searchUrl = SourcePages.url(baseUrl(), SEARCH_PATH, SourcePages.query("query", term));
        HttpFetchResult search = SourcePages.requireSuccess(httpClient.get(searchUrl, SourcePages.HTML_ACCEPT), false);
        Document landing = SourcePages.parse(search);

        List<RawDocument> documents = new ArrayList<>();
        if (isCompanyPage(landing, identity)) {
            log.debug("Northdata search for {} landed on the company page", term);
            documents.add(RawDocument.html(CanonicalField.HTML_FILEPATH, search.finalUrlOrRequested(), search.body()));
            return new RawPayload(SourceId.NORTHDATA, documents, Instant.now());
        }

        String companyUrl = pickResult(landing, identity);
        if (companyUrl == null) {
            if (SourcePages.indicatesNoHits(landing)) {
                throw new SourceFetchException(FailureKind.RECORD_NOT_FOUND, "no Northdata result for " + term);
            }
            throw new SourceFetchException(FailureKind.MALFORMED_RESPONSE, "unrecognized Northdata result page " + search.finalUrlOrRequested());
        }

        HttpFetchResult company = SourcePages.requireSuccess(httpClient.get(companyUrl, SourcePages.HTML_ACCEPT), false);
        documents.add(RawDocument.html(CanonicalField.HTML_FILEPATH, company.finalUrlOrRequested(), company.body()));
        documents.add(RawDocument.html(CanonicalField.SEARCH_RESULTS_HTML, search.finalUrlOrRequested(), search.body()));
        return new RawPayload(SourceId.NORTHDATA, documents, Instant.now());
    }

    private boolean isCompanyPage(Document page, CompanyIdentity identity) {
        Element heading = page.selectFirst("span.heading, h1.heading, h1");
        if (heading == null || !identity.hasCompanyName()) {
            return false;
        }
        return heading.text().toLowerCase(Locale.ROOT).contains(identity.companyName().toLowerCase(Locale.ROOT));
    }

    private String pickResult(Document page, CompanyIdentity identity) {
        Elements events = page.select(".event");
        if (events.isEmpty()) {
            return null;
        }
        Element chosen = events.first();
        if (identity.hasRegisternummer()) {
            String wanted = identity.registernummer().replace(" ", "");
            for (Element event : events) {
                if (event.text().replace(" ", "").toUpperCase(Locale.ROOT).contains(wanted)) {
                    chosen = event;
                    break;
                }
            }
        }
        String dataUri = chosen.attr("data-uri");
        if (!dataUri.isBlank()) {
            return httpClient.resolve(page.location(), dataUri);
        }
        Element link = chosen.selectFirst("a.title[href], a[href]");
        return link == null ? null : link.absUrl("href");
    }

    private String baseUrl() {
        String configured = properties.source(SourceId.NORTHDATA).getBaseUrl();
        return configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured;
    }
}
