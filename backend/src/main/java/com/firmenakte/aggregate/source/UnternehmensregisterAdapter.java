package com.firmenakte.aggregate.source;

import com.firmenakte.aggregate.http.HttpFetchResult;
import com.firmenakte.aggregate.http.SourceHttpClient;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.RawPayload;
import com.firmenakte.aggregate.model.SessionState;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.config.AggregatorProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Official company register. Only the most recent published Jahresabschluss is fetched; older years
 * are left for a later run.
 */
@Component
public class UnternehmensregisterAdapter implements SourceAdapter {
    static final String DEFAULT_BASE_URL = "https://www.unternehmensregister.de";
    static final String SEARCH_PATH = "/de/suche";

    private final SourceHttpClient httpClient;
    private final AggregatorProperties properties;

    public UnternehmensregisterAdapter(SourceHttpClient httpClient, AggregatorProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public SourceId source() {
        return SourceId.UNTERNEHMENSREGISTER;
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
        String searchUrl = SourcePages.url(
            baseUrl(),
            SEARCH_PATH,
            SourcePages.query("companyName", identity.companyName(), "registerNumber", identity.registernummer())
        );
        HttpFetchResult search = SourcePages.requireSuccess(httpClient.get(searchUrl, SourcePages.HTML_ACCEPT), false);
        Document results = SourcePages.parse(search);

        Element link = jahresabschlussLink(results);
        if (link == null) {
            String detail = SourcePages.indicatesNoHits(results)
                ? "no register publication for "
                : "no Jahresabschluss published for ";
            throw new SourceFetchException(FailureKind.RECORD_NOT_FOUND, detail + identity.displayName());
        }

        HttpFetchResult statement = SourcePages.requireSuccess(
            httpClient.get(link.absUrl("href"), SourcePages.HTML_ACCEPT),
            false
        );
        return new RawPayload(
            SourceId.UNTERNEHMENSREGISTER,
            List.of(
                RawDocument.html(CanonicalField.JAHRESABSCHLUSS_HTML, statement.finalUrlOrRequested(), statement.body()),
                RawDocument.html(CanonicalField.SEARCH_RESULTS_HTML, search.finalUrlOrRequested(), search.body())
            ),
            Instant.now()
        );
    }

    private Element jahresabschlussLink(Document results) {
        Element fallback = null;
        for (Element link : results.select("a[href]")) {
            String text = link.text();
            if (text.contains("Jahresabschluss zum Geschäftsjahr")) {
                return link;
            }
            if (fallback == null && text.contains("Jahresabschluss")) {
                fallback = link;
            }
        }
        return fallback;
    }

    private String baseUrl() {
        String configured = properties.source(SourceId.UNTERNEHMENSREGISTER).getBaseUrl();
        return configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured;
    }
}
