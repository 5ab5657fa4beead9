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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Commercial register search. The result row links the structured content (SI, XJustiz XML) and the
 * current printout (AD, PDF); both are downloaded, XML first because it is the more reliable parse.
 */
@Component
public class HandelsregisterAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(HandelsregisterAdapter.class);
    static final String DEFAULT_BASE_URL = "https://www.handelsregister.de";
    static final String SEARCH_PATH = "/rp_web/erweitertesuche.xhtml";

    private final SourceHttpClient httpClient;
    private final AggregatorProperties properties;

    public HandelsregisterAdapter(SourceHttpClient httpClient, AggregatorProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public SourceId source() {
        return SourceId.HANDELSREGISTER;
    }

    @Override
    public boolean requiresSession() {
        return false;
    }

    @Override
    public boolean supports(CompanyIdentity identity) {
        return identity.hasRegisternummer() || identity.hasCompanyName();
    }

    @Override
    public RawPayload fetch(CompanyIdentity identity, SessionState session) throws SourceFetchException {
        String searchUrl = SourcePages.url(
            baseUrl(),
            SEARCH_PATH,
            SourcePages.query(
                "registerNummer", registerDigits(identity.registernummer()),
                "registerArt", registerType(identity.registernummer()),
                "schlagwoerter", identity.hasRegisternummer() ? null : identity.companyName()
            )
        );
        HttpFetchResult search = SourcePages.requireSuccess(httpClient.get(searchUrl, SourcePages.HTML_ACCEPT), false);
        Document page = SourcePages.parse(search);

        String siUrl = documentLink(page, "SI");
        String adUrl = documentLink(page, "AD");
        if (siUrl == null && adUrl == null) {
            if (SourcePages.indicatesNoHits(page)) {
                throw new SourceFetchException(FailureKind.RECORD_NOT_FOUND, "no register entry for " + identity.displayName());
            }
            throw new SourceFetchException(FailureKind.MALFORMED_RESPONSE, "no SI/AD document links on " + search.finalUrlOrRequested());
        }

        List<RawDocument> documents = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        SourceFetchException firstFailure = null;
        for (DocumentLink link : List.of(
            new DocumentLink(siUrl, DocumentFormat.XML, CanonicalField.XML_FILEPATH),
            new DocumentLink(adUrl, DocumentFormat.PDF, CanonicalField.PDF_FILEPATH)
        )) {
            if (link.url() == null) {
                continue;
            }
            try {
                HttpFetchResult download = SourcePages.requireSuccess(
                    httpClient.get(link.url(), SourcePages.DOCUMENT_ACCEPT),
                    false
                );
                documents.add(new RawDocument(
                    link.format(),
                    link.artifactField(),
                    download.finalUrlOrRequested(),
                    download.bodyBytes(),
                    download.contentType()
                ));
            } catch (SourceFetchException e) {
                log.warn("Handelsregister {} download failed: {}", link.format(), e.getMessage());
                failures.add(link.format() + " download failed (" + e.getKind() + "): " + e.getMessage());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (documents.isEmpty() && firstFailure != null) {
            throw firstFailure;
        }
        return new RawPayload(SourceId.HANDELSREGISTER, documents, Instant.now(), failures);
    }

    private String documentLink(Document page, String documentType) {
        String marker = "dokumentart." + documentType.toLowerCase(Locale.ROOT);
        for (Element link : page.select("a[href]")) {
            String href = link.attr("href").toLowerCase(Locale.ROOT);
            String onclick = link.attr("onclick").toLowerCase(Locale.ROOT);
            boolean matches = href.contains(marker)
                || onclick.contains(marker)
                || documentType.equalsIgnoreCase(link.text().trim());
            if (matches && !href.isBlank() && !href.startsWith("#") && !href.startsWith("javascript")) {
                return link.absUrl("href");
            }
        }
        return null;
    }

    private String baseUrl() {
        String configured = properties.source(SourceId.HANDELSREGISTER).getBaseUrl();
        return configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured;
    }

    static String registerType(String registernummer) {
        if (registernummer == null) {
            return null;
        }
        String upper = registernummer.toUpperCase(Locale.ROOT);
        return upper.startsWith("HRA") ? "HRA" : upper.startsWith("HRB") ? "HRB" : null;
    }

    static String registerDigits(String registernummer) {
        if (registernummer == null) {
            return null;
        }
        String digits = registernummer.replaceAll("^(?i)HR[AB]", "").trim();
        return digits.isEmpty() ? null : digits;
    }

    private record DocumentLink(String url, DocumentFormat format, CanonicalField artifactField) {
    }
}
