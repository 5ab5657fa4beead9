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
import com.firmenakte.aggregate.session.SessionManager;
import com.firmenakte.config.AggregatorProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Company "About" page on the professional network. Requests carry the stored session cookies; any
 * sign of a login wall invalidates the session so later runs fail fast until it is refreshed.
 */
@Component
public class LinkedInAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(LinkedInAdapter.class);
    static final String DEFAULT_BASE_URL = "https://www.linkedin.com";
    static final String SEARCH_PATH = "/search/results/companies/";
    private static final List<String> LOGIN_WALL_PATHS = List.of("/login", "/authwall", "/checkpoint", "/uas/login");

    private final SourceHttpClient httpClient;
    private final SessionManager sessionManager;
    private final AggregatorProperties properties;

    public LinkedInAdapter(SourceHttpClient httpClient, SessionManager sessionManager, AggregatorProperties properties) {
        this.httpClient = httpClient;
        this.sessionManager = sessionManager;
        this.properties = properties;
    }

    @Override
    public SourceId source() {
        return SourceId.LINKEDIN;
    }

    @Override
    public boolean requiresSession() {
        return true;
    }

    @Override
    public boolean supports(CompanyIdentity identity) {
        return identity.hasCompanyName();
    }

    @Override
    public RawPayload fetch(CompanyIdentity identity, SessionState session) throws SourceFetchException {
        if (session == null || !session.usable()) {
            throw new SourceFetchException(FailureKind.AUTH_EXPIRED, "no valid session");
        }
        Map<String, String> headers = Map.of("Cookie", cookieHeader(session.credentialBlob()));

        String searchUrl = SourcePages.url(baseUrl(), SEARCH_PATH, SourcePages.query("keywords", identity.companyName()));
        HttpFetchResult search = authenticated(httpClient.get(searchUrl, SourcePages.HTML_ACCEPT, headers), session);
        Document results = SourcePages.parse(search);

        Element companyLink = results.selectFirst("a[href*=/company/]");
        if (companyLink == null) {
            if (SourcePages.indicatesNoHits(results)) {
                throw new SourceFetchException(FailureKind.RECORD_NOT_FOUND, "no company result for " + identity.companyName());
            }
            throw new SourceFetchException(FailureKind.MALFORMED_RESPONSE, "no company links on " + results.location());
        }
        if (!matchesName(companyLink.text(), identity.companyName())) {
            log.info("First LinkedIn company result '{}' does not match '{}', using it anyway", companyLink.text(), identity.companyName());
        }

        String aboutUrl = aboutUrl(companyLink.absUrl("href"));
        HttpFetchResult about = authenticated(httpClient.get(aboutUrl, SourcePages.HTML_ACCEPT, headers), session);
        Document aboutPage = SourcePages.parse(about);
        Element section = aboutPage.selectFirst("section.org-page-details-module__card-spacing, section.artdeco-card:has(dl)");
        String html = section != null ? section.outerHtml() : about.body();
        return new RawPayload(
            SourceId.LINKEDIN,
            List.of(RawDocument.html(CanonicalField.ABOUT_HTML, about.finalUrlOrRequested(), html)),
            Instant.now()
        );
    }

    private HttpFetchResult authenticated(HttpFetchResult result, SessionState session) throws SourceFetchException {
        try {
            SourcePages.requireSuccess(result, true);
        } catch (SourceFetchException e) {
            if (e.getKind() == FailureKind.AUTH_EXPIRED) {
                sessionManager.markInvalid(session);
            }
            throw e;
        }
        if (isLoginWall(result)) {
            sessionManager.markInvalid(session);
            throw new SourceFetchException(FailureKind.AUTH_EXPIRED, "login wall at " + result.finalUrlOrRequested());
        }
        return result;
    }

    private boolean isLoginWall(HttpFetchResult result) {
        String path = result.finalUri() == null || result.finalUri().getPath() == null
            ? ""
            : result.finalUri().getPath().toLowerCase(Locale.ROOT);
        for (String marker : LOGIN_WALL_PATHS) {
            if (path.startsWith(marker)) {
                return true;
            }
        }
        Document page = SourcePages.parse(result);
        return page.selectFirst("form.login__form, input[name=session_key], form[action*=login-submit]") != null;
    }

    private boolean matchesName(String linkText, String companyName) {
        String found = linkText.trim().toLowerCase(Locale.ROOT);
        String wanted = companyName.toLowerCase(Locale.ROOT);
        return !found.isEmpty() && (found.contains(wanted) || wanted.contains(found));
    }

    static String aboutUrl(String companyUrl) {
        String base = companyUrl;
        int query = base.indexOf('?');
        if (query >= 0) {
            base = base.substring(0, query);
        }
        if (!base.endsWith("/")) {
            base = base + "/";
        }
        return base.endsWith("/about/") ? base : base + "about/";
    }

    static String cookieHeader(String credentialBlob) {
        String blob = credentialBlob.trim();
        return blob.contains("=") ? blob : "li_at=" + blob;
    }

    private String baseUrl() {
        String configured = properties.source(SourceId.LINKEDIN).getBaseUrl();
        return configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured;
    }
}
