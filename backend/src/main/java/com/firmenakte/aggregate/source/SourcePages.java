package com.firmenakte.aggregate.source;

import com.firmenakte.aggregate.http.HttpFetchResult;
import com.firmenakte.aggregate.model.FailureKind;
import com.firmenakte.aggregate.util.FailureClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

final class SourcePages {
    static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    static final String DOCUMENT_ACCEPT = "application/pdf,application/xml,text/xml;q=0.9,*/*;q=0.8";

    private static final List<String> NO_HIT_MARKERS = List.of(
        "keine treffer",
        "keine ergebnisse",
        "no results",
        "no matching",
        "0 treffer",
        "es wurden keine"
    );

    private SourcePages() {
    }

    static HttpFetchResult requireSuccess(HttpFetchResult result, boolean sessionSource) throws SourceFetchException {
        FailureKind kind = FailureClassifier.classify(result, sessionSource);
        if (kind != null) {
            throw new SourceFetchException(kind, FailureClassifier.describe(result));
        }
        if (result.bodyBytes() == null || result.bodyBytes().length == 0) {
            throw new SourceFetchException(FailureKind.MALFORMED_RESPONSE, "empty body " + result.finalUrlOrRequested());
        }
        return result;
    }

    static Document parse(HttpFetchResult result) {
        return Jsoup.parse(result.body(), result.finalUrlOrRequested());
    }

    static boolean indicatesNoHits(Document page) {
        String text = page.text().toLowerCase(Locale.ROOT);
        for (String marker : NO_HIT_MARKERS) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    static String url(String baseUrl, String path, Map<String, String> query) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : query.entrySet()) {
            if (entry.getValue() != null && !entry.getValue().isBlank()) {
                joiner.add(entry.getKey() + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
            }
        }
        String queryString = joiner.toString();
        return base + path + (queryString.isEmpty() ? "" : "?" + queryString);
    }

    static Map<String, String> query(String... keyValues) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            out.put(keyValues[i], keyValues[i + 1]);
        }
        return out;
    }
}
