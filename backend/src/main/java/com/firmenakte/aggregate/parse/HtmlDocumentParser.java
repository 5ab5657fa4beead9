package com.firmenakte.aggregate.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class HtmlDocumentParser implements DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(HtmlDocumentParser.class);
    private static final Set<String> ORGANIZATION_TYPES = Set.of(
        "organization",
        "corporation",
        "localbusiness",
        "realestateagent"
    );

    private final ObjectMapper objectMapper;

    public HtmlDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.HTML;
    }

    @Override
    public PartialFieldMap parse(RawDocument document, SourceId source, Instant fetchedAt) throws DocumentParseException {
        String html = document.text();
        if (html.isBlank()) {
            throw new DocumentParseException("Empty HTML document " + document.artifactRef());
        }
        Document page = Jsoup.parse(html, document.artifactRef() == null ? "" : document.artifactRef());
        Element body = page.body();
        if (body == null || (body.text().isBlank() && page.select("script[type=application/ld+json]").isEmpty())) {
            throw new DocumentParseException("HTML document has no content " + document.artifactRef());
        }

        PartialFieldMap fields = new PartialFieldMap(source, fetchedAt);
        // result listings name other companies as well, so they are kept as artifacts only
        if (document.artifactField() == CanonicalField.SEARCH_RESULTS_HTML) {
            return fields;
        }

        extractJsonLd(page, fields);
        extractDefinitionList(page, fields);
        extractLinks(page, fields);
        extractText(blockText(body), fields);
        log.debug("Parsed {} fields from {} HTML {}", fields.size(), source.key(), document.artifactRef());
        return fields;
    }

    private void extractJsonLd(Document page, PartialFieldMap fields) {
        List<JsonNode> organizations = new ArrayList<>();
        for (Element script : page.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectOrganizationNodes(objectMapper.readTree(payload), organizations);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        for (JsonNode node : organizations) {
            fields.putIfAbsent(CanonicalField.GRUENDUNGSDATUM, GermanTextPatterns.isoDate(text(node, "foundingDate")));
            fields.putIfAbsent(CanonicalField.TELEFONNUMMER, text(node, "telephone"));
            String email = text(node, "email");
            fields.putIfAbsent(CanonicalField.EMAIL, email == null ? null : email.replaceFirst("(?i)^mailto:", ""));
            fields.putIfAbsent(CanonicalField.MITARBEITER, employees(node.get("numberOfEmployees")));
            fields.putIfAbsent(CanonicalField.UST_IDNR, text(node, "vatID"));
            JsonNode address = node.get("address");
            if (address != null && address.isObject()) {
                fields.putIfAbsent(CanonicalField.GESCHAEFTSADRESSE, formatAddress(address));
                fields.putIfAbsent(CanonicalField.LAND_DES_HAUPTSITZES, country(text(address, "addressCountry")));
            }
        }
    }

    private void collectOrganizationNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isOrganizationType(node.get("@type"))) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectOrganizationNodes(value, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectOrganizationNodes(child, out);
            }
        }
    }

    private boolean isOrganizationType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return ORGANIZATION_TYPES.contains(typeNode.asText().toLowerCase(Locale.ROOT));
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && ORGANIZATION_TYPES.contains(child.asText().toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    private void extractDefinitionList(Document page, PartialFieldMap fields) {
        Map<String, Element> entries = new LinkedHashMap<>();
        for (Element dt : page.select("dt")) {
            Element dd = dt.nextElementSibling();
            while (dd != null && !"dd".equals(dd.normalName())) {
                if ("dt".equals(dd.normalName())) {
                    dd = null;
                    break;
                }
                dd = dd.nextElementSibling();
            }
            if (dd != null) {
                entries.putIfAbsent(dt.text().trim().toLowerCase(Locale.ROOT), dd);
            }
        }
        for (Map.Entry<String, Element> entry : entries.entrySet()) {
            String label = entry.getKey();
            Element dd = entry.getValue();
            Element link = dd.selectFirst("a[href]");
            String value = dd.text();
            if (label.startsWith("website") || label.startsWith("webseite")) {
                fields.putIfAbsent(CanonicalField.WEBSITE, link != null ? link.attr("abs:href") : value);
            } else if (label.startsWith("phone") || label.startsWith("telefon")) {
                fields.putIfAbsent(CanonicalField.TELEFONNUMMER, link != null ? link.text() : value);
            } else if (label.startsWith("company size") || label.startsWith("unternehmensgröße")) {
                fields.putIfAbsent(CanonicalField.MITARBEITER, GermanTextPatterns.maxNumber(value));
            } else if (label.startsWith("founded") || label.startsWith("gegründet")) {
                fields.putIfAbsent(CanonicalField.GRUENDUNGSDATUM, GermanTextPatterns.isoDate(value));
            } else if (label.startsWith("headquarters") || label.startsWith("hauptsitz")) {
                fields.putIfAbsent(CanonicalField.GESCHAEFTSADRESSE, value);
            }
        }
    }

    private void extractLinks(Document page, PartialFieldMap fields) {
        Element mail = page.selectFirst("a[href^=mailto:]");
        if (mail != null) {
            String address = mail.attr("href").substring("mailto:".length());
            int query = address.indexOf('?');
            fields.putIfAbsent(CanonicalField.EMAIL, query >= 0 ? address.substring(0, query) : address);
        }
        Element phone = page.selectFirst("a[href^=tel:]");
        if (phone != null) {
            fields.putIfAbsent(CanonicalField.TELEFONNUMMER, phone.text().isBlank()
                ? phone.attr("href").substring("tel:".length())
                : phone.text());
        }
    }

    private void extractText(String text, PartialFieldMap fields) {
        fields.putIfAbsent(CanonicalField.REGISTERNUMMER, GermanTextPatterns.registernummer(text));
        String court = GermanTextPatterns.registerCourt(text);
        fields.putIfAbsent(CanonicalField.HANDELSREGISTER, court);
        fields.putIfAbsent(CanonicalField.GERICHTSSTAND, court == null ? null : "Amtsgericht " + court);
        fields.putIfAbsent(CanonicalField.GESCHAEFTSADRESSE, GermanTextPatterns.geschaeftsanschrift(text));
        fields.putIfAbsent(CanonicalField.UNTERNEHMENSZWECK, GermanTextPatterns.gegenstand(text));
        if (GermanTextPatterns.mentionsParagraph34c(text)) {
            fields.putIfAbsent(CanonicalField.PARAGRAPH_34_GEWO, Boolean.TRUE);
        }
        fields.putIfAbsent(CanonicalField.MITARBEITER, GermanTextPatterns.employees(text));
        fields.putIfAbsent(CanonicalField.UMSATZ, GermanTextPatterns.umsatz(text));
        fields.putIfAbsent(CanonicalField.GEWINN, GermanTextPatterns.gewinn(text));
        if (GermanTextPatterns.mentionsInsolvency(text)) {
            fields.putIfAbsent(CanonicalField.INSOLVENZ, Boolean.TRUE);
        }
        fields.putIfAbsent(CanonicalField.ANZAHL_IMMOBILIEN, GermanTextPatterns.anzahlImmobilien(text));
        fields.putIfAbsent(CanonicalField.GESAMTWERT_IMMOBILIEN, GermanTextPatterns.gesamtwertImmobilien(text));
        List<String> rights = GermanTextPatterns.sonstigeRechte(text);
        if (!rights.isEmpty()) {
            fields.putIfAbsent(CanonicalField.SONSTIGE_RECHTE, rights);
        }
        fields.putIfAbsent(CanonicalField.GRUENDUNGSDATUM, GermanTextPatterns.gruendungsdatum(text));
        fields.putIfAbsent(CanonicalField.AKTIV_SEIT, GermanTextPatterns.aktivSeit(text));
        List<String> managers = GermanTextPatterns.geschaeftsfuehrer(text);
        if (!managers.isEmpty()) {
            fields.putIfAbsent(CanonicalField.GESCHAEFTSFUEHRER, managers);
        }
        fields.putIfAbsent(CanonicalField.TELEFONNUMMER, GermanTextPatterns.telefon(text));
        fields.putIfAbsent(CanonicalField.EMAIL, GermanTextPatterns.email(text));
        fields.putIfAbsent(CanonicalField.UST_IDNR, GermanTextPatterns.ustIdnr(text));
    }

    private Integer employees(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.canConvertToExactIntegral() && node.canConvertToInt() ? node.intValue() : null;
        }
        if (node.isTextual()) {
            return GermanTextPatterns.maxNumber(node.asText());
        }
        if (node.isObject()) {
            Integer value = employees(node.get("value"));
            return value != null ? value : employees(node.get("maxValue"));
        }
        return null;
    }

    private String formatAddress(JsonNode address) {
        String street = text(address, "streetAddress");
        String postalCode = text(address, "postalCode");
        String locality = text(address, "addressLocality");
        String city = String.join(" ", nonBlank(postalCode, locality));
        List<String> parts = nonBlank(street, city);
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    private String country(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim();
        if ("DE".equalsIgnoreCase(normalized) || "DEU".equalsIgnoreCase(normalized) || "Germany".equalsIgnoreCase(normalized)) {
            return "Deutschland";
        }
        return normalized;
    }

    private List<String> nonBlank(String... values) {
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            return value.asText().trim();
        }
        if (value.isObject() && value.has("name")) {
            return text(value, "name");
        }
        return null;
    }

    // one line per block element so line-anchored patterns stop at element boundaries
    private String blockText(Element body) {
        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    out.append(textNode.text());
                } else if (node instanceof Element element && (element.isBlock() || "br".equals(element.normalName()))) {
                    out.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    out.append('\n');
                }
            }
        }, body);
        return out.toString().replaceAll("[ \\t\\x0B\\f\\r]+", " ").replaceAll(" ?\n ?", "\n");
    }
}
