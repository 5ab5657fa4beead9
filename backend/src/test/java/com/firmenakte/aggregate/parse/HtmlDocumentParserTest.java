package com.firmenakte.aggregate.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HtmlDocumentParserTest {
    private final HtmlDocumentParser parser = new HtmlDocumentParser(new ObjectMapper());

    @Test
    void companyPageCombinesJsonLdAndText() throws Exception {
        String html = """
            <html><head>
            <script type="application/ld+json">
            {"@context":"https://schema.org","@type":"Organization","name":"MAGNA Real Estate GmbH",
             "foundingDate":"2015-03-01","telephone":"+49 40 999",
             "address":{"@type":"PostalAddress","streetAddress":"Neuer Wall 10","postalCode":"20354",
                        "addressLocality":"Hamburg","addressCountry":"DE"}}
            </script>
            </head><body>
            <h1>MAGNA Real Estate GmbH</h1>
            <p>Amtsgericht Hamburg HRB 182742</p>
            <p>Gegenstand des Unternehmens: Erwerb und Verwaltung von Immobilien.</p>
            <p>Umsatz 2023: 1.200.000 EUR</p>
            <p>Jahresüberschuss: 85.000 EUR</p>
            <p>42 Mitarbeiter</p>
            <p>Geschäftsführer: Max Mustermann</p>
            <a href="mailto:info@magna-re.de">Kontakt</a>
            </body></html>
            """;

        PartialFieldMap fields = parse(CanonicalField.HTML_FILEPATH, "https://www.northdata.de/MAGNA", html);

        assertThat(fields.get(CanonicalField.GRUENDUNGSDATUM)).contains("2015-03-01");
        assertThat(fields.get(CanonicalField.TELEFONNUMMER)).contains("+49 40 999");
        assertThat(fields.get(CanonicalField.GESCHAEFTSADRESSE)).contains("Neuer Wall 10, 20354 Hamburg");
        assertThat(fields.get(CanonicalField.LAND_DES_HAUPTSITZES)).contains("Deutschland");
        assertThat(fields.get(CanonicalField.REGISTERNUMMER)).contains("HRB182742");
        assertThat(fields.get(CanonicalField.HANDELSREGISTER)).contains("Hamburg");
        assertThat(fields.get(CanonicalField.GERICHTSSTAND)).contains("Amtsgericht Hamburg");
        assertThat(fields.get(CanonicalField.UNTERNEHMENSZWECK)).contains("Erwerb und Verwaltung von Immobilien.");
        assertThat(fields.get(CanonicalField.UMSATZ)).contains(new BigDecimal("1200000"));
        assertThat(fields.get(CanonicalField.GEWINN)).contains(new BigDecimal("85000"));
        assertThat(fields.get(CanonicalField.MITARBEITER)).contains(42);
        assertThat(fields.get(CanonicalField.GESCHAEFTSFUEHRER)).contains(List.of("Max Mustermann"));
        assertThat(fields.get(CanonicalField.EMAIL)).contains("info@magna-re.de");
        assertThat(fields.contains(CanonicalField.WEBSITE)).isFalse();
        assertThat(fields.contains(CanonicalField.INSOLVENZ)).isFalse();
        assertThat(fields.contains(CanonicalField.PARAGRAPH_34_GEWO)).isFalse();
    }

    @Test
    void aboutPageReadsDefinitionList() throws Exception {
        String html = """
            <html><body><section><dl>
            <dt>Website</dt><dd><a href="https://www.magna-re.de">https://www.magna-re.de</a></dd>
            <dt>Phone</dt><dd><a href="tel:+4940123">+49 40 123</a></dd>
            <dt>Company size</dt><dd>11-50 employees</dd>
            <dt>Headquarters</dt><dd>Hamburg, Hamburg</dd>
            <dt>Founded</dt><dd>2015</dd>
            </dl></section></body></html>
            """;

        PartialFieldMap fields = parse(CanonicalField.ABOUT_HTML, "https://www.linkedin.com/company/magna/about/", html);

        assertThat(fields.get(CanonicalField.WEBSITE)).contains("https://www.magna-re.de");
        assertThat(fields.get(CanonicalField.TELEFONNUMMER)).contains("+49 40 123");
        assertThat(fields.get(CanonicalField.MITARBEITER)).contains(50);
        assertThat(fields.get(CanonicalField.GESCHAEFTSADRESSE)).contains("Hamburg, Hamburg");
        assertThat(fields.get(CanonicalField.GRUENDUNGSDATUM)).contains("2015");
    }

    @Test
    void searchResultsAreNotMined() throws Exception {
        String html = "<html><body><div class=\"event\">Andere GmbH HRB 1 Amtsgericht Berlin</div></body></html>";

        PartialFieldMap fields = parse(CanonicalField.SEARCH_RESULTS_HTML, "https://www.northdata.de/search?query=MAGNA", html);

        assertThat(fields.isEmpty()).isTrue();
    }

    @Test
    void insolvencyNoticeSetsFlag() throws Exception {
        PartialFieldMap fields = parse(
            CanonicalField.HTML_FILEPATH,
            "https://example.test/x",
            "<html><body><p>Das Insolvenzverfahren wurde am 01.02.2024 eröffnet.</p></body></html>"
        );

        assertThat(fields.get(CanonicalField.INSOLVENZ)).contains(Boolean.TRUE);
    }

    @Test
    void emptyPagesAreRejected() {
        assertThatThrownBy(() -> parse(CanonicalField.HTML_FILEPATH, "https://example.test/empty", "<html><body></body></html>"))
            .isInstanceOf(DocumentParseException.class);
        assertThatThrownBy(() -> parse(CanonicalField.HTML_FILEPATH, "https://example.test/blank", "   "))
            .isInstanceOf(DocumentParseException.class);
    }

    private PartialFieldMap parse(CanonicalField field, String ref, String html) throws DocumentParseException {
        return parser.parse(RawDocument.html(field, ref, html), SourceId.NORTHDATA, Instant.parse("2026-03-01T10:00:00Z"));
    }
}
