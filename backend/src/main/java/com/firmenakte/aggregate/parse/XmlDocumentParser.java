package com.firmenakte.aggregate.parse;

import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses XJustiz "strukturierter Registerinhalt" (SI) exports. Elements are matched by local name so
 * the parser does not depend on the namespace prefix a court happens to use.
 */
@Component
public class XmlDocumentParser implements DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(XmlDocumentParser.class);
    private static final String ROLE_GESCHAEFTSFUEHRER = "086";
    private static final String STAAT_DEUTSCHLAND = "000";
    private static final String PLACEHOLDER_GEGENSTAND = "Strukturierter Registerinhalt";
    private static final Map<String, String> COURTS = Map.of(
        "K1101R", "Hamburg",
        "F1103R", "Berlin (Charlottenburg)",
        "D2601R", "München",
        "R3101R", "Köln"
    );

    @Override
    public DocumentFormat format() {
        return DocumentFormat.XML;
    }

    @Override
    public PartialFieldMap parse(RawDocument document, SourceId source, Instant fetchedAt) throws DocumentParseException {
        Document xml;
        try {
            xml = Jsoup.parse(document.text(), "", Parser.xmlParser());
        } catch (RuntimeException e) {
            throw new DocumentParseException("Unreadable XML " + document.artifactRef(), e);
        }
        if (first(xml, "basisdatenRegister") == null
            && first(xml, "registrierung") == null
            && first(xml, "registereintragung") == null) {
            throw new DocumentParseException("Not an XJustiz register export " + document.artifactRef());
        }

        PartialFieldMap fields = new PartialFieldMap(source, fetchedAt);
        String registerCode = codeOf(first(xml, "register"));
        String laufendeNummer = text(first(xml, "laufendeNummer"));
        if (registerCode != null && laufendeNummer != null) {
            fields.put(CanonicalField.REGISTERNUMMER, (registerCode + laufendeNummer).replace(" ", ""));
        }

        String court = court(first(xml, "gericht"));
        fields.put(CanonicalField.HANDELSREGISTER, court);
        fields.put(CanonicalField.GERICHTSSTAND, court == null ? null : "Amtsgericht " + court);

        List<String> managers = geschaeftsfuehrer(xml);
        if (!managers.isEmpty()) {
            fields.put(CanonicalField.GESCHAEFTSFUEHRER, managers);
        }

        fields.put(CanonicalField.GESCHAEFTSADRESSE, address(xml));

        String gegenstand = text(first(first(xml, "basisdatenRegister"), "gegenstand"));
        if (gegenstand != null && !PLACEHOLDER_GEGENSTAND.equalsIgnoreCase(gegenstand)) {
            fields.put(CanonicalField.UNTERNEHMENSZWECK, gegenstand);
            if (GermanTextPatterns.mentionsParagraph34c(gegenstand)) {
                fields.put(CanonicalField.PARAGRAPH_34_GEWO, Boolean.TRUE);
            }
        }

        fields.put(CanonicalField.LAND_DES_HAUPTSITZES, country(xml));
        fields.put(CanonicalField.UST_IDNR, GermanTextPatterns.ustIdnr(xml.text()));
        log.debug("Parsed {} fields from {} XML {}", fields.size(), source.key(), document.artifactRef());
        return fields;
    }

    private List<String> geschaeftsfuehrer(Document xml) {
        List<String> names = new ArrayList<>();
        for (Element beteiligung : all(xml, "beteiligung")) {
            boolean manager = false;
            for (Element code : all(beteiligung, "code")) {
                if (ROLE_GESCHAEFTSFUEHRER.equals(code.text().trim())) {
                    manager = true;
                    break;
                }
            }
            if (!manager) {
                continue;
            }
            String vorname = text(first(beteiligung, "vorname"));
            String nachname = text(first(beteiligung, "nachname"));
            if (vorname != null && nachname != null) {
                String name = vorname + " " + nachname;
                if (!names.contains(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private String address(Document xml) {
        Element anschrift = first(xml, "anschrift");
        Element scope = anschrift != null ? anschrift : xml;
        String strasse = text(first(scope, "strasse"));
        String hausnummer = text(first(scope, "hausnummer"));
        String plz = text(first(scope, "postleitzahl"));
        String ort = text(first(scope, "ort"));
        if (strasse == null || plz == null || ort == null) {
            return null;
        }
        String street = hausnummer == null ? strasse : strasse + " " + hausnummer;
        return street + ", " + plz + " " + ort;
    }

    private String country(Document xml) {
        for (Element staat : all(xml, "staat")) {
            String code = codeOf(staat);
            if (STAAT_DEUTSCHLAND.equals(code) || staat.text().contains("Deutschland")) {
                return "Deutschland";
            }
        }
        return null;
    }

    private String court(Element gericht) {
        if (gericht == null) {
            return null;
        }
        String code = codeOf(gericht);
        if (code != null && COURTS.containsKey(code.toUpperCase(Locale.ROOT))) {
            return COURTS.get(code.toUpperCase(Locale.ROOT));
        }
        for (Element child : gericht.children()) {
            if (!"code".equals(localName(child)) && !"listversionid".equals(localName(child)) && !child.text().isBlank()) {
                return child.text().trim().replaceFirst("^Amtsgericht\\s+", "");
            }
        }
        return null;
    }

    private String codeOf(Element element) {
        return element == null ? null : text(first(element, "code"));
    }

    private Element first(Element scope, String localName) {
        if (scope == null) {
            return null;
        }
        String wanted = localName.toLowerCase(Locale.ROOT);
        for (Element element : scope.getAllElements()) {
            if (element != scope && wanted.equals(localName(element))) {
                return element;
            }
        }
        return null;
    }

    private List<Element> all(Element scope, String localName) {
        List<Element> out = new ArrayList<>();
        String wanted = localName.toLowerCase(Locale.ROOT);
        for (Element element : scope.getAllElements()) {
            if (element != scope && wanted.equals(localName(element))) {
                out.add(element);
            }
        }
        return out;
    }

    private String localName(Element element) {
        String name = element.tagName();
        int colon = name.indexOf(':');
        return (colon >= 0 ? name.substring(colon + 1) : name).toLowerCase(Locale.ROOT);
    }

    private String text(Element element) {
        if (element == null) {
            return null;
        }
        String value = element.text().trim();
        return value.isEmpty() ? null : value;
    }
}
