package com.firmenakte.aggregate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The 27 fields of the canonical company record. Keys match the snake_case names used in stored
 * records and API payloads.
 */
public enum CanonicalField {
    REGISTERNUMMER("registernummer", FieldGroup.REGISTRY, FieldType.TEXT),
    HANDELSREGISTER("handelsregister", FieldGroup.REGISTRY, FieldType.TEXT),
    GESCHAEFTSADRESSE("geschaeftsadresse", FieldGroup.REGISTRY, FieldType.TEXT),
    UNTERNEHMENSZWECK("unternehmenszweck", FieldGroup.REGISTRY, FieldType.TEXT),
    LAND_DES_HAUPTSITZES("land_des_hauptsitzes", FieldGroup.REGISTRY, FieldType.TEXT),
    GERICHTSSTAND("gerichtsstand", FieldGroup.REGISTRY, FieldType.TEXT),
    PARAGRAPH_34_GEWO("paragraph_34_gewo", FieldGroup.REGISTRY, FieldType.BOOLEAN),

    MITARBEITER("mitarbeiter", FieldGroup.FINANCIAL, FieldType.INTEGER),
    UMSATZ("umsatz", FieldGroup.FINANCIAL, FieldType.DECIMAL),
    GEWINN("gewinn", FieldGroup.FINANCIAL, FieldType.DECIMAL),
    INSOLVENZ("insolvenz", FieldGroup.FINANCIAL, FieldType.BOOLEAN),

    ANZAHL_IMMOBILIEN("anzahl_immobilien", FieldGroup.REAL_ESTATE, FieldType.INTEGER),
    GESAMTWERT_IMMOBILIEN("gesamtwert_immobilien", FieldGroup.REAL_ESTATE, FieldType.DECIMAL),

    SONSTIGE_RECHTE("sonstige_rechte", FieldGroup.MISC, FieldType.TEXT_LIST),
    GRUENDUNGSDATUM("gruendungsdatum", FieldGroup.MISC, FieldType.TEXT),
    AKTIV_SEIT("aktiv_seit", FieldGroup.MISC, FieldType.TEXT),

    GESCHAEFTSFUEHRER("geschaeftsfuehrer", FieldGroup.CONTACT, FieldType.TEXT_LIST),
    TELEFONNUMMER("telefonnummer", FieldGroup.CONTACT, FieldType.TEXT),
    EMAIL("email", FieldGroup.CONTACT, FieldType.TEXT),
    WEBSITE("website", FieldGroup.CONTACT, FieldType.TEXT),

    HTML_FILEPATH("html_filepath", FieldGroup.ARTIFACT, FieldType.TEXT),
    ABOUT_HTML("about_html", FieldGroup.ARTIFACT, FieldType.TEXT),
    PDF_FILEPATH("pdf_filepath", FieldGroup.ARTIFACT, FieldType.TEXT),
    XML_FILEPATH("xml_filepath", FieldGroup.ARTIFACT, FieldType.TEXT),
    SEARCH_RESULTS_HTML("search_results_html", FieldGroup.ARTIFACT, FieldType.TEXT),
    JAHRESABSCHLUSS_HTML("jahresabschluss_html", FieldGroup.ARTIFACT, FieldType.TEXT),

    UST_IDNR("ust_idnr", FieldGroup.TAX, FieldType.TEXT);

    private final String key;
    private final FieldGroup group;
    private final FieldType type;

    CanonicalField(String key, FieldGroup group, FieldType type) {
        this.key = key;
        this.group = group;
        this.type = type;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public FieldGroup group() {
        return group;
    }

    public FieldType type() {
        return type;
    }

    @JsonCreator
    public static CanonicalField fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Field key must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CanonicalField field : values()) {
            if (field.key.equals(normalized)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown canonical field: " + value);
    }
}
