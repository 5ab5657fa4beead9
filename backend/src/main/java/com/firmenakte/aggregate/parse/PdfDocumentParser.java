package com.firmenakte.aggregate.parse;

import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Reads register extracts (AD, "aktueller Abdruck") and annual statements delivered as PDF. Only the
 * text layer is used; scanned documents without text are rejected.
 */
@Component
public class PdfDocumentParser implements DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(PdfDocumentParser.class);

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PDF;
    }

    @Override
    public PartialFieldMap parse(RawDocument document, SourceId source, Instant fetchedAt) throws DocumentParseException {
        String text = extractText(document);
        if (text == null || text.isBlank()) {
            throw new DocumentParseException("PDF has no text layer " + document.artifactRef());
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');

        PartialFieldMap fields = new PartialFieldMap(source, fetchedAt);
        fields.put(CanonicalField.REGISTERNUMMER, GermanTextPatterns.registernummer(normalized));
        String court = GermanTextPatterns.registerCourt(normalized);
        fields.put(CanonicalField.HANDELSREGISTER, court);
        fields.put(CanonicalField.GERICHTSSTAND, court == null ? null : "Amtsgericht " + court);
        fields.put(CanonicalField.GESCHAEFTSADRESSE, GermanTextPatterns.geschaeftsanschrift(normalized));
        String gegenstand = GermanTextPatterns.gegenstand(normalized);
        fields.put(CanonicalField.UNTERNEHMENSZWECK, gegenstand);
        if (GermanTextPatterns.mentionsParagraph34c(normalized)) {
            fields.put(CanonicalField.PARAGRAPH_34_GEWO, Boolean.TRUE);
        }
        List<String> managers = GermanTextPatterns.geschaeftsfuehrer(normalized);
        if (!managers.isEmpty()) {
            fields.put(CanonicalField.GESCHAEFTSFUEHRER, managers);
        }
        fields.put(CanonicalField.UST_IDNR, GermanTextPatterns.ustIdnr(normalized));
        fields.put(CanonicalField.UMSATZ, GermanTextPatterns.umsatz(normalized));
        fields.put(CanonicalField.GEWINN, GermanTextPatterns.gewinn(normalized));
        fields.put(CanonicalField.MITARBEITER, GermanTextPatterns.employees(normalized));
        fields.put(CanonicalField.GRUENDUNGSDATUM, GermanTextPatterns.gruendungsdatum(normalized));
        if (GermanTextPatterns.mentionsInsolvency(normalized)) {
            fields.put(CanonicalField.INSOLVENZ, Boolean.TRUE);
        }
        log.debug("Parsed {} fields from {} PDF {}", fields.size(), source.key(), document.artifactRef());
        return fields;
    }

    private String extractText(RawDocument document) throws DocumentParseException {
        try (PDDocument pdf = Loader.loadPDF(document.content())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(pdf);
        } catch (IOException e) {
            throw new DocumentParseException("Unreadable PDF " + document.artifactRef() + ": " + e.getMessage(), e);
        }
    }
}
