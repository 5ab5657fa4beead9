package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.aggregate.parse.DocumentParseException;
import com.firmenakte.aggregate.parse.DocumentParser;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/** Parses {@code field=value} lines; a document reading "garbage" fails to parse. */
class KeyValueDocumentParser implements DocumentParser {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.HTML;
    }

    @Override
    public PartialFieldMap parse(RawDocument document, SourceId source, Instant fetchedAt) throws DocumentParseException {
        String text = document.text().trim();
        if ("garbage".equals(text)) {
            throw new DocumentParseException("unreadable document");
        }
        PartialFieldMap fields = new PartialFieldMap(source, fetchedAt);
        for (String line : text.split("\\R")) {
            int eq = line.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            CanonicalField field = CanonicalField.fromKey(line.substring(0, eq).trim());
            String raw = line.substring(eq + 1).trim();
            switch (field.type()) {
                case INTEGER -> fields.put(field, Integer.parseInt(raw));
                case DECIMAL -> fields.put(field, new BigDecimal(raw));
                case BOOLEAN -> fields.put(field, Boolean.parseBoolean(raw));
                case TEXT_LIST -> fields.put(field, List.copyOf(Arrays.asList(raw.split("\\s*;\\s*"))));
                default -> fields.put(field, raw);
            }
        }
        return fields;
    }
}
