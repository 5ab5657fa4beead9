package com.firmenakte.aggregate.parse;

import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class DocumentParserRegistry {
    private final Map<DocumentFormat, DocumentParser> parsers = new EnumMap<>(DocumentFormat.class);

    public DocumentParserRegistry(List<DocumentParser> parsers) {
        for (DocumentParser parser : parsers) {
            DocumentParser previous = this.parsers.putIfAbsent(parser.format(), parser);
            if (previous != null) {
                throw new IllegalStateException("Duplicate parser for format " + parser.format());
            }
        }
    }

    public PartialFieldMap parse(RawDocument document, SourceId source, Instant fetchedAt) throws DocumentParseException {
        DocumentParser parser = parsers.get(document.format());
        if (parser == null) {
            throw new DocumentParseException("No parser registered for " + document.format());
        }
        if (document.isEmpty()) {
            throw new DocumentParseException("Empty " + document.format() + " document " + document.artifactRef());
        }
        return parser.parse(document, source, fetchedAt);
    }

    public boolean supports(DocumentFormat format) {
        return parsers.containsKey(format);
    }
}
