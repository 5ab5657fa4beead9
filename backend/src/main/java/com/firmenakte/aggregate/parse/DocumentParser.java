package com.firmenakte.aggregate.parse;

import com.firmenakte.aggregate.model.DocumentFormat;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;

import java.time.Instant;

public interface DocumentParser {
    DocumentFormat format();

    /**
     * Extracts the canonical fields present in one document. Fields that are not found are left out
     * of the map; a document that cannot be read at all raises {@link DocumentParseException}.
     */
    PartialFieldMap parse(RawDocument document, SourceId source, Instant fetchedAt) throws DocumentParseException;
}
