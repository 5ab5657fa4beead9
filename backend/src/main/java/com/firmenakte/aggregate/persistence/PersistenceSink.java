package com.firmenakte.aggregate.persistence;

import com.firmenakte.aggregate.model.AggregationReport;
import com.firmenakte.aggregate.model.CanonicalCompanyRecord;
import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.model.RawDocument;
import com.firmenakte.aggregate.model.SourceId;

import java.util.List;
import java.util.Map;

public interface PersistenceSink {
    /**
     * Stores the merged record, its report and the raw documents. Writing the same identity again
     * replaces the earlier record.
     */
    void persist(
        CompanyIdentity identity,
        CanonicalCompanyRecord record,
        AggregationReport report,
        Map<SourceId, List<RawDocument>> rawArtifacts
    ) throws StorageException;
}
