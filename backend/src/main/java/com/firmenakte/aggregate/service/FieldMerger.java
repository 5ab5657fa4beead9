package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.CanonicalCompanyRecord;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.FieldConflict;
import com.firmenakte.aggregate.model.FieldValue;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.SourceId;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-source partial maps into one canonical record. For every field the candidate with the
 * lowest rank wins; equal ranks prefer the most recently fetched value and then {@link SourceId}
 * order, so the same inputs always produce the same record regardless of completion order.
 */
@Component
public class FieldMerger {

    public MergeOutcome merge(List<PartialFieldMap> partials, MergePolicy policy, Instant aggregatedAt) {
        Map<CanonicalField, FieldValue> merged = new EnumMap<>(CanonicalField.class);
        List<FieldConflict> conflicts = new ArrayList<>();
        Set<SourceId> dataSources = EnumSet.noneOf(SourceId.class);

        for (CanonicalField field : CanonicalField.values()) {
            List<PartialFieldMap> candidates = new ArrayList<>();
            for (PartialFieldMap partial : partials) {
                if (partial != null && partial.contains(field)) {
                    candidates.add(partial);
                }
            }
            if (candidates.isEmpty()) {
                continue;
            }
            candidates.sort(order(field, policy));

            PartialFieldMap winner = candidates.get(0);
            Object keptValue = winner.get(field).orElseThrow();
            merged.put(field, new FieldValue(keptValue, winner.source(), winner.fetchedAt()));
            dataSources.add(winner.source());

            for (PartialFieldMap loser : candidates.subList(1, candidates.size())) {
                Object discarded = loser.get(field).orElseThrow();
                if (equivalent(keptValue, discarded)) {
                    continue;
                }
                conflicts.add(new FieldConflict(
                    field,
                    winner.source(),
                    keptValue,
                    loser.source(),
                    discarded,
                    reason(field, policy, winner, loser)
                ));
            }
        }
        CanonicalCompanyRecord record = new CanonicalCompanyRecord(merged, aggregatedAt, List.copyOf(dataSources));
        return new MergeOutcome(record, conflicts);
    }

    private Comparator<PartialFieldMap> order(CanonicalField field, MergePolicy policy) {
        return Comparator
            .comparingInt((PartialFieldMap partial) -> policy.rank(field, partial.source()))
            .thenComparing(PartialFieldMap::fetchedAt, Comparator.reverseOrder())
            .thenComparing(PartialFieldMap::source);
    }

    private String reason(CanonicalField field, MergePolicy policy, PartialFieldMap winner, PartialFieldMap loser) {
        if (policy.rank(field, winner.source()) != policy.rank(field, loser.source())) {
            return FieldConflict.LOWER_PRIORITY;
        }
        if (!winner.fetchedAt().equals(loser.fetchedAt())) {
            return FieldConflict.OLDER_AT_EQUAL_PRIORITY;
        }
        return FieldConflict.SOURCE_ORDER_AT_EQUAL_PRIORITY;
    }

    static boolean equivalent(Object left, Object right) {
        if (left instanceof BigDecimal a && right instanceof BigDecimal b) {
            return a.compareTo(b) == 0;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!normalize(a.get(i)).equals(normalize(b.get(i)))) {
                    return false;
                }
            }
            return true;
        }
        return normalize(left).equals(normalize(right));
    }

    private static String normalize(Object value) {
        return value == null ? "" : value.toString().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public record MergeOutcome(CanonicalCompanyRecord record, List<FieldConflict> conflicts) {
    }
}
