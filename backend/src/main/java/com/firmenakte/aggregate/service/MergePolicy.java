package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.FieldGroup;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.config.AggregatorProperties;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Source precedence for merging. A field-level rank overrides a group-level rank, which overrides the
 * default rank. Lower ranks win; a source without any rank sorts last.
 */
public final class MergePolicy {
    public static final int UNRANKED = Integer.MAX_VALUE;

    private final Map<SourceId, Integer> defaultRanks;
    private final Map<FieldGroup, Map<SourceId, Integer>> groupRanks;
    private final Map<CanonicalField, Map<SourceId, Integer>> fieldRanks;

    public MergePolicy(
        Map<SourceId, Integer> defaultRanks,
        Map<FieldGroup, Map<SourceId, Integer>> groupRanks,
        Map<CanonicalField, Map<SourceId, Integer>> fieldRanks
    ) {
        this.defaultRanks = copyRanks(defaultRanks);
        this.groupRanks = copyNested(groupRanks, FieldGroup.class);
        this.fieldRanks = copyNested(fieldRanks, CanonicalField.class);
    }

    public static MergePolicy of(Map<SourceId, Integer> defaultRanks) {
        return new MergePolicy(defaultRanks, Map.of(), Map.of());
    }

    public static MergePolicy from(AggregatorProperties.Merge merge) {
        Map<SourceId, Integer> defaults = parseRanks(merge.getDefaultRanks());
        Map<FieldGroup, Map<SourceId, Integer>> groups = new EnumMap<>(FieldGroup.class);
        merge.getGroupRanks().forEach((group, ranks) -> groups.put(parseGroup(group), parseRanks(ranks)));
        Map<CanonicalField, Map<SourceId, Integer>> fields = new EnumMap<>(CanonicalField.class);
        merge.getFieldRanks().forEach((field, ranks) -> fields.put(CanonicalField.fromKey(field), parseRanks(ranks)));
        return new MergePolicy(defaults, groups, fields);
    }

    public int rank(CanonicalField field, SourceId source) {
        Integer rank = lookup(fieldRanks.get(field), source);
        if (rank == null) {
            rank = lookup(groupRanks.get(field.group()), source);
        }
        if (rank == null) {
            rank = defaultRanks.get(source);
        }
        return rank == null ? UNRANKED : rank;
    }

    private static Integer lookup(Map<SourceId, Integer> ranks, SourceId source) {
        return ranks == null ? null : ranks.get(source);
    }

    private static Map<SourceId, Integer> parseRanks(Map<String, Integer> raw) {
        Map<SourceId, Integer> ranks = new EnumMap<>(SourceId.class);
        if (raw != null) {
            raw.forEach((source, rank) -> {
                if (rank != null) {
                    ranks.put(SourceId.fromKey(source), rank);
                }
            });
        }
        return ranks;
    }

    static FieldGroup parseGroup(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (FieldGroup group : FieldGroup.values()) {
            if (group.key().equals(normalized)) {
                return group;
            }
        }
        throw new IllegalArgumentException("Unknown field group: " + raw);
    }

    private static Map<SourceId, Integer> copyRanks(Map<SourceId, Integer> ranks) {
        Map<SourceId, Integer> copy = new EnumMap<>(SourceId.class);
        if (ranks != null) {
            copy.putAll(ranks);
        }
        return Collections.unmodifiableMap(copy);
    }

    private static <K extends Enum<K>> Map<K, Map<SourceId, Integer>> copyNested(
        Map<K, Map<SourceId, Integer>> source,
        Class<K> type
    ) {
        Map<K, Map<SourceId, Integer>> copy = new EnumMap<>(type);
        if (source != null) {
            source.forEach((key, ranks) -> copy.put(key, copyRanks(ranks)));
        }
        return Collections.unmodifiableMap(copy);
    }
}
