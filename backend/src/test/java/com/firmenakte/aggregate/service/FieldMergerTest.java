package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.CanonicalCompanyRecord;
import com.firmenakte.aggregate.model.CanonicalField;
import com.firmenakte.aggregate.model.FieldConflict;
import com.firmenakte.aggregate.model.FieldGroup;
import com.firmenakte.aggregate.model.PartialFieldMap;
import com.firmenakte.aggregate.model.SourceId;
import com.firmenakte.config.AggregatorProperties;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldMergerTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final FieldMerger merger = new FieldMerger();
    private final MergePolicy policy = MergePolicy.from(new AggregatorProperties.Merge());

    @Test
    void higherPriorityValueWinsAndSameValuesDoNotConflict() {
        PartialFieldMap registry = new PartialFieldMap(SourceId.HANDELSREGISTER, T0)
            .put(CanonicalField.REGISTERNUMMER, "HRB182742")
            .put(CanonicalField.GRUENDUNGSDATUM, "2015-03-01");
        PartialFieldMap aggregator = new PartialFieldMap(SourceId.NORTHDATA, T0.plusSeconds(5))
            .put(CanonicalField.MITARBEITER, 42)
            .put(CanonicalField.UMSATZ, new BigDecimal("1200000"))
            .put(CanonicalField.REGISTERNUMMER, "hrb182742 ");

        FieldMerger.MergeOutcome outcome = merger.merge(List.of(aggregator, registry), policy, T0);
        CanonicalCompanyRecord record = outcome.record();

        assertThat(record.value(CanonicalField.REGISTERNUMMER)).contains("HRB182742");
        assertThat(record.field(CanonicalField.REGISTERNUMMER).orElseThrow().source()).isEqualTo(SourceId.HANDELSREGISTER);
        assertThat(record.value(CanonicalField.MITARBEITER)).contains(42);
        assertThat(record.value(CanonicalField.GRUENDUNGSDATUM)).contains("2015-03-01");
        assertThat(outcome.conflicts()).isEmpty();
        assertThat(record.dataSources()).containsExactly(SourceId.HANDELSREGISTER, SourceId.NORTHDATA);
    }

    @Test
    void conflictingLowerPriorityValueIsRecorded() {
        PartialFieldMap registry = new PartialFieldMap(SourceId.HANDELSREGISTER, T0)
            .put(CanonicalField.GESCHAEFTSADRESSE, "Neuer Wall 10, 20354 Hamburg");
        PartialFieldMap aggregator = new PartialFieldMap(SourceId.NORTHDATA, T0)
            .put(CanonicalField.GESCHAEFTSADRESSE, "Alter Wall 1, 20457 Hamburg");

        FieldMerger.MergeOutcome outcome = merger.merge(List.of(registry, aggregator), policy, T0);

        assertThat(outcome.record().value(CanonicalField.GESCHAEFTSADRESSE)).contains("Neuer Wall 10, 20354 Hamburg");
        assertThat(outcome.conflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.field()).isEqualTo(CanonicalField.GESCHAEFTSADRESSE);
            assertThat(conflict.keptSource()).isEqualTo(SourceId.HANDELSREGISTER);
            assertThat(conflict.discardedSource()).isEqualTo(SourceId.NORTHDATA);
            assertThat(conflict.discardedValue()).isEqualTo("Alter Wall 1, 20457 Hamburg");
            assertThat(conflict.reason()).isEqualTo(FieldConflict.LOWER_PRIORITY);
        });
    }

    @Test
    void equalPriorityPrefersMostRecentlyFetched() {
        MergePolicy flat = MergePolicy.of(Map.of(SourceId.NORTHDATA, 1, SourceId.LINKEDIN, 1));
        PartialFieldMap older = new PartialFieldMap(SourceId.NORTHDATA, T0).put(CanonicalField.TELEFONNUMMER, "+49 40 111");
        PartialFieldMap newer = new PartialFieldMap(SourceId.LINKEDIN, T0.plusSeconds(60)).put(CanonicalField.TELEFONNUMMER, "+49 40 222");

        FieldMerger.MergeOutcome outcome = merger.merge(List.of(older, newer), flat, T0);

        assertThat(outcome.record().value(CanonicalField.TELEFONNUMMER)).contains("+49 40 222");
        assertThat(outcome.conflicts()).extracting(FieldConflict::reason).containsExactly(FieldConflict.OLDER_AT_EQUAL_PRIORITY);
    }

    @Test
    void fullTieFallsBackToSourceOrder() {
        MergePolicy flat = MergePolicy.of(Map.of(SourceId.NORTHDATA, 1, SourceId.LINKEDIN, 1));
        PartialFieldMap northdata = new PartialFieldMap(SourceId.NORTHDATA, T0).put(CanonicalField.WEBSITE, "https://a.example");
        PartialFieldMap linkedin = new PartialFieldMap(SourceId.LINKEDIN, T0).put(CanonicalField.WEBSITE, "https://b.example");

        FieldMerger.MergeOutcome outcome = merger.merge(List.of(linkedin, northdata), flat, T0);

        assertThat(outcome.record().value(CanonicalField.WEBSITE)).contains("https://a.example");
        assertThat(outcome.conflicts()).extracting(FieldConflict::reason)
            .containsExactly(FieldConflict.SOURCE_ORDER_AT_EQUAL_PRIORITY);
    }

    @Test
    void groupRankOverridesDefaultRank() {
        AggregatorProperties.Merge merge = new AggregatorProperties.Merge();
        merge.getGroupRanks().put("contact", Map.of("linkedin", 1, "handelsregister", 5));
        MergePolicy contactFirst = MergePolicy.from(merge);
        PartialFieldMap registry = new PartialFieldMap(SourceId.HANDELSREGISTER, T0)
            .put(CanonicalField.EMAIL, "info@registry.example")
            .put(CanonicalField.REGISTERNUMMER, "HRB182742");
        PartialFieldMap linkedin = new PartialFieldMap(SourceId.LINKEDIN, T0)
            .put(CanonicalField.EMAIL, "hello@magna.example")
            .put(CanonicalField.REGISTERNUMMER, "HRB999");

        CanonicalCompanyRecord record = merger.merge(List.of(registry, linkedin), contactFirst, T0).record();

        assertThat(contactFirst.rank(CanonicalField.EMAIL, SourceId.LINKEDIN)).isEqualTo(1);
        assertThat(CanonicalField.EMAIL.group()).isEqualTo(FieldGroup.CONTACT);
        assertThat(record.value(CanonicalField.EMAIL)).contains("hello@magna.example");
        assertThat(record.value(CanonicalField.REGISTERNUMMER)).contains("HRB182742");
    }

    @Test
    void fieldRankOverridesGroupRank() {
        AggregatorProperties.Merge merge = new AggregatorProperties.Merge();
        merge.getGroupRanks().put("financial", Map.of("unternehmensregister", 1));
        merge.getFieldRanks().put("mitarbeiter", Map.of("linkedin", 0));
        MergePolicy configured = MergePolicy.from(merge);

        assertThat(configured.rank(CanonicalField.MITARBEITER, SourceId.LINKEDIN)).isZero();
        assertThat(configured.rank(CanonicalField.UMSATZ, SourceId.UNTERNEHMENSREGISTER)).isEqualTo(1);
        assertThat(configured.rank(CanonicalField.UMSATZ, SourceId.LINKEDIN)).isEqualTo(4);
        assertThat(MergePolicy.of(Map.of()).rank(CanonicalField.UMSATZ, SourceId.LINKEDIN)).isEqualTo(MergePolicy.UNRANKED);
    }

    @Test
    void mergeIsIndependentOfInputOrder() {
        List<PartialFieldMap> partials = new ArrayList<>(List.of(
            new PartialFieldMap(SourceId.HANDELSREGISTER, T0).put(CanonicalField.GEWINN, new BigDecimal("10.00")),
            new PartialFieldMap(SourceId.NORTHDATA, T0.plusSeconds(1)).put(CanonicalField.GEWINN, new BigDecimal("12")),
            new PartialFieldMap(SourceId.UNTERNEHMENSREGISTER, T0.plusSeconds(2)).put(CanonicalField.GEWINN, new BigDecimal("10")),
            new PartialFieldMap(SourceId.LINKEDIN, T0.plusSeconds(3)).put(CanonicalField.WEBSITE, "https://magna.example")
        ));

        FieldMerger.MergeOutcome first = merger.merge(partials, policy, T0);
        Collections.reverse(partials);
        FieldMerger.MergeOutcome second = merger.merge(partials, policy, T0);

        assertThat(second.record().toValueMap()).isEqualTo(first.record().toValueMap());
        assertThat(second.conflicts()).isEqualTo(first.conflicts());
        assertThat(first.conflicts()).extracting(FieldConflict::discardedSource).containsExactly(SourceId.NORTHDATA);
    }

    @Test
    void fieldsNoSourceReportedStayAbsent() {
        PartialFieldMap registry = new PartialFieldMap(SourceId.HANDELSREGISTER, T0)
            .put(CanonicalField.REGISTERNUMMER, "HRB182742")
            .put(CanonicalField.WEBSITE, "   ");

        CanonicalCompanyRecord record = merger.merge(List.of(registry), policy, T0).record();

        assertThat(record.fields()).containsOnlyKeys(CanonicalField.REGISTERNUMMER);
        assertThat(record.has(CanonicalField.WEBSITE)).isFalse();
        assertThat(record.value(CanonicalField.MITARBEITER)).isEmpty();
        assertThat(record.toValueMap()).doesNotContainKeys("website", "mitarbeiter", "insolvenz");
    }

    @Test
    void emptyInputProducesEmptyRecord() {
        FieldMerger.MergeOutcome outcome = merger.merge(List.of(), policy, T0);

        assertThat(outcome.record().fields()).isEmpty();
        assertThat(outcome.record().dataSources()).isEmpty();
        assertThat(outcome.conflicts()).isEmpty();
    }
}
