package com.ryuqq.recordgraph.core.query;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.PrimitiveValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SortKey 테스트.
 */
class SortKeyTest {

    @Test
    void parse_TrailingMark_Descending() {
        SortKey key = SortKey.parse("createdAt⇩");

        assertEquals("createdAt", key.field());
        assertFalse(key.ascending());
        assertEquals("createdAt⇩", key.toString());
    }

    @Test
    void parse_PlainName_Ascending() {
        SortKey key = SortKey.parse("name");

        assertEquals(SortKey.ascending("name"), key);
        assertEquals("name", key.toString());
    }

    @Test
    void parse_Blank_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> SortKey.parse(" "));
    }

    @Test
    void comparator_MixedNumbersCompareNumerically() {
        List<StoredRecord> records = new ArrayList<>(List.of(rank("a", 10L), rank("b", 2), rank("c", 3.5d)));

        records.sort(SortKey.comparator(List.of(SortKey.ascending("rank"))));

        assertEquals(List.of("b", "c", "a"), ids(records));
    }

    @Test
    void comparator_MissingValuesSortLastInBothDirections() {
        StoredRecord missing = StoredRecord.builder("R").identity(Identity.of("none")).build();
        List<StoredRecord> ascending = new ArrayList<>(List.of(missing, rank("a", 1), rank("b", 2)));
        List<StoredRecord> descending = new ArrayList<>(ascending);

        ascending.sort(SortKey.comparator(List.of(SortKey.ascending("rank"))));
        descending.sort(SortKey.comparator(List.of(SortKey.descending("rank"))));

        assertEquals(List.of("a", "b", "none"), ids(ascending));
        assertEquals(List.of("b", "a", "none"), ids(descending));
    }

    @Test
    void comparator_SecondKeyBreaksTies() {
        StoredRecord x = rank("x", 1).withField("name", PrimitiveValue.of("zed"));
        StoredRecord y = rank("y", 1).withField("name", PrimitiveValue.of("amy"));
        List<StoredRecord> records = new ArrayList<>(List.of(x, y));

        records.sort(SortKey.comparator(List.of(SortKey.ascending("rank"), SortKey.ascending("name"))));

        assertEquals(List.of("y", "x"), ids(records));
    }

    @Test
    void comparator_InstantsCompareChronologically() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        List<StoredRecord> records = new ArrayList<>(List.of(
            field("late", now.plusSeconds(60)), field("early", now.minusSeconds(60)), field("mid", now)));

        records.sort(SortKey.comparator(List.of(SortKey.ascending("rank"))));

        assertEquals(List.of("early", "mid", "late"), ids(records));
    }

    @Test
    void comparator_DifferentKindsOrderedByTypeName() {
        List<StoredRecord> records = new ArrayList<>(List.of(field("s", "text"), field("b", true), field("n", 1)));

        records.sort(SortKey.comparator(List.of(SortKey.ascending("rank"))));

        // java.lang.Boolean < java.lang.Integer < java.lang.String
        assertEquals(List.of("b", "n", "s"), ids(records));
    }

    private static StoredRecord field(String identity, Object value) {
        return StoredRecord.builder("R")
            .identity(Identity.of(identity))
            .field("rank", PrimitiveValue.of(value))
            .build();
    }

    private static StoredRecord rank(String identity, Number rank) {
        return StoredRecord.builder("R")
            .identity(Identity.of(identity))
            .field("rank", PrimitiveValue.of(rank))
            .build();
    }

    private static List<String> ids(List<StoredRecord> records) {
        return records.stream()
            .map(record -> record.getIdentity().orElseThrow().getValue())
            .collect(Collectors.toList());
    }
}
