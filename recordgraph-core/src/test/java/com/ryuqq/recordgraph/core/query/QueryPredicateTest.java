package com.ryuqq.recordgraph.core.query;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.PrimitiveList;
import com.ryuqq.recordgraph.core.model.PrimitiveValue;
import com.ryuqq.recordgraph.core.model.ReferenceList;
import com.ryuqq.recordgraph.core.model.ReferenceValue;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryPredicate 및 페이지 모델 테스트.
 */
class QueryPredicateTest {

    private final StoredRecord record = StoredRecord.builder("R")
        .identity(Identity.of("r-1"))
        .field("name", PrimitiveValue.of("ada"))
        .field("tags", PrimitiveList.of(List.of("x", "y")))
        .field("owner", ReferenceValue.to(Identity.of("o-1")))
        .field("members", ReferenceList.of(List.of(Identity.of("m-1"), Identity.of("m-2"))))
        .build();

    @Test
    void fieldEquals_PrimitiveAndListMembership() {
        assertTrue(QueryPredicate.fieldEquals("name", "ada").test(record));
        assertFalse(QueryPredicate.fieldEquals("name", "bob").test(record));
        assertTrue(QueryPredicate.fieldEquals("tags", "y").test(record));
        assertTrue(QueryPredicate.fieldEquals("absent", null).test(record));
    }

    @Test
    void references_SingleAndList() {
        assertTrue(QueryPredicate.references("owner", Identity.of("o-1")).test(record));
        assertTrue(QueryPredicate.references("members", Identity.of("m-2")).test(record));
        assertFalse(QueryPredicate.references("members", Identity.of("o-1")).test(record));
    }

    @Test
    void and_BothMustMatch() {
        QueryPredicate predicate = QueryPredicate.fieldEquals("name", "ada")
            .and(QueryPredicate.references("owner", Identity.of("nobody")));

        assertFalse(predicate.test(record));
    }

    @Test
    void queryRequest_NonPositiveLimit_Rejected() {
        assertThrows(IllegalArgumentException.class,
            () -> QueryRequest.first("R", QueryPredicate.all(), List.of(), 0));
    }

    @Test
    void queryMatch_RequiresExactlyOneOfRecordOrError() {
        assertThrows(IllegalArgumentException.class,
            () -> new QueryMatch(Identity.of("r-1"), null, null));
        assertTrue(QueryMatch.success(record).isSuccess());
        assertFalse(QueryMatch.failure(Identity.of("r-2"), new IllegalStateException("bad")).isSuccess());
    }

    @Test
    void queryResult_LastPageHasNoCursor() {
        QueryResult last = QueryResult.lastPage(List.of(QueryMatch.success(record)));
        QueryResult more = new QueryResult(List.of(), QueryCursor.of("t-1"));

        assertFalse(last.hasMore());
        assertTrue(more.hasMore());
        assertEquals(QueryCursor.of("t-1"), more.nextCursor().orElseThrow());
    }
}
