package com.ryuqq.recordgraph.core.query;

import java.util.List;
import java.util.Optional;

/**
 * 한 페이지 쿼리 요청.
 *
 * <p>cursor가 있으면 이전 쿼리의 다음 페이지를 요청합니다. 이 경우 Store는 cursor에 담긴
 * 원래 조건과 정렬을 사용하며 predicate와 sortKeys는 무시할 수 있습니다.</p>
 *
 * @param recordKind 레코드 종류
 * @param predicate 조건
 * @param sortKeys 정렬 키 목록
 * @param cursorOrNull 연속 토큰 (첫 페이지면 null)
 * @param limit 페이지당 최대 레코드 수
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record QueryRequest(
    String recordKind,
    QueryPredicate predicate,
    List<SortKey> sortKeys,
    QueryCursor cursorOrNull,
    int limit
) {

    /**
     * limit을 지정하지 않았을 때의 페이지 크기.
     */
    public static final int DEFAULT_LIMIT = 100;

    public QueryRequest {
        if (recordKind == null || recordKind.isBlank()) {
            throw new IllegalArgumentException("recordKind cannot be null or blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (sortKeys == null) {
            throw new IllegalArgumentException("sortKeys cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        sortKeys = List.copyOf(sortKeys);
    }

    /**
     * 첫 페이지 요청 생성.
     */
    public static QueryRequest first(String recordKind, QueryPredicate predicate, List<SortKey> sortKeys, int limit) {
        return new QueryRequest(recordKind, predicate, sortKeys, null, limit);
    }

    /**
     * cursor 이후 페이지 요청 생성.
     */
    public static QueryRequest continuing(String recordKind, QueryCursor cursor, int limit) {
        if (cursor == null) {
            throw new IllegalArgumentException("cursor cannot be null");
        }
        return new QueryRequest(recordKind, QueryPredicate.all(), List.of(), cursor, limit);
    }

    public Optional<QueryCursor> cursor() {
        return Optional.ofNullable(cursorOrNull);
    }
}
