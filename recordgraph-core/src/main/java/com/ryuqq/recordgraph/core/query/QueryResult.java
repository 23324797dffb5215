package com.ryuqq.recordgraph.core.query;

import java.util.List;
import java.util.Optional;

/**
 * 한 페이지 쿼리 결과.
 *
 * @param matches 일치 항목 (Store가 돌려준 순서)
 * @param cursorOrNull 다음 페이지 토큰 (마지막 페이지면 null)
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record QueryResult(List<QueryMatch> matches, QueryCursor cursorOrNull) {

    public QueryResult {
        if (matches == null) {
            throw new IllegalArgumentException("matches cannot be null");
        }
        matches = List.copyOf(matches);
    }

    public static QueryResult lastPage(List<QueryMatch> matches) {
        return new QueryResult(matches, null);
    }

    public Optional<QueryCursor> nextCursor() {
        return Optional.ofNullable(cursorOrNull);
    }

    public boolean hasMore() {
        return cursorOrNull != null;
    }
}
