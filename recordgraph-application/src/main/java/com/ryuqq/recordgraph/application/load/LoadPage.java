package com.ryuqq.recordgraph.application.load;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.query.QueryCursor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 조회 결과 한 페이지.
 *
 * <p>레코드 하나의 디코딩 실패는 페이지를 중단시키지 않고 partialErrors에 Identity별로 기록됩니다.</p>
 *
 * @param items 디코딩된 객체 (Store가 돌려준 순서)
 * @param cursorOrNull 다음 페이지 토큰 (마지막 페이지면 null)
 * @param partialErrors Identity → 실패 원인 (발생 순서 유지)
 * @param <T> 객체 타입
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record LoadPage<T>(List<T> items, QueryCursor cursorOrNull, Map<Identity, Throwable> partialErrors) {

    public LoadPage {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (partialErrors == null) {
            throw new IllegalArgumentException("partialErrors cannot be null");
        }
        items = List.copyOf(items);
        partialErrors = Collections.unmodifiableMap(new LinkedHashMap<>(partialErrors));
    }

    public Optional<QueryCursor> nextCursor() {
        return Optional.ofNullable(cursorOrNull);
    }

    public boolean hasMore() {
        return cursorOrNull != null;
    }

    public boolean hasPartialErrors() {
        return !partialErrors.isEmpty();
    }
}
