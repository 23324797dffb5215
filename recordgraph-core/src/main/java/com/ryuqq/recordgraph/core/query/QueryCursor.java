package com.ryuqq.recordgraph.core.query;

/**
 * 페이지 조회의 연속 토큰.
 *
 * <p>Store가 발급하는 불투명 토큰이며, 다음 페이지를 가져올 때 그대로 돌려줍니다.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class QueryCursor {

    private final String token;

    private QueryCursor(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
        this.token = token;
    }

    public static QueryCursor of(String token) {
        return new QueryCursor(token);
    }

    public String getToken() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return token.equals(((QueryCursor) o).token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return "QueryCursor{" + token + '}';
    }
}
