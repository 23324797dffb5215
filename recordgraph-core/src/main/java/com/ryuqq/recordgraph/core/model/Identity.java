package com.ryuqq.recordgraph.core.model;

/**
 * 저장된 레코드의 전역 고유 식별자.
 *
 * <p>Identity는 Store에 영속화된 레코드를 가리키는 불투명(opaque) 문자열입니다.
 * 최초 저장이 성공하기 전까지 객체에는 Identity가 없으며, 한 번 부여되면 바뀌지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class Identity {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private Identity(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Identity length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * Identity 생성.
     *
     * @param value Identity 값
     * @return Identity 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Identity of(String value) {
        return new Identity(value);
    }

    /**
     * Identity 값 조회.
     *
     * @return Identity 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identity identity = (Identity) o;
        return value.equals(identity.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Identity{" + value + '}';
    }
}
