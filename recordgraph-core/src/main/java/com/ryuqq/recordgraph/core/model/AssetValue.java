package com.ryuqq.recordgraph.core.model;

import java.util.Arrays;

/**
 * 바이너리 자산 값.
 *
 * <p>객체의 {@code byte[]} 필드는 Store의 자산(asset) 핸들로 감싸져 저장됩니다.
 * 내부 배열은 방어적으로 복사됩니다.</p>
 *
 * @param bytes 자산 내용
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record AssetValue(byte[] bytes) implements FieldValue {

    public AssetValue {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        bytes = bytes.clone();
    }

    public static AssetValue of(byte[] bytes) {
        return new AssetValue(bytes);
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * 자산 크기 조회.
     *
     * @return 바이트 수
     */
    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((AssetValue) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "AssetValue{" + bytes.length + " bytes}";
    }
}
