package com.ryuqq.recordgraph.core.model;

import java.util.List;

/**
 * 자산 리스트.
 *
 * @param assets 자산 목록 (불변 복사본)
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public record AssetList(List<AssetValue> assets) implements FieldValue {

    public AssetList {
        if (assets == null) {
            throw new IllegalArgumentException("assets cannot be null");
        }
        assets = List.copyOf(assets);
    }

    public static AssetList ofBytes(List<byte[]> contents) {
        if (contents == null) {
            throw new IllegalArgumentException("contents cannot be null");
        }
        return new AssetList(contents.stream().map(AssetValue::of).toList());
    }
}
