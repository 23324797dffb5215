package com.ryuqq.recordgraph.core.codec;

import com.ryuqq.recordgraph.core.model.Identity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reference placeholders in the wire map.
 *
 * <p>An un-inlined reference is {@code {identity}}. A reference revisited while inlining is
 * {@code {identity, isCycle: true}}; decoding links it to the instance already materialised
 * for that identity.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class CycleMarker {

    public static final String IDENTITY = "identity";
    public static final String IS_CYCLE = "isCycle";

    private CycleMarker() {
    }

    /**
     * Builds a cycle marker for the given identity.
     */
    public static Map<String, Object> of(Identity identity) {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put(IDENTITY, identity.getValue());
        marker.put(IS_CYCLE, Boolean.TRUE);
        return Collections.unmodifiableMap(marker);
    }

    /**
     * Builds a plain {@code {identity}} reference map.
     */
    public static Map<String, Object> reference(Identity identity) {
        Map<String, Object> reference = new LinkedHashMap<>();
        reference.put(IDENTITY, identity.getValue());
        return reference;
    }

    public static boolean isMarker(Map<?, ?> values) {
        return values != null && Boolean.TRUE.equals(values.get(IS_CYCLE));
    }
}
