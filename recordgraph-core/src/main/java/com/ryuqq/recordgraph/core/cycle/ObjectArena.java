package com.ryuqq.recordgraph.core.cycle;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns dense integer indices to objects by reference identity.
 *
 * <p>Two distinct instances never share an index even when they are {@code equals}.
 * Not thread-safe; one arena per traversal.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class ObjectArena {

    private final Map<Object, Integer> indices = new IdentityHashMap<>();
    private final List<Object> objects = new ArrayList<>();

    /**
     * Returns the index of an object, registering it on first sight.
     *
     * @param object the object (non-null)
     * @return its index, stable for the arena's lifetime
     */
    public int indexOf(Object object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
        Integer index = indices.get(object);
        if (index != null) {
            return index;
        }
        int assigned = objects.size();
        indices.put(object, assigned);
        objects.add(object);
        return assigned;
    }

    public Object objectAt(int index) {
        return objects.get(index);
    }

    public int size() {
        return objects.size();
    }
}
