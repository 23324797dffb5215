package com.ryuqq.recordgraph.core.codec;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.object.TypeDescriptor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State shared across one decode call.
 *
 * <p>Maps each identity to the single instance materialised for it, so a cycle marker or a
 * repeated reference resolves to the same object and the decoded Java graph keeps the stored
 * graph's shape (cycles included). Not thread-safe; one context per decode.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class DecodeContext {

    private final Map<Identity, Persistable> instances = new HashMap<>();
    private final Set<Identity> populated = new HashSet<>();

    /**
     * Returns the instance for an identity, creating an identity-only stub when none exists yet.
     *
     * @param identity the identity
     * @param descriptor descriptor of the expected type
     * @return the shared instance
     * @throws IllegalStateException if the identity is already bound to an instance of another type
     */
    public <T extends Persistable> T instanceFor(Identity identity, TypeDescriptor<T> descriptor) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        Persistable existing = instances.get(identity);
        if (existing != null) {
            if (!descriptor.getType().isInstance(existing)) {
                throw new IllegalStateException("identity " + identity.getValue() + " is bound to "
                        + existing.getClass().getSimpleName() + ", not " + descriptor.getType().getSimpleName());
            }
            return descriptor.getType().cast(existing);
        }
        T created = descriptor.newInstance();
        created.assignIdentity(identity);
        instances.put(identity, created);
        return created;
    }

    /**
     * Binds an externally built instance (custom codecs) unless the identity is already bound.
     */
    public void register(Identity identity, Persistable instance) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        instances.putIfAbsent(identity, instance);
    }

    public Optional<Persistable> find(Identity identity) {
        return Optional.ofNullable(instances.get(identity));
    }

    /**
     * Marks the instance of an identity as populated.
     *
     * @return true the first time, false if its fields were already decoded
     */
    boolean markPopulated(Identity identity) {
        return populated.add(identity);
    }

    public int size() {
        return instances.size();
    }
}
