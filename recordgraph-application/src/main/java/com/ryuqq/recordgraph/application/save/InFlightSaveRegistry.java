package com.ryuqq.recordgraph.application.save;

import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.model.StoredRecord;
import com.ryuqq.recordgraph.core.object.Persistable;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Registry of in-flight saves, top-level and nested.
 *
 * <p>Concurrent saves of the same identity, or of the same not-yet-identified instance,
 * share one future: the first caller builds the save, later callers join it. When a new
 * instance receives its identity mid-flight, the identity is registered as a second key for
 * the same flight. All keys are removed before the shared future completes, so a save issued
 * after completion starts a fresh write.</p>
 *
 * <p><strong>Nested saves:</strong> {@link #runNested} joins only flights of objects that have
 * no identity yet. An object that already has an identity and is being saved by another chain
 * can be referenced right away, and waiting on it could close a wait cycle between two
 * chains that reference each other.</p>
 *
 * <p><strong>Thread Safety:</strong> {@link ConcurrentHashMap#putIfAbsent} decides the
 * single builder; no manual locking.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class InFlightSaveRegistry {

    private final ConcurrentHashMap<Object, Flight> inFlight = new ConcurrentHashMap<>();

    /**
     * Runs the save unless one for the same key is already running.
     *
     * @param object the object being saved
     * @param save builds the save future; invoked at most once per in-flight key
     * @return the shared future
     */
    public CompletableFuture<StoredRecord> runOnce(Persistable object, Supplier<CompletableFuture<StoredRecord>> save) {
        requireArguments(object, save);
        Flight flight = new Flight(keyOf(object));
        Flight existing = inFlight.putIfAbsent(flight.keys.get(0), flight);
        if (existing != null) {
            return existing.shared;
        }
        return start(flight, save);
    }

    /**
     * Runs a save issued from inside another save.
     *
     * @param object the referenced object
     * @param save builds the save future; invoked at most once per in-flight key
     * @return the shared future, or empty when the object already has an identity and
     *         another save of it is running
     */
    public Optional<CompletableFuture<StoredRecord>> runNested(Persistable object,
                                                               Supplier<CompletableFuture<StoredRecord>> save) {
        requireArguments(object, save);
        Flight flight = new Flight(keyOf(object));
        Flight existing = inFlight.putIfAbsent(flight.keys.get(0), flight);
        if (existing != null) {
            return object.getIdentity().isPresent() ? Optional.empty() : Optional.of(existing.shared);
        }
        return Optional.of(start(flight, save));
    }

    /**
     * Registers the identity just assigned to an instance as another key of its flight.
     *
     * <p>No-op when the instance has no identity or is not being saved.</p>
     */
    public void identityAssigned(Persistable object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
        Optional<Identity> identity = object.getIdentity();
        if (identity.isEmpty()) {
            return;
        }
        Flight flight = inFlight.get(new InstanceKey(object));
        if (flight != null && inFlight.putIfAbsent(identity.get(), flight) == null) {
            flight.keys.add(identity.get());
        }
    }

    public int size() {
        return inFlight.size();
    }

    private CompletableFuture<StoredRecord> start(Flight flight, Supplier<CompletableFuture<StoredRecord>> save) {
        CompletableFuture<StoredRecord> started;
        try {
            started = save.get();
        } catch (RuntimeException e) {
            release(flight);
            flight.shared.completeExceptionally(e);
            return flight.shared;
        }
        started.whenComplete((record, error) -> {
            release(flight);
            if (error != null) {
                flight.shared.completeExceptionally(error);
            } else {
                flight.shared.complete(record);
            }
        });
        return flight.shared;
    }

    private void release(Flight flight) {
        for (Object key : flight.keys) {
            inFlight.remove(key, flight);
        }
    }

    private static void requireArguments(Persistable object, Supplier<CompletableFuture<StoredRecord>> save) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
        if (save == null) {
            throw new IllegalArgumentException("save cannot be null");
        }
    }

    private static Object keyOf(Persistable object) {
        return object.getIdentity().<Object>map(identity -> identity).orElseGet(() -> new InstanceKey(object));
    }

    /**
     * One running save and every key it is registered under.
     */
    private static final class Flight {

        private final CompletableFuture<StoredRecord> shared = new CompletableFuture<>();
        private final List<Object> keys = new CopyOnWriteArrayList<>();

        Flight(Object key) {
            keys.add(key);
        }
    }

    /**
     * Key comparing by reference identity.
     */
    private static final class InstanceKey {

        private final Object instance;

        InstanceKey(Object instance) {
            this.instance = instance;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof InstanceKey other && other.instance == instance;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(instance);
        }
    }
}
