package com.ryuqq.relay.adapter.inmemory.registry;

import com.ryuqq.relay.core.spi.ComponentCreationException;
import com.ryuqq.relay.core.spi.SingletonRegistry;
import com.ryuqq.relay.core.spi.SingletonStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link SingletonRegistry}.
 *
 * <p>One instance of this class lives for the whole warm process. It holds
 * every long-lived component (clients, caches, breaker providers) so that
 * sequential invocations reuse them.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>All state is guarded by the registry's intrinsic lock</li>
 *   <li>The lock is reentrant, so a factory may itself resolve other components</li>
 *   <li>A factory runs at most once per name until that name is deleted</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * SingletonRegistry registry = new InMemorySingletonRegistry();
 *
 * Cache first = registry.getOrCreate("cache", Cache.class, () -&gt; new TtlLruCache(config, clock));
 * Cache second = registry.getOrCreate("cache", Cache.class, () -&gt; new TtlLruCache(other, clock));
 *
 * assert first == second; // second factory never runs
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemorySingletonRegistry implements SingletonRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemorySingletonRegistry.class);

    /**
     * name → handle. Guarded by {@code this}.
     */
    private final Map<String, Handle> handles = new HashMap<>();

    private final Clock clock;

    /**
     * Creates a registry that stamps creation times with the system UTC clock.
     */
    public InMemorySingletonRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock wall clock used for creation timestamps only
     */
    public InMemorySingletonRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The factory is invoked while holding the registry lock</li>
     *   <li>A factory that throws or returns null leaves the name unregistered</li>
     * </ul>
     */
    @Override
    public synchronized Object getOrCreate(String name, Supplier<?> factory) {
        validateName(name);
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }

        Handle existing = handles.get(name);
        if (existing != null) {
            existing.accessCount++;
            return existing.instance;
        }

        Object instance;
        try {
            instance = factory.get();
        } catch (RuntimeException e) {
            log.warn("Component factory failed: name={}, error={}", name, e.toString());
            throw new ComponentCreationException(name, e);
        }
        if (instance == null) {
            log.warn("Component factory returned null: name={}", name);
            throw new ComponentCreationException(name, "factory returned null");
        }

        Handle handle = new Handle(instance, clock.instant());
        handle.accessCount++;
        handles.put(name, handle);
        log.debug("Component created: name={}, type={}", name, instance.getClass().getSimpleName());
        return instance;
    }

    @Override
    public synchronized Optional<Object> find(String name) {
        validateName(name);
        Handle handle = handles.get(name);
        if (handle == null) {
            return Optional.empty();
        }
        handle.accessCount++;
        return Optional.of(handle.instance);
    }

    @Override
    public synchronized Optional<Object> replace(String name, Object instance) {
        validateName(name);
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        Handle previous = handles.put(name, new Handle(instance, clock.instant()));
        log.info("Component replaced: name={}, type={}", name, instance.getClass().getSimpleName());
        return previous == null ? Optional.empty() : Optional.of(previous.instance);
    }

    @Override
    public synchronized boolean delete(String name) {
        validateName(name);
        boolean removed = handles.remove(name) != null;
        if (removed) {
            log.debug("Component deleted: name={}", name);
        }
        return removed;
    }

    @Override
    public synchronized boolean exists(String name) {
        validateName(name);
        return handles.containsKey(name);
    }

    @Override
    public synchronized int clear() {
        int count = handles.size();
        handles.clear();
        log.info("Registry cleared: removed={}", count);
        return count;
    }

    @Override
    public synchronized Set<String> names() {
        return new TreeSet<>(handles.keySet());
    }

    @Override
    public synchronized SingletonStats stats() {
        List<SingletonStats.Entry> entries = new ArrayList<>(handles.size());
        for (String name : new TreeSet<>(handles.keySet())) {
            Handle handle = handles.get(name);
            entries.add(new SingletonStats.Entry(
                name,
                handle.instance.getClass().getSimpleName(),
                handle.createdAt,
                handle.accessCount
            ));
        }
        return new SingletonStats(handles.size(), entries);
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    /**
     * Registered instance with bookkeeping. Mutable fields are guarded by the registry lock.
     */
    private static final class Handle {

        private final Object instance;
        private final Instant createdAt;
        private long accessCount;

        private Handle(Object instance, Instant createdAt) {
            this.instance = instance;
            this.createdAt = createdAt;
        }
    }
}
