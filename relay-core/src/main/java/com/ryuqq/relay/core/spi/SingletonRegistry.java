package com.ryuqq.relay.core.spi;

import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Process-wide registry of named long-lived component instances.
 *
 * <p>The registry is the only place that creates, replaces and discards
 * components. Everything else (the gateway, clients, caches) obtains
 * components through it, so a warm process reuses what a previous invocation built.</p>
 *
 * <p><strong>Lifecycle law:</strong></p>
 * <pre>
 * getOrCreate(n, f) == getOrCreate(n, g)      // second factory never runs
 * delete(n); getOrCreate(n, f)                // f runs again, fresh instance
 * exists(n) == (getOrCreate(n, ...) was called and delete(n)/clear() was not)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Exactly one instance per name at any time</li>
 *   <li>A factory that throws registers nothing</li>
 *   <li>Safe under concurrent callers (the factory runs at most once per name)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface SingletonRegistry {

    /**
     * Returns the instance registered under {@code name}, creating it with
     * {@code factory} on first use.
     *
     * @param name component name, non-blank
     * @param factory invoked only when no instance exists yet
     * @return the registered instance
     * @throws IllegalArgumentException if name is blank or factory is null
     * @throws ComponentCreationException if the factory throws or returns null
     */
    Object getOrCreate(String name, Supplier<?> factory);

    /**
     * Typed variant of {@link #getOrCreate(String, Supplier)}.
     *
     * @param name component name
     * @param type expected instance type
     * @param factory invoked only when no instance exists yet
     * @param <T> instance type
     * @return the registered instance
     * @throws ComponentCreationException if the factory fails or the registered
     *         instance is not a {@code type}
     */
    default <T> T getOrCreate(String name, Class<T> type, Supplier<? extends T> factory) {
        Object instance = getOrCreate(name, factory);
        if (!type.isInstance(instance)) {
            throw new ComponentCreationException(name,
                "registered instance is " + instance.getClass().getName() + ", not " + type.getName());
        }
        return type.cast(instance);
    }

    /**
     * Looks up an instance without creating it.
     *
     * @param name component name
     * @return the instance, or empty when none is registered
     */
    Optional<Object> find(String name);

    /**
     * Registers {@code instance} under {@code name}, replacing any previous one.
     *
     * @param name component name
     * @param instance new instance, non-null
     * @return the replaced instance, or empty
     */
    Optional<Object> replace(String name, Object instance);

    /**
     * Removes the instance registered under {@code name}.
     *
     * @param name component name
     * @return true if an instance was removed
     */
    boolean delete(String name);

    /**
     * @param name component name
     * @return true if an instance is registered
     */
    boolean exists(String name);

    /**
     * Removes every instance.
     *
     * @return number of removed instances
     */
    int clear();

    /**
     * @return snapshot of the registered names, sorted
     */
    Set<String> names();

    /**
     * @return instance count with per-name creation time and access count
     */
    SingletonStats stats();
}
