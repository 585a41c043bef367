package org.foxesworld.kalibridge.engine.host;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Insertion-ordered key → object registry that becomes immutable after {@link #freeze()}.
 * Written only on the registration thread; reads after freeze need no locking.
 */
public final class NativeRegistry<T> {
    private static final Logger log = LogManager.getLogger(NativeRegistry.class);

    private final String name;
    private final Map<ResourceKey, T> entries = new LinkedHashMap<>();
    private volatile boolean frozen;

    public NativeRegistry(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /**
     * @throws RegistryFrozenException after {@link #freeze()}
     * @throws IllegalStateException if {@code key} is already taken
     */
    public T register(ResourceKey key, T value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (frozen) throw new RegistryFrozenException(name);
        if (entries.containsKey(key)) {
            throw new IllegalStateException("Duplicate key in registry '" + name + "': " + key);
        }
        entries.put(key, value);
        log.debug("{} += {}", name, key);
        return value;
    }

    public T get(ResourceKey key) {
        return entries.get(key);
    }

    public boolean containsKey(ResourceKey key) {
        return entries.containsKey(key);
    }

    public Set<ResourceKey> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public void freeze() {
        if (!frozen) {
            frozen = true;
            log.info("Registry '{}' frozen with {} entries", name, entries.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }
}
