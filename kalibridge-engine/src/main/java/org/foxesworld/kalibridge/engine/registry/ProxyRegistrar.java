package org.foxesworld.kalibridge.engine.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.core.pending.PendingRegistry;
import org.foxesworld.kalibridge.core.pending.UnknownHandleException;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.NativeRegistry;
import org.foxesworld.kalibridge.engine.host.ResourceKey;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Two-phase builder for one kind of proxy object.
 *
 * <p>{@link #create(Object)} captures settings under a fresh handle and returns at once, from any
 * thread. {@link #register(long, String, String)} is the build step: on the registration thread,
 * before freeze, it consumes the settings, builds the native object and puts it in the host registry
 * under the now-known key. Every failure is logged and reported as {@code false}; nothing throws
 * out of {@code register}.</p>
 *
 * @param <S> settings type
 * @param <T> native object type
 */
public abstract class ProxyRegistrar<S, T> {
    private static final Logger log = LogManager.getLogger(ProxyRegistrar.class);

    protected final HostEngine host;
    private final String kind;
    private final HandleAllocator handles;
    private final PendingRegistry<S> pending;
    private final Map<Long, T> built = new ConcurrentHashMap<>();
    private final List<Long> order = new CopyOnWriteArrayList<>();

    protected ProxyRegistrar(String kind, HostEngine host, HandleAllocator handles) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.host = Objects.requireNonNull(host, "host");
        this.handles = Objects.requireNonNull(handles, "handles");
        this.pending = new PendingRegistry<>(kind);
    }

    public String kind() {
        return kind;
    }

    /** Phase one. Any thread. */
    public long create(S settings) {
        Objects.requireNonNull(settings, "settings");
        long handle = handles.nextHandle();
        pending.put(handle, settings);
        log.debug("Prepared {} slot, handle {}", kind, handle);
        return handle;
    }

    /** Phase one for a handle the caller already allocated (registration queue). */
    void stage(long handle, S settings) {
        pending.put(handle, settings);
    }

    public boolean isPending(long handle) {
        return pending.contains(handle);
    }

    /** Phase two. Registration thread only. */
    public boolean register(long handle, String namespace, String path) {
        if (!host.isRegistrationThread()) {
            log.error("{} handle {}: register called on '{}', not on the registration thread '{}'",
                    kind, handle, Thread.currentThread().getName(), host.registrationThread().getName());
            return false;
        }
        NativeRegistry<? super T> registry = registry();
        if (registry.isFrozen()) {
            log.error("{} handle {}: registry '{}' is frozen", kind, handle, registry.name());
            return false;
        }

        ResourceKey key;
        try {
            key = ResourceKey.of(namespace, path);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.error("{} handle {}: invalid key '{}:{}': {}", kind, handle, namespace, path, e.getMessage());
            return false;
        }
        if (registry.containsKey(key)) {
            log.error("{} handle {}: key {} already registered", kind, handle, key);
            return false;
        }

        S settings;
        try {
            settings = pending.takeFor(handle);
        } catch (UnknownHandleException e) {
            if (built.containsKey(handle)) log.error("{} handle {} was already registered", kind, handle);
            else log.error("{} handle {} is unknown: no pending settings", kind, handle);
            return false;
        }

        T object;
        try {
            object = build(handle, key, settings);
            registry.register(key, object);
        } catch (RuntimeException e) {
            log.error("{} {} (handle {}) failed to build", kind, key, handle, e);
            return false;
        }

        built.put(handle, object);
        order.add(handle);
        onRegistered(handle, key, object);
        log.info("Registered {} {} (handle {})", kind, key, handle);
        return true;
    }

    protected abstract NativeRegistry<? super T> registry();

    protected abstract T build(long handle, ResourceKey key, S settings);

    /** Hook after the object landed in its registry. */
    protected void onRegistered(long handle, ResourceKey key, T object) {}

    /** Registered object for {@code handle}, or {@code null}. */
    public T get(long handle) {
        return built.get(handle);
    }

    /** Registered handles, in registration order. */
    public List<Long> handles() {
        return List.copyOf(order);
    }

    public int count() {
        return built.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{registered=" + count() + ", pending=" + pendingCount() + '}';
    }
}
