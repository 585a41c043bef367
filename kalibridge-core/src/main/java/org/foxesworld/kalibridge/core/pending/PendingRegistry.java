package org.foxesworld.kalibridge.core.pending;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Holds captured settings between the "create" and "register" calls of the two-phase protocol.
 *
 * <p>One instance per object kind. At most one entry per handle; {@link #takeFor(long)} consumes it.
 * Internally synchronized because queued creation writes here from non-engine threads.</p>
 *
 * @param <S> settings record type
 */
public final class PendingRegistry<S> {

    private final String kind;
    private final Map<Long, S> pending = new HashMap<>();

    public PendingRegistry(String kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String kind() {
        return kind;
    }

    public synchronized void put(long handle, S settings) {
        Objects.requireNonNull(settings, "settings");
        if (pending.containsKey(handle)) {
            throw new DuplicateHandleException(handle);
        }
        pending.put(handle, settings);
    }

    public synchronized S takeFor(long handle) {
        S s = pending.remove(handle);
        if (s == null) throw new UnknownHandleException(handle);
        return s;
    }

    public synchronized boolean contains(long handle) {
        return pending.containsKey(handle);
    }

    public synchronized int size() {
        return pending.size();
    }

    @Override
    public String toString() {
        return "PendingRegistry{" + kind + ", size=" + size() + '}';
    }
}
