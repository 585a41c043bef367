package org.foxesworld.kalibridge.engine.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.host.HostEngine;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Creation requests made off the registration thread, replayed on it in arrival order.
 *
 * <p>{@link #enqueue} allocates the handle, stages the settings and appends the entry under one
 * lock, so handle order and queue order agree and no flush can see a half-staged entry.</p>
 */
public final class RegistrationQueue {
    private static final Logger log = LogManager.getLogger(RegistrationQueue.class);

    private record Entry(long handle, ProxyRegistrar<?, ?> registrar, String namespace, String path) {}

    private final Object lock = new Object();
    private final ArrayDeque<Entry> fifo = new ArrayDeque<>();
    private final HostEngine host;
    private final HandleAllocator handles;
    private final CountDownLatch queued = new CountDownLatch(1);

    public RegistrationQueue(HostEngine host, HandleAllocator handles) {
        this.host = Objects.requireNonNull(host, "host");
        this.handles = Objects.requireNonNull(handles, "handles");
    }

    /**
     * Any thread. The returned handle is valid right away for handle-keyed setup
     * (e.g. entity behaviors) that must happen before the flush.
     */
    public <S> long enqueue(ProxyRegistrar<S, ?> registrar, S settings, String namespace, String path) {
        Objects.requireNonNull(registrar, "registrar");
        Objects.requireNonNull(settings, "settings");
        synchronized (lock) {
            long handle = handles.nextHandle();
            registrar.stage(handle, settings);
            fifo.addLast(new Entry(handle, registrar, namespace, path));
            log.debug("Queued {} {}:{} as handle {}", registrar.kind(), namespace, path, handle);
            return handle;
        }
    }

    /**
     * Registers everything queued so far, oldest first. Entries that fail are logged and dropped.
     * Registration thread only, before the freeze; otherwise the queue is left alone.
     *
     * @return number of entries registered successfully
     */
    public int flush() {
        if (!host.isRegistrationThread()) {
            log.error("flush called on '{}', not on the registration thread; queue left as is",
                    Thread.currentThread().getName());
            return 0;
        }
        if (host.isFrozen()) {
            log.error("flush called after the registry freeze; {} queued entries not registered", size());
            return 0;
        }

        int ok = 0;
        int total = 0;
        while (true) {
            Entry e;
            synchronized (lock) {
                e = fifo.pollFirst();
            }
            if (e == null) break;
            total++;
            if (e.registrar().register(e.handle(), e.namespace(), e.path())) {
                ok++;
            } else {
                log.warn("Queued {} {}:{} (handle {}) was not registered",
                        e.registrar().kind(), e.namespace(), e.path(), e.handle());
            }
        }
        if (total > 0) log.info("Registration queue flushed: {}/{} registered", ok, total);
        return ok;
    }

    public int size() {
        synchronized (lock) {
            return fifo.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /** The scripting side is done queueing. */
    public void markComplete() {
        queued.countDown();
    }

    public boolean isComplete() {
        return queued.getCount() == 0;
    }

    /**
     * Waits for {@link #markComplete()}.
     *
     * @return {@code false} on timeout or interrupt
     */
    public boolean awaitComplete(long timeoutMillis) {
        try {
            return queued.await(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for queued registrations");
            return false;
        }
    }
}
