package org.foxesworld.kalibridge.core.handle;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues opaque handles that tie a scripted definition to its native counterpart.
 *
 * <p>Handles start at 1, grow strictly and are never reused. Nothing is ever freed:
 * registration happens once at startup and the handle count is bounded by authored content.</p>
 *
 * <p>Safe to call from any thread.</p>
 */
public final class HandleAllocator {

    /** Never returned by {@link #nextHandle()}. */
    public static final long NO_HANDLE = 0L;

    private final AtomicLong next = new AtomicLong(1);

    public long nextHandle() {
        return next.getAndIncrement();
    }

    /** Number of handles issued so far (diagnostics). */
    public long issued() {
        return next.get() - 1;
    }
}
