package org.foxesworld.kalibridge.engine.dispatch;

import java.util.function.Supplier;

/**
 * Synchronous round-trip into the runtime that owns a handler.
 * The caller blocks until {@code call} has run and its result (or exception) is back.
 */
public interface CallGate {

    <T> T call(Supplier<T> call);
}
