package org.foxesworld.kalibridge.engine.dispatch;

/**
 * Untyped callback: positional boxed arguments in, a plain Java value out
 * ({@code Boolean}, {@code Number}, {@code String} or {@code null}).
 * {@link CallbackKind#bind(DynamicCallback)} turns it into the kind's typed handler.
 */
@FunctionalInterface
public interface DynamicCallback {

    Object call(Object... args);
}
