package org.foxesworld.kalibridge.script;

import org.foxesworld.kalibridge.engine.dispatch.CallGate;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.dispatch.DynamicCallback;
import org.graalvm.polyglot.Value;

import java.util.Objects;

/** Script functions as dispatch handlers. */
public final class ScriptHandlers {
    private ScriptHandlers() {}

    /**
     * Positional arguments go to the function as they are; its return value is converted with
     * {@link ScriptValues#toJava}, so {@code undefined} becomes the kind's default.
     */
    public static DynamicCallback callback(Value fn) {
        Objects.requireNonNull(fn, "fn");
        if (!fn.canExecute()) throw new IllegalArgumentException("Handler is not a function: " + fn);
        return args -> ScriptValues.toJava(fn.execute(args));
    }

    public static <H> H bind(CallbackKind<H, ?> kind, Value fn) {
        return kind.bind(callback(fn));
    }

    public static <H> void install(CallbackDispatchTable table, CallbackKind<H, ?> kind, Value fn, CallGate gate) {
        table.install(kind, bind(kind, fn), gate);
    }
}
