package org.foxesworld.kalibridge.script;

import org.foxesworld.kalibridge.engine.dispatch.CallGate;

import java.util.Objects;
import java.util.function.Supplier;

/** Runs handler calls on the isolate thread, blocking the caller until they return. */
public final class IsolateCallGate implements CallGate {

    private final ScriptIsolate isolate;

    public IsolateCallGate(ScriptIsolate isolate) {
        this.isolate = Objects.requireNonNull(isolate, "isolate");
    }

    @Override
    public <T> T call(Supplier<T> call) {
        return isolate.call(call);
    }
}
