package org.foxesworld.kalibridge.engine.dispatch;

import java.util.function.Supplier;

/** Runs the call on the invoking thread. For handlers written in Java. */
public final class DirectCallGate implements CallGate {

    public static final DirectCallGate INSTANCE = new DirectCallGate();

    private DirectCallGate() {}

    @Override
    public <T> T call(Supplier<T> call) {
        return call.get();
    }
}
