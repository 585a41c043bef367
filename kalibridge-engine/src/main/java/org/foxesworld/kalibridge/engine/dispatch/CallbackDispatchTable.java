package org.foxesworld.kalibridge.engine.dispatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One handler slot per {@link CallbackKind}, the native → script dispatch boundary.
 *
 * <p>Installing replaces; reads are lock-free. Dispatch never lets a handler failure escape:
 * the error is logged with the kind name and the kind's failure value comes back instead.</p>
 */
public final class CallbackDispatchTable {
    private static final Logger log = LogManager.getLogger(CallbackDispatchTable.class);

    private record Slot(Object handler, CallGate gate) {}

    private final AtomicReferenceArray<Slot> slots = new AtomicReferenceArray<>(CallbackKind.count());
    private final CallGate defaultGate;

    public CallbackDispatchTable() {
        this(DirectCallGate.INSTANCE);
    }

    public CallbackDispatchTable(CallGate defaultGate) {
        this.defaultGate = Objects.requireNonNull(defaultGate, "defaultGate");
    }

    public <H> void install(CallbackKind<H, ?> kind, H handler) {
        install(kind, handler, defaultGate);
    }

    /** Installs {@code handler} for {@code kind}, replacing any previous one. */
    public <H> void install(CallbackKind<H, ?> kind, H handler, CallGate gate) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(gate, "gate");
        Slot prev = slots.getAndSet(kind.ordinal(), new Slot(kind.handlerType().cast(handler), gate));
        if (prev != null) log.debug("Callback {} replaced", kind);
        else log.debug("Callback {} installed", kind);
    }

    public boolean uninstall(CallbackKind<?, ?> kind) {
        Objects.requireNonNull(kind, "kind");
        return slots.getAndSet(kind.ordinal(), null) != null;
    }

    public boolean isInstalled(CallbackKind<?, ?> kind) {
        return slots.get(kind.ordinal()) != null;
    }

    /** Removes every handler (isolate shutdown). */
    public void clear() {
        for (int i = 0; i < slots.length(); i++) slots.set(i, null);
    }

    /**
     * Calls the installed handler through its gate and waits for the answer.
     *
     * @return the handler's result, the kind's default if nothing is installed (or the handler
     *         answered {@code null}), or the kind's failure value if it threw
     */
    public <H, R> R invoke(CallbackKind<H, R> kind, Function<? super H, ? extends R> call) {
        Objects.requireNonNull(call, "call");
        Slot s = slots.get(kind.ordinal());
        if (s == null) return kind.defaultValue();

        H h = kind.handlerType().cast(s.handler());
        try {
            R r = s.gate().call(() -> call.apply(h));
            return r != null ? r : kind.defaultValue();
        } catch (Throwable t) {
            log.error("Callback {} failed; returning {}", kind, kind.failureValue(), t);
            return kind.failureValue();
        }
    }

    /** Notification form of {@link #invoke}; does nothing if no handler is installed. */
    public <H> void fire(CallbackKind<H, Void> kind, Consumer<? super H> call) {
        Objects.requireNonNull(call, "call");
        invoke(kind, h -> {
            call.accept(h);
            return null;
        });
    }
}
