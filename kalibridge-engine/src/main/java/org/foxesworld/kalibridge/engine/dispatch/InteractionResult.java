package org.foxesworld.kalibridge.engine.dispatch;

/** Outcome of a use/interact callback. Scripts answer with the ordinal. */
public enum InteractionResult {
    SUCCESS,
    CONSUME,
    CONSUME_PARTIAL,
    PASS,
    FAIL;

    private static final InteractionResult[] VALUES = values();

    /** Unknown ordinals map to {@link #PASS}. */
    public static InteractionResult fromOrdinal(int ordinal) {
        if (ordinal < 0 || ordinal >= VALUES.length) return PASS;
        return VALUES[ordinal];
    }

    public boolean consumesAction() {
        return this == SUCCESS || this == CONSUME || this == CONSUME_PARTIAL;
    }
}
