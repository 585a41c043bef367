package org.foxesworld.kalibridge.script;

import org.graalvm.polyglot.Value;

/** Guest value → plain Java value conversion. Call on the thread that owns the value's context. */
public final class ScriptValues {
    private ScriptValues() {}

    /**
     * {@code null}/{@code undefined} → {@code null}; booleans, numbers (narrowest of
     * Integer, Long, Double) and strings as themselves; host objects unwrapped; anything else
     * (functions, guest objects) → {@code null}.
     */
    public static Object toJava(Value v) {
        if (v == null || v.isNull()) return null;
        if (v.isBoolean()) return v.asBoolean();
        if (v.isNumber()) {
            if (v.fitsInInt()) return v.asInt();
            if (v.fitsInLong()) return v.asLong();
            return v.asDouble();
        }
        if (v.isString()) return v.asString();
        if (v.isHostObject()) return v.asHostObject();
        return null;
    }
}
