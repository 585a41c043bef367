package org.foxesworld.kalibridge.script;

import org.graalvm.polyglot.Value;

import java.util.ArrayList;
import java.util.List;

/** Defaults-aware reads from script config objects. Missing, null or mistyped members yield the default. */
final class ValueCfg {
    private ValueCfg() {}

    static boolean bool(Value cfg, String key, boolean def) {
        Value v = member(cfg, key);
        return v != null && v.isBoolean() ? v.asBoolean() : def;
    }

    static int i32(Value cfg, String key, int def) {
        Value v = member(cfg, key);
        return v != null && v.fitsInInt() ? v.asInt() : def;
    }

    static double f64(Value cfg, String key, double def) {
        Value v = member(cfg, key);
        return v != null && v.fitsInDouble() ? v.asDouble() : def;
    }

    static float f32(Value cfg, String key, float def) {
        return (float) f64(cfg, key, def);
    }

    static String str(Value cfg, String key, String def) {
        Value v = member(cfg, key);
        return v != null && v.isString() ? v.asString() : def;
    }

    /** Elements of an array member; empty if absent. */
    static List<Value> list(Value cfg, String key) {
        Value v = member(cfg, key);
        if (v == null || !v.hasArrayElements()) return List.of();
        long n = v.getArraySize();
        List<Value> out = new ArrayList<>((int) n);
        for (long i = 0; i < n; i++) out.add(v.getArrayElement(i));
        return out;
    }

    private static Value member(Value cfg, String key) {
        if (cfg == null || cfg.isNull() || !cfg.hasMember(key)) return null;
        Value v = cfg.getMember(key);
        return v == null || v.isNull() ? null : v;
    }
}
