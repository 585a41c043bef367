package org.foxesworld.kalibridge.core.state;

import java.util.Locale;

/** Block faces, in the host engine's ordinal order. */
public enum Direction {
    DOWN, UP, NORTH, SOUTH, WEST, EAST;

    public static final Direction[] HORIZONTAL = {NORTH, SOUTH, EAST, WEST};

    public String serializedName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Direction byName(String name) {
        if (name == null) return null;
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (Direction d : values()) {
            if (d.serializedName().equals(n)) return d;
        }
        return null;
    }
}
