package org.foxesworld.kalibridge.engine.ai;

import java.util.Locale;

/** Control channels a goal claims while it runs. Two running goals never share a flag. */
public enum GoalFlag {
    MOVE,
    LOOK,
    JUMP,
    TARGET;

    /** {@code "move"} etc., case-insensitive; {@code null} if unknown. */
    public static GoalFlag parse(String name) {
        if (name == null) return null;
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "move" -> MOVE;
            case "look" -> LOOK;
            case "jump" -> JUMP;
            case "target" -> TARGET;
            default -> null;
        };
    }
}
