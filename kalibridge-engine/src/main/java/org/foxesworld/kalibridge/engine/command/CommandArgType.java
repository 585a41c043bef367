package org.foxesworld.kalibridge.engine.command;

/** Argument types a scripted command can declare, by wire name. */
public enum CommandArgType {
    STRING("string"),
    INTEGER("integer"),
    DOUBLE("double_"),
    BOOL("bool_"),
    PLAYER("player"),
    POSITION("position"),
    BLOCK("block"),
    ITEM("item"),
    GREEDY_STRING("greedyString");

    private final String wireName;

    CommandArgType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Unknown names fall back to {@link #STRING}. */
    public static CommandArgType fromWire(String name) {
        if (name != null) {
            for (CommandArgType t : values()) {
                if (t.wireName.equals(name)) return t;
            }
        }
        return STRING;
    }
}
