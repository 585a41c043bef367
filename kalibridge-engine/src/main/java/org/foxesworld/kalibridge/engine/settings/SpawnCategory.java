package org.foxesworld.kalibridge.engine.settings;

/** Mob cap bucket an entity type spawns into. */
public enum SpawnCategory {
    MONSTER,
    CREATURE,
    AMBIENT,
    WATER_CREATURE,
    MISC;

    /** Wire ordinal; anything outside 0..3 is {@link #MISC}. */
    public static SpawnCategory fromOrdinal(int ordinal) {
        return switch (ordinal) {
            case 0 -> MONSTER;
            case 1 -> CREATURE;
            case 2 -> AMBIENT;
            case 3 -> WATER_CREATURE;
            default -> MISC;
        };
    }
}
