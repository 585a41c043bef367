package org.foxesworld.kalibridge.engine.settings;

/** Native base class a scripted entity type is built on. */
public enum EntityArchetype {
    PATHFINDER_MOB(true, false),
    MONSTER(true, false),
    ANIMAL(true, true),
    PROJECTILE(false, false);

    private final boolean pathfinding;
    private final boolean breeds;

    EntityArchetype(boolean pathfinding, boolean breeds) {
        this.pathfinding = pathfinding;
        this.breeds = breeds;
    }

    /** Has a navigator, so movement goals work. */
    public boolean pathfinding() {
        return pathfinding;
    }

    public boolean breeds() {
        return breeds;
    }

    /** Projectiles carry no goal selectors at all. */
    public boolean hasGoals() {
        return this != PROJECTILE;
    }

    public static EntityArchetype fromOrdinal(int ordinal) {
        return switch (ordinal) {
            case 1 -> MONSTER;
            case 2 -> ANIMAL;
            case 3 -> PROJECTILE;
            default -> PATHFINDER_MOB;
        };
    }
}
