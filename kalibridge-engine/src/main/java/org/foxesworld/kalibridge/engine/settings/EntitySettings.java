package org.foxesworld.kalibridge.engine.settings;

import java.util.Objects;

/**
 * Captured entity type definition.
 *
 * @param breedingItem item key ({@code ns:path}) animals are fed with, or {@code null}
 * @param tickCallbacks when set, every entity tick is dispatched to the scripting side
 */
public record EntitySettings(float width,
                             float height,
                             double maxHealth,
                             double movementSpeed,
                             double attackDamage,
                             SpawnCategory spawnCategory,
                             EntityArchetype archetype,
                             String breedingItem,
                             boolean tickCallbacks) {

    public EntitySettings {
        if (!(width > 0f) || !(height > 0f)) {
            throw new IllegalArgumentException("Entity size must be positive, got " + width + "x" + height);
        }
        if (!(maxHealth > 0.0)) throw new IllegalArgumentException("maxHealth must be > 0, got " + maxHealth);
        if (movementSpeed < 0.0) throw new IllegalArgumentException("movementSpeed must be >= 0");
        if (attackDamage < 0.0) throw new IllegalArgumentException("attackDamage must be >= 0");
        Objects.requireNonNull(spawnCategory, "spawnCategory");
        Objects.requireNonNull(archetype, "archetype");
        if (breedingItem != null && breedingItem.isBlank()) breedingItem = null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private float width = 0.6f;
        private float height = 1.8f;
        private double maxHealth = 20.0;
        private double movementSpeed = 0.25;
        private double attackDamage = 2.0;
        private SpawnCategory spawnCategory = SpawnCategory.CREATURE;
        private EntityArchetype archetype = EntityArchetype.PATHFINDER_MOB;
        private String breedingItem;
        private boolean tickCallbacks;

        private Builder() {}

        public Builder size(float width, float height) { this.width = width; this.height = height; return this; }
        public Builder maxHealth(double v) { this.maxHealth = v; return this; }
        public Builder movementSpeed(double v) { this.movementSpeed = v; return this; }
        public Builder attackDamage(double v) { this.attackDamage = v; return this; }
        public Builder spawnCategory(SpawnCategory v) { this.spawnCategory = v; return this; }
        public Builder archetype(EntityArchetype v) { this.archetype = v; return this; }
        public Builder breedingItem(String v) { this.breedingItem = v; return this; }
        public Builder tickCallbacks(boolean v) { this.tickCallbacks = v; return this; }

        public EntitySettings build() {
            return new EntitySettings(width, height, maxHealth, movementSpeed, attackDamage,
                    spawnCategory, archetype, breedingItem, tickCallbacks);
        }
    }
}
