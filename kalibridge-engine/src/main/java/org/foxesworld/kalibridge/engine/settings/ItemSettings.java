package org.foxesworld.kalibridge.engine.settings;

import java.util.Optional;

/**
 * Captured item definition.
 *
 * @param maxDamage 0 for items that do not wear out; anything higher forces a stack size of 1
 * @param combat    absent for non-weapons
 */
public record ItemSettings(int maxStackSize,
                           int maxDamage,
                           boolean fireResistant,
                           Optional<CombatAttributes> combat) {

    public static final int MAX_STACK = 99;

    public ItemSettings {
        if (maxStackSize < 1 || maxStackSize > MAX_STACK) {
            throw new IllegalArgumentException("maxStackSize must be 1.." + MAX_STACK + ", got " + maxStackSize);
        }
        if (maxDamage < 0) throw new IllegalArgumentException("maxDamage must be >= 0, got " + maxDamage);
        combat = combat == null ? Optional.empty() : combat;
    }

    public static ItemSettings simple(int maxStackSize) {
        return new ItemSettings(maxStackSize, 0, false, Optional.empty());
    }

    public boolean damageable() {
        return maxDamage > 0;
    }

    /** Stack size the host actually uses. */
    public int effectiveStackSize() {
        return damageable() ? 1 : maxStackSize;
    }

    /**
     * Combat attributes are only set when every value is a number; a NaN anywhere means "none".
     */
    public static Optional<CombatAttributes> combatOf(double attackDamage, double attackSpeed, double attackKnockback) {
        if (Double.isNaN(attackDamage) || Double.isNaN(attackSpeed) || Double.isNaN(attackKnockback)) {
            return Optional.empty();
        }
        return Optional.of(new CombatAttributes(attackDamage, attackSpeed, attackKnockback));
    }
}
