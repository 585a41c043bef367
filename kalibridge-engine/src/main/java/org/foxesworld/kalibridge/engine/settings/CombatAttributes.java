package org.foxesworld.kalibridge.engine.settings;

/** Melee attributes of a weapon-like item. */
public record CombatAttributes(double attackDamage, double attackSpeed, double attackKnockback) {

    public CombatAttributes {
        if (!Double.isFinite(attackDamage) || !Double.isFinite(attackSpeed) || !Double.isFinite(attackKnockback)) {
            throw new IllegalArgumentException("Combat attributes must be finite");
        }
        if (attackKnockback < 0.0) throw new IllegalArgumentException("attackKnockback must be >= 0");
    }
}
