package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.OptionalLong;

/** Babies stay within 3..16 blocks of an adult of their type. Claims no flags. */
public final class FollowParentGoal extends Goal {

    private final MobBody mob;
    private final double speedModifier;
    private long parent;
    private int timeToRecalcPath;

    public FollowParentGoal(MobBody mob, double speedModifier) {
        this.mob = mob;
        this.speedModifier = speedModifier;
    }

    @Override
    public boolean canUse() {
        if (!mob.isBaby()) return false;
        OptionalLong adult = mob.nearestAdultOfSameType(8.0);
        if (adult.isEmpty()) return false;
        if (mob.distanceSqTo(adult.getAsLong()) < 9.0) return false;
        parent = adult.getAsLong();
        return true;
    }

    @Override
    public boolean canContinueToUse() {
        if (!mob.isBaby() || !mob.isAlive(parent)) return false;
        double d = mob.distanceSqTo(parent);
        return d >= 9.0 && d <= 256.0;
    }

    @Override
    public void start() {
        timeToRecalcPath = 0;
    }

    @Override
    public void stop() {
        parent = MobBody.NO_ENTITY;
    }

    @Override
    public void tick() {
        if (--timeToRecalcPath <= 0) {
            timeToRecalcPath = adjustedTickDelay(10);
            mob.moveToEntity(parent, speedModifier);
        }
    }
}
