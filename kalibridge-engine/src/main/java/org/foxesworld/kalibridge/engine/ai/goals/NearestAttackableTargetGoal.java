package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;
import java.util.Objects;
import java.util.OptionalLong;

/** Picks the nearest entity of a type as attack target. */
public final class NearestAttackableTargetGoal extends Goal {

    private static final int RANDOM_INTERVAL = 10;
    private static final double FOLLOW_RANGE = 16.0;

    private final MobBody mob;
    private final String targetType;
    private final boolean mustSee;
    private long target;

    public NearestAttackableTargetGoal(MobBody mob, String targetType, boolean mustSee) {
        this.mob = mob;
        this.targetType = Objects.requireNonNull(targetType, "targetType");
        this.mustSee = mustSee;
        setFlags(EnumSet.of(GoalFlag.TARGET));
    }

    public String targetType() {
        return targetType;
    }

    @Override
    public boolean canUse() {
        if (mob.random().nextInt(reducedTickDelay(RANDOM_INTERVAL)) != 0) return false;
        OptionalLong found = mob.nearestEntityOfType(targetType, FOLLOW_RANGE, mustSee);
        if (found.isEmpty()) return false;
        target = found.getAsLong();
        return true;
    }

    @Override
    public boolean canContinueToUse() {
        long current = mob.target();
        if (current == MobBody.NO_ENTITY || current != target || !mob.isAlive(current)) return false;
        if (mustSee && !mob.canSee(current)) return false;
        return mob.distanceSqTo(current) <= FOLLOW_RANGE * FOLLOW_RANGE;
    }

    @Override
    public void start() {
        mob.setTarget(target);
    }

    @Override
    public void stop() {
        if (mob.target() == target) mob.setTarget(MobBody.NO_ENTITY);
        target = MobBody.NO_ENTITY;
    }
}
