package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;

/** Targets whoever hurt the mob last, optionally rallying its kind. */
public final class HurtByTargetGoal extends Goal {

    private final MobBody mob;
    private final boolean alertOthers;
    private int timestamp;
    private long target;

    public HurtByTargetGoal(MobBody mob, boolean alertOthers) {
        this.mob = mob;
        this.alertOthers = alertOthers;
        setFlags(EnumSet.of(GoalFlag.TARGET));
    }

    @Override
    public boolean canUse() {
        long attacker = mob.lastHurtBy();
        return attacker != MobBody.NO_ENTITY
                && mob.lastHurtByTimestamp() != timestamp
                && mob.isAlive(attacker);
    }

    @Override
    public boolean canContinueToUse() {
        long current = mob.target();
        return current != MobBody.NO_ENTITY && current == target && mob.isAlive(current);
    }

    @Override
    public void start() {
        target = mob.lastHurtBy();
        timestamp = mob.lastHurtByTimestamp();
        mob.setTarget(target);
        if (alertOthers) mob.alertOthers(target);
    }

    @Override
    public void stop() {
        if (mob.target() == target) mob.setTarget(MobBody.NO_ENTITY);
        target = MobBody.NO_ENTITY;
    }
}
