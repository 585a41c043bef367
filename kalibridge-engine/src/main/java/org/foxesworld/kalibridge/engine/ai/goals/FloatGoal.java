package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;

/** Keeps the mob swimming up in water. */
public final class FloatGoal extends Goal {

    private final MobBody mob;

    public FloatGoal(MobBody mob) {
        this.mob = mob;
        setFlags(EnumSet.of(GoalFlag.JUMP));
    }

    @Override
    public boolean canUse() {
        return mob.isInWater();
    }

    @Override
    public boolean requiresUpdateEveryTick() {
        return true;
    }

    @Override
    public void tick() {
        if (mob.random().nextFloat() < 0.8f) mob.jump();
    }
}
