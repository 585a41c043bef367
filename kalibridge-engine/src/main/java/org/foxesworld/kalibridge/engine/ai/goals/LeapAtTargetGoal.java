package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;

/** Jumps at a target 2..4 blocks away. */
public final class LeapAtTargetGoal extends Goal {

    private final MobBody mob;
    private final double yd;
    private long target;

    public LeapAtTargetGoal(MobBody mob, double yd) {
        this.mob = mob;
        this.yd = yd;
        setFlags(EnumSet.of(GoalFlag.JUMP, GoalFlag.MOVE));
    }

    @Override
    public boolean canUse() {
        target = mob.target();
        if (target == MobBody.NO_ENTITY || !mob.isOnGround()) return false;
        double d = mob.distanceSqTo(target);
        if (d < 4.0 || d > 16.0) return false;
        return mob.random().nextInt(reducedTickDelay(5)) == 0;
    }

    @Override
    public boolean canContinueToUse() {
        return !mob.isOnGround();
    }

    @Override
    public void start() {
        mob.leapTowards(target, yd);
    }
}
