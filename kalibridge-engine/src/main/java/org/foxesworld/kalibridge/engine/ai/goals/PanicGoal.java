package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;
import org.foxesworld.kalibridge.engine.ai.Position;

import java.util.EnumSet;
import java.util.Optional;

/** Runs off to a random spot after being hurt. */
public final class PanicGoal extends Goal {

    private final MobBody mob;
    private final double speedModifier;
    private Position wanted;

    public PanicGoal(MobBody mob, double speedModifier) {
        this.mob = mob;
        this.speedModifier = speedModifier;
        setFlags(EnumSet.of(GoalFlag.MOVE));
    }

    @Override
    public boolean canUse() {
        if (!mob.isPanicking()) return false;
        Optional<Position> pos = mob.randomStrollTarget(5, 4, false);
        if (pos.isEmpty()) return false;
        wanted = pos.get();
        return true;
    }

    @Override
    public boolean canContinueToUse() {
        return mob.isNavigating();
    }

    @Override
    public void start() {
        mob.moveTo(wanted, speedModifier);
    }
}
