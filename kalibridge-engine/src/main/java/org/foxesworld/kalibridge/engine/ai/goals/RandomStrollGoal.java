package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;
import org.foxesworld.kalibridge.engine.ai.Position;

import java.util.EnumSet;
import java.util.Optional;

/** Wanders to a random nearby spot every now and then. */
public class RandomStrollGoal extends Goal {

    static final int DEFAULT_INTERVAL = 120;

    protected final MobBody mob;
    private final double speedModifier;
    private final int interval;
    private final boolean avoidWater;
    private Position wanted;

    public RandomStrollGoal(MobBody mob, double speedModifier) {
        this(mob, speedModifier, DEFAULT_INTERVAL, false);
    }

    protected RandomStrollGoal(MobBody mob, double speedModifier, int interval, boolean avoidWater) {
        this.mob = mob;
        this.speedModifier = speedModifier;
        this.interval = interval;
        this.avoidWater = avoidWater;
        setFlags(EnumSet.of(GoalFlag.MOVE));
    }

    @Override
    public boolean canUse() {
        if (mob.random().nextInt(reducedTickDelay(interval)) != 0) return false;
        Optional<Position> pos = mob.randomStrollTarget(10, 7, avoidWater);
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

    @Override
    public void stop() {
        mob.stopNavigation();
    }
}
