package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;
import java.util.OptionalLong;

public final class LookAtPlayerGoal extends Goal {

    static final float PROBABILITY = 0.02f;

    private final MobBody mob;
    private final double lookDistance;
    private long lookAt;
    private int lookTime;

    public LookAtPlayerGoal(MobBody mob, double lookDistance) {
        this.mob = mob;
        this.lookDistance = lookDistance;
        setFlags(EnumSet.of(GoalFlag.LOOK));
    }

    @Override
    public boolean canUse() {
        if (mob.random().nextFloat() >= PROBABILITY) return false;
        OptionalLong player = mob.nearestPlayer(lookDistance);
        if (player.isEmpty()) return false;
        lookAt = player.getAsLong();
        return true;
    }

    @Override
    public boolean canContinueToUse() {
        if (!mob.isAlive(lookAt)) return false;
        if (mob.distanceSqTo(lookAt) > lookDistance * lookDistance) return false;
        return lookTime > 0;
    }

    @Override
    public void start() {
        lookTime = adjustedTickDelay(40 + mob.random().nextInt(40));
    }

    @Override
    public void stop() {
        lookAt = MobBody.NO_ENTITY;
    }

    @Override
    public void tick() {
        if (mob.isAlive(lookAt)) mob.lookAt(lookAt);
        --lookTime;
    }
}
