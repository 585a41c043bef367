package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;
import java.util.OptionalLong;

/** Walks up to a mate in love and breeds after spending 60 ticks together. */
public final class BreedGoal extends Goal {

    private static final int BREED_TIME = 60;

    private final MobBody mob;
    private final double speedModifier;
    private long partner;
    private int loveTime;

    public BreedGoal(MobBody mob, double speedModifier) {
        this.mob = mob;
        this.speedModifier = speedModifier;
        setFlags(EnumSet.of(GoalFlag.MOVE, GoalFlag.LOOK));
    }

    @Override
    public boolean canUse() {
        if (!mob.isInLove()) return false;
        OptionalLong mate = mob.findMate(8.0);
        if (mate.isEmpty()) return false;
        partner = mate.getAsLong();
        return true;
    }

    @Override
    public boolean canContinueToUse() {
        return mob.isAlive(partner) && mob.isInLove(partner) && loveTime < BREED_TIME;
    }

    @Override
    public void stop() {
        partner = MobBody.NO_ENTITY;
        loveTime = 0;
    }

    @Override
    public void tick() {
        mob.lookAt(partner);
        mob.moveToEntity(partner, speedModifier);
        ++loveTime;
        if (loveTime >= adjustedTickDelay(BREED_TIME) && mob.distanceSqTo(partner) < 9.0) {
            mob.breedWith(partner);
        }
    }
}
