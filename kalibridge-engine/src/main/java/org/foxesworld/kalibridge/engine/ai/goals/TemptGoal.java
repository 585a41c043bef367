package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;
import java.util.Objects;
import java.util.OptionalLong;

/** Follows a nearby player holding the tempt item. */
public final class TemptGoal extends Goal {

    private static final double TEMPT_RANGE = 10.0;

    private final MobBody mob;
    private final double speedModifier;
    private final String temptItem;
    private final boolean canScare;
    private long player;
    private int calmDown;

    public TemptGoal(MobBody mob, double speedModifier, String temptItem, boolean canScare) {
        this.mob = mob;
        this.speedModifier = speedModifier;
        this.temptItem = Objects.requireNonNull(temptItem, "temptItem");
        this.canScare = canScare;
        setFlags(EnumSet.of(GoalFlag.MOVE, GoalFlag.LOOK));
    }

    public String temptItem() {
        return temptItem;
    }

    @Override
    public boolean canUse() {
        if (calmDown > 0) {
            --calmDown;
            return false;
        }
        OptionalLong p = mob.nearestPlayerHolding(temptItem, TEMPT_RANGE);
        if (p.isEmpty()) return false;
        player = p.getAsLong();
        return true;
    }

    @Override
    public boolean canContinueToUse() {
        // a scary player who wandered too far ends the temptation immediately
        if (canScare && player != MobBody.NO_ENTITY && mob.distanceSqTo(player) > 36.0) return false;
        return canUse();
    }

    @Override
    public void stop() {
        player = MobBody.NO_ENTITY;
        mob.stopNavigation();
        calmDown = reducedTickDelay(100);
    }

    @Override
    public void tick() {
        mob.lookAt(player);
        if (mob.distanceSqTo(player) < 6.25) mob.stopNavigation();
        else mob.moveToEntity(player, speedModifier);
    }
}
