package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;

/** Chases the current target and hits it when in reach, once per 20 ticks. */
public final class MeleeAttackGoal extends Goal {

    static final int ATTACK_INTERVAL = 20;

    private final MobBody mob;
    private final double speedModifier;
    private final boolean followEvenIfNotSeen;
    private int ticksUntilNextPathRecalculation;
    private int ticksUntilNextAttack;

    public MeleeAttackGoal(MobBody mob, double speedModifier, boolean followEvenIfNotSeen) {
        this.mob = mob;
        this.speedModifier = speedModifier;
        this.followEvenIfNotSeen = followEvenIfNotSeen;
        setFlags(EnumSet.of(GoalFlag.MOVE, GoalFlag.LOOK));
    }

    @Override
    public boolean canUse() {
        long target = mob.target();
        return target != MobBody.NO_ENTITY && mob.isAlive(target)
                && (mob.isWithinMeleeRange(target) || mob.canPathTo(target));
    }

    @Override
    public boolean canContinueToUse() {
        long target = mob.target();
        if (target == MobBody.NO_ENTITY || !mob.isAlive(target)) return false;
        return followEvenIfNotSeen || mob.isNavigating();
    }

    @Override
    public void start() {
        mob.moveToEntity(mob.target(), speedModifier);
        ticksUntilNextPathRecalculation = 0;
        ticksUntilNextAttack = 0;
    }

    @Override
    public void stop() {
        mob.stopNavigation();
    }

    @Override
    public boolean requiresUpdateEveryTick() {
        return true;
    }

    @Override
    public void tick() {
        long target = mob.target();
        if (target == MobBody.NO_ENTITY) return;
        mob.lookAt(target);

        ticksUntilNextPathRecalculation = Math.max(ticksUntilNextPathRecalculation - 1, 0);
        if ((followEvenIfNotSeen || mob.canSee(target)) && ticksUntilNextPathRecalculation <= 0) {
            ticksUntilNextPathRecalculation = 4 + mob.random().nextInt(7);
            if (!mob.moveToEntity(target, speedModifier)) ticksUntilNextPathRecalculation += 15;
        }

        ticksUntilNextAttack = Math.max(ticksUntilNextAttack - 1, 0);
        if (ticksUntilNextAttack <= 0 && mob.isWithinMeleeRange(target)) {
            ticksUntilNextAttack = adjustedTickDelay(ATTACK_INTERVAL);
            mob.doHurtTarget(target);
        }
    }
}
