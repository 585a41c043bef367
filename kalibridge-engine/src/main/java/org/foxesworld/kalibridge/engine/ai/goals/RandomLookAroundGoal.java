package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;

import java.util.EnumSet;

public final class RandomLookAroundGoal extends Goal {

    private final MobBody mob;
    private double relX;
    private double relZ;
    private int lookTime;

    public RandomLookAroundGoal(MobBody mob) {
        this.mob = mob;
        setFlags(EnumSet.of(GoalFlag.MOVE, GoalFlag.LOOK));
    }

    @Override
    public boolean canUse() {
        return mob.random().nextFloat() < 0.02f;
    }

    @Override
    public boolean canContinueToUse() {
        return lookTime >= 0;
    }

    @Override
    public void start() {
        double angle = Math.PI * 2.0 * mob.random().nextDouble();
        relX = Math.cos(angle);
        relZ = Math.sin(angle);
        lookTime = 20 + mob.random().nextInt(20);
    }

    @Override
    public boolean requiresUpdateEveryTick() {
        return true;
    }

    @Override
    public void tick() {
        --lookTime;
        mob.lookAt(mob.x() + relX, mob.y() + mob.eyeHeight(), mob.z() + relZ);
    }
}
