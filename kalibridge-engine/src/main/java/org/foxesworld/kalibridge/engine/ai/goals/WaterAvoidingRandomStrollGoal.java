package org.foxesworld.kalibridge.engine.ai.goals;

import org.foxesworld.kalibridge.engine.ai.MobBody;

/** {@link RandomStrollGoal} that only picks dry destinations. */
public final class WaterAvoidingRandomStrollGoal extends RandomStrollGoal {

    public WaterAvoidingRandomStrollGoal(MobBody mob, double speedModifier) {
        super(mob, speedModifier, DEFAULT_INTERVAL, true);
    }
}
