package org.foxesworld.kalibridge.engine.ai.behavior;

import org.foxesworld.kalibridge.engine.ai.GoalFlag;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** Goal implemented by the scripting side, addressed by {@code goalId}. */
public record CustomBehavior(int priority, String goalId, Set<GoalFlag> flags, boolean requiresUpdateEveryTick)
        implements BehaviorDescriptor {

    public CustomBehavior {
        Objects.requireNonNull(goalId, "goalId");
        Objects.requireNonNull(flags, "flags");
        flags = Collections.unmodifiableSet(flags.isEmpty() ? EnumSet.noneOf(GoalFlag.class) : EnumSet.copyOf(flags));
    }

    @Override
    public String type() {
        return CUSTOM;
    }
}
