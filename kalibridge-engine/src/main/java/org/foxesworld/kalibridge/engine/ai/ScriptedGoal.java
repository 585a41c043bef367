package org.foxesworld.kalibridge.engine.ai;

import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Goal whose decisions live on the scripting side. Every lifecycle step is one GOAL_* dispatch
 * keyed by {@code (goalId, entityId)}; with no handler installed the goal never starts.
 */
public final class ScriptedGoal extends Goal {

    private final String goalId;
    private final long entityId;
    private final boolean everyTick;
    private final CallbackDispatchTable dispatch;

    public ScriptedGoal(String goalId, long entityId, Set<GoalFlag> flags, boolean requiresUpdateEveryTick,
                        CallbackDispatchTable dispatch) {
        this.goalId = Objects.requireNonNull(goalId, "goalId");
        this.entityId = entityId;
        this.everyTick = requiresUpdateEveryTick;
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
        setFlags(flags.isEmpty() ? EnumSet.noneOf(GoalFlag.class) : EnumSet.copyOf(flags));
    }

    public String goalId() {
        return goalId;
    }

    @Override
    public boolean canUse() {
        return dispatch.invoke(CallbackKind.GOAL_CAN_USE, h -> h.test(goalId, entityId));
    }

    @Override
    public boolean canContinueToUse() {
        return dispatch.invoke(CallbackKind.GOAL_CAN_CONTINUE, h -> h.test(goalId, entityId));
    }

    @Override
    public void start() {
        dispatch.fire(CallbackKind.GOAL_START, h -> h.run(goalId, entityId));
    }

    @Override
    public void tick() {
        dispatch.fire(CallbackKind.GOAL_TICK, h -> h.run(goalId, entityId));
    }

    @Override
    public void stop() {
        dispatch.fire(CallbackKind.GOAL_STOP, h -> h.run(goalId, entityId));
    }

    @Override
    public boolean requiresUpdateEveryTick() {
        return everyTick;
    }

    @Override
    public String toString() {
        return "ScriptedGoal[" + goalId + "]";
    }
}
