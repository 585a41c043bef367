package org.foxesworld.kalibridge.engine.ai;

import java.util.EnumSet;
import java.util.Objects;

/** A goal plus its priority (lower runs first) and running state inside one selector. */
public final class WrappedGoal extends Goal {

    private final Goal goal;
    private final int priority;
    private boolean running;

    public WrappedGoal(int priority, Goal goal) {
        this.priority = priority;
        this.goal = Objects.requireNonNull(goal, "goal");
    }

    public boolean canBeReplacedBy(WrappedGoal other) {
        return isInterruptable() && other.getPriority() < priority;
    }

    @Override public boolean canUse() { return goal.canUse(); }
    @Override public boolean canContinueToUse() { return goal.canContinueToUse(); }
    @Override public boolean isInterruptable() { return goal.isInterruptable(); }
    @Override public boolean requiresUpdateEveryTick() { return goal.requiresUpdateEveryTick(); }
    @Override public EnumSet<GoalFlag> getFlags() { return goal.getFlags(); }
    @Override public void setFlags(EnumSet<GoalFlag> flags) { goal.setFlags(flags); }

    @Override
    public void start() {
        if (running) return;
        running = true;
        goal.start();
    }

    @Override
    public void stop() {
        if (!running) return;
        running = false;
        goal.stop();
    }

    @Override
    public void tick() {
        goal.tick();
    }

    public boolean isRunning() {
        return running;
    }

    public int getPriority() {
        return priority;
    }

    public Goal getGoal() {
        return goal;
    }

    @Override
    public String toString() {
        return goal + "@" + priority + (running ? "*" : "");
    }
}
