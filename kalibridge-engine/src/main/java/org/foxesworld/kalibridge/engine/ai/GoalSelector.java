package org.foxesworld.kalibridge.engine.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Priority-ordered, flag-exclusive goal scheduler.
 *
 * <p>Goals are kept sorted by ascending priority; equal priorities keep insertion order.
 * A goal may start only if each of its flags is free or held by an interruptible goal of
 * strictly worse priority, which is then stopped.</p>
 */
public final class GoalSelector {

    private static final WrappedGoal NO_GOAL = new WrappedGoal(Integer.MAX_VALUE, new Goal() {
        @Override public boolean canUse() { return false; }
    });

    private final Map<GoalFlag, WrappedGoal> lockedFlags = new EnumMap<>(GoalFlag.class);
    private final List<WrappedGoal> availableGoals = new ArrayList<>();
    private final EnumSet<GoalFlag> disabledFlags = EnumSet.noneOf(GoalFlag.class);

    public void addGoal(int priority, Goal goal) {
        Objects.requireNonNull(goal, "goal");
        WrappedGoal w = new WrappedGoal(priority, goal);
        int at = availableGoals.size();
        while (at > 0 && availableGoals.get(at - 1).getPriority() > priority) at--;
        availableGoals.add(at, w);
    }

    public void removeGoal(Goal goal) {
        availableGoals.removeIf(w -> {
            if (w.getGoal() != goal) return false;
            w.stop();
            return true;
        });
        lockedFlags.values().removeIf(w -> w.getGoal() == goal);
    }

    public void removeAllGoals() {
        for (WrappedGoal w : availableGoals) w.stop();
        availableGoals.clear();
        lockedFlags.clear();
    }

    public void tick() {
        // 1) stop what can't go on
        for (WrappedGoal w : availableGoals) {
            if (w.isRunning() && (goalContainsAnyFlags(w, disabledFlags) || !w.canContinueToUse())) {
                w.stop();
            }
        }
        lockedFlags.values().removeIf(w -> !w.isRunning());

        // 2) start what can, displacing worse holders
        for (WrappedGoal w : availableGoals) {
            if (!w.isRunning()
                    && !goalContainsAnyFlags(w, disabledFlags)
                    && goalCanBeReplacedForAllFlags(w)
                    && w.canUse()) {
                for (GoalFlag f : w.getFlags()) {
                    WrappedGoal holder = lockedFlags.getOrDefault(f, NO_GOAL);
                    holder.stop();
                    lockedFlags.put(f, w);
                }
                w.start();
            }
        }

        // 3)
        tickRunningGoals(true);
    }

    /** @param tickAllRunning {@code false} ticks only goals that want every tick */
    public void tickRunningGoals(boolean tickAllRunning) {
        for (WrappedGoal w : availableGoals) {
            if (w.isRunning() && (tickAllRunning || w.requiresUpdateEveryTick())) {
                w.tick();
            }
        }
    }

    private boolean goalCanBeReplacedForAllFlags(WrappedGoal goal) {
        for (GoalFlag f : goal.getFlags()) {
            if (!lockedFlags.getOrDefault(f, NO_GOAL).canBeReplacedBy(goal)) return false;
        }
        return true;
    }

    private static boolean goalContainsAnyFlags(WrappedGoal goal, EnumSet<GoalFlag> flags) {
        for (GoalFlag f : goal.getFlags()) {
            if (flags.contains(f)) return true;
        }
        return false;
    }

    public void disableControlFlag(GoalFlag flag) {
        disabledFlags.add(flag);
    }

    public void enableControlFlag(GoalFlag flag) {
        disabledFlags.remove(flag);
    }

    public void setControlFlag(GoalFlag flag, boolean enabled) {
        if (enabled) enableControlFlag(flag);
        else disableControlFlag(flag);
    }

    /** All goals in scheduling order. */
    public List<WrappedGoal> getAvailableGoals() {
        return Collections.unmodifiableList(availableGoals);
    }

    public List<WrappedGoal> getRunningGoals() {
        List<WrappedGoal> out = new ArrayList<>();
        for (WrappedGoal w : availableGoals) if (w.isRunning()) out.add(w);
        return out;
    }

    /** Current holder of {@code flag}, or {@code null}. */
    public WrappedGoal holderOf(GoalFlag flag) {
        return lockedFlags.get(flag);
    }

    public int size() {
        return availableGoals.size();
    }
}
