package org.foxesworld.kalibridge.engine.ai;

import java.util.EnumSet;
import java.util.Objects;

/**
 * A unit of mob behavior scheduled by a {@link GoalSelector}.
 *
 * <p>Lifecycle: {@link #canUse()} → {@link #start()} → {@link #tick()}* → {@link #stop()},
 * with {@link #canContinueToUse()} checked on every evaluation tick while running.</p>
 */
public abstract class Goal {

    private final EnumSet<GoalFlag> flags = EnumSet.noneOf(GoalFlag.class);

    public abstract boolean canUse();

    public boolean canContinueToUse() {
        return canUse();
    }

    /** Whether a better-priority goal may take this goal's flags away. */
    public boolean isInterruptable() {
        return true;
    }

    public void start() {}

    public void stop() {}

    /** {@code true} to be ticked on the odd (light) ticks as well. */
    public boolean requiresUpdateEveryTick() {
        return false;
    }

    public void tick() {}

    public void setFlags(EnumSet<GoalFlag> flags) {
        Objects.requireNonNull(flags, "flags");
        this.flags.clear();
        this.flags.addAll(flags);
    }

    public EnumSet<GoalFlag> getFlags() {
        return flags;
    }

    /** Converts a per-tick delay to evaluation ticks unless the goal runs every tick. */
    protected int adjustedTickDelay(int ticks) {
        return requiresUpdateEveryTick() ? ticks : reducedTickDelay(ticks);
    }

    protected static int reducedTickDelay(int ticks) {
        return (ticks + 1) / 2;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
