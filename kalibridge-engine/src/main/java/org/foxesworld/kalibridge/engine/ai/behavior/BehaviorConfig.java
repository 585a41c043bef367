package org.foxesworld.kalibridge.engine.ai.behavior;

import java.util.List;
import java.util.Objects;

/**
 * Behavior lists of one entity type: goals and target goals.
 * A present config with both lists empty means "no AI at all"; an absent one means archetype defaults.
 */
public record BehaviorConfig(List<BehaviorDescriptor> goals, List<BehaviorDescriptor> targets) {

    public static final BehaviorConfig EMPTY = new BehaviorConfig(List.of(), List.of());

    public BehaviorConfig {
        goals = List.copyOf(Objects.requireNonNull(goals, "goals"));
        targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
    }

    public boolean isEmpty() {
        return goals.isEmpty() && targets.isEmpty();
    }
}
