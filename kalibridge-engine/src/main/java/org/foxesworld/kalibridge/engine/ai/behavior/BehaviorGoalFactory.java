package org.foxesworld.kalibridge.engine.ai.behavior;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.engine.ai.Goal;
import org.foxesworld.kalibridge.engine.ai.GoalSelector;
import org.foxesworld.kalibridge.engine.ai.MobBody;
import org.foxesworld.kalibridge.engine.ai.ScriptedGoal;
import org.foxesworld.kalibridge.engine.ai.goals.BreedGoal;
import org.foxesworld.kalibridge.engine.ai.goals.FloatGoal;
import org.foxesworld.kalibridge.engine.ai.goals.FollowParentGoal;
import org.foxesworld.kalibridge.engine.ai.goals.HurtByTargetGoal;
import org.foxesworld.kalibridge.engine.ai.goals.LeapAtTargetGoal;
import org.foxesworld.kalibridge.engine.ai.goals.LookAtPlayerGoal;
import org.foxesworld.kalibridge.engine.ai.goals.MeleeAttackGoal;
import org.foxesworld.kalibridge.engine.ai.goals.NearestAttackableTargetGoal;
import org.foxesworld.kalibridge.engine.ai.goals.PanicGoal;
import org.foxesworld.kalibridge.engine.ai.goals.RandomLookAroundGoal;
import org.foxesworld.kalibridge.engine.ai.goals.RandomStrollGoal;
import org.foxesworld.kalibridge.engine.ai.goals.TemptGoal;
import org.foxesworld.kalibridge.engine.ai.goals.WaterAvoidingRandomStrollGoal;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.settings.EntityArchetype;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns behavior lists into goals on a mob's two selectors.
 *
 * <p>Entries are installed in ascending priority (ties keep list order). Kinds the archetype
 * cannot run, and kinds nobody knows, are logged and skipped.</p>
 */
public final class BehaviorGoalFactory {
    private static final Logger log = LogManager.getLogger(BehaviorGoalFactory.class);

    public static final String DEFAULT_TEMPT_ITEM = "minecraft:wheat";

    private final CallbackDispatchTable dispatch;

    public BehaviorGoalFactory(CallbackDispatchTable dispatch) {
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    /**
     * @param config       {@code null} for archetype defaults
     * @param breedingItem item key animals are tempted by in the defaults, may be {@code null}
     * @return number of goals installed on both selectors
     */
    public int populate(BehaviorConfig config, EntityArchetype archetype, MobBody mob, String breedingItem,
                        GoalSelector goals, GoalSelector targets) {
        Objects.requireNonNull(archetype, "archetype");
        Objects.requireNonNull(mob, "mob");
        if (!archetype.hasGoals()) {
            if (config != null && !config.isEmpty()) {
                log.warn("Entity {} is a {}; its behavior list is ignored", mob.entityId(), archetype);
            }
            return 0;
        }
        BehaviorConfig effective = config != null ? config : defaultsFor(archetype, breedingItem);

        int n = 0;
        for (BehaviorDescriptor d : byPriority(effective.goals())) {
            Goal g = createGoal(d, archetype, mob);
            if (g != null) {
                goals.addGoal(d.priority(), g);
                n++;
            }
        }
        for (BehaviorDescriptor d : byPriority(effective.targets())) {
            Goal g = createTargetGoal(d, archetype, mob);
            if (g != null) {
                targets.addGoal(d.priority(), g);
                n++;
            }
        }
        log.debug("Entity {}: {} goals installed ({})", mob.entityId(), n, config != null ? "configured" : "defaults");
        return n;
    }

    Goal createGoal(BehaviorDescriptor d, EntityArchetype archetype, MobBody mob) {
        if (d instanceof CustomBehavior c) return scripted(c, mob);
        BuiltinBehavior b = (BuiltinBehavior) d;
        return switch (b.type()) {
            case "float" -> new FloatGoal(mob);
            case "melee_attack" -> requirePathfinding(b, archetype)
                    ? new MeleeAttackGoal(mob, b.number("speedModifier", 1.0), b.flag("followEvenIfNotSeen", true))
                    : null;
            case "leap_at_target" -> new LeapAtTargetGoal(mob, b.number("yd", 0.4));
            case "random_stroll" -> requirePathfinding(b, archetype)
                    ? new RandomStrollGoal(mob, b.number("speedModifier", 1.0))
                    : null;
            case "water_avoiding_random_stroll" -> requirePathfinding(b, archetype)
                    ? new WaterAvoidingRandomStrollGoal(mob, b.number("speedModifier", 1.0))
                    : null;
            case "look_at_player" -> new LookAtPlayerGoal(mob, b.number("lookDistance", 8.0));
            case "random_look_around" -> new RandomLookAroundGoal(mob);
            case "panic" -> requirePathfinding(b, archetype)
                    ? new PanicGoal(mob, b.number("speedModifier", 1.5))
                    : null;
            case "breed" -> requireAnimal(b, archetype)
                    ? new BreedGoal(mob, b.number("speedModifier", 1.0))
                    : null;
            case "tempt" -> requirePathfinding(b, archetype)
                    ? new TemptGoal(mob, b.number("speedModifier", 1.0),
                            b.text("temptItem", DEFAULT_TEMPT_ITEM), b.flag("canScare", false))
                    : null;
            case "follow_parent" -> requireAnimal(b, archetype)
                    ? new FollowParentGoal(mob, b.number("speedModifier", 1.1))
                    : null;
            default -> {
                log.warn("Unknown goal type '{}' (priority {}), skipped", b.type(), b.priority());
                yield null;
            }
        };
    }

    Goal createTargetGoal(BehaviorDescriptor d, EntityArchetype archetype, MobBody mob) {
        if (d instanceof CustomBehavior c) return scripted(c, mob);
        BuiltinBehavior b = (BuiltinBehavior) d;
        return switch (b.type()) {
            case "nearest_attackable_target" ->
                    new NearestAttackableTargetGoal(mob, b.text("targetType", "player"), b.flag("mustSee", true));
            case "hurt_by_target" -> requirePathfinding(b, archetype)
                    ? new HurtByTargetGoal(mob, b.flag("alertOthers", true))
                    : null;
            default -> {
                log.warn("Unknown target goal type '{}' (priority {}), skipped", b.type(), b.priority());
                yield null;
            }
        };
    }

    private Goal scripted(CustomBehavior c, MobBody mob) {
        return new ScriptedGoal(c.goalId(), mob.entityId(), c.flags(), c.requiresUpdateEveryTick(), dispatch);
    }

    /** Goals used when an entity type has no behavior configuration. */
    public static BehaviorConfig defaultsFor(EntityArchetype archetype, String breedingItem) {
        return switch (archetype) {
            case PATHFINDER_MOB -> new BehaviorConfig(List.of(
                    BuiltinBehavior.of("float", 0),
                    BuiltinBehavior.of("water_avoiding_random_stroll", 5),
                    BuiltinBehavior.of("look_at_player", 6),
                    BuiltinBehavior.of("random_look_around", 7)), List.of());
            case MONSTER -> new BehaviorConfig(List.of(
                    BuiltinBehavior.of("float", 0),
                    BuiltinBehavior.of("melee_attack", 2),
                    BuiltinBehavior.of("water_avoiding_random_stroll", 5),
                    BuiltinBehavior.of("look_at_player", 6),
                    BuiltinBehavior.of("random_look_around", 7)), List.of(
                    BuiltinBehavior.of("hurt_by_target", 1),
                    BuiltinBehavior.of("nearest_attackable_target", 2)));
            case ANIMAL -> new BehaviorConfig(List.of(
                    BuiltinBehavior.of("float", 0),
                    BuiltinBehavior.of("panic", 1),
                    BuiltinBehavior.of("breed", 2),
                    BuiltinBehavior.of("tempt", 3, "temptItem", breedingItem != null ? breedingItem : DEFAULT_TEMPT_ITEM),
                    BuiltinBehavior.of("follow_parent", 4),
                    BuiltinBehavior.of("water_avoiding_random_stroll", 5),
                    BuiltinBehavior.of("look_at_player", 6),
                    BuiltinBehavior.of("random_look_around", 7)), List.of());
            case PROJECTILE -> BehaviorConfig.EMPTY;
        };
    }

    private static List<BehaviorDescriptor> byPriority(List<BehaviorDescriptor> in) {
        List<BehaviorDescriptor> sorted = new ArrayList<>(in);
        sorted.sort(Comparator.comparingInt(BehaviorDescriptor::priority));
        return sorted;
    }

    private static boolean requirePathfinding(BuiltinBehavior b, EntityArchetype archetype) {
        if (archetype.pathfinding()) return true;
        log.warn("Goal '{}' needs a pathfinding mob, {} is not one; skipped", b.type(), archetype);
        return false;
    }

    private static boolean requireAnimal(BuiltinBehavior b, EntityArchetype archetype) {
        if (archetype.breeds()) return true;
        log.warn("Goal '{}' needs an animal, {} is not one; skipped", b.type(), archetype);
        return false;
    }
}
