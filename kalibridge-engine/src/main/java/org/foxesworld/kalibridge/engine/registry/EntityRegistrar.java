package org.foxesworld.kalibridge.engine.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.ai.behavior.BehaviorConfig;
import org.foxesworld.kalibridge.engine.ai.behavior.BehaviorConfigParser;
import org.foxesworld.kalibridge.engine.ai.behavior.BehaviorGoalFactory;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.NativeRegistry;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.proxy.ItemLike;
import org.foxesworld.kalibridge.engine.proxy.ProxyEntityType;
import org.foxesworld.kalibridge.engine.settings.EntitySettings;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds {@link ProxyEntityType}s. Behavior lists are attached per handle between create and
 * register; a type registered without one gets its archetype's default goals.
 */
public final class EntityRegistrar extends ProxyRegistrar<EntitySettings, ProxyEntityType> {
    private static final Logger log = LogManager.getLogger(EntityRegistrar.class);

    private final CallbackDispatchTable dispatch;
    private final BehaviorConfigParser parser;
    private final BehaviorGoalFactory goalFactory;
    private final Map<Long, BehaviorConfig> pendingBehaviors = new ConcurrentHashMap<>();
    /** Guards the pending check in setBehaviors against the take in build. */
    private final Object behaviorLock = new Object();

    public EntityRegistrar(HostEngine host, HandleAllocator handles, CallbackDispatchTable dispatch,
                           BehaviorConfigParser parser, BehaviorGoalFactory goalFactory) {
        super("entity", host, handles);
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.goalFactory = Objects.requireNonNull(goalFactory, "goalFactory");
    }

    /**
     * Attaches behavior lists to a pending entity. Either list may be {@code null} (= empty);
     * a call with both empty leaves the type without any goals.
     *
     * @return {@code false} if the handle has no pending entity
     */
    public boolean setBehaviors(long handle, String goalsJson, String targetGoalsJson) {
        BehaviorConfig cfg = parser.parse(goalsJson, targetGoalsJson);
        synchronized (behaviorLock) {
            if (!isPending(handle)) {
                log.error("setBehaviors: no pending entity for handle {}", handle);
                return false;
            }
            if (pendingBehaviors.put(handle, cfg) != null) {
                log.debug("Behaviors for entity handle {} replaced", handle);
            }
        }
        return true;
    }

    public boolean hasBehaviors(long handle) {
        return pendingBehaviors.containsKey(handle);
    }

    @Override
    protected NativeRegistry<ProxyEntityType> registry() {
        return host.entityTypes();
    }

    @Override
    protected ProxyEntityType build(long handle, ResourceKey key, EntitySettings settings) {
        BehaviorConfig behaviors;
        synchronized (behaviorLock) {
            behaviors = pendingBehaviors.remove(handle);
        }
        ItemLike breedingItem = resolveBreedingItem(key, settings.breedingItem());
        return new ProxyEntityType(handle, key, settings, behaviors, breedingItem, goalFactory, dispatch);
    }

    private ItemLike resolveBreedingItem(ResourceKey entity, String itemKey) {
        if (itemKey == null) return null;
        ItemLike item;
        try {
            item = host.items().get(ResourceKey.parse(itemKey));
        } catch (IllegalArgumentException e) {
            log.warn("Entity {}: breeding item '{}' is not a valid key", entity, itemKey);
            return null;
        }
        if (item == null) log.warn("Entity {}: breeding item '{}' not found; breeding disabled", entity, itemKey);
        return item;
    }
}
