package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.ai.GoalSelector;
import org.foxesworld.kalibridge.engine.ai.MobBody;
import org.foxesworld.kalibridge.engine.ai.behavior.BehaviorConfig;
import org.foxesworld.kalibridge.engine.ai.behavior.BehaviorGoalFactory;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.settings.EntitySettings;

import java.util.Objects;

/**
 * Native entity type for a scripted one.
 *
 * @see #spawn(long, long, MobBody)
 */
public final class ProxyEntityType {

    private final long handle;
    private final ResourceKey key;
    private final EntitySettings settings;
    private final BehaviorConfig behaviors;
    private final ItemLike breedingItem;
    private final BehaviorGoalFactory goalFactory;
    private final CallbackDispatchTable dispatch;

    /**
     * @param behaviors    {@code null} for archetype defaults
     * @param breedingItem resolved breeding item, or {@code null}
     */
    public ProxyEntityType(long handle, ResourceKey key, EntitySettings settings, BehaviorConfig behaviors,
                           ItemLike breedingItem, BehaviorGoalFactory goalFactory, CallbackDispatchTable dispatch) {
        this.handle = handle;
        this.key = Objects.requireNonNull(key, "key");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.behaviors = behaviors;
        this.breedingItem = breedingItem;
        this.goalFactory = Objects.requireNonNull(goalFactory, "goalFactory");
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    public long handle() { return handle; }
    public ResourceKey key() { return key; }
    public EntitySettings settings() { return settings; }
    public BehaviorConfig behaviors() { return behaviors; }
    public ItemLike breedingItem() { return breedingItem; }

    public boolean usesDefaultBehaviors() {
        return behaviors == null;
    }

    /**
     * Creates the live entity: builds its goal and target selectors and dispatches ENTITY_SPAWN.
     */
    public ProxyEntity spawn(long entityId, long worldId, MobBody body) {
        Objects.requireNonNull(body, "body");
        GoalSelector goals = new GoalSelector();
        GoalSelector targets = new GoalSelector();
        String breedKey = breedingItem != null ? breedingItem.key().toString() : null;
        goalFactory.populate(behaviors, settings.archetype(), body, breedKey, goals, targets);

        ProxyEntity e = new ProxyEntity(this, entityId, body, goals, targets, dispatch);
        dispatch.fire(CallbackKind.ENTITY_SPAWN, h -> h.accept(handle, entityId, worldId));
        return e;
    }

    @Override
    public String toString() {
        return "ProxyEntityType{" + key + ", " + settings.archetype() + ", handle=" + handle + '}';
    }
}
