package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.ai.GoalSelector;
import org.foxesworld.kalibridge.engine.ai.MobBody;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.host.ResourceKey;

import java.util.Objects;

/**
 * One live scripted mob. Runs its selectors like the host does for native mobs: full evaluation
 * on even ticks, only every-tick goals on odd ones.
 */
public final class ProxyEntity {

    private final ProxyEntityType type;
    private final long entityId;
    private final MobBody body;
    private final GoalSelector goalSelector;
    private final GoalSelector targetSelector;
    private final CallbackDispatchTable dispatch;

    private long tickCount;
    private long lastTarget = MobBody.NO_ENTITY;
    private boolean dead;

    ProxyEntity(ProxyEntityType type, long entityId, MobBody body, GoalSelector goalSelector,
                GoalSelector targetSelector, CallbackDispatchTable dispatch) {
        this.type = type;
        this.entityId = entityId;
        this.body = body;
        this.goalSelector = goalSelector;
        this.targetSelector = targetSelector;
        this.dispatch = dispatch;
    }

    public ProxyEntityType type() { return type; }
    public long entityId() { return entityId; }
    public MobBody body() { return body; }
    public GoalSelector goalSelector() { return goalSelector; }
    public GoalSelector targetSelector() { return targetSelector; }
    public long tickCount() { return tickCount; }
    public boolean isDead() { return dead; }

    public void tick() {
        if (dead) return;
        long h = type.handle();
        if ((tickCount++ & 1L) == 0L) {
            targetSelector.tick();
            goalSelector.tick();
        } else {
            targetSelector.tickRunningGoals(false);
            goalSelector.tickRunningGoals(false);
        }

        long target = body.target();
        if (target != lastTarget) {
            lastTarget = target;
            if (target != MobBody.NO_ENTITY) {
                dispatch.fire(CallbackKind.ENTITY_TARGET, c -> c.accept(h, entityId, target));
            }
        }

        if (type.settings().tickCallbacks()) {
            dispatch.fire(CallbackKind.ENTITY_TICK, c -> c.onTick(h, entityId));
        }
    }

    /** @return {@code false} if the damage is cancelled */
    public boolean hurt(String damageSource, float amount) {
        if (dead) return false;
        return dispatch.invoke(CallbackKind.ENTITY_DAMAGE, c -> c.onDamage(type.handle(), entityId, damageSource, amount));
    }

    public void die(String damageSource) {
        if (dead) return;
        dead = true;
        goalSelector.removeAllGoals();
        targetSelector.removeAllGoals();
        dispatch.fire(CallbackKind.ENTITY_DEATH, c -> c.onDeath(type.handle(), entityId, damageSource));
    }

    /** Called by the host after this mob landed a melee hit. */
    public void onAttack(long targetId) {
        dispatch.fire(CallbackKind.ENTITY_ATTACK, c -> c.accept(type.handle(), entityId, targetId));
    }

    /** Whether {@code itemKey} is this type's breeding item. */
    public boolean isFood(ResourceKey itemKey) {
        ItemLike food = type.breedingItem();
        return food != null && food.key().equals(itemKey);
    }

    /** Called by the host once a baby was spawned from this animal and {@code partnerId}. */
    public void onBred(long partnerId, long babyId) {
        dispatch.fire(CallbackKind.ANIMAL_BREED, c -> c.onBreed(type.handle(), entityId, partnerId, babyId));
    }

    @Override
    public String toString() {
        return "ProxyEntity{" + type.key() + "#" + entityId + '}';
    }
}
