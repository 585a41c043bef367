package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.dispatch.InteractionResult;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.settings.CombatAttributes;
import org.foxesworld.kalibridge.engine.settings.ItemSettings;

import java.util.Objects;
import java.util.Optional;

public final class ProxyItem implements ItemLike {

    private final long handle;
    private final ResourceKey key;
    private final ItemSettings settings;
    private final CallbackDispatchTable dispatch;

    public ProxyItem(long handle, ResourceKey key, ItemSettings settings, CallbackDispatchTable dispatch) {
        this.handle = handle;
        this.key = Objects.requireNonNull(key, "key");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    @Override public long handle() { return handle; }
    @Override public ResourceKey key() { return key; }
    @Override public int maxStackSize() { return settings.effectiveStackSize(); }

    public ItemSettings settings() {
        return settings;
    }

    public Optional<CombatAttributes> combat() {
        return settings.combat();
    }

    public InteractionResult use(long worldId, long playerId, int hand) {
        return dispatch.invoke(CallbackKind.ITEM_USE, h -> h.onUse(handle, worldId, playerId, hand));
    }

    public InteractionResult useOn(long worldId, int x, int y, int z, long playerId, int hand) {
        return dispatch.invoke(CallbackKind.ITEM_USE_ON_BLOCK, h -> h.onUse(handle, worldId, x, y, z, playerId, hand));
    }

    public InteractionResult interactLivingEntity(long worldId, long entityId, long playerId, int hand) {
        return dispatch.invoke(CallbackKind.ITEM_USE_ON_ENTITY, h -> h.onUse(handle, worldId, entityId, playerId, hand));
    }

    /** @return {@code false} to cancel the hit */
    public boolean hurtEnemy(long worldId, long attackerId, long targetId) {
        return dispatch.invoke(CallbackKind.ITEM_ATTACK_ENTITY, h -> h.onAttack(handle, worldId, attackerId, targetId));
    }

    @Override
    public String toString() {
        return "ProxyItem{" + key + ", handle=" + handle + '}';
    }
}
