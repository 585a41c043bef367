package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.core.state.StateCodec;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.dispatch.InteractionResult;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.settings.BlockSettings;

import java.util.Objects;

/**
 * Native block type standing in for a scripted one. Each hook the host calls becomes a single
 * dispatch keyed by {@link #handle()}.
 */
public final class ProxyBlock {

    private final long handle;
    private final ResourceKey key;
    private final BlockSettings settings;
    private final StateCodec stateCodec;
    private final CallbackDispatchTable dispatch;

    public ProxyBlock(long handle, ResourceKey key, BlockSettings settings, CallbackDispatchTable dispatch) {
        this.handle = handle;
        this.key = Objects.requireNonNull(key, "key");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
        this.stateCodec = settings.properties().isEmpty() ? StateCodec.EMPTY : new StateCodec(settings.properties());
    }

    public long handle() { return handle; }
    public ResourceKey key() { return key; }
    public BlockSettings settings() { return settings; }
    public StateCodec stateCodec() { return stateCodec; }

    public int defaultState() {
        return stateCodec.defaultState();
    }

    public boolean isRandomlyTicking() {
        return settings.randomTicks();
    }

    /** @return {@code false} to cancel the break */
    public boolean playerWillDestroy(long worldId, int x, int y, int z, long playerId) {
        return dispatch.invoke(CallbackKind.BLOCK_BREAK, h -> h.onBreak(handle, worldId, x, y, z, playerId));
    }

    public InteractionResult use(long worldId, int x, int y, int z, long playerId, int hand) {
        return dispatch.invoke(CallbackKind.BLOCK_USE, h -> h.onUse(handle, worldId, x, y, z, playerId, hand));
    }

    public void stepOn(long worldId, int x, int y, int z, long entityId) {
        dispatch.fire(CallbackKind.BLOCK_STEPPED_ON, h -> h.accept(handle, worldId, x, y, z, entityId));
    }

    public void fallOn(long worldId, int x, int y, int z, long entityId, float fallDistance) {
        dispatch.fire(CallbackKind.BLOCK_FALLEN_UPON, h -> h.onFall(handle, worldId, x, y, z, entityId, fallDistance));
    }

    /** Ignored unless the block was declared with random ticks. */
    public void randomTick(long worldId, int x, int y, int z) {
        if (!settings.randomTicks()) return;
        dispatch.fire(CallbackKind.BLOCK_RANDOM_TICK, h -> h.accept(handle, worldId, x, y, z));
    }

    public void onPlace(long worldId, int x, int y, int z, long placerId) {
        dispatch.fire(CallbackKind.BLOCK_PLACED, h -> h.accept(handle, worldId, x, y, z, placerId));
    }

    public void onRemove(long worldId, int x, int y, int z) {
        dispatch.fire(CallbackKind.BLOCK_REMOVED, h -> h.accept(handle, worldId, x, y, z));
    }

    public void neighborChanged(long worldId, int x, int y, int z, int nx, int ny, int nz) {
        dispatch.fire(CallbackKind.BLOCK_NEIGHBOR_CHANGED, h -> h.onNeighborChanged(handle, worldId, x, y, z, nx, ny, nz));
    }

    public void entityInside(long worldId, int x, int y, int z, long entityId) {
        dispatch.fire(CallbackKind.BLOCK_ENTITY_INSIDE, h -> h.accept(handle, worldId, x, y, z, entityId));
    }

    @Override
    public String toString() {
        return "ProxyBlock{" + key + ", handle=" + handle + '}';
    }
}
