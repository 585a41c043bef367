package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.settings.BlockEntitySettings;

import java.util.Objects;

/** Native block entity type of a scripted block; one {@link ProxyBlockEntity} per placed block. */
public final class ProxyBlockEntityType {

    private final long handle;
    private final ResourceKey key;
    private final BlockEntitySettings settings;
    private final ProxyBlock block;
    private final CallbackDispatchTable dispatch;

    public ProxyBlockEntityType(long handle, ResourceKey key, BlockEntitySettings settings, ProxyBlock block,
                                CallbackDispatchTable dispatch) {
        this.handle = handle;
        this.key = Objects.requireNonNull(key, "key");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.block = Objects.requireNonNull(block, "block");
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    public long handle() { return handle; }
    public ResourceKey key() { return key; }
    public BlockEntitySettings settings() { return settings; }
    public ProxyBlock block() { return block; }

    public ProxyBlockEntity create(int x, int y, int z) {
        return new ProxyBlockEntity(this, ProxyBlockEntity.packPos(x, y, z), dispatch);
    }

    @Override
    public String toString() {
        return "ProxyBlockEntityType{" + key + ", slots=" + settings.inventorySize()
                + ", ticks=" + settings.ticks() + '}';
    }
}
