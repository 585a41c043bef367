package org.foxesworld.kalibridge.engine.registry;

import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.NativeRegistry;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlock;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlockEntityType;
import org.foxesworld.kalibridge.engine.settings.BlockEntitySettings;

import java.util.Objects;

/**
 * Builds {@link ProxyBlockEntityType}s. The block with the same key must be registered first;
 * the block entity attaches to it.
 */
public final class BlockEntityRegistrar extends ProxyRegistrar<BlockEntitySettings, ProxyBlockEntityType> {

    private final CallbackDispatchTable dispatch;

    public BlockEntityRegistrar(HostEngine host, HandleAllocator handles, CallbackDispatchTable dispatch) {
        super("block_entity", host, handles);
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    @Override
    protected NativeRegistry<ProxyBlockEntityType> registry() {
        return host.blockEntityTypes();
    }

    @Override
    protected ProxyBlockEntityType build(long handle, ResourceKey key, BlockEntitySettings settings) {
        ProxyBlock block = host.blocks().get(key);
        if (block == null) throw new IllegalStateException("no block registered under " + key);
        return new ProxyBlockEntityType(handle, key, settings, block, dispatch);
    }
}
