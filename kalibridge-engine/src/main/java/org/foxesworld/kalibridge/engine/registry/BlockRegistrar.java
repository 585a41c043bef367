package org.foxesworld.kalibridge.engine.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.NativeRegistry;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlock;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlockItem;
import org.foxesworld.kalibridge.engine.settings.BlockSettings;

import java.util.Objects;

/** Builds {@link ProxyBlock}s, each with a {@link ProxyBlockItem} under the same key. */
public final class BlockRegistrar extends ProxyRegistrar<BlockSettings, ProxyBlock> {
    private static final Logger log = LogManager.getLogger(BlockRegistrar.class);

    private final CallbackDispatchTable dispatch;

    public BlockRegistrar(HostEngine host, HandleAllocator handles, CallbackDispatchTable dispatch) {
        super("block", host, handles);
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    @Override
    protected NativeRegistry<ProxyBlock> registry() {
        return host.blocks();
    }

    @Override
    protected ProxyBlock build(long handle, ResourceKey key, BlockSettings settings) {
        return new ProxyBlock(handle, key, settings, dispatch);
    }

    @Override
    protected void onRegistered(long handle, ResourceKey key, ProxyBlock block) {
        if (host.items().containsKey(key)) {
            log.warn("Item {} already exists; block {} gets no block item", key, key);
            return;
        }
        host.items().register(key, new ProxyBlockItem(block));
    }
}
