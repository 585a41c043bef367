package org.foxesworld.kalibridge.engine.registry;

import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.NativeRegistry;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.proxy.ItemLike;
import org.foxesworld.kalibridge.engine.proxy.ProxyItem;
import org.foxesworld.kalibridge.engine.settings.ItemSettings;

import java.util.Objects;

public final class ItemRegistrar extends ProxyRegistrar<ItemSettings, ProxyItem> {

    private final CallbackDispatchTable dispatch;

    public ItemRegistrar(HostEngine host, HandleAllocator handles, CallbackDispatchTable dispatch) {
        super("item", host, handles);
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    @Override
    protected NativeRegistry<ItemLike> registry() {
        return host.items();
    }

    @Override
    protected ProxyItem build(long handle, ResourceKey key, ItemSettings settings) {
        return new ProxyItem(handle, key, settings, dispatch);
    }
}
