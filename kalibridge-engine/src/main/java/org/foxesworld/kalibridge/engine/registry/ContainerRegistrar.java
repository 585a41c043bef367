package org.foxesworld.kalibridge.engine.registry;

import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.NativeRegistry;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.proxy.ProxyContainerType;
import org.foxesworld.kalibridge.engine.settings.ContainerSettings;

import java.util.Objects;

public final class ContainerRegistrar extends ProxyRegistrar<ContainerSettings, ProxyContainerType> {

    private final CallbackDispatchTable dispatch;

    public ContainerRegistrar(HostEngine host, HandleAllocator handles, CallbackDispatchTable dispatch) {
        super("container", host, handles);
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    @Override
    protected NativeRegistry<ProxyContainerType> registry() {
        return host.menus();
    }

    @Override
    protected ProxyContainerType build(long handle, ResourceKey key, ContainerSettings settings) {
        return new ProxyContainerType(handle, key, settings, dispatch);
    }
}
