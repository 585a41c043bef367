package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.settings.ContainerSettings;

import java.util.Objects;

/** Native menu type for a scripted container. */
public final class ProxyContainerType {

    private final long handle;
    private final ResourceKey key;
    private final ContainerSettings settings;
    private final CallbackDispatchTable dispatch;

    public ProxyContainerType(long handle, ResourceKey key, ContainerSettings settings, CallbackDispatchTable dispatch) {
        this.handle = handle;
        this.key = Objects.requireNonNull(key, "key");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    public long handle() { return handle; }
    public ResourceKey key() { return key; }
    public ContainerSettings settings() { return settings; }

    public int slotCount() {
        return settings.slotCount();
    }

    public ProxyMenu open(long menuId, long playerId) {
        ProxyMenu menu = new ProxyMenu(this, menuId, playerId, dispatch);
        dispatch.fire(CallbackKind.CONTAINER_OPEN, h -> h.accept(handle, menuId, playerId));
        return menu;
    }

    @Override
    public String toString() {
        return "ProxyContainerType{" + key + ", " + settings.rows() + "x" + settings.columns() + '}';
    }
}
