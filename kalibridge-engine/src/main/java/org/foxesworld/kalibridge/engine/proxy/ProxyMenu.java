package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;

/** An open container screen for one player. */
public final class ProxyMenu {

    private final ProxyContainerType type;
    private final long menuId;
    private final long playerId;
    private final CallbackDispatchTable dispatch;
    private boolean closed;

    ProxyMenu(ProxyContainerType type, long menuId, long playerId, CallbackDispatchTable dispatch) {
        this.type = type;
        this.menuId = menuId;
        this.playerId = playerId;
        this.dispatch = dispatch;
    }

    public ProxyContainerType type() { return type; }
    public long menuId() { return menuId; }
    public long playerId() { return playerId; }
    public boolean isClosed() { return closed; }

    /**
     * @return 0 to let the host handle the click as usual, anything else if the script took it
     */
    public int clicked(int slot, int button, int clickType) {
        if (!validSlot(slot)) return 0;
        return dispatch.invoke(CallbackKind.CONTAINER_SLOT_CLICK, h -> h.onClick(type.handle(), menuId, slot, button, clickType));
    }

    public boolean mayPlace(int slot, String itemId) {
        if (!validSlot(slot)) return false;
        return dispatch.invoke(CallbackKind.CONTAINER_MAY_PLACE, h -> h.mayPlace(type.handle(), menuId, slot, itemId));
    }

    public boolean mayPickup(int slot) {
        if (!validSlot(slot)) return false;
        return dispatch.invoke(CallbackKind.CONTAINER_MAY_PICKUP, h -> h.mayPickup(type.handle(), menuId, slot));
    }

    /**
     * Shift-click on {@code slot}.
     *
     * @return item key the script moved, {@code null} to let the host move the stack itself
     */
    public String quickMove(int slot) {
        if (!validSlot(slot)) return null;
        return dispatch.invoke(CallbackKind.CONTAINER_QUICK_MOVE, h -> h.onQuickMove(type.handle(), menuId, slot));
    }

    public void removed() {
        if (closed) return;
        closed = true;
        dispatch.fire(CallbackKind.CONTAINER_CLOSE, h -> h.accept(type.handle(), menuId, playerId));
    }

    private boolean validSlot(int slot) {
        return !closed && slot >= 0 && slot < type.slotCount();
    }
}
