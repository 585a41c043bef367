package org.foxesworld.kalibridge.engine.events;

import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;

import java.util.Objects;

/**
 * Server, player and world events that are not tied to one proxy object. The host calls these
 * from its own event hooks; every call is a single dispatch.
 *
 * <p>Boolean results are allow/deny: {@code false} cancels the host action.</p>
 */
public final class HostEvents {

    private final CallbackDispatchTable dispatch;

    public HostEvents(CallbackDispatchTable dispatch) {
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
    }

    // ---- server lifecycle ----

    public void serverStarting() {
        dispatch.fire(CallbackKind.SERVER_STARTING, h -> h.run());
    }

    public void serverStarted() {
        dispatch.fire(CallbackKind.SERVER_STARTED, h -> h.run());
    }

    public void serverStopping() {
        dispatch.fire(CallbackKind.SERVER_STOPPING, h -> h.run());
    }

    /** Once per server tick. */
    public void tick(long tick) {
        dispatch.fire(CallbackKind.SERVER_TICK, h -> h.onTick(tick));
    }

    // ---- players ----

    public void playerJoin(long playerId) {
        dispatch.fire(CallbackKind.PLAYER_JOIN, h -> h.accept(playerId));
    }

    public void playerLeave(long playerId) {
        dispatch.fire(CallbackKind.PLAYER_LEAVE, h -> h.accept(playerId));
    }

    public void playerRespawn(long playerId, boolean endConquered) {
        dispatch.fire(CallbackKind.PLAYER_RESPAWN, h -> h.onRespawn(playerId, endConquered));
    }

    /** @return the death message to show, or {@code null} for the host's own */
    public String playerDeath(long playerId, String damageSource) {
        return dispatch.invoke(CallbackKind.PLAYER_DEATH, h -> h.onDeath(playerId, damageSource));
    }

    /** @return the message to broadcast: the script's replacement, else {@code message} */
    public String playerChat(long playerId, String message) {
        String replaced = dispatch.invoke(CallbackKind.PLAYER_CHAT, h -> h.onChat(playerId, message));
        return replaced != null ? replaced : message;
    }

    public boolean playerCommand(long playerId, String command) {
        return dispatch.invoke(CallbackKind.PLAYER_COMMAND, h -> h.onCommand(playerId, command));
    }

    public boolean playerAttackEntity(long playerId, long targetId) {
        return dispatch.invoke(CallbackKind.PLAYER_ATTACK_ENTITY, h -> h.onAttack(playerId, targetId));
    }

    public boolean playerDropItem(long playerId, String itemId, int count) {
        return dispatch.invoke(CallbackKind.PLAYER_DROP_ITEM, h -> h.onDrop(playerId, itemId, count));
    }

    public boolean playerPickupItem(long playerId, long itemEntityId) {
        return dispatch.invoke(CallbackKind.PLAYER_PICKUP_ITEM, h -> h.onPickup(playerId, itemEntityId));
    }

    // ---- any block ----

    public boolean blockBreak(long worldId, int x, int y, int z, long playerId) {
        return dispatch.invoke(CallbackKind.WORLD_BLOCK_BREAK, h -> h.onBreak(worldId, x, y, z, playerId));
    }

    public boolean blockPlace(long worldId, int x, int y, int z, long playerId, String blockId) {
        return dispatch.invoke(CallbackKind.WORLD_BLOCK_PLACE, h -> h.onPlace(worldId, x, y, z, playerId, blockId));
    }

    public boolean blockInteract(long worldId, int x, int y, int z, long playerId, int hand) {
        return dispatch.invoke(CallbackKind.WORLD_BLOCK_INTERACT, h -> h.onInteract(worldId, x, y, z, playerId, hand));
    }
}
