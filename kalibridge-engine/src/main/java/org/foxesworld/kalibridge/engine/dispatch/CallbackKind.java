package org.foxesworld.kalibridge.engine.dispatch;

import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.AnimalBreed;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockActor;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockAt;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockBreak;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockEntityDataGet;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockEntityDataSet;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockEntityEvent;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockEntityLoad;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockEntitySave;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockFall;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockInteract;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.BlockNeighbor;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.CommandExecute;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.ContainerPlayer;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.EntityDamage;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.EntityDeath;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.EntityPair;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.EntityTick;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.GoalAction;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.GoalQuery;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.ItemAttack;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.ItemUse;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.ItemUseOnEntity;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.PlayerAttack;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.PlayerChat;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.PlayerCommand;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.PlayerDeath;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.PlayerDropItem;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.PlayerEvent;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.PlayerPickupItem;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.PlayerRespawn;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.ServerEvent;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.ServerTick;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.SlotClick;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.SlotMayPickup;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.SlotMayPlace;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.SlotQuickMove;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.WorldBlockBreak;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.WorldBlockInteract;
import org.foxesworld.kalibridge.engine.dispatch.CallbackHandlers.WorldBlockPlace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Closed set of callback kinds the host can dispatch into the scripting side.
 *
 * <p>Each kind fixes its handler shape {@code H}, its result type {@code R}, the value returned
 * while no handler is installed, and the value returned when a handler throws
 * ({@code false} for allow/deny kinds, the default otherwise).</p>
 *
 * @param <H> handler interface
 * @param <R> result type ({@link Void} for notifications)
 */
public final class CallbackKind<H, R> {

    public enum Result { VOID, ALLOW, BOOLEAN, INTERACTION, INT, STRING }

    private static final List<CallbackKind<?, ?>> VALUES = new ArrayList<>();

    // blocks
    public static final CallbackKind<BlockBreak, Boolean> BLOCK_BREAK = new CallbackKind<>(
            "BLOCK_BREAK", BlockBreak.class, Result.ALLOW, true,
            cb -> (h, w, x, y, z, p) -> toBool(cb.call(h, w, x, y, z, p), true));
    public static final CallbackKind<BlockInteract, InteractionResult> BLOCK_USE = new CallbackKind<>(
            "BLOCK_USE", BlockInteract.class, Result.INTERACTION, InteractionResult.PASS,
            cb -> (h, w, x, y, z, p, hand) -> toInteraction(cb.call(h, w, x, y, z, p, hand), InteractionResult.PASS));
    public static final CallbackKind<BlockActor, Void> BLOCK_STEPPED_ON = blockActor("BLOCK_STEPPED_ON");
    public static final CallbackKind<BlockFall, Void> BLOCK_FALLEN_UPON = new CallbackKind<>(
            "BLOCK_FALLEN_UPON", BlockFall.class, Result.VOID, null,
            cb -> (h, w, x, y, z, e, d) -> cb.call(h, w, x, y, z, e, d));
    public static final CallbackKind<BlockAt, Void> BLOCK_RANDOM_TICK = blockAt("BLOCK_RANDOM_TICK");
    public static final CallbackKind<BlockActor, Void> BLOCK_PLACED = blockActor("BLOCK_PLACED");
    public static final CallbackKind<BlockAt, Void> BLOCK_REMOVED = blockAt("BLOCK_REMOVED");
    public static final CallbackKind<BlockNeighbor, Void> BLOCK_NEIGHBOR_CHANGED = new CallbackKind<>(
            "BLOCK_NEIGHBOR_CHANGED", BlockNeighbor.class, Result.VOID, null,
            cb -> (h, w, x, y, z, nx, ny, nz) -> cb.call(h, w, x, y, z, nx, ny, nz));
    public static final CallbackKind<BlockActor, Void> BLOCK_ENTITY_INSIDE = blockActor("BLOCK_ENTITY_INSIDE");

    // items
    public static final CallbackKind<ItemUse, InteractionResult> ITEM_USE = new CallbackKind<>(
            "ITEM_USE", ItemUse.class, Result.INTERACTION, InteractionResult.FAIL,
            cb -> (h, w, p, hand) -> toInteraction(cb.call(h, w, p, hand), InteractionResult.FAIL));
    public static final CallbackKind<BlockInteract, InteractionResult> ITEM_USE_ON_BLOCK = new CallbackKind<>(
            "ITEM_USE_ON_BLOCK", BlockInteract.class, Result.INTERACTION, InteractionResult.FAIL,
            cb -> (h, w, x, y, z, p, hand) -> toInteraction(cb.call(h, w, x, y, z, p, hand), InteractionResult.FAIL));
    public static final CallbackKind<ItemUseOnEntity, InteractionResult> ITEM_USE_ON_ENTITY = new CallbackKind<>(
            "ITEM_USE_ON_ENTITY", ItemUseOnEntity.class, Result.INTERACTION, InteractionResult.FAIL,
            cb -> (h, w, e, p, hand) -> toInteraction(cb.call(h, w, e, p, hand), InteractionResult.FAIL));
    public static final CallbackKind<ItemAttack, Boolean> ITEM_ATTACK_ENTITY = new CallbackKind<>(
            "ITEM_ATTACK_ENTITY", ItemAttack.class, Result.ALLOW, true,
            cb -> (h, w, a, t) -> toBool(cb.call(h, w, a, t), true));

    // entities
    public static final CallbackKind<EntityPair, Void> ENTITY_SPAWN = entityPair("ENTITY_SPAWN");
    public static final CallbackKind<EntityTick, Void> ENTITY_TICK = new CallbackKind<>(
            "ENTITY_TICK", EntityTick.class, Result.VOID, null,
            cb -> (h, e) -> cb.call(h, e));
    public static final CallbackKind<EntityDeath, Void> ENTITY_DEATH = new CallbackKind<>(
            "ENTITY_DEATH", EntityDeath.class, Result.VOID, null,
            cb -> (h, e, src) -> cb.call(h, e, src));
    public static final CallbackKind<EntityDamage, Boolean> ENTITY_DAMAGE = new CallbackKind<>(
            "ENTITY_DAMAGE", EntityDamage.class, Result.ALLOW, true,
            cb -> (h, e, src, amount) -> toBool(cb.call(h, e, src, amount), true));
    public static final CallbackKind<EntityPair, Void> ENTITY_ATTACK = entityPair("ENTITY_ATTACK");
    public static final CallbackKind<EntityPair, Void> ENTITY_TARGET = entityPair("ENTITY_TARGET");
    public static final CallbackKind<AnimalBreed, Void> ANIMAL_BREED = new CallbackKind<>(
            "ANIMAL_BREED", AnimalBreed.class, Result.VOID, null,
            cb -> (h, e, partner, baby) -> cb.call(h, e, partner, baby));

    // containers
    public static final CallbackKind<ContainerPlayer, Void> CONTAINER_OPEN = containerPlayer("CONTAINER_OPEN");
    public static final CallbackKind<ContainerPlayer, Void> CONTAINER_CLOSE = containerPlayer("CONTAINER_CLOSE");
    public static final CallbackKind<SlotClick, Integer> CONTAINER_SLOT_CLICK = new CallbackKind<>(
            "CONTAINER_SLOT_CLICK", SlotClick.class, Result.INT, 0,
            cb -> (h, m, slot, button, type) -> toInt(cb.call(h, m, slot, button, type), 0));
    public static final CallbackKind<SlotMayPlace, Boolean> CONTAINER_MAY_PLACE = new CallbackKind<>(
            "CONTAINER_MAY_PLACE", SlotMayPlace.class, Result.ALLOW, true,
            cb -> (h, m, slot, item) -> toBool(cb.call(h, m, slot, item), true));
    public static final CallbackKind<SlotMayPickup, Boolean> CONTAINER_MAY_PICKUP = new CallbackKind<>(
            "CONTAINER_MAY_PICKUP", SlotMayPickup.class, Result.ALLOW, true,
            cb -> (h, m, slot) -> toBool(cb.call(h, m, slot), true));
    public static final CallbackKind<SlotQuickMove, String> CONTAINER_QUICK_MOVE = new CallbackKind<>(
            "CONTAINER_QUICK_MOVE", SlotQuickMove.class, Result.STRING, null,
            cb -> (h, m, slot) -> toStr(cb.call(h, m, slot)));

    // block entities
    public static final CallbackKind<BlockEntityLoad, Void> BLOCK_ENTITY_LOAD = new CallbackKind<>(
            "BLOCK_ENTITY_LOAD", BlockEntityLoad.class, Result.VOID, null,
            cb -> (h, pos, data) -> cb.call(h, pos, data));
    public static final CallbackKind<BlockEntitySave, String> BLOCK_ENTITY_SAVE = new CallbackKind<>(
            "BLOCK_ENTITY_SAVE", BlockEntitySave.class, Result.STRING, null,
            cb -> (h, pos) -> toStr(cb.call(h, pos)));
    public static final CallbackKind<BlockEntityEvent, Void> BLOCK_ENTITY_TICK = blockEntityEvent("BLOCK_ENTITY_TICK");
    public static final CallbackKind<BlockEntityEvent, Void> BLOCK_ENTITY_REMOVED = blockEntityEvent("BLOCK_ENTITY_REMOVED");
    public static final CallbackKind<BlockEntityEvent, Void> BLOCK_ENTITY_CONTAINER_OPEN =
            blockEntityEvent("BLOCK_ENTITY_CONTAINER_OPEN");
    public static final CallbackKind<BlockEntityEvent, Void> BLOCK_ENTITY_CONTAINER_CLOSE =
            blockEntityEvent("BLOCK_ENTITY_CONTAINER_CLOSE");
    public static final CallbackKind<BlockEntityDataGet, Integer> BLOCK_ENTITY_DATA_GET = new CallbackKind<>(
            "BLOCK_ENTITY_DATA_GET", BlockEntityDataGet.class, Result.INT, null,
            cb -> (h, pos, i) -> toInteger(cb.call(h, pos, i)));
    public static final CallbackKind<BlockEntityDataSet, Void> BLOCK_ENTITY_DATA_SET = new CallbackKind<>(
            "BLOCK_ENTITY_DATA_SET", BlockEntityDataSet.class, Result.VOID, null,
            cb -> (h, pos, i, v) -> cb.call(h, pos, i, v));

    // server
    public static final CallbackKind<ServerEvent, Void> SERVER_STARTING = serverEvent("SERVER_STARTING");
    public static final CallbackKind<ServerEvent, Void> SERVER_STARTED = serverEvent("SERVER_STARTED");
    public static final CallbackKind<ServerEvent, Void> SERVER_STOPPING = serverEvent("SERVER_STOPPING");
    public static final CallbackKind<ServerTick, Void> SERVER_TICK = new CallbackKind<>(
            "SERVER_TICK", ServerTick.class, Result.VOID, null,
            cb -> t -> cb.call(t));

    // players
    public static final CallbackKind<PlayerEvent, Void> PLAYER_JOIN = playerEvent("PLAYER_JOIN");
    public static final CallbackKind<PlayerEvent, Void> PLAYER_LEAVE = playerEvent("PLAYER_LEAVE");
    public static final CallbackKind<PlayerRespawn, Void> PLAYER_RESPAWN = new CallbackKind<>(
            "PLAYER_RESPAWN", PlayerRespawn.class, Result.VOID, null,
            cb -> (p, end) -> cb.call(p, end));
    public static final CallbackKind<PlayerDeath, String> PLAYER_DEATH = new CallbackKind<>(
            "PLAYER_DEATH", PlayerDeath.class, Result.STRING, null,
            cb -> (p, src) -> toStr(cb.call(p, src)));
    public static final CallbackKind<PlayerChat, String> PLAYER_CHAT = new CallbackKind<>(
            "PLAYER_CHAT", PlayerChat.class, Result.STRING, null,
            cb -> (p, msg) -> toStr(cb.call(p, msg)));
    public static final CallbackKind<PlayerCommand, Boolean> PLAYER_COMMAND = new CallbackKind<>(
            "PLAYER_COMMAND", PlayerCommand.class, Result.ALLOW, true,
            cb -> (p, cmd) -> toBool(cb.call(p, cmd), true));
    public static final CallbackKind<PlayerAttack, Boolean> PLAYER_ATTACK_ENTITY = new CallbackKind<>(
            "PLAYER_ATTACK_ENTITY", PlayerAttack.class, Result.ALLOW, true,
            cb -> (p, t) -> toBool(cb.call(p, t), true));
    public static final CallbackKind<PlayerDropItem, Boolean> PLAYER_DROP_ITEM = new CallbackKind<>(
            "PLAYER_DROP_ITEM", PlayerDropItem.class, Result.ALLOW, true,
            cb -> (p, item, count) -> toBool(cb.call(p, item, count), true));
    public static final CallbackKind<PlayerPickupItem, Boolean> PLAYER_PICKUP_ITEM = new CallbackKind<>(
            "PLAYER_PICKUP_ITEM", PlayerPickupItem.class, Result.ALLOW, true,
            cb -> (p, e) -> toBool(cb.call(p, e), true));

    // any block in the world
    public static final CallbackKind<WorldBlockBreak, Boolean> WORLD_BLOCK_BREAK = new CallbackKind<>(
            "WORLD_BLOCK_BREAK", WorldBlockBreak.class, Result.ALLOW, true,
            cb -> (w, x, y, z, p) -> toBool(cb.call(w, x, y, z, p), true));
    public static final CallbackKind<WorldBlockPlace, Boolean> WORLD_BLOCK_PLACE = new CallbackKind<>(
            "WORLD_BLOCK_PLACE", WorldBlockPlace.class, Result.ALLOW, true,
            cb -> (w, x, y, z, p, block) -> toBool(cb.call(w, x, y, z, p, block), true));
    public static final CallbackKind<WorldBlockInteract, Boolean> WORLD_BLOCK_INTERACT = new CallbackKind<>(
            "WORLD_BLOCK_INTERACT", WorldBlockInteract.class, Result.ALLOW, true,
            cb -> (w, x, y, z, p, hand) -> toBool(cb.call(w, x, y, z, p, hand), true));

    // commands
    public static final CallbackKind<CommandExecute, Integer> COMMAND_EXECUTE = new CallbackKind<>(
            "COMMAND_EXECUTE", CommandExecute.class, Result.INT, 0,
            cb -> (c, p, args) -> toInt(cb.call(c, p, args), 0));

    // scripted goals
    public static final CallbackKind<GoalQuery, Boolean> GOAL_CAN_USE = goalQuery("GOAL_CAN_USE");
    public static final CallbackKind<GoalQuery, Boolean> GOAL_CAN_CONTINUE = goalQuery("GOAL_CAN_CONTINUE");
    public static final CallbackKind<GoalAction, Void> GOAL_START = goalAction("GOAL_START");
    public static final CallbackKind<GoalAction, Void> GOAL_TICK = goalAction("GOAL_TICK");
    public static final CallbackKind<GoalAction, Void> GOAL_STOP = goalAction("GOAL_STOP");

    private final int ordinal;
    private final String name;
    private final Class<H> handlerType;
    private final Result result;
    private final R defaultValue;
    private final Function<DynamicCallback, H> binder;

    private CallbackKind(String name, Class<H> handlerType, Result result, R defaultValue,
                         Function<DynamicCallback, H> binder) {
        this.name = name;
        this.handlerType = handlerType;
        this.result = result;
        this.defaultValue = defaultValue;
        this.binder = binder;
        this.ordinal = VALUES.size();
        VALUES.add(this);
    }

    public static List<CallbackKind<?, ?>> values() {
        return Collections.unmodifiableList(VALUES);
    }

    public static int count() {
        return VALUES.size();
    }

    /** Case-insensitive lookup by name, {@code null} if unknown. */
    public static CallbackKind<?, ?> byName(String name) {
        if (name == null) return null;
        String n = name.trim().toUpperCase(Locale.ROOT);
        for (CallbackKind<?, ?> k : VALUES) {
            if (k.name.equals(n)) return k;
        }
        return null;
    }

    public int ordinal() { return ordinal; }
    public String name() { return name; }
    public Class<H> handlerType() { return handlerType; }
    public Result result() { return result; }

    /** Returned when no handler is installed. {@code null} for notifications. */
    public R defaultValue() {
        return defaultValue;
    }

    /** Returned when the handler throws. */
    @SuppressWarnings("unchecked")
    public R failureValue() {
        return result == Result.ALLOW ? (R) Boolean.FALSE : defaultValue;
    }

    /** Wraps an untyped callback as this kind's handler; unusable results fall back to the default. */
    public H bind(DynamicCallback callback) {
        Objects.requireNonNull(callback, "callback");
        return binder.apply(callback);
    }

    @Override
    public String toString() {
        return name;
    }

    // ---- factories for shared shapes ----

    private static CallbackKind<BlockActor, Void> blockActor(String name) {
        return new CallbackKind<>(name, BlockActor.class, Result.VOID, null,
                cb -> (h, w, x, y, z, a) -> cb.call(h, w, x, y, z, a));
    }

    private static CallbackKind<BlockAt, Void> blockAt(String name) {
        return new CallbackKind<>(name, BlockAt.class, Result.VOID, null,
                cb -> (h, w, x, y, z) -> cb.call(h, w, x, y, z));
    }

    private static CallbackKind<EntityPair, Void> entityPair(String name) {
        return new CallbackKind<>(name, EntityPair.class, Result.VOID, null,
                cb -> (h, e, o) -> cb.call(h, e, o));
    }

    private static CallbackKind<ContainerPlayer, Void> containerPlayer(String name) {
        return new CallbackKind<>(name, ContainerPlayer.class, Result.VOID, null,
                cb -> (h, m, p) -> cb.call(h, m, p));
    }

    private static CallbackKind<BlockEntityEvent, Void> blockEntityEvent(String name) {
        return new CallbackKind<>(name, BlockEntityEvent.class, Result.VOID, null,
                cb -> (h, pos) -> cb.call(h, pos));
    }

    private static CallbackKind<ServerEvent, Void> serverEvent(String name) {
        return new CallbackKind<>(name, ServerEvent.class, Result.VOID, null,
                cb -> () -> cb.call());
    }

    private static CallbackKind<PlayerEvent, Void> playerEvent(String name) {
        return new CallbackKind<>(name, PlayerEvent.class, Result.VOID, null,
                cb -> p -> cb.call(p));
    }

    private static CallbackKind<GoalQuery, Boolean> goalQuery(String name) {
        return new CallbackKind<>(name, GoalQuery.class, Result.BOOLEAN, false,
                cb -> (g, e) -> toBool(cb.call(g, e), false));
    }

    private static CallbackKind<GoalAction, Void> goalAction(String name) {
        return new CallbackKind<>(name, GoalAction.class, Result.VOID, null,
                cb -> (g, e) -> cb.call(g, e));
    }

    // ---- result coercion ----

    static boolean toBool(Object v, boolean def) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0.0;
        return def;
    }

    static int toInt(Object v, int def) {
        if (v instanceof Number n) return n.intValue();
        if (v instanceof Boolean b) return b ? 1 : 0;
        return def;
    }

    static Integer toInteger(Object v) {
        if (v instanceof Number n) return n.intValue();
        if (v instanceof Boolean b) return b ? 1 : 0;
        return null;
    }

    static String toStr(Object v) {
        return v instanceof String s ? s : null;
    }

    static InteractionResult toInteraction(Object v, InteractionResult def) {
        if (v instanceof InteractionResult r) return r;
        if (v instanceof Number n) return InteractionResult.fromOrdinal(n.intValue());
        if (v instanceof String s) {
            try {
                return InteractionResult.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return InteractionResult.PASS;
            }
        }
        return def;
    }
}
