package org.foxesworld.kalibridge.engine.dispatch;

/**
 * Handler shapes, one per argument layout. {@code handle} is the proxy object's handle; the
 * server, player and world shapes are global and carry none.
 */
public final class CallbackHandlers {

    private CallbackHandlers() {}

    @FunctionalInterface
    public interface BlockBreak {
        boolean onBreak(long handle, long worldId, int x, int y, int z, long playerId);
    }

    @FunctionalInterface
    public interface BlockInteract {
        InteractionResult onUse(long handle, long worldId, int x, int y, int z, long playerId, int hand);
    }

    /** Stepped on, placed, entity inside. */
    @FunctionalInterface
    public interface BlockActor {
        void accept(long handle, long worldId, int x, int y, int z, long actorId);
    }

    @FunctionalInterface
    public interface BlockFall {
        void onFall(long handle, long worldId, int x, int y, int z, long entityId, float fallDistance);
    }

    /** Random tick, removed. */
    @FunctionalInterface
    public interface BlockAt {
        void accept(long handle, long worldId, int x, int y, int z);
    }

    @FunctionalInterface
    public interface BlockNeighbor {
        void onNeighborChanged(long handle, long worldId, int x, int y, int z, int nx, int ny, int nz);
    }

    @FunctionalInterface
    public interface ItemUse {
        InteractionResult onUse(long handle, long worldId, long playerId, int hand);
    }

    @FunctionalInterface
    public interface ItemUseOnEntity {
        InteractionResult onUse(long handle, long worldId, long entityId, long playerId, int hand);
    }

    @FunctionalInterface
    public interface ItemAttack {
        boolean onAttack(long handle, long worldId, long attackerId, long targetId);
    }

    /** Spawn (other = world), attack and target (other = target entity). */
    @FunctionalInterface
    public interface EntityPair {
        void accept(long handle, long entityId, long otherId);
    }

    @FunctionalInterface
    public interface EntityTick {
        void onTick(long handle, long entityId);
    }

    @FunctionalInterface
    public interface EntityDeath {
        void onDeath(long handle, long entityId, String damageSource);
    }

    @FunctionalInterface
    public interface EntityDamage {
        boolean onDamage(long handle, long entityId, String damageSource, float amount);
    }

    @FunctionalInterface
    public interface AnimalBreed {
        void onBreed(long handle, long entityId, long partnerId, long babyId);
    }

    /** Open, close. */
    @FunctionalInterface
    public interface ContainerPlayer {
        void accept(long handle, long menuId, long playerId);
    }

    @FunctionalInterface
    public interface SlotClick {
        int onClick(long handle, long menuId, int slot, int button, int clickType);
    }

    @FunctionalInterface
    public interface SlotMayPlace {
        boolean mayPlace(long handle, long menuId, int slot, String itemId);
    }

    @FunctionalInterface
    public interface SlotMayPickup {
        boolean mayPickup(long handle, long menuId, int slot);
    }

    @FunctionalInterface
    public interface CommandExecute {
        int execute(long commandId, long playerId, String argsJson);
    }

    @FunctionalInterface
    public interface GoalQuery {
        boolean test(String goalId, long entityId);
    }

    @FunctionalInterface
    public interface GoalAction {
        void run(String goalId, long entityId);
    }

    /** Menu shift-click; a non-null answer is the item data the script moved. */
    @FunctionalInterface
    public interface SlotQuickMove {
        String onQuickMove(long handle, long menuId, int slot);
    }

    // ---- block entities; posHash is the packed block position ----

    /** Tick, removed, container open, container close. */
    @FunctionalInterface
    public interface BlockEntityEvent {
        void accept(long handle, long posHash);
    }

    @FunctionalInterface
    public interface BlockEntityLoad {
        void onLoad(long handle, long posHash, String dataJson);
    }

    /** A non-empty answer replaces the stored data. */
    @FunctionalInterface
    public interface BlockEntitySave {
        String onSave(long handle, long posHash);
    }

    /** {@code null} leaves the read to the block entity's own value. */
    @FunctionalInterface
    public interface BlockEntityDataGet {
        Integer get(long handle, long posHash, int index);
    }

    @FunctionalInterface
    public interface BlockEntityDataSet {
        void set(long handle, long posHash, int index, int value);
    }

    // ---- server and player events ----

    /** Starting, started, stopping. */
    @FunctionalInterface
    public interface ServerEvent {
        void run();
    }

    @FunctionalInterface
    public interface ServerTick {
        void onTick(long tick);
    }

    /** Join, leave. */
    @FunctionalInterface
    public interface PlayerEvent {
        void accept(long playerId);
    }

    @FunctionalInterface
    public interface PlayerRespawn {
        void onRespawn(long playerId, boolean endConquered);
    }

    /** Answers a death message, or {@code null} for the host's own. */
    @FunctionalInterface
    public interface PlayerDeath {
        String onDeath(long playerId, String damageSource);
    }

    /** Answers the message to broadcast, or {@code null} to keep it unchanged. */
    @FunctionalInterface
    public interface PlayerChat {
        String onChat(long playerId, String message);
    }

    @FunctionalInterface
    public interface PlayerCommand {
        boolean onCommand(long playerId, String command);
    }

    @FunctionalInterface
    public interface PlayerAttack {
        boolean onAttack(long playerId, long targetId);
    }

    @FunctionalInterface
    public interface PlayerDropItem {
        boolean onDrop(long playerId, String itemId, int count);
    }

    @FunctionalInterface
    public interface PlayerPickupItem {
        boolean onPickup(long playerId, long itemEntityId);
    }

    // ---- world-wide block events, any block ----

    @FunctionalInterface
    public interface WorldBlockBreak {
        boolean onBreak(long worldId, int x, int y, int z, long playerId);
    }

    @FunctionalInterface
    public interface WorldBlockPlace {
        boolean onPlace(long worldId, int x, int y, int z, long playerId, String blockId);
    }

    @FunctionalInterface
    public interface WorldBlockInteract {
        boolean onInteract(long worldId, int x, int y, int z, long playerId, int hand);
    }
}
