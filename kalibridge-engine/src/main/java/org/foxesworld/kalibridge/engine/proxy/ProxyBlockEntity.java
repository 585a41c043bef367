package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.settings.BlockEntitySettings;

import java.util.Arrays;

/**
 * One placed block entity. Scripts see it as (type handle, packed position); the script keeps
 * its own state and hands it back as JSON on save.
 *
 * <p>Data slots answer from the script while a {@code BLOCK_ENTITY_DATA_GET} handler is
 * installed and from the local copy otherwise. Host thread only.</p>
 */
public final class ProxyBlockEntity {

    public static final int LIT_TIME = 0;
    public static final int LIT_DURATION = 1;
    public static final int COOKING_PROGRESS = 2;
    public static final int COOKING_TOTAL_TIME = 3;

    static final int DEFAULT_COOKING_TIME = 200;

    private final ProxyBlockEntityType type;
    private final long posHash;
    private final CallbackDispatchTable dispatch;
    private final String[] slots;
    private final int[] data;
    private String dataJson = "{}";
    private boolean removed;

    ProxyBlockEntity(ProxyBlockEntityType type, long posHash, CallbackDispatchTable dispatch) {
        this.type = type;
        this.posHash = posHash;
        this.dispatch = dispatch;
        BlockEntitySettings s = type.settings();
        this.slots = new String[s.inventorySize()];
        this.data = new int[s.dataSlots()];
        if (s.processing()) data[COOKING_TOTAL_TIME] = DEFAULT_COOKING_TIME;
    }

    public ProxyBlockEntityType type() { return type; }
    public long handle() { return type.handle(); }
    public long posHash() { return posHash; }
    public boolean isRemoved() { return removed; }
    public String dataJson() { return dataJson; }

    /** Restores saved data and hands it to the script. */
    public void load(String json) {
        dataJson = json == null || json.isBlank() ? "{}" : json;
        dispatch.fire(CallbackKind.BLOCK_ENTITY_LOAD, h -> h.onLoad(type.handle(), posHash, dataJson));
    }

    /** @return the data to persist: the script's answer if it gave one, else what was loaded */
    public String save() {
        String fromScript = dispatch.invoke(CallbackKind.BLOCK_ENTITY_SAVE, h -> h.onSave(type.handle(), posHash));
        if (fromScript != null && !fromScript.isEmpty()) dataJson = fromScript;
        return dataJson;
    }

    /** @return {@code false} if the type does not tick or the entity is gone */
    public boolean tick() {
        if (removed || !type.settings().ticks()) return false;
        dispatch.fire(CallbackKind.BLOCK_ENTITY_TICK, h -> h.accept(type.handle(), posHash));
        return true;
    }

    public void setRemoved() {
        if (removed) return;
        removed = true;
        dispatch.fire(CallbackKind.BLOCK_ENTITY_REMOVED, h -> h.accept(type.handle(), posHash));
    }

    public void startOpen() {
        if (removed) return;
        dispatch.fire(CallbackKind.BLOCK_ENTITY_CONTAINER_OPEN, h -> h.accept(type.handle(), posHash));
    }

    public void stopOpen() {
        if (removed) return;
        dispatch.fire(CallbackKind.BLOCK_ENTITY_CONTAINER_CLOSE, h -> h.accept(type.handle(), posHash));
    }

    // ---- inventory ----

    public int containerSize() {
        return slots.length;
    }

    /** Item key in {@code slot}, {@code null} if empty or out of range. */
    public String getItem(int slot) {
        return slot >= 0 && slot < slots.length ? slots[slot] : null;
    }

    /** Out-of-range slots are ignored. */
    public void setItem(int slot, String itemId) {
        if (slot < 0 || slot >= slots.length) return;
        slots[slot] = itemId == null || itemId.isBlank() ? null : itemId;
    }

    public boolean isEmpty() {
        return Arrays.stream(slots).allMatch(s -> s == null);
    }

    // ---- synced data ----

    public int dataSlotCount() {
        return data.length;
    }

    public int getData(int index) {
        if (index < 0 || index >= data.length) return 0;
        Integer fromScript = dispatch.invoke(CallbackKind.BLOCK_ENTITY_DATA_GET, h -> h.get(type.handle(), posHash, index));
        return fromScript != null ? fromScript : data[index];
    }

    public void setData(int index, int value) {
        if (index < 0 || index >= data.length) return;
        dispatch.fire(CallbackKind.BLOCK_ENTITY_DATA_SET, h -> h.set(type.handle(), posHash, index, value));
        data[index] = value;
    }

    /** Processing types only: fuel is burning. */
    public boolean isLit() {
        return type.settings().processing() && getData(LIT_TIME) > 0;
    }

    // ---- position packing, 26 bits x, 26 bits z, 12 bits y ----

    public static long packPos(int x, int y, int z) {
        return ((long) x & 0x3FFFFFFL) << 38 | ((long) z & 0x3FFFFFFL) << 12 | ((long) y & 0xFFFL);
    }

    public static int unpackX(long posHash) {
        return (int) (posHash >> 38);
    }

    public static int unpackY(long posHash) {
        return (int) (posHash << 52 >> 52);
    }

    public static int unpackZ(long posHash) {
        return (int) (posHash << 26 >> 38);
    }

    @Override
    public String toString() {
        return "ProxyBlockEntity{" + type.key() + " @ " + unpackX(posHash) + "," + unpackY(posHash) + ","
                + unpackZ(posHash) + '}';
    }
}
