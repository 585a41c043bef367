package org.foxesworld.kalibridge.engine.settings;

import java.util.Objects;

/**
 * Captured block entity definition, attached to the block registered under the same key.
 *
 * @param inventorySize item slots, 0 for none
 * @param ticks         when set, every block entity tick is dispatched to the scripting side
 * @param processing    furnace-style: four synced values (lit time, lit duration, cooking
 *                      progress, cooking total time) at the front of the data slots
 * @param dataSlots     synced integer values the menu reads; at least 4 when processing
 */
public record BlockEntitySettings(int inventorySize,
                                  String containerTitle,
                                  boolean ticks,
                                  boolean processing,
                                  int dataSlots) {

    public static final int MAX_INVENTORY = 54;
    public static final int MAX_DATA_SLOTS = 32;
    public static final int PROCESSING_SLOTS = 4;

    public BlockEntitySettings {
        if (inventorySize < 0 || inventorySize > MAX_INVENTORY) {
            throw new IllegalArgumentException("inventorySize must be 0.." + MAX_INVENTORY + ", got " + inventorySize);
        }
        Objects.requireNonNull(containerTitle, "containerTitle");
        if (processing && dataSlots < PROCESSING_SLOTS) dataSlots = PROCESSING_SLOTS;
        if (dataSlots < 0 || dataSlots > MAX_DATA_SLOTS) {
            throw new IllegalArgumentException("dataSlots must be 0.." + MAX_DATA_SLOTS + ", got " + dataSlots);
        }
    }

    public boolean hasInventory() {
        return inventorySize > 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int inventorySize;
        private String containerTitle = "Container";
        private boolean ticks;
        private boolean processing;
        private int dataSlots;

        private Builder() {}

        public Builder inventory(int size) { this.inventorySize = size; return this; }
        public Builder containerTitle(String v) { this.containerTitle = v; return this; }
        public Builder ticks(boolean v) { this.ticks = v; return this; }
        public Builder processing(boolean v) { this.processing = v; return this; }
        public Builder dataSlots(int v) { this.dataSlots = v; return this; }

        public BlockEntitySettings build() {
            return new BlockEntitySettings(inventorySize, containerTitle, ticks, processing, dataSlots);
        }
    }
}
