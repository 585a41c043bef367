package org.foxesworld.kalibridge.engine.settings;

import java.util.Objects;

/** Captured menu (container screen) definition. */
public record ContainerSettings(String title, int rows, int columns) {

    public ContainerSettings {
        Objects.requireNonNull(title, "title");
        if (rows < 1 || rows > 6) throw new IllegalArgumentException("rows must be 1..6, got " + rows);
        if (columns < 1 || columns > 9) throw new IllegalArgumentException("columns must be 1..9, got " + columns);
    }

    public int slotCount() {
        return rows * columns;
    }
}
