package org.foxesworld.kalibridge.core;

public final class KalibridgeVersion {
    public static final String NAME = "Kalibridge";
    public static final String VERSION = "0.3.0";

    private KalibridgeVersion() {}
}
