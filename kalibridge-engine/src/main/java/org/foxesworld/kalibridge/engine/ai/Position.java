package org.foxesworld.kalibridge.engine.ai;

public record Position(double x, double y, double z) {}
