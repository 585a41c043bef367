package org.foxesworld.kalibridge.engine.settings;

import org.foxesworld.kalibridge.core.state.PropertyDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Captured block definition, held between {@code create} and {@code register}.
 *
 * @param hardness   break time; -1 means unbreakable
 * @param luminance  emitted light, 0..15
 * @param friction   slipperiness (ice is 0.98)
 * @param properties variant state properties, in packing order
 */
public record BlockSettings(float hardness,
                            float resistance,
                            boolean requiresTool,
                            int luminance,
                            double friction,
                            double speedFactor,
                            double jumpFactor,
                            boolean randomTicks,
                            boolean collidable,
                            boolean replaceable,
                            boolean burnable,
                            boolean redstoneSource,
                            boolean analogOutput,
                            List<PropertyDescriptor> properties) {

    public BlockSettings {
        if (hardness < -1f) throw new IllegalArgumentException("hardness must be >= -1, got " + hardness);
        if (resistance < 0f) throw new IllegalArgumentException("resistance must be >= 0, got " + resistance);
        if (luminance < 0 || luminance > 15) {
            throw new IllegalArgumentException("luminance must be 0..15, got " + luminance);
        }
        if (friction <= 0.0 || friction > 1.0) throw new IllegalArgumentException("friction must be in (0, 1], got " + friction);
        if (speedFactor < 0.0) throw new IllegalArgumentException("speedFactor must be >= 0");
        if (jumpFactor < 0.0) throw new IllegalArgumentException("jumpFactor must be >= 0");
        properties = List.copyOf(Objects.requireNonNull(properties, "properties"));
    }

    public boolean unbreakable() {
        return hardness < 0f;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private float hardness = 1.0f;
        private float resistance = 1.0f;
        private boolean requiresTool;
        private int luminance;
        private double friction = 0.6;
        private double speedFactor = 1.0;
        private double jumpFactor = 1.0;
        private boolean randomTicks;
        private boolean collidable = true;
        private boolean replaceable;
        private boolean burnable;
        private boolean redstoneSource;
        private boolean analogOutput;
        private final List<PropertyDescriptor> properties = new ArrayList<>();

        private Builder() {}

        public Builder hardness(float v) { this.hardness = v; return this; }
        public Builder resistance(float v) { this.resistance = v; return this; }
        public Builder requiresTool(boolean v) { this.requiresTool = v; return this; }
        public Builder luminance(int v) { this.luminance = v; return this; }
        public Builder friction(double v) { this.friction = v; return this; }
        public Builder speedFactor(double v) { this.speedFactor = v; return this; }
        public Builder jumpFactor(double v) { this.jumpFactor = v; return this; }
        public Builder randomTicks(boolean v) { this.randomTicks = v; return this; }
        public Builder collidable(boolean v) { this.collidable = v; return this; }
        public Builder replaceable(boolean v) { this.replaceable = v; return this; }
        public Builder burnable(boolean v) { this.burnable = v; return this; }
        public Builder redstoneSource(boolean v) { this.redstoneSource = v; return this; }
        public Builder analogOutput(boolean v) { this.analogOutput = v; return this; }

        public Builder property(PropertyDescriptor p) {
            properties.add(Objects.requireNonNull(p, "property"));
            return this;
        }

        public BlockSettings build() {
            return new BlockSettings(hardness, resistance, requiresTool, luminance, friction, speedFactor,
                    jumpFactor, randomTicks, collidable, replaceable, burnable, redstoneSource, analogOutput,
                    properties);
        }
    }
}
