package org.foxesworld.kalibridge.engine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class BridgeConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(BridgeConfig.AWAIT_MILLIS_PROP);
        System.clearProperty(BridgeConfig.THREAD_NAME_PROP);
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(BridgeConfig.AWAIT_MILLIS_PROP, "250");
        System.setProperty(BridgeConfig.THREAD_NAME_PROP, "js-main");

        BridgeConfig cfg = BridgeConfig.fromSystemProperties();

        assertThat(cfg.registrationAwaitMillis()).isEqualTo(250L);
        assertThat(cfg.isolateThreadName()).isEqualTo("js-main");
        assertThat(cfg.maxJobsPerDrain()).isEqualTo(BridgeConfig.defaults().maxJobsPerDrain());
    }

    @Test
    void rejectsNonsense() {
        assertThatThrownBy(() -> new BridgeConfig(-1, 1, 0, 0, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BridgeConfig(0, 0, 0, 0, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThat(new BridgeConfig(0, 1, 0, 0, " ").isolateThreadName()).isEqualTo("kalibridge-isolate");
    }
}
