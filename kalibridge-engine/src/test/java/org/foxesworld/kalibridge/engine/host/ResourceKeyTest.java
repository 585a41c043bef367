package org.foxesworld.kalibridge.engine.host;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

final class ResourceKeyTest {

    @Test
    void parsesNamespacedAndBareKeys() {
        assertThat(ResourceKey.parse("farm:tools/hoe")).isEqualTo(ResourceKey.of("farm", "tools/hoe"));
        assertThat(ResourceKey.parse("lamp").namespace()).isEqualTo(ResourceKey.DEFAULT_NAMESPACE);
        assertThat(ResourceKey.of("farm", "hoe")).hasToString("farm:hoe");
    }

    @Test
    void rejectsCharactersOutsideTheAllowedSets() {
        assertThatThrownBy(() -> ResourceKey.of("Farm", "hoe")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceKey.of("farm", "big hoe")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceKey.of("far/m", "hoe")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceKey.parse("farm:")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceKey.parse("a:b:c")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResourceKey.of(null, "hoe")).isInstanceOf(NullPointerException.class);
    }
}
