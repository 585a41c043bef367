package org.foxesworld.kalibridge.engine.host;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

final class NativeRegistryTest {

    private final NativeRegistry<String> registry = new NativeRegistry<>("test");

    @Test
    void keepsInsertionOrder() {
        registry.register(ResourceKey.parse("a:z"), "z");
        registry.register(ResourceKey.parse("a:b"), "b");

        assertThat(registry.keys()).extracting(ResourceKey::path).containsExactly("z", "b");
        assertThat(registry.get(ResourceKey.parse("a:b"))).isEqualTo("b");
        assertThat(registry.get(ResourceKey.parse("a:q"))).isNull();
    }

    @Test
    void duplicateKeyIsRejectedAndFirstValueKept() {
        registry.register(ResourceKey.parse("a:x"), "first");

        assertThatThrownBy(() -> registry.register(ResourceKey.parse("a:x"), "second"))
                .isInstanceOf(IllegalStateException.class)
                .isNotInstanceOf(RegistryFrozenException.class);
        assertThat(registry.get(ResourceKey.parse("a:x"))).isEqualTo("first");
    }

    @Test
    void frozenRegistryRefusesWrites() {
        registry.register(ResourceKey.parse("a:x"), "x");
        registry.freeze();
        registry.freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThatThrownBy(() -> registry.register(ResourceKey.parse("a:y"), "y"))
                .isInstanceOf(RegistryFrozenException.class);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void hostFreezesEveryRegistry() {
        HostEngine host = new HostEngine();

        assertThat(host.isRegistrationThread()).isTrue();
        host.freeze();

        assertThat(host.isFrozen()).isTrue();
        assertThat(host.blocks().isFrozen()).isTrue();
        assertThat(host.blockEntityTypes().isFrozen()).isTrue();
        assertThat(host.items().isFrozen()).isTrue();
        assertThat(host.entityTypes().isFrozen()).isTrue();
        assertThat(host.menus().isFrozen()).isTrue();
        assertThat(host.commands().isFrozen()).isTrue();
    }
}
