package org.foxesworld.kalibridge.engine.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;
import org.foxesworld.kalibridge.core.state.PropertyDescriptor;
import org.junit.jupiter.api.Test;

final class SettingsValidationTest {

    @Test
    void blockBuilderDefaults() {
        BlockSettings s = BlockSettings.builder().build();

        assertThat(s.friction()).isEqualTo(0.6);
        assertThat(s.collidable()).isTrue();
        assertThat(s.properties()).isEmpty();
        assertThat(s.unbreakable()).isFalse();
        assertThat(BlockSettings.builder().hardness(-1f).build().unbreakable()).isTrue();
    }

    @Test
    void blockRangesAreChecked() {
        assertThatThrownBy(() -> BlockSettings.builder().hardness(-2f).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BlockSettings.builder().luminance(16).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BlockSettings.builder().friction(0.0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blockPropertiesAreCopied() {
        BlockSettings.Builder b = BlockSettings.builder().property(PropertyDescriptor.bool("lit"));
        BlockSettings s = b.build();
        b.property(PropertyDescriptor.intRange("age", 0, 3));

        assertThat(s.properties()).hasSize(1);
    }

    @Test
    void damageableItemsDoNotStack() {
        ItemSettings sword = new ItemSettings(64, 250, false, ItemSettings.combatOf(6, -2.4, 0));

        assertThat(sword.effectiveStackSize()).isEqualTo(1);
        assertThat(sword.combat()).map(CombatAttributes::attackDamage).contains(6.0);
        assertThat(ItemSettings.simple(16).effectiveStackSize()).isEqualTo(16);
    }

    @Test
    void nanMeansNoCombat() {
        assertThat(ItemSettings.combatOf(Double.NaN, 1, 0)).isEmpty();
        assertThat(new ItemSettings(1, 0, false, null).combat()).isEqualTo(Optional.empty());
    }

    @Test
    void itemRangesAreChecked() {
        assertThatThrownBy(() -> ItemSettings.simple(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ItemSettings.simple(100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ItemSettings(1, -1, false, Optional.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CombatAttributes(1, 1, -0.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void entityDefaultsAndBlankBreedingItem() {
        EntitySettings s = EntitySettings.builder().breedingItem("  ").build();

        assertThat(s.width()).isEqualTo(0.6f);
        assertThat(s.height()).isEqualTo(1.8f);
        assertThat(s.archetype()).isEqualTo(EntityArchetype.PATHFINDER_MOB);
        assertThat(s.breedingItem()).isNull();
        assertThatThrownBy(() -> EntitySettings.builder().size(0f, 1f).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EntitySettings.builder().maxHealth(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wireOrdinalsFallBack() {
        assertThat(EntityArchetype.fromOrdinal(2)).isEqualTo(EntityArchetype.ANIMAL);
        assertThat(EntityArchetype.fromOrdinal(9)).isEqualTo(EntityArchetype.PATHFINDER_MOB);
        assertThat(SpawnCategory.fromOrdinal(-1)).isEqualTo(SpawnCategory.MISC);
    }

    @Test
    void containerGeometry() {
        assertThat(new ContainerSettings("Crate", 3, 9).slotCount()).isEqualTo(27);
        assertThatThrownBy(() -> new ContainerSettings("Crate", 7, 9)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContainerSettings("Crate", 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
