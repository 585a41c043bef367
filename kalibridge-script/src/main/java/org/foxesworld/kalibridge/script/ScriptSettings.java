package org.foxesworld.kalibridge.script;

import org.foxesworld.kalibridge.core.state.PropertyDescriptor;
import org.foxesworld.kalibridge.engine.settings.BlockEntitySettings;
import org.foxesworld.kalibridge.engine.settings.BlockSettings;
import org.foxesworld.kalibridge.engine.settings.ContainerSettings;
import org.foxesworld.kalibridge.engine.settings.EntityArchetype;
import org.foxesworld.kalibridge.engine.settings.EntitySettings;
import org.foxesworld.kalibridge.engine.settings.ItemSettings;
import org.foxesworld.kalibridge.engine.settings.SpawnCategory;
import org.graalvm.polyglot.Value;

import java.util.Locale;

/**
 * Settings records from script config objects. Absent members take the builder defaults;
 * out-of-range values fail with {@link IllegalArgumentException}.
 *
 * <pre>
 * bridge.createBlock({hardness: 2, luminance: 15,
 *                     properties: [{type: "direction", name: "facing", values: "horizontal"},
 *                                  {type: "int", name: "power", min: 0, max: 15}]})
 * </pre>
 */
final class ScriptSettings {
    private ScriptSettings() {}

    static BlockSettings block(Value cfg) {
        BlockSettings.Builder b = BlockSettings.builder()
                .hardness(ValueCfg.f32(cfg, "hardness", 1.0f))
                .resistance(ValueCfg.f32(cfg, "resistance", 1.0f))
                .requiresTool(ValueCfg.bool(cfg, "requiresTool", false))
                .luminance(ValueCfg.i32(cfg, "luminance", 0))
                .friction(ValueCfg.f64(cfg, "friction", 0.6))
                .speedFactor(ValueCfg.f64(cfg, "speedFactor", 1.0))
                .jumpFactor(ValueCfg.f64(cfg, "jumpFactor", 1.0))
                .randomTicks(ValueCfg.bool(cfg, "randomTicks", false))
                .collidable(ValueCfg.bool(cfg, "collidable", true))
                .replaceable(ValueCfg.bool(cfg, "replaceable", false))
                .burnable(ValueCfg.bool(cfg, "burnable", false))
                .redstoneSource(ValueCfg.bool(cfg, "redstoneSource", false))
                .analogOutput(ValueCfg.bool(cfg, "analogOutput", false));
        for (Value p : ValueCfg.list(cfg, "properties")) {
            b.property(property(p));
        }
        return b.build();
    }

    private static PropertyDescriptor property(Value p) {
        String type = ValueCfg.str(p, "type", null);
        String name = ValueCfg.str(p, "name", null);
        if (type == null || name == null) {
            throw new IllegalArgumentException("Block property needs 'type' and 'name': " + p);
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "int", "integer" -> PropertyDescriptor.ofType(type, name,
                    ValueCfg.i32(p, "min", 0), ValueCfg.i32(p, "max", 15));
            case "direction" -> PropertyDescriptor.ofType(type, name, ValueCfg.str(p, "values", "all"));
            default -> PropertyDescriptor.ofType(type, name);
        };
    }

    static BlockEntitySettings blockEntity(Value cfg) {
        return BlockEntitySettings.builder()
                .inventory(ValueCfg.i32(cfg, "inventorySize", 0))
                .containerTitle(ValueCfg.str(cfg, "containerTitle", "Container"))
                .ticks(ValueCfg.bool(cfg, "ticks", false))
                .processing(ValueCfg.bool(cfg, "processing", false))
                .dataSlots(ValueCfg.i32(cfg, "dataSlots", 0))
                .build();
    }

    static ItemSettings item(Value cfg) {
        return new ItemSettings(
                ValueCfg.i32(cfg, "maxStackSize", 64),
                ValueCfg.i32(cfg, "maxDamage", 0),
                ValueCfg.bool(cfg, "fireResistant", false),
                ItemSettings.combatOf(
                        ValueCfg.f64(cfg, "attackDamage", Double.NaN),
                        ValueCfg.f64(cfg, "attackSpeed", Double.NaN),
                        ValueCfg.f64(cfg, "attackKnockback", Double.NaN)));
    }

    static EntitySettings entity(Value cfg) {
        return EntitySettings.builder()
                .size(ValueCfg.f32(cfg, "width", 0.6f), ValueCfg.f32(cfg, "height", 1.8f))
                .maxHealth(ValueCfg.f64(cfg, "maxHealth", 20.0))
                .movementSpeed(ValueCfg.f64(cfg, "movementSpeed", 0.25))
                .attackDamage(ValueCfg.f64(cfg, "attackDamage", 2.0))
                .spawnCategory(SpawnCategory.fromOrdinal(ValueCfg.i32(cfg, "spawnGroup", SpawnCategory.CREATURE.ordinal())))
                .archetype(EntityArchetype.fromOrdinal(ValueCfg.i32(cfg, "baseType", 0)))
                .breedingItem(ValueCfg.str(cfg, "breedingItem", null))
                .tickCallbacks(ValueCfg.bool(cfg, "tickCallbacks", false))
                .build();
    }

    static ContainerSettings container(Value cfg) {
        return new ContainerSettings(
                ValueCfg.str(cfg, "title", "Container"),
                ValueCfg.i32(cfg, "rows", 3),
                ValueCfg.i32(cfg, "columns", 9));
    }
}
