package org.foxesworld.kalibridge.script;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import org.foxesworld.kalibridge.engine.BridgeContext;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;
import org.foxesworld.kalibridge.engine.ai.MobBody;
import org.foxesworld.kalibridge.engine.ai.Position;
import org.foxesworld.kalibridge.engine.config.BridgeConfig;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.dispatch.InteractionResult;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlock;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlockEntity;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlockEntityType;
import org.foxesworld.kalibridge.engine.proxy.ProxyEntity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

final class BridgeScriptApiTest {

    private final BridgeConfig config = new BridgeConfig(5_000, 256, 0, 16, "api-isolate");
    private final BridgeContext ctx = new BridgeContext(config);
    private final ScriptIsolate isolate = new ScriptIsolate(config).start();

    {
        BridgeScriptApi.install(isolate, ctx);
    }

    @AfterEach
    void stop() {
        isolate.close();
    }

    private long evalHandle(String code) {
        return ((Number) isolate.eval("test.js", code)).longValue();
    }

    @Test
    void queuedRegistrationsFlushOnTheRegistrationThread() {
        isolate.eval("mod.js", """
                var lamp = bridge.enqueueBlock({
                    luminance: 15, randomTicks: true,
                    properties: [{type: "direction", name: "facing", values: "horizontal"},
                                 {type: "int", name: "power", min: 0, max: 15}]
                }, "demo", "lamp");
                var sword = bridge.enqueueItem({maxDamage: 250, attackDamage: 6, attackSpeed: -2.4,
                                                attackKnockback: 0}, "demo", "sword");
                var golem = bridge.enqueueEntity({baseType: 1, maxHealth: 40}, "demo", "golem");
                bridge.setEntityBehaviors(golem, JSON.stringify([{type: "float", priority: 0}]), null);
                bridge.enqueueContainer({title: "Crate", rows: 2}, "demo", "crate");
                bridge.markRegistrationsQueued();
                """);

        assertThat(ctx.awaitAndFlush()).isEqualTo(4);

        long lamp = evalHandle("lamp");
        ProxyBlock block = ctx.blocks().get(lamp);
        assertThat(block.key()).isEqualTo(ResourceKey.of("demo", "lamp"));
        assertThat(block.stateCodec().stateCount()).isEqualTo(64);
        assertThat(block.settings().luminance()).isEqualTo(15);
        assertThat(ctx.items().get(evalHandle("sword")).maxStackSize()).isEqualTo(1);
        assertThat(ctx.items().get(evalHandle("sword")).combat()).isPresent();
        assertThat(ctx.entities().get(evalHandle("golem")).behaviors().goals()).hasSize(1);
        assertThat(ctx.host().menus().get(ResourceKey.of("demo", "crate")).slotCount()).isEqualTo(18);
    }

    @Test
    void twoPhaseRegistrationFromScriptNeedsTheRegistrationThread() {
        long h = evalHandle("var h = bridge.createItem({maxStackSize: 16}); h");

        assertThat(isolate.eval("reg.js", "bridge.registerItem(h, 'demo', 'gem')")).isEqualTo(false);
        assertThat(ctx.items().register(h, "demo", "gem")).isTrue();
        assertThat(ctx.items().get(h).maxStackSize()).isEqualTo(16);
    }

    @Test
    void invalidConfigsYieldNoHandle() {
        assertThat(isolate.eval("bad.js", "bridge.createBlock({luminance: 99})")).isEqualTo(0);
        assertThat(isolate.eval("bad.js", "bridge.createItem({maxStackSize: 0})")).isEqualTo(0);
        assertThat(isolate.eval("bad.js", "bridge.enqueueBlock({properties: [{type: 'color', name: 'c'}]}, 'demo', 'x')"))
                .isEqualTo(0);
        assertThat(isolate.eval("bad.js", "bridge.createBlock({get hardness() { throw new Error('unreadable'); }})"))
                .isEqualTo(0);
        assertThat(isolate.eval("bad.js", "bridge.createEntity({get width() { throw new TypeError('nope'); }})"))
                .isEqualTo(0);
        assertThat(ctx.queue().isEmpty()).isTrue();
    }

    @Test
    void scriptHandlersAnswerNativeHooks() {
        long lamp = evalHandle("""
                var lamp = bridge.createBlock({});
                var uses = 0;
                bridge.on("block_use", function (handle, world, x, y, z, player, hand) {
                    uses++;
                    return handle === lamp ? 0 : 3;
                });
                bridge.on("BLOCK_BREAK", function () { throw new Error("no breaking"); });
                bridge.on("ENTITY_DAMAGE", function (h, e, source, amount) { return source !== "fall"; });
                lamp;
                """);
        ctx.blocks().register(lamp, "demo", "lamp");
        ProxyBlock block = ctx.blocks().get(lamp);

        assertThat(block.use(0L, 1, 2, 3, 9L, 0)).isEqualTo(InteractionResult.SUCCESS);
        assertThat(isolate.eval("uses.js", "uses")).isEqualTo(1);
        assertThat(block.playerWillDestroy(0L, 1, 2, 3, 9L)).isFalse();
        assertThat(ctx.dispatch().invoke(CallbackKind.ENTITY_DAMAGE, c -> c.onDamage(1L, 2L, "fall", 1f))).isFalse();
        assertThat(ctx.dispatch().invoke(CallbackKind.ENTITY_DAMAGE, c -> c.onDamage(1L, 2L, "lava", 1f))).isTrue();
    }

    @Test
    void undefinedResultsAndUninstallFallBackToDefaults() {
        isolate.eval("h.js", "bridge.on('ITEM_USE', function () {});");

        assertThat(ctx.dispatch().invoke(CallbackKind.ITEM_USE, c -> c.onUse(1L, 0L, 2L, 0)))
                .isEqualTo(InteractionResult.FAIL);
        assertThat(isolate.eval("off.js", "bridge.off('ITEM_USE')")).isEqualTo(true);
        assertThat(isolate.eval("off.js", "bridge.off('ITEM_USE')")).isEqualTo(false);
        assertThat(isolate.eval("on.js", "bridge.on('NO_SUCH_KIND', function () {})")).isEqualTo(false);
        assertThat(isolate.eval("on.js", "bridge.on('ITEM_USE', 42)")).isEqualTo(false);
        assertThat(ctx.dispatch().isInstalled(CallbackKind.ITEM_USE)).isFalse();
    }

    @Test
    void commandsRunScriptCode() {
        isolate.eval("cmd.js", """
                var heal = bridge.registerCommand("heal", "Heals a player",
                        JSON.stringify([{name: "amount", type: "integer"}]), 2);
                bridge.on("COMMAND_EXECUTE", function (id, player, argsJson) {
                    return id === heal ? JSON.parse(argsJson).amount * 2 : -5;
                });
                """);
        long id = ctx.commands().byName("heal").id();

        assertThat(ctx.commands().execute(id, 7L, Map.of("amount", 21))).isEqualTo(42);
    }

    @Test
    void blockEntitiesAndWorldEventsRunScriptCode() {
        isolate.eval("furnace.js", """
                var furnace = bridge.enqueueBlock({}, "demo", "furnace");
                var be = bridge.enqueueBlockEntity({inventorySize: 3, processing: true, ticks: true}, "demo", "furnace");
                var ticks = 0;
                bridge.on("BLOCK_ENTITY_TICK", function (handle, pos) { ticks++; });
                bridge.on("BLOCK_ENTITY_SAVE", function (handle, pos) { return JSON.stringify({ticks: ticks}); });
                bridge.on("player_chat", function (player, msg) { return msg.toUpperCase(); });
                bridge.on("WORLD_BLOCK_BREAK", function (world, x, y, z, player) { return y > 0; });
                bridge.markRegistrationsQueued();
                """);

        assertThat(ctx.awaitAndFlush()).isEqualTo(2);

        ProxyBlockEntityType type = ctx.blockEntities().get(evalHandle("be"));
        assertThat(type.block()).isSameAs(ctx.blocks().get(evalHandle("furnace")));
        ProxyBlockEntity furnace = type.create(0, 64, 0);
        furnace.tick();
        furnace.tick();
        assertThat(furnace.save()).isEqualTo("{\"ticks\":2}");
        assertThat(furnace.containerSize()).isEqualTo(3);

        assertThat(ctx.events().playerChat(1L, "hi")).isEqualTo("HI");
        assertThat(ctx.events().blockBreak(0L, 0, -10, 0, 1L)).isFalse();
        assertThat(ctx.events().blockBreak(0L, 0, 10, 0, 1L)).isTrue();
        assertThat(isolate.eval("off.js", "bridge.off('PLAYER_CHAT')")).isEqualTo(true);
        assertThat(ctx.events().playerChat(1L, "hi")).isEqualTo("hi");
        assertThat(isolate.eval("bad.js", "bridge.createBlockEntity({inventorySize: 99})")).isEqualTo(0);
    }

    @Test
    void customGoalsAreDrivenByScript() {
        long golem = evalHandle("""
                var golem = bridge.createEntity({});
                bridge.setEntityBehaviors(golem, JSON.stringify([
                    {type: "custom", priority: 1, goalId: "dig", flags: ["move"]}]), "[]");
                var ticks = 0;
                bridge.on("GOAL_CAN_USE", function (goalId, entityId) { return goalId === "dig"; });
                bridge.on("GOAL_CAN_CONTINUE", function () { return true; });
                bridge.on("GOAL_TICK", function (goalId, entityId) { ticks += entityId; });
                golem;
                """);
        ctx.entities().register(golem, "demo", "golem");

        ProxyEntity e = ctx.entities().get(golem).spawn(5L, 0L, new StillBody(5L));
        e.tick();
        e.tick();
        e.tick();

        assertThat(e.goalSelector().holderOf(GoalFlag.MOVE)).isNotNull();
        assertThat(isolate.eval("ticks.js", "ticks")).isEqualTo(15);
    }

    /** A mob that never moves and sees nothing. */
    private record StillBody(long entityId) implements MobBody {
        @Override public Random random() { return new Random(1L); }
        @Override public double x() { return 0; }
        @Override public double y() { return 0; }
        @Override public double z() { return 0; }
        @Override public double eyeHeight() { return 1.5; }
        @Override public boolean isInWater() { return false; }
        @Override public boolean isOnGround() { return true; }
        @Override public boolean isBaby() { return false; }
        @Override public boolean isInLove() { return false; }
        @Override public boolean isPanicking() { return false; }
        @Override public boolean isAlive(long id) { return false; }
        @Override public boolean isInLove(long id) { return false; }
        @Override public double distanceSqTo(long id) { return Double.MAX_VALUE; }
        @Override public boolean canSee(long id) { return false; }
        @Override public long target() { return NO_ENTITY; }
        @Override public void setTarget(long id) {}
        @Override public long lastHurtBy() { return NO_ENTITY; }
        @Override public int lastHurtByTimestamp() { return 0; }
        @Override public OptionalLong nearestPlayer(double range) { return OptionalLong.empty(); }
        @Override public OptionalLong nearestPlayerHolding(String item, double range) { return OptionalLong.empty(); }
        @Override public OptionalLong nearestEntityOfType(String type, double range, boolean mustSee) { return OptionalLong.empty(); }
        @Override public OptionalLong nearestAdultOfSameType(double range) { return OptionalLong.empty(); }
        @Override public OptionalLong findMate(double range) { return OptionalLong.empty(); }
        @Override public Optional<Position> randomStrollTarget(int h, int v, boolean avoidWater) { return Optional.empty(); }
        @Override public boolean moveTo(Position p, double speed) { return false; }
        @Override public boolean moveToEntity(long id, double speed) { return false; }
        @Override public boolean canPathTo(long id) { return false; }
        @Override public boolean isNavigating() { return false; }
        @Override public void stopNavigation() {}
        @Override public void lookAt(long id) {}
        @Override public void lookAt(double x, double y, double z) {}
        @Override public void jump() {}
        @Override public void leapTowards(long id, double yd) {}
        @Override public boolean isWithinMeleeRange(long id) { return false; }
        @Override public boolean doHurtTarget(long id) { return false; }
        @Override public void breedWith(long id) {}
        @Override public void alertOthers(long attackerId) {}
    }
}
