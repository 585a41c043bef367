package org.foxesworld.kalibridge.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.foxesworld.kalibridge.core.state.PropertyDescriptor;
import org.foxesworld.kalibridge.engine.ai.FakeMobBody;
import org.foxesworld.kalibridge.engine.ai.goals.TemptGoal;
import org.foxesworld.kalibridge.engine.config.BridgeConfig;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.dispatch.InteractionResult;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.proxy.ProxyEntity;
import org.foxesworld.kalibridge.engine.settings.BlockSettings;
import org.foxesworld.kalibridge.engine.settings.ContainerSettings;
import org.foxesworld.kalibridge.engine.settings.EntityArchetype;
import org.foxesworld.kalibridge.engine.settings.EntitySettings;
import org.foxesworld.kalibridge.engine.settings.ItemSettings;
import org.junit.jupiter.api.Test;

final class BridgeContextTest {

    private final BridgeContext ctx = new BridgeContext(BridgeConfig.defaults());

    @Test
    void startupSequenceRegistersEverythingAndFreezes() throws InterruptedException {
        long lamp = ctx.enqueueBlock(BlockSettings.builder().property(PropertyDescriptor.bool("lit")).build(),
                "demo", "lamp");
        long carrot = ctx.enqueueItem(ItemSettings.simple(64), "demo", "carrot");
        long pig = ctx.enqueueEntity(EntitySettings.builder()
                .archetype(EntityArchetype.ANIMAL).breedingItem("demo:carrot").build(), "demo", "pig");
        long crate = ctx.enqueueContainer(new ContainerSettings("Crate", 3, 9), "demo", "crate");
        ctx.commands().register("oink", "Makes noise", null, 0);

        Thread script = new Thread(ctx.queue()::markComplete);
        script.start();
        assertThat(ctx.awaitAndFlush()).isEqualTo(4);
        script.join();
        ctx.freeze();

        assertThat(ctx.host().isFrozen()).isTrue();
        assertThat(ctx.blocks().get(lamp).stateCodec().stateCount()).isEqualTo(2);
        assertThat(ctx.host().items().keys()).extracting(ResourceKey::path).containsExactly("lamp", "carrot");
        assertThat(ctx.entities().get(pig).breedingItem().handle()).isEqualTo(carrot);
        assertThat(ctx.containers().get(crate).slotCount()).isEqualTo(27);
        assertThat(ctx.host().commands().containsKey(ResourceKey.of("kalibridge", "oink"))).isTrue();

        ProxyEntity e = ctx.entities().get(pig).spawn(500L, 0L, new FakeMobBody(500L));
        TemptGoal tempt = (TemptGoal) e.goalSelector().getAvailableGoals().get(3).getGoal();
        assertThat(tempt.temptItem()).isEqualTo("demo:carrot");
    }

    @Test
    void handlersInstalledOnTheContextReachProxies() {
        long h = ctx.enqueueBlock(BlockSettings.builder().build(), "demo", "button");
        ctx.flushAll();
        ctx.dispatch().install(CallbackKind.BLOCK_USE, (handle, w, x, y, z, p, hand) ->
                handle == h ? InteractionResult.CONSUME : InteractionResult.FAIL);

        assertThat(ctx.blocks().get(h).use(0L, 0, 0, 0, 1L, 0)).isEqualTo(InteractionResult.CONSUME);
    }

    @Test
    void entriesQueuedAfterFreezeAreNeverRegistered() {
        ctx.flushAll();
        ctx.freeze();
        long late = ctx.enqueueItem(ItemSettings.simple(1), "demo", "late");

        assertThat(ctx.flushAll()).isZero();
        assertThat(ctx.items().get(late)).isNull();
        assertThat(ctx.queue().size()).isEqualTo(1);
    }

    @Test
    void awaitTimesOutAndStillFlushes() {
        BridgeContext quick = new BridgeContext(new BridgeConfig(20, 4096, 2_000_000, 16, "isolate"));
        quick.enqueueItem(ItemSettings.simple(1), "demo", "gem");

        assertThat(quick.awaitAndFlush()).isEqualTo(1);
    }
}
