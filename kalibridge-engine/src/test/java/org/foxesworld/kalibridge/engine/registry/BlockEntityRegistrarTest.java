package org.foxesworld.kalibridge.engine.registry;

import static org.assertj.core.api.Assertions.assertThat;

import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.ResourceKey;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlockEntityType;
import org.foxesworld.kalibridge.engine.settings.BlockEntitySettings;
import org.foxesworld.kalibridge.engine.settings.BlockSettings;
import org.junit.jupiter.api.Test;

final class BlockEntityRegistrarTest {

    private final HostEngine host = new HostEngine();
    private final HandleAllocator handles = new HandleAllocator();
    private final CallbackDispatchTable dispatch = new CallbackDispatchTable();
    private final BlockRegistrar blocks = new BlockRegistrar(host, handles, dispatch);
    private final BlockEntityRegistrar blockEntities = new BlockEntityRegistrar(host, handles, dispatch);
    private final RegistrationQueue queue = new RegistrationQueue(host, handles);

    @Test
    void attachesToTheBlockWithTheSameKey() {
        long block = blocks.create(BlockSettings.builder().build());
        blocks.register(block, "demo", "furnace");
        long handle = blockEntities.create(BlockEntitySettings.builder().inventory(3).processing(true).build());

        assertThat(blockEntities.register(handle, "demo", "furnace")).isTrue();

        ProxyBlockEntityType type = host.blockEntityTypes().get(ResourceKey.of("demo", "furnace"));
        assertThat(type).isSameAs(blockEntities.get(handle));
        assertThat(type.block()).isSameAs(blocks.get(block));
        assertThat(type.settings().dataSlots()).isEqualTo(BlockEntitySettings.PROCESSING_SLOTS);
    }

    @Test
    void blockEntityWithoutItsBlockIsRejected() {
        long handle = blockEntities.create(BlockEntitySettings.builder().build());

        assertThat(blockEntities.register(handle, "demo", "orphan")).isFalse();
        assertThat(host.blockEntityTypes().size()).isZero();
        assertThat(blockEntities.get(handle)).isNull();
    }

    @Test
    void queuedAfterItsBlockRegistersInOrder() {
        queue.enqueue(blocks, BlockSettings.builder().build(), "demo", "chest");
        long handle = queue.enqueue(blockEntities, BlockEntitySettings.builder().inventory(27).build(), "demo", "chest");

        assertThat(queue.flush()).isEqualTo(2);
        assertThat(blockEntities.get(handle).settings().hasInventory()).isTrue();
    }
}
