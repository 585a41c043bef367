package org.foxesworld.kalibridge.engine.events;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.junit.jupiter.api.Test;

final class HostEventsTest {

    private final CallbackDispatchTable dispatch = new CallbackDispatchTable();
    private final HostEvents events = new HostEvents(dispatch);

    @Test
    void withoutHandlersEverythingIsAllowedAndUnchanged() {
        events.serverStarting();
        events.tick(1L);
        events.playerJoin(5L);

        assertThat(events.playerChat(5L, "hello")).isEqualTo("hello");
        assertThat(events.playerDeath(5L, "lava")).isNull();
        assertThat(events.playerCommand(5L, "/spawn")).isTrue();
        assertThat(events.playerAttackEntity(5L, 6L)).isTrue();
        assertThat(events.playerDropItem(5L, "demo:gem", 1)).isTrue();
        assertThat(events.playerPickupItem(5L, 7L)).isTrue();
        assertThat(events.blockBreak(0L, 1, 2, 3, 5L)).isTrue();
        assertThat(events.blockPlace(0L, 1, 2, 3, 5L, "demo:lamp")).isTrue();
        assertThat(events.blockInteract(0L, 1, 2, 3, 5L, 0)).isTrue();
    }

    @Test
    void serverLifecycleReachesItsHandlers() {
        List<String> seen = new ArrayList<>();
        dispatch.install(CallbackKind.SERVER_STARTING, () -> seen.add("starting"));
        dispatch.install(CallbackKind.SERVER_STARTED, () -> seen.add("started"));
        dispatch.install(CallbackKind.SERVER_TICK, t -> seen.add("tick " + t));
        dispatch.install(CallbackKind.SERVER_STOPPING, () -> seen.add("stopping"));

        events.serverStarting();
        events.serverStarted();
        events.tick(20L);
        events.serverStopping();

        assertThat(seen).containsExactly("starting", "started", "tick 20", "stopping");
    }

    @Test
    void playerHandlersCanRewriteAndCancel() {
        List<String> seen = new ArrayList<>();
        dispatch.install(CallbackKind.PLAYER_JOIN, p -> seen.add("join " + p));
        dispatch.install(CallbackKind.PLAYER_LEAVE, p -> seen.add("leave " + p));
        dispatch.install(CallbackKind.PLAYER_RESPAWN, (p, end) -> seen.add("respawn " + p + " " + end));
        dispatch.install(CallbackKind.PLAYER_CHAT, (p, msg) -> msg.replace("darn", "****"));
        dispatch.install(CallbackKind.PLAYER_DEATH, (p, src) -> "player " + p + " met " + src);
        dispatch.install(CallbackKind.PLAYER_COMMAND, (p, cmd) -> !cmd.startsWith("/op"));
        dispatch.install(CallbackKind.PLAYER_DROP_ITEM, (p, item, count) -> count < 64);

        events.playerJoin(3L);
        events.playerRespawn(3L, true);
        events.playerLeave(3L);

        assertThat(seen).containsExactly("join 3", "respawn 3 true", "leave 3");
        assertThat(events.playerChat(3L, "darn it")).isEqualTo("**** it");
        assertThat(events.playerDeath(3L, "lava")).isEqualTo("player 3 met lava");
        assertThat(events.playerCommand(3L, "/op me")).isFalse();
        assertThat(events.playerCommand(3L, "/home")).isTrue();
        assertThat(events.playerDropItem(3L, "demo:gem", 64)).isFalse();
    }

    @Test
    void failingHandlerDeniesTheWorldAction() {
        dispatch.install(CallbackKind.WORLD_BLOCK_BREAK, (w, x, y, z, p) -> {
            throw new IllegalStateException("boom");
        });
        dispatch.install(CallbackKind.WORLD_BLOCK_PLACE, (w, x, y, z, p, id) -> y < 100);
        dispatch.install(CallbackKind.PLAYER_CHAT, (p, msg) -> {
            throw new IllegalStateException("boom");
        });

        assertThat(events.blockBreak(0L, 0, 64, 0, 1L)).isFalse();
        assertThat(events.blockPlace(0L, 0, 64, 0, 1L, "demo:lamp")).isTrue();
        assertThat(events.blockPlace(0L, 0, 120, 0, 1L, "demo:lamp")).isFalse();
        assertThat(events.playerChat(1L, "hi")).isEqualTo("hi");
    }
}
