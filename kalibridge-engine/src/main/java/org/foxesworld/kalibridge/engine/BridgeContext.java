package org.foxesworld.kalibridge.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.core.KalibridgeVersion;
import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.ai.behavior.BehaviorConfigParser;
import org.foxesworld.kalibridge.engine.ai.behavior.BehaviorGoalFactory;
import org.foxesworld.kalibridge.engine.command.CommandRegistry;
import org.foxesworld.kalibridge.engine.config.BridgeConfig;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallGate;
import org.foxesworld.kalibridge.engine.dispatch.DirectCallGate;
import org.foxesworld.kalibridge.engine.events.HostEvents;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.registry.BlockEntityRegistrar;
import org.foxesworld.kalibridge.engine.registry.BlockRegistrar;
import org.foxesworld.kalibridge.engine.registry.ContainerRegistrar;
import org.foxesworld.kalibridge.engine.registry.EntityRegistrar;
import org.foxesworld.kalibridge.engine.registry.ItemRegistrar;
import org.foxesworld.kalibridge.engine.registry.RegistrationQueue;
import org.foxesworld.kalibridge.engine.settings.BlockEntitySettings;
import org.foxesworld.kalibridge.engine.settings.BlockSettings;
import org.foxesworld.kalibridge.engine.settings.ContainerSettings;
import org.foxesworld.kalibridge.engine.settings.EntitySettings;
import org.foxesworld.kalibridge.engine.settings.ItemSettings;

import java.util.Objects;

/**
 * Everything one bridge instance owns, passed by reference to every entry point.
 *
 * <p>Startup order on the registration thread: scripts create/enqueue → {@link #awaitAndFlush()}
 * (or {@link #flushAll()}) → {@link #freeze()}.</p>
 */
public final class BridgeContext {
    private static final Logger log = LogManager.getLogger(BridgeContext.class);

    private final BridgeConfig config;
    private final HostEngine host;
    private final HandleAllocator handles = new HandleAllocator();
    private final CallbackDispatchTable dispatch;
    private final ObjectMapper mapper = new ObjectMapper();
    private final BehaviorConfigParser behaviorParser;
    private final BehaviorGoalFactory goalFactory;
    private final RegistrationQueue queue;
    private final BlockRegistrar blocks;
    private final BlockEntityRegistrar blockEntities;
    private final ItemRegistrar items;
    private final EntityRegistrar entities;
    private final ContainerRegistrar containers;
    private final CommandRegistry commands;
    private final HostEvents events;

    /** Host bound to the calling thread, handlers called directly. */
    public BridgeContext(BridgeConfig config) {
        this(config, new HostEngine(), DirectCallGate.INSTANCE);
    }

    public BridgeContext(BridgeConfig config, HostEngine host, CallGate defaultGate) {
        this.config = Objects.requireNonNull(config, "config");
        this.host = Objects.requireNonNull(host, "host");
        this.dispatch = new CallbackDispatchTable(defaultGate);
        this.behaviorParser = new BehaviorConfigParser(mapper, config.behaviorCacheSize());
        this.goalFactory = new BehaviorGoalFactory(dispatch);
        this.queue = new RegistrationQueue(host, handles);
        this.blocks = new BlockRegistrar(host, handles, dispatch);
        this.blockEntities = new BlockEntityRegistrar(host, handles, dispatch);
        this.items = new ItemRegistrar(host, handles, dispatch);
        this.entities = new EntityRegistrar(host, handles, dispatch, behaviorParser, goalFactory);
        this.containers = new ContainerRegistrar(host, handles, dispatch);
        this.commands = new CommandRegistry(host, handles, dispatch, mapper);
        this.events = new HostEvents(dispatch);
        log.info("{} {} bridge context ready (registration thread '{}')",
                KalibridgeVersion.NAME, KalibridgeVersion.VERSION, host.registrationThread().getName());
    }

    public BridgeConfig config() { return config; }
    public HostEngine host() { return host; }
    public HandleAllocator handles() { return handles; }
    public CallbackDispatchTable dispatch() { return dispatch; }
    public ObjectMapper mapper() { return mapper; }
    public BehaviorGoalFactory goalFactory() { return goalFactory; }
    public RegistrationQueue queue() { return queue; }
    public BlockRegistrar blocks() { return blocks; }
    public BlockEntityRegistrar blockEntities() { return blockEntities; }
    public ItemRegistrar items() { return items; }
    public EntityRegistrar entities() { return entities; }
    public ContainerRegistrar containers() { return containers; }
    public CommandRegistry commands() { return commands; }
    public HostEvents events() { return events; }

    public long enqueueBlock(BlockSettings settings, String namespace, String path) {
        return queue.enqueue(blocks, settings, namespace, path);
    }

    /** Must be queued after the block with the same key. */
    public long enqueueBlockEntity(BlockEntitySettings settings, String namespace, String path) {
        return queue.enqueue(blockEntities, settings, namespace, path);
    }

    public long enqueueItem(ItemSettings settings, String namespace, String path) {
        return queue.enqueue(items, settings, namespace, path);
    }

    public long enqueueEntity(EntitySettings settings, String namespace, String path) {
        return queue.enqueue(entities, settings, namespace, path);
    }

    public long enqueueContainer(ContainerSettings settings, String namespace, String path) {
        return queue.enqueue(containers, settings, namespace, path);
    }

    public int flushAll() {
        return queue.flush();
    }

    /**
     * Waits up to {@link BridgeConfig#registrationAwaitMillis()} for the scripting side to finish
     * queueing, then flushes whatever is there.
     */
    public int awaitAndFlush() {
        if (!queue.awaitComplete(config.registrationAwaitMillis())) {
            log.warn("Scripts did not signal queued registrations within {} ms; flushing {} entries anyway",
                    config.registrationAwaitMillis(), queue.size());
        }
        return queue.flush();
    }

    /**
     * Installs commands and freezes every host registry. Does not flush; entries still queued
     * afterwards are never registered.
     */
    public void freeze() {
        if (!queue.isEmpty()) {
            log.warn("Freezing with {} unflushed registrations", queue.size());
        }
        commands.installAll();
        host.freeze();
    }
}
