package org.foxesworld.kalibridge.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.BridgeContext;
import org.foxesworld.kalibridge.engine.dispatch.CallGate;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.registry.ProxyRegistrar;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;

import java.util.Objects;
import java.util.function.Function;

/**
 * The {@code bridge} global scripts see.
 *
 * <pre>
 * const lamp = bridge.enqueueBlock({luminance: 15}, "demo", "lamp");
 * bridge.on("BLOCK_USE", (handle, world, x, y, z, player, hand) => handle === lamp ? 0 : 3);
 * bridge.markRegistrationsQueued();
 * </pre>
 *
 * Config objects that cannot be read or converted are logged and answered with handle 0.
 */
public final class BridgeScriptApi {
    private static final Logger log = LogManager.getLogger(BridgeScriptApi.class);

    public static final String GLOBAL_NAME = "bridge";

    private final BridgeContext bridge;
    private final CallGate gate;

    public BridgeScriptApi(BridgeContext bridge, CallGate gate) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.gate = Objects.requireNonNull(gate, "gate");
    }

    /** Binds a new API as {@value #GLOBAL_NAME}, with handlers called through the isolate. */
    public static BridgeScriptApi install(ScriptIsolate isolate, BridgeContext bridge) {
        BridgeScriptApi api = new BridgeScriptApi(bridge, new IsolateCallGate(isolate));
        isolate.putGlobal(GLOBAL_NAME, api);
        return api;
    }

    // ---- blocks ----

    @HostAccess.Export
    public long createBlock(Value cfg) {
        return create("block", cfg, ScriptSettings::block, bridge.blocks());
    }

    @HostAccess.Export
    public boolean registerBlock(long handle, String namespace, String path) {
        return bridge.blocks().register(handle, namespace, path);
    }

    @HostAccess.Export
    public long enqueueBlock(Value cfg, String namespace, String path) {
        return enqueue("block", cfg, ScriptSettings::block, bridge.blocks(), namespace, path);
    }

    // ---- block entities, keyed like their block ----

    @HostAccess.Export
    public long createBlockEntity(Value cfg) {
        return create("block entity", cfg, ScriptSettings::blockEntity, bridge.blockEntities());
    }

    @HostAccess.Export
    public boolean registerBlockEntity(long handle, String namespace, String path) {
        return bridge.blockEntities().register(handle, namespace, path);
    }

    @HostAccess.Export
    public long enqueueBlockEntity(Value cfg, String namespace, String path) {
        return enqueue("block entity", cfg, ScriptSettings::blockEntity, bridge.blockEntities(), namespace, path);
    }

    // ---- items ----

    @HostAccess.Export
    public long createItem(Value cfg) {
        return create("item", cfg, ScriptSettings::item, bridge.items());
    }

    @HostAccess.Export
    public boolean registerItem(long handle, String namespace, String path) {
        return bridge.items().register(handle, namespace, path);
    }

    @HostAccess.Export
    public long enqueueItem(Value cfg, String namespace, String path) {
        return enqueue("item", cfg, ScriptSettings::item, bridge.items(), namespace, path);
    }

    // ---- entities ----

    @HostAccess.Export
    public long createEntity(Value cfg) {
        return create("entity", cfg, ScriptSettings::entity, bridge.entities());
    }

    @HostAccess.Export
    public boolean registerEntity(long handle, String namespace, String path) {
        return bridge.entities().register(handle, namespace, path);
    }

    @HostAccess.Export
    public long enqueueEntity(Value cfg, String namespace, String path) {
        return enqueue("entity", cfg, ScriptSettings::entity, bridge.entities(), namespace, path);
    }

    /** Either list may be null; two empty lists leave the entity without goals. */
    @HostAccess.Export
    public boolean setEntityBehaviors(long handle, String goalsJson, String targetGoalsJson) {
        return bridge.entities().setBehaviors(handle, goalsJson, targetGoalsJson);
    }

    // ---- containers ----

    @HostAccess.Export
    public long createContainer(Value cfg) {
        return create("container", cfg, ScriptSettings::container, bridge.containers());
    }

    @HostAccess.Export
    public boolean registerContainer(long handle, String namespace, String path) {
        return bridge.containers().register(handle, namespace, path);
    }

    @HostAccess.Export
    public long enqueueContainer(Value cfg, String namespace, String path) {
        return enqueue("container", cfg, ScriptSettings::container, bridge.containers(), namespace, path);
    }

    // ---- commands, lifecycle, handlers ----

    @HostAccess.Export
    public long registerCommand(String name, String description, String argsJson, int permission) {
        return bridge.commands().register(name, description, argsJson, permission);
    }

    /** Tells the registration thread everything is queued. */
    @HostAccess.Export
    public void markRegistrationsQueued() {
        bridge.queue().markComplete();
    }

    /**
     * Installs {@code fn} as the handler of the kind named {@code kindName}, replacing any
     * previous one.
     */
    @HostAccess.Export
    public boolean on(String kindName, Value fn) {
        CallbackKind<?, ?> kind = CallbackKind.byName(kindName);
        if (kind == null) {
            log.error("on: unknown callback kind '{}'", kindName);
            return false;
        }
        if (fn == null || !fn.canExecute()) {
            log.error("on({}): handler is not a function", kind);
            return false;
        }
        ScriptHandlers.install(bridge.dispatch(), kind, fn, gate);
        log.debug("Script handler installed for {}", kind);
        return true;
    }

    @HostAccess.Export
    public boolean off(String kindName) {
        CallbackKind<?, ?> kind = CallbackKind.byName(kindName);
        return kind != null && bridge.dispatch().uninstall(kind);
    }

    private <S> long create(String what, Value cfg, Function<Value, S> parse, ProxyRegistrar<S, ?> registrar) {
        S settings = settings(what, cfg, parse);
        return settings == null ? HandleAllocator.NO_HANDLE : registrar.create(settings);
    }

    private <S> long enqueue(String what, Value cfg, Function<Value, S> parse, ProxyRegistrar<S, ?> registrar,
                             String namespace, String path) {
        S settings = settings(what, cfg, parse);
        return settings == null ? HandleAllocator.NO_HANDLE : bridge.queue().enqueue(registrar, settings, namespace, path);
    }

    private static <S> S settings(String what, Value cfg, Function<Value, S> parse) {
        try {
            return parse.apply(cfg);
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException
                 | UnsupportedOperationException | PolyglotException e) {
            log.error("Invalid {} settings: {}", what, e.getMessage());
            return null;
        }
    }
}
