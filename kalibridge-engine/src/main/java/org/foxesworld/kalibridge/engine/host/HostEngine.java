package org.foxesworld.kalibridge.engine.host;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.engine.command.ProxyCommand;
import org.foxesworld.kalibridge.engine.proxy.ItemLike;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlock;
import org.foxesworld.kalibridge.engine.proxy.ProxyBlockEntityType;
import org.foxesworld.kalibridge.engine.proxy.ProxyContainerType;
import org.foxesworld.kalibridge.engine.proxy.ProxyEntityType;

import java.util.List;
import java.util.Objects;

/**
 * The host side of the bridge: the native registries and the one thread allowed to fill them.
 */
public final class HostEngine {
    private static final Logger log = LogManager.getLogger(HostEngine.class);

    private final Thread registrationThread;

    private final NativeRegistry<ProxyBlock> blocks = new NativeRegistry<>("block");
    private final NativeRegistry<ProxyBlockEntityType> blockEntityTypes = new NativeRegistry<>("block_entity_type");
    private final NativeRegistry<ItemLike> items = new NativeRegistry<>("item");
    private final NativeRegistry<ProxyEntityType> entityTypes = new NativeRegistry<>("entity_type");
    private final NativeRegistry<ProxyContainerType> menus = new NativeRegistry<>("menu");
    private final NativeRegistry<ProxyCommand> commands = new NativeRegistry<>("command");

    /** Binds the registration thread to the calling thread. */
    public HostEngine() {
        this(Thread.currentThread());
    }

    public HostEngine(Thread registrationThread) {
        this.registrationThread = Objects.requireNonNull(registrationThread, "registrationThread");
    }

    public NativeRegistry<ProxyBlock> blocks() { return blocks; }
    public NativeRegistry<ProxyBlockEntityType> blockEntityTypes() { return blockEntityTypes; }
    public NativeRegistry<ItemLike> items() { return items; }
    public NativeRegistry<ProxyEntityType> entityTypes() { return entityTypes; }
    public NativeRegistry<ProxyContainerType> menus() { return menus; }
    public NativeRegistry<ProxyCommand> commands() { return commands; }

    public Thread registrationThread() {
        return registrationThread;
    }

    public boolean isRegistrationThread() {
        return Thread.currentThread() == registrationThread;
    }

    /** Freezes every registry. Nothing can be added afterwards. */
    public void freeze() {
        for (NativeRegistry<?> r : all()) r.freeze();
        log.info("Host registries frozen: blocks={} blockEntities={} items={} entities={} menus={} commands={}",
                blocks.size(), blockEntityTypes.size(), items.size(), entityTypes.size(), menus.size(), commands.size());
    }

    public boolean isFrozen() {
        return blocks.isFrozen();
    }

    private List<NativeRegistry<?>> all() {
        return List.of(blocks, blockEntityTypes, items, entityTypes, menus, commands);
    }
}
