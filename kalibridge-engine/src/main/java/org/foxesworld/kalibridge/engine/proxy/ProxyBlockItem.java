package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.host.ResourceKey;

import java.util.Objects;

/** Item form of a {@link ProxyBlock}, registered under the block's key. */
public final class ProxyBlockItem implements ItemLike {

    private final ProxyBlock block;

    public ProxyBlockItem(ProxyBlock block) {
        this.block = Objects.requireNonNull(block, "block");
    }

    public ProxyBlock block() {
        return block;
    }

    @Override public long handle() { return block.handle(); }
    @Override public ResourceKey key() { return block.key(); }
    @Override public int maxStackSize() { return 64; }

    @Override
    public String toString() {
        return "ProxyBlockItem{" + block.key() + '}';
    }
}
