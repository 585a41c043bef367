package org.foxesworld.kalibridge.engine.proxy;

import org.foxesworld.kalibridge.engine.host.ResourceKey;

/** Anything the host's item registry holds. */
public interface ItemLike {

    long handle();

    ResourceKey key();

    int maxStackSize();
}
