package org.foxesworld.kalibridge.engine.host;

public final class RegistryFrozenException extends IllegalStateException {

    public RegistryFrozenException(String registry) {
        super("Registry '" + registry + "' is frozen");
    }
}
