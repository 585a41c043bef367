package org.foxesworld.kalibridge.engine.command;

import java.util.Objects;

public record CommandArg(String name, CommandArgType type, boolean required) {

    public CommandArg {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
