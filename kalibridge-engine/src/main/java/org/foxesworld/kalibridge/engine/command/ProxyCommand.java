package org.foxesworld.kalibridge.engine.command;

import java.util.List;
import java.util.Objects;

/**
 * A command declared by the scripting side.
 *
 * @param permission operator level required, 0..4
 */
public record ProxyCommand(long id, String name, String description, List<CommandArg> args, int permission) {

    public ProxyCommand {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        args = List.copyOf(Objects.requireNonNull(args, "args"));
    }

    public String usage() {
        StringBuilder sb = new StringBuilder("/").append(name);
        for (CommandArg a : args) {
            sb.append(' ').append(a.required() ? '<' : '[').append(a.name()).append(a.required() ? '>' : ']');
        }
        return sb.toString();
    }
}
