package org.foxesworld.kalibridge.engine.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.core.handle.HandleAllocator;
import org.foxesworld.kalibridge.engine.dispatch.CallbackDispatchTable;
import org.foxesworld.kalibridge.engine.dispatch.CallbackKind;
import org.foxesworld.kalibridge.engine.host.HostEngine;
import org.foxesworld.kalibridge.engine.host.ResourceKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Scripted commands: declared from any thread, installed into the host's command registry at
 * freeze time, executed through COMMAND_EXECUTE with the parsed arguments as JSON.
 */
public final class CommandRegistry {
    private static final Logger log = LogManager.getLogger(CommandRegistry.class);

    /** Returned by {@link #execute} when the command is unknown or arguments are missing. */
    public static final int USAGE_ERROR = -1;

    private static final Pattern NAME = Pattern.compile("[a-z0-9_-]+");

    private final HostEngine host;
    private final HandleAllocator handles;
    private final CallbackDispatchTable dispatch;
    private final ObjectMapper mapper;
    private final Map<Long, ProxyCommand> commands = new LinkedHashMap<>();

    public CommandRegistry(HostEngine host, HandleAllocator handles, CallbackDispatchTable dispatch, ObjectMapper mapper) {
        this.host = Objects.requireNonNull(host, "host");
        this.handles = Objects.requireNonNull(handles, "handles");
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @param argsJson {@code [{"name": "target", "type": "player", "required": true}, ...]}, or {@code null}
     * @return the command id, or {@link HandleAllocator#NO_HANDLE} if the declaration is rejected
     */
    public synchronized long register(String name, String description, String argsJson, int permission) {
        if (name == null || !NAME.matcher(name).matches()) {
            log.error("Command name '{}' is invalid", name);
            return HandleAllocator.NO_HANDLE;
        }
        if (byName(name) != null) {
            log.error("Command '{}' is already declared", name);
            return HandleAllocator.NO_HANDLE;
        }
        if (host.commands().isFrozen()) {
            log.error("Command '{}' declared after the registry freeze", name);
            return HandleAllocator.NO_HANDLE;
        }
        List<CommandArg> args = parseArgs(name, argsJson);
        if (args == null) return HandleAllocator.NO_HANDLE;

        long id = handles.nextHandle();
        commands.put(id, new ProxyCommand(id, name, description, args, Math.max(0, Math.min(4, permission))));
        log.debug("Command /{} declared as {} with {} args", name, id, args.size());
        return id;
    }

    private List<CommandArg> parseArgs(String command, String argsJson) {
        if (argsJson == null || argsJson.isBlank()) return List.of();
        JsonNode root;
        try {
            root = mapper.readTree(argsJson);
        } catch (JsonProcessingException e) {
            log.error("Command '{}': arguments are not valid JSON: {}", command, e.getOriginalMessage());
            return null;
        }
        if (root == null || !root.isArray()) {
            log.error("Command '{}': arguments must be a JSON array", command);
            return null;
        }
        List<CommandArg> out = new ArrayList<>();
        for (JsonNode a : root) {
            JsonNode n = a.get("name");
            if (!a.isObject() || n == null || !n.isTextual() || n.textValue().isBlank()) {
                log.error("Command '{}': argument without a name: {}", command, a);
                return null;
            }
            JsonNode t = a.get("type");
            JsonNode r = a.get("required");
            out.add(new CommandArg(n.textValue(),
                    CommandArgType.fromWire(t != null && t.isTextual() ? t.textValue() : null),
                    r == null || !r.isBoolean() || r.booleanValue()));
        }
        return out;
    }

    /** Puts every declared command into the host registry. Registration thread, before freeze. */
    public synchronized int installAll() {
        if (!host.isRegistrationThread()) {
            log.error("installAll called off the registration thread");
            return 0;
        }
        int n = 0;
        for (ProxyCommand c : commands.values()) {
            ResourceKey key = ResourceKey.of(ResourceKey.DEFAULT_NAMESPACE, c.name());
            if (host.commands().containsKey(key)) continue;
            try {
                host.commands().register(key, c);
                n++;
            } catch (IllegalStateException e) {
                log.error("Command /{} not installed: {}", c.name(), e.getMessage());
            }
        }
        if (n > 0) log.info("Installed {} scripted commands", n);
        return n;
    }

    /**
     * Runs a command for a player. Missing required arguments are answered with
     * {@link #USAGE_ERROR} without calling the script.
     */
    public int execute(long commandId, long playerId, Map<String, ?> args) {
        ProxyCommand c = get(commandId);
        if (c == null) {
            log.warn("execute: unknown command id {}", commandId);
            return USAGE_ERROR;
        }
        Map<String, ?> given = args == null ? Map.of() : args;
        for (CommandArg a : c.args()) {
            if (a.required() && given.get(a.name()) == null) {
                log.debug("/{}: missing argument '{}'; usage {}", c.name(), a.name(), c.usage());
                return USAGE_ERROR;
            }
        }
        String json;
        try {
            json = mapper.writeValueAsString(given);
        } catch (JsonProcessingException e) {
            log.error("/{}: arguments could not be serialized", c.name(), e);
            return USAGE_ERROR;
        }
        return dispatch.invoke(CallbackKind.COMMAND_EXECUTE, h -> h.execute(commandId, playerId, json));
    }

    public synchronized ProxyCommand get(long commandId) {
        return commands.get(commandId);
    }

    public synchronized ProxyCommand byName(String name) {
        for (ProxyCommand c : commands.values()) {
            if (c.name().equals(name)) return c;
        }
        return null;
    }

    public synchronized List<ProxyCommand> all() {
        return Collections.unmodifiableList(new ArrayList<>(commands.values()));
    }

    public synchronized int count() {
        return commands.size();
    }
}
