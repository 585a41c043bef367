package org.foxesworld.kalibridge.engine.ai.behavior;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.kalibridge.engine.ai.GoalFlag;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses behavior-list JSON documents.
 *
 * <pre>
 * [
 *   {"type": "float", "priority": 0},
 *   {"type": "melee_attack", "priority": 2, "speedModifier": 1.2},
 *   {"type": "custom", "priority": 3, "goalId": "guard_post", "flags": ["move", "look"]}
 * ]
 * </pre>
 *
 * Bad entries are skipped with a warning. Many entity types share the same list text,
 * so parsed lists are cached by document.
 */
public final class BehaviorConfigParser {
    private static final Logger log = LogManager.getLogger(BehaviorConfigParser.class);

    private final ObjectMapper mapper;
    private final Cache<String, List<BehaviorDescriptor>> parsed;

    public BehaviorConfigParser(ObjectMapper mapper, int cacheSize) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.parsed = Caffeine.newBuilder()
                .maximumSize(Math.max(0, cacheSize))
                .build();
    }

    /** {@code null} lists parse as empty. */
    public BehaviorConfig parse(String goalsJson, String targetsJson) {
        return new BehaviorConfig(parseList(goalsJson), parseList(targetsJson));
    }

    public List<BehaviorDescriptor> parseList(String json) {
        if (json == null || json.isBlank()) return List.of();
        return parsed.get(json, this::parseDocument);
    }

    private List<BehaviorDescriptor> parseDocument(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Behavior list is not valid JSON: {}", e.getOriginalMessage());
            return List.of();
        }
        if (root == null || !root.isArray()) {
            log.error("Behavior list must be a JSON array, got {}", root == null ? "nothing" : root.getNodeType());
            return List.of();
        }

        List<BehaviorDescriptor> out = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            BehaviorDescriptor d = parseEntry(i, root.get(i));
            if (d != null) out.add(d);
        }
        return List.copyOf(out);
    }

    private static BehaviorDescriptor parseEntry(int index, JsonNode n) {
        if (n == null || !n.isObject()) {
            log.warn("Behavior #{} skipped: not an object", index);
            return null;
        }
        JsonNode typeNode = n.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.textValue().isBlank()) {
            log.warn("Behavior #{} skipped: missing or invalid 'type'", index);
            return null;
        }
        JsonNode prioNode = n.get("priority");
        if (prioNode == null || !prioNode.isIntegralNumber() || !prioNode.canConvertToInt()) {
            log.warn("Behavior #{} ({}) skipped: missing or invalid 'priority'", index, typeNode.textValue());
            return null;
        }
        String type = typeNode.textValue().trim().toLowerCase(Locale.ROOT);
        int priority = prioNode.intValue();

        if (!BehaviorDescriptor.CUSTOM.equals(type)) {
            return new BuiltinBehavior(type, priority, n);
        }

        JsonNode goalId = n.get("goalId");
        if (goalId == null || !goalId.isTextual() || goalId.textValue().isBlank()) {
            log.warn("Behavior #{} skipped: custom goal without 'goalId'", index);
            return null;
        }
        EnumSet<GoalFlag> flags = EnumSet.noneOf(GoalFlag.class);
        JsonNode flagsNode = n.get("flags");
        if (flagsNode != null && !flagsNode.isNull()) {
            if (!flagsNode.isArray()) {
                log.warn("Behavior #{} ({}) skipped: 'flags' must be an array", index, goalId.textValue());
                return null;
            }
            for (JsonNode f : flagsNode) {
                GoalFlag flag = f.isTextual() ? GoalFlag.parse(f.textValue()) : null;
                if (flag == null) {
                    log.warn("Behavior #{} ({}) skipped: unknown flag {}", index, goalId.textValue(), f);
                    return null;
                }
                flags.add(flag);
            }
        }
        JsonNode every = n.get("requiresUpdateEveryTick");
        boolean everyTick = every == null || !every.isBoolean() || every.booleanValue();
        return new CustomBehavior(priority, goalId.textValue(), flags, everyTick);
    }

    public void invalidateAll() {
        parsed.invalidateAll();
    }
}
