package io.callflow.core.compiler;

import io.callflow.core.flow.FlowEdge;
import io.callflow.core.flow.FlowNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Resolves the rule for one edge leaving a condition node.
///
/// Lookup order, first hit wins:
/// 1. a configured condition (`config.conditions[]`) whose `targetNodeId` is the edge's
///    target
/// 2. a configured condition whose `id` or `label` equals the edge's handle or label
/// 3. the edge targets `config.defaultTargetNodeId`: "Other cases"
/// 4. the handle or label itself: yes/true, no/false, default/else/otherwise, or any other
///    text as a mentioned keyword
/// 5. nothing: {@link BranchCondition#none()}
///
/// A configured condition whose text comes out empty falls through to steps 3 and 4.
/// A configured condition of type `always` resolves to
/// {@link BranchCondition#unconditional()}.
public final class BranchConditionResolver {

    static final String SAID_YES = "User said yes or agreed";
    static final String SAID_NO = "User said no or declined";
    static final String OTHER_CASES = "Other cases";
    static final String SOUNDS_INTERESTED = "User sounds interested";
    static final String SOUNDS_NOT_INTERESTED = "User sounds not interested";
    static final String SOUNDS_NEUTRAL = "User sounds neutral";

    private static final String ALWAYS = "always";

    /// Resolves the rule for an edge leaving the given condition node.
    ///
    /// @param conditionNode the condition node, not null
    /// @param leaving edge whose source is `conditionNode`, not null
    /// @return resolved rule, never null
    public BranchCondition resolve(FlowNode conditionNode, FlowEdge leaving) {
        Objects.requireNonNull(conditionNode, "conditionNode must not be null");
        Objects.requireNonNull(leaving, "leaving must not be null");

        List<Map<?, ?>> configured = configuredConditions(conditionNode);
        String handle = leaving.handleOrLabel();

        Map<?, ?> match = findBy(configured, "targetNodeId", "targetNodeId", leaving.target());
        if (match == null && handle != null) {
            match = findBy(configured, "id", "label", handle);
        }
        if (match != null) {
            if (ALWAYS.equals(string(match, "type"))) {
                return BranchCondition.unconditional();
            }
            String text = configuredText(match);
            if (!text.isEmpty()) {
                return BranchCondition.named(text);
            }
        }

        String defaultTarget = conditionNode.config().text("defaultTargetNodeId");
        if (leaving.target().equals(defaultTarget)) {
            return BranchCondition.named(OTHER_CASES);
        }

        if (handle != null) {
            return BranchCondition.named(handleText(handle));
        }
        return BranchCondition.none();
    }

    /// Text of a configured condition: its description, a yes/no or sentiment phrase, or
    /// the mentioned keyword.
    static String configuredText(Map<?, ?> condition) {
        String description = string(condition, "description");
        if (!description.isEmpty()) {
            return description;
        }
        String type = string(condition, "type");
        if (type.isEmpty()) {
            type = "keyword";
        }
        String value = string(condition, "value");
        if (value.isEmpty()) {
            value = string(condition, "label");
        }
        String normalized = value.toLowerCase(Locale.ROOT);

        if (type.equals("yes_no") || type.equals("boolean")) {
            if (normalized.equals("yes") || normalized.equals("true")) {
                return SAID_YES;
            }
            if (normalized.equals("no") || normalized.equals("false")) {
                return SAID_NO;
            }
        }
        if (type.equals("sentiment")) {
            switch (normalized) {
                case "positive", "interested" -> {
                    return SOUNDS_INTERESTED;
                }
                case "negative", "not_interested" -> {
                    return SOUNDS_NOT_INTERESTED;
                }
                case "neutral" -> {
                    return SOUNDS_NEUTRAL;
                }
                default -> {}
            }
        }
        return value.isEmpty() ? "" : mentioned(value);
    }

    /// Text of a bare handle or label.
    static String handleText(String handle) {
        return switch (handle.toLowerCase(Locale.ROOT)) {
            case "yes", "true" -> SAID_YES;
            case "no", "false" -> SAID_NO;
            case "default", "else", "otherwise" -> OTHER_CASES;
            default -> mentioned(handle);
        };
    }

    private static String mentioned(String value) {
        return "User mentioned \"" + value + "\"";
    }

    private static List<Map<?, ?>> configuredConditions(FlowNode conditionNode) {
        List<Map<?, ?>> result = new ArrayList<>();
        for (Object item : conditionNode.config().list("conditions")) {
            if (item instanceof Map<?, ?> map) {
                result.add(map);
            }
        }
        return result;
    }

    private static Map<?, ?> findBy(
            List<Map<?, ?>> conditions, String key, String alternateKey, String value) {
        for (Map<?, ?> condition : conditions) {
            if (value.equals(condition.get(key)) || value.equals(condition.get(alternateKey))) {
                return condition;
            }
        }
        return null;
    }

    private static String string(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : "";
    }
}
