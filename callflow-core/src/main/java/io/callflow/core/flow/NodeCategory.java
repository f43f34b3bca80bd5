package io.callflow.core.flow;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// Closed set of semantic node kinds understood by the flow compiler.
///
/// The visual editor tags nodes with free-text category strings, and several
/// strings map to the same kind (`transfer`, `transfer_call` and `phone_transfer`
/// are all phone transfers). {@link #of(String)} resolves a raw tag to its category;
/// anything unrecognized resolves to {@link #UNKNOWN}, which the node compiler
/// handles as an explicit fallback branch.
///
/// Each category also carries its default wait-for-response behavior, used when a
/// node's configuration does not set `waitForResponse` explicitly.
public enum NodeCategory {
    START(false, "start", "trigger"),
    MESSAGE(false, "message"),
    GREETING(false, "greeting"),
    QUESTION(true, "question"),
    APPOINTMENT(true, "appointment"),
    FORM(true, "form", "form_submission", "collect_info"),
    DELAY(false, "delay", "wait", "pause"),
    PHONE_TRANSFER(false, "transfer", "transfer_call", "phone_transfer"),
    AGENT_TRANSFER(false, "agent_transfer", "transfer_agent"),
    END(false, "end", "end_call", "hangup"),
    WEBHOOK(false, "webhook", "api_call", "tool"),
    PLAY_AUDIO(false, "play_audio"),
    CONDITION(false, "condition"),
    UNKNOWN(false);

    private static final Map<String, NodeCategory> BY_ALIAS = new HashMap<>();

    static {
        for (NodeCategory category : values()) {
            for (String alias : category.aliases) {
                BY_ALIAS.put(alias, category);
            }
        }
    }

    private final boolean waitsForResponseByDefault;
    private final List<String> aliases;

    NodeCategory(boolean waitsForResponseByDefault, String... aliases) {
        this.waitsForResponseByDefault = waitsForResponseByDefault;
        this.aliases = List.of(aliases);
    }

    /// Resolves a raw editor tag to its category.
    ///
    /// @param raw category tag from the node config or node type, may be null
    /// @return matching category, or {@link #UNKNOWN} for null or unrecognized tags
    public static NodeCategory of(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        return BY_ALIAS.getOrDefault(raw, UNKNOWN);
    }

    /// Returns whether nodes of this category wait for the caller's reply before
    /// their outgoing transitions may fire, absent an explicit setting.
    ///
    /// @return true for question, form and appointment nodes
    public boolean waitsForResponseByDefault() {
        return waitsForResponseByDefault;
    }

    /// Returns whether this category exists only in the authoring graph.
    ///
    /// Structural nodes (triggers and branches) never appear in the compiled workflow.
    ///
    /// @return true for {@link #START} and {@link #CONDITION}
    public boolean isStructural() {
        return this == START || this == CONDITION;
    }
}
