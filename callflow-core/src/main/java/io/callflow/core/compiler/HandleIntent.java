package io.callflow.core.compiler;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/// Caller intents recognized from the name of an edge's output port.
///
/// Port names are matched case-insensitively.
public enum HandleIntent {
    AFFIRMATIVE(LlmConditions.YES_ACCEPTANCE, "yes", "true", "accept", "agree"),
    NEGATIVE(LlmConditions.NO_REJECTION, "no", "false", "reject", "decline"),
    HUMAN_HANDOFF(LlmConditions.TRANSFER_INTENT, "transfer", "human", "agent"),
    CLARIFICATION(LlmConditions.CONFUSION, "question", "confused", "clarify"),
    NO_RESPONSE(LlmConditions.SILENCE, "silence", "noresponse", "timeout");

    private final String condition;
    private final Set<String> handles;

    HandleIntent(String condition, String... handles) {
        this.condition = condition;
        this.handles = Set.of(handles);
    }

    /// Resolves a port name to an intent.
    ///
    /// @param handle source handle of an edge, may be null
    /// @return matching intent, or empty for null or unrecognized handles
    public static Optional<HandleIntent> of(String handle) {
        if (handle == null || handle.isEmpty()) {
            return Optional.empty();
        }
        String normalized = handle.toLowerCase(Locale.ROOT);
        for (HandleIntent intent : values()) {
            if (intent.handles.contains(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }

    /// Returns the transition rule text for this intent.
    ///
    /// @return condition text, never null
    public String condition() {
        return condition;
    }
}
