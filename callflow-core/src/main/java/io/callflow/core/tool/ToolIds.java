package io.callflow.core.tool;

/// Deterministic tool ids the compiler generates for platform-registered tools.
///
/// The same ids must be used when the tools are registered, so both sides derive them
/// from here.
public final class ToolIds {

    private static final int SUFFIX_LENGTH = 8;

    private ToolIds() {}

    /// Returns the submit tool id of a form: `submit_form_` plus the last 8 characters of
    /// the form id.
    ///
    /// @param formId form identifier, not null
    /// @return tool id, never null
    public static String submitForm(String formId) {
        return "submit_form_" + lastChars(formId);
    }

    /// Returns the audio playback tool id of a node: `play_audio_` plus the last 8
    /// characters of the node id.
    ///
    /// @param nodeId node identifier, not null
    /// @return tool id, never null
    public static String playAudio(String nodeId) {
        return "play_audio_" + lastChars(nodeId);
    }

    /// Returns the fallback tool id of a webhook node without an explicit id.
    ///
    /// @param nodeId node identifier, not null
    /// @return tool id, never null
    public static String webhookFallback(String nodeId) {
        return "webhook_" + nodeId;
    }

    private static String lastChars(String value) {
        return value.length() <= SUFFIX_LENGTH
                ? value
                : value.substring(value.length() - SUFFIX_LENGTH);
    }
}
