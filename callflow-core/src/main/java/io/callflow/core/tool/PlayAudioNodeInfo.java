package io.callflow.core.tool;

import java.util.Objects;

/// Audio clip played by a compiled tool node, reported for tool registration.
///
/// @param nodeId authoring node id, not null
/// @param audioUrl clip location, empty when not configured
/// @param audioFileName display file name, not null
/// @param interruptible whether the caller may talk over the clip
/// @param waitForComplete whether the flow waits for playback to finish
public record PlayAudioNodeInfo(
        String nodeId,
        String audioUrl,
        String audioFileName,
        boolean interruptible,
        boolean waitForComplete) {

    public PlayAudioNodeInfo {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        audioUrl = audioUrl != null ? audioUrl : "";
        audioFileName = audioFileName != null ? audioFileName : "audio";
    }

    /// Returns the tool id the compiled node invokes.
    ///
    /// @return tool id, never null
    public String toolId() {
        return ToolIds.playAudio(nodeId);
    }
}
