package io.callflow.core.compiler;

import io.callflow.core.form.FormNodeInfo;
import io.callflow.core.tool.PlayAudioNodeInfo;
import io.callflow.core.tool.WebhookNodeInfo;
import io.callflow.core.workflow.Workflow;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Compiled workflow together with the facts registration logic needs about it.
///
/// @param workflow compiled workflow, not null
/// @param firstMessage text of the entry message node, null when the entry is not a message
/// @param hasTransferNodes whether any phone transfer was compiled
/// @param hasAppointmentNodes whether any appointment step was compiled
/// @param hasFormNodes whether any form step was compiled
/// @param formNodes forms referenced by form steps, in node order
/// @param hasWebhookNodes whether any webhook with a URL was compiled
/// @param webhookNodes webhooks with a URL, in node order
/// @param hasPlayAudioNodes whether any audio playback was compiled
/// @param playAudioNodes audio clips, in node order
/// @param toolIds every tool id referenced by the workflow, first-seen order, no duplicates
public record CompileResult(
        Workflow workflow,
        String firstMessage,
        boolean hasTransferNodes,
        boolean hasAppointmentNodes,
        boolean hasFormNodes,
        List<FormNodeInfo> formNodes,
        boolean hasWebhookNodes,
        List<WebhookNodeInfo> webhookNodes,
        boolean hasPlayAudioNodes,
        List<PlayAudioNodeInfo> playAudioNodes,
        List<String> toolIds) {

    public CompileResult {
        Objects.requireNonNull(workflow, "workflow must not be null");
        formNodes = formNodes != null ? List.copyOf(formNodes) : List.of();
        webhookNodes = webhookNodes != null ? List.copyOf(webhookNodes) : List.of();
        playAudioNodes = playAudioNodes != null ? List.copyOf(playAudioNodes) : List.of();
        toolIds = toolIds != null ? List.copyOf(toolIds) : List.of();
    }

    /// Returns the entry message, if the flow opens with one.
    ///
    /// Informational only: the entry node speaks the line itself.
    ///
    /// @return first message, or empty
    public Optional<String> detectedFirstMessage() {
        return Optional.ofNullable(firstMessage);
    }
}
