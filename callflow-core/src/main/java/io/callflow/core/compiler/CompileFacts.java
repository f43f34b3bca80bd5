package io.callflow.core.compiler;

import io.callflow.core.form.FormNodeInfo;
import io.callflow.core.tool.PlayAudioNodeInfo;
import io.callflow.core.tool.WebhookNodeInfo;
import io.callflow.core.workflow.Workflow;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Mutable accumulator of compile-time facts, owned by one compilation.
final class CompileFacts {

    private String firstMessage;
    private boolean hasTransferNodes;
    private boolean hasAppointmentNodes;
    private boolean hasFormNodes;
    private final List<FormNodeInfo> formNodes = new ArrayList<>();
    private final List<WebhookNodeInfo> webhookNodes = new ArrayList<>();
    private final List<PlayAudioNodeInfo> playAudioNodes = new ArrayList<>();
    private final Set<String> toolIds = new LinkedHashSet<>();

    void firstMessage(String firstMessage) {
        this.firstMessage = firstMessage;
    }

    void markTransfer() {
        hasTransferNodes = true;
    }

    void markAppointment() {
        hasAppointmentNodes = true;
    }

    void markForm() {
        hasFormNodes = true;
    }

    void addForm(FormNodeInfo form) {
        formNodes.add(form);
    }

    void addWebhook(WebhookNodeInfo webhook) {
        webhookNodes.add(webhook);
    }

    void addPlayAudio(PlayAudioNodeInfo audio) {
        playAudioNodes.add(audio);
    }

    void addToolId(String toolId) {
        toolIds.add(toolId);
    }

    CompileResult toResult(Workflow workflow) {
        return new CompileResult(
                workflow,
                firstMessage,
                hasTransferNodes,
                hasAppointmentNodes,
                hasFormNodes,
                formNodes,
                !webhookNodes.isEmpty(),
                webhookNodes,
                !playAudioNodes.isEmpty(),
                playAudioNodes,
                new ArrayList<>(toolIds));
    }
}
