package io.callflow.core.compiler;

import io.callflow.core.Position;
import io.callflow.core.flow.FlowNode;
import io.callflow.core.flow.NodeConfig;
import io.callflow.core.form.FormField;
import io.callflow.core.form.FormNodeInfo;
import io.callflow.core.tool.PlayAudioNodeInfo;
import io.callflow.core.tool.ToolIds;
import io.callflow.core.tool.WebhookNodeInfo;
import io.callflow.core.workflow.node.EndNode;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.core.workflow.node.PhoneNumberNode;
import io.callflow.core.workflow.node.StandaloneAgentNode;
import io.callflow.core.workflow.node.ToolNode;
import io.callflow.core.workflow.node.TransferType;
import io.callflow.core.workflow.node.WorkflowNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// Maps one authoring node to at most one workflow node.
///
/// Conversational steps (message, question, appointment, form, delay and anything
/// unrecognized) become scripted {@link OverrideAgentNode}s that differ only in their
/// prompt. Transfers, hang-ups and tool calls get dedicated node kinds. Triggers and
/// condition nodes produce nothing: the assembler injects its own start node and
/// conditions are folded into edges.
///
/// Side facts (transfer presence, forms, webhooks, audio clips, tool ids) are recorded
/// into the compilation's {@link CompileFacts}.
final class NodeCompiler {

    private static final Logger logger = Logger.getLogger(NodeCompiler.class.getName());

    static final String DEFAULT_MESSAGE = "Hello";
    static final String DEFAULT_QUESTION = "How can I help you?";
    static final String DEFAULT_APPOINTMENT_INTRO = "I can help you schedule an appointment.";
    static final String DEFAULT_FORM_INTRO = "I need to collect some information from you.";
    static final String DEFAULT_FORM_NAME = "Data Collection";
    static final String DEFAULT_WAIT_MESSAGE = "One moment please...";
    static final String DEFAULT_FALLBACK_MESSAGE = "How may I assist you?";
    static final long DEFAULT_APPOINTMENT_DURATION = 30;

    Optional<WorkflowNode> compile(FlowNode node, CompileFacts facts) {
        NodeConfig config = node.config();
        Position position = node.position();
        String label = label(node, config);

        WorkflowNode compiled =
                switch (node.category()) {
                    case START, CONDITION -> null;
                    case MESSAGE ->
                            scripted(
                                    position,
                                    label,
                                    PromptTemplates.message(
                                            config.textOr(DEFAULT_MESSAGE, "message")));
                    case QUESTION ->
                            scripted(
                                    position,
                                    label,
                                    PromptTemplates.question(
                                            config.textOr(DEFAULT_QUESTION, "question", "message")));
                    case APPOINTMENT -> compileAppointment(position, label, config, facts);
                    case FORM -> compileForm(position, label, config, facts);
                    case DELAY ->
                            scripted(
                                    position,
                                    label,
                                    PromptTemplates.delay(
                                            config.textOr(
                                                    DEFAULT_WAIT_MESSAGE, "message", "waitMessage")));
                    case PHONE_TRANSFER -> compilePhoneTransfer(node, position, config, facts);
                    case AGENT_TRANSFER ->
                            new StandaloneAgentNode(
                                    position,
                                    List.of(),
                                    config.textOr("", "agentId", "agent_id"),
                                    config.numberOr(0, "delay_ms", "delayMs"),
                                    config.flagOr(
                                            "enableFirstMessage",
                                            StandaloneAgentNode.DEFAULT_FIRST_MESSAGE_ENABLED));
                    case END -> EndNode.at(position);
                    case WEBHOOK -> compileWebhook(node, position, config, facts);
                    case PLAY_AUDIO -> compilePlayAudio(node, position, config, facts);
                    case GREETING, UNKNOWN -> {
                        logger.info(
                                "Compiling node "
                                        + node.id()
                                        + " of unhandled type '"
                                        + node.rawCategory()
                                        + "' as a scripted message");
                        yield scripted(
                                position,
                                label,
                                PromptTemplates.message(
                                        config.textOr(DEFAULT_FALLBACK_MESSAGE, "message", "text")));
                    }
                };
        return Optional.ofNullable(compiled);
    }

    /// `config.label`, `config.name`, `data.label`, the raw category, else `Node`.
    static String label(FlowNode node, NodeConfig config) {
        String label = config.text("label", "name");
        if (label != null) {
            return label;
        }
        if (node.label() != null) {
            return node.label();
        }
        String raw = node.rawCategory();
        return raw.isEmpty() ? "Node" : raw;
    }

    private static OverrideAgentNode scripted(Position position, String label, String prompt) {
        return OverrideAgentNode.builder()
                .position(position)
                .label(label)
                .additionalPrompt(prompt)
                .build();
    }

    private static WorkflowNode compileAppointment(
            Position position, String label, NodeConfig config, CompileFacts facts) {
        facts.markAppointment();
        String intro = config.textOr(DEFAULT_APPOINTMENT_INTRO, "message", "introMessage");
        String serviceName = config.textOr("appointment", "serviceName", "service");
        long duration = config.numberOr(DEFAULT_APPOINTMENT_DURATION, "duration");
        return scripted(position, label, PromptTemplates.appointment(intro, serviceName, duration));
    }

    private static WorkflowNode compileForm(
            Position position, String label, NodeConfig config, CompileFacts facts) {
        facts.markForm();
        String intro = config.textOr(DEFAULT_FORM_INTRO, "message", "introMessage");
        String formId = config.text("formId");
        String formName = config.textOr(DEFAULT_FORM_NAME, "formName");
        List<FormField> fields = FormField.fromList(config.list("fields"));

        List<String> toolIds = List.of();
        if (formId != null) {
            facts.addForm(new FormNodeInfo(formId, formName, fields));
            String submitToolId = ToolIds.submitForm(formId);
            facts.addToolId(submitToolId);
            toolIds = List.of(submitToolId);
        }
        logger.fine(
                "Form node " + label + ": formId " + formId + ", " + fields.size() + " field(s)");

        return OverrideAgentNode.builder()
                .position(position)
                .label(label)
                .additionalPrompt(PromptTemplates.form(intro, formName, fields))
                .additionalToolIds(toolIds)
                .build();
    }

    private static WorkflowNode compilePhoneTransfer(
            FlowNode node, Position position, NodeConfig config, CompileFacts facts) {
        facts.markTransfer();
        String phoneNumber = config.textOr("", "phoneNumber", "transferNumber", "number");
        String rawType = config.text("transferType");
        TransferType transferType = TransferType.fromWireName(rawType);
        if (transferType == null) {
            if (rawType != null) {
                logger.warning(
                        "Unknown transfer type '"
                                + rawType
                                + "' on node "
                                + node.id()
                                + ", using conference");
            }
            transferType = TransferType.CONFERENCE;
        }
        return new PhoneNumberNode(position, List.of(), phoneNumber, transferType);
    }

    private static WorkflowNode compileWebhook(
            FlowNode node, Position position, NodeConfig config, CompileFacts facts) {
        NodeConfig data = node.dataView();
        String toolId = config.text("toolId", "tool_id", "name");
        if (toolId == null) {
            toolId = data.textOr(ToolIds.webhookFallback(node.id()), "toolId", "tool_id", "name");
        }
        facts.addToolId(toolId);

        String url = config.text("url", "webhookUrl");
        if (url == null) {
            url = data.text("url", "webhookUrl");
        }
        if (url != null) {
            String method = config.textOr(data.textOr("POST", "method"), "method");
            Map<String, Object> headers = config.map("headers");
            Map<String, Object> payload = config.map("payload");
            facts.addWebhook(
                    new WebhookNodeInfo(
                            toolId,
                            url,
                            method,
                            headers != null ? headers : data.map("headers"),
                            payload != null ? payload : data.map("payload")));
            logger.fine(
                    "Webhook node "
                            + node.id()
                            + " configured: "
                            + toolId
                            + " -> "
                            + method
                            + " "
                            + url);
        } else {
            logger.warning("Webhook node " + node.id() + " has no URL configured");
        }
        return ToolNode.invoking(position, toolId);
    }

    private static WorkflowNode compilePlayAudio(
            FlowNode node, Position position, NodeConfig config, CompileFacts facts) {
        String audioUrl = config.textOr("", "audioUrl");
        if (audioUrl.isEmpty()) {
            logger.warning("Play audio node " + node.id() + " has no audio URL configured");
        }
        PlayAudioNodeInfo audio =
                new PlayAudioNodeInfo(
                        node.id(),
                        audioUrl,
                        config.textOr("audio", "audioFileName"),
                        config.flagOr("interruptible", false),
                        config.flagOr("waitForComplete", true));
        facts.addPlayAudio(audio);
        facts.addToolId(audio.toolId());
        return ToolNode.invoking(position, audio.toolId());
    }
}
