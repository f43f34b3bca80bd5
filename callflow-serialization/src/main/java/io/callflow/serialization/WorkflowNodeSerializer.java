package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.callflow.core.Position;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.core.workflow.node.PhoneNumberNode;
import io.callflow.core.workflow.node.StandaloneAgentNode;
import io.callflow.core.workflow.node.ToolNode;
import io.callflow.core.workflow.node.WorkflowNode;
import java.io.IOException;
import java.io.Serial;

/// Serializes `WorkflowNode` subtypes to the voice platform's workflow node JSON.
///
/// Every object starts with `"type"`, `"position"` and `"edge_order"`, followed by the
/// subtype fields:
///
/// ```
/// type              Additional fields
/// ——————————————————+———————————————————————————————————————————————————————————
/// start, end        │ (none)
/// override_agent    │ label, override_prompt, additional_prompt,
///                   │ additional_tool_ids, additional_knowledge_base, conversation_config
/// phone_number      │ transfer_destination {type, phone_number}, transfer_type
/// standalone_agent  │ agent_id, delay_ms, enable_transferred_agent_first_message
/// tool              │ tools [{tool_id}]
/// ```
///
/// @implNote Package-private. Registered by {@link CallflowJacksonModule}.
/// @see WorkflowNodeDeserializer for the inverse operation
class WorkflowNodeSerializer extends StdSerializer<WorkflowNode> {

    @Serial private static final long serialVersionUID = -6019358112708331254L;

    WorkflowNodeSerializer() {
        super(WorkflowNode.class);
    }

    @Override
    public void serialize(WorkflowNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", node.nodeType().wireName());
        writePosition(node.position(), gen);
        provider.defaultSerializeField("edge_order", node.edgeOrder(), gen);

        switch (node.nodeType()) {
            case START, END -> {}
            case OVERRIDE_AGENT -> writeOverrideAgent((OverrideAgentNode) node, gen, provider);
            case PHONE_NUMBER -> writePhoneNumber((PhoneNumberNode) node, gen);
            case STANDALONE_AGENT -> writeStandaloneAgent((StandaloneAgentNode) node, gen);
            case TOOL -> writeTool((ToolNode) node, gen);
        }

        gen.writeEndObject();
    }

    private void writePosition(Position position, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("position");
        gen.writeNumberField("x", position.x());
        gen.writeNumberField("y", position.y());
        gen.writeEndObject();
    }

    private void writeOverrideAgent(
            OverrideAgentNode n, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("label", n.label());
        gen.writeBooleanField("override_prompt", n.overridePrompt());
        gen.writeStringField("additional_prompt", n.additionalPrompt());
        provider.defaultSerializeField("additional_tool_ids", n.additionalToolIds(), gen);
        provider.defaultSerializeField(
                "additional_knowledge_base", n.additionalKnowledgeBase(), gen);
        provider.defaultSerializeField("conversation_config", n.conversationConfig(), gen);
    }

    private void writePhoneNumber(PhoneNumberNode n, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("transfer_destination");
        gen.writeStringField("type", "phone");
        gen.writeStringField("phone_number", n.phoneNumber());
        gen.writeEndObject();
        gen.writeStringField("transfer_type", n.transferType().wireName());
    }

    private void writeStandaloneAgent(StandaloneAgentNode n, JsonGenerator gen)
            throws IOException {
        gen.writeStringField("agent_id", n.agentId());
        gen.writeNumberField("delay_ms", n.delayMs());
        gen.writeBooleanField(
                "enable_transferred_agent_first_message", n.enableTransferredAgentFirstMessage());
    }

    private void writeTool(ToolNode n, JsonGenerator gen) throws IOException {
        gen.writeArrayFieldStart("tools");
        for (String toolId : n.toolIds()) {
            gen.writeStartObject();
            gen.writeStringField("tool_id", toolId);
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
