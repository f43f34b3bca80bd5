package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.callflow.core.Position;
import io.callflow.core.workflow.node.EndNode;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.core.workflow.node.PhoneNumberNode;
import io.callflow.core.workflow.node.StandaloneAgentNode;
import io.callflow.core.workflow.node.StartNode;
import io.callflow.core.workflow.node.ToolNode;
import io.callflow.core.workflow.node.TransferType;
import io.callflow.core.workflow.node.WorkflowNode;
import io.callflow.core.workflow.node.WorkflowNodeType;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Deserializes workflow node JSON to the matching `WorkflowNode` record using the `"type"`
/// discriminator.
///
/// Missing optional fields fall back to the same defaults the records apply. An unknown
/// `type` or `transfer_type` is rejected.
///
/// @implNote Package-private. Registered by {@link CallflowJacksonModule}.
/// @see WorkflowNodeSerializer for the inverse operation
class WorkflowNodeDeserializer extends StdDeserializer<WorkflowNode> {

    @Serial private static final long serialVersionUID = 2287415390634508977L;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Object>> OBJECT_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    WorkflowNodeDeserializer() {
        super(WorkflowNode.class);
    }

    /// Reads the node tree and dispatches on its `"type"` field.
    ///
    /// @param p the JSON parser positioned at the start of the node object, not null
    /// @param ctxt the deserialization context, not null
    /// @return the constructed node, never null
    /// @throws IOException if `"type"` is absent or names no known node kind
    @Override
    public WorkflowNode deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null || typeNode.isNull()) {
            throw new IOException("Workflow node is missing its type");
        }
        WorkflowNodeType type;
        try {
            type = WorkflowNodeType.fromWireName(typeNode.asText());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }

        Position position = readPosition(root.get("position"));
        List<String> edgeOrder = readList(mapper, root, "edge_order", STRING_LIST);

        return switch (type) {
            case START -> new StartNode(position, edgeOrder);
            case END -> new EndNode(position, edgeOrder);
            case OVERRIDE_AGENT -> readOverrideAgent(mapper, root, position, edgeOrder);
            case PHONE_NUMBER -> readPhoneNumber(root, position, edgeOrder);
            case STANDALONE_AGENT ->
                    new StandaloneAgentNode(
                            position,
                            edgeOrder,
                            text(root, "agent_id"),
                            root.path("delay_ms").asLong(0),
                            root.path("enable_transferred_agent_first_message")
                                    .asBoolean(StandaloneAgentNode.DEFAULT_FIRST_MESSAGE_ENABLED));
            case TOOL -> readTool(root, position, edgeOrder);
        };
    }

    private OverrideAgentNode readOverrideAgent(
            ObjectMapper mapper, JsonNode root, Position position, List<String> edgeOrder) {
        Map<String, Object> conversationConfig =
                root.hasNonNull("conversation_config")
                        ? mapper.convertValue(root.get("conversation_config"), OBJECT_MAP)
                        : Map.of();
        return OverrideAgentNode.builder()
                .position(position)
                .edgeOrder(edgeOrder)
                .label(root.path("label").asText(""))
                .overridePrompt(root.path("override_prompt").asBoolean(true))
                .additionalPrompt(root.path("additional_prompt").asText(""))
                .additionalToolIds(readList(mapper, root, "additional_tool_ids", STRING_LIST))
                .additionalKnowledgeBase(
                        readList(mapper, root, "additional_knowledge_base", OBJECT_LIST))
                .conversationConfig(conversationConfig)
                .build();
    }

    private PhoneNumberNode readPhoneNumber(
            JsonNode root, Position position, List<String> edgeOrder) throws IOException {
        String rawType = root.path("transfer_type").asText(TransferType.CONFERENCE.wireName());
        TransferType transferType = TransferType.fromWireName(rawType);
        if (transferType == null) {
            throw new IOException("Unknown transfer_type: " + rawType);
        }
        String phoneNumber = root.path("transfer_destination").path("phone_number").asText("");
        return new PhoneNumberNode(position, edgeOrder, phoneNumber, transferType);
    }

    private ToolNode readTool(JsonNode root, Position position, List<String> edgeOrder) {
        List<String> toolIds = new ArrayList<>();
        for (JsonNode tool : root.path("tools")) {
            if (tool.hasNonNull("tool_id")) {
                toolIds.add(tool.get("tool_id").asText());
            }
        }
        return new ToolNode(position, edgeOrder, toolIds);
    }

    private Position readPosition(JsonNode position) {
        if (position == null || position.isNull()) {
            return Position.origin();
        }
        return new Position(position.path("x").asDouble(0), position.path("y").asDouble(0));
    }

    private <T> List<T> readList(
            ObjectMapper mapper, JsonNode root, String field, TypeReference<List<T>> type) {
        return root.hasNonNull(field) ? mapper.convertValue(root.get(field), type) : List.of();
    }

    private String text(JsonNode root, String field) {
        return root.hasNonNull(field) ? root.get(field).asText() : null;
    }
}
