package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.condition.ForwardCondition;
import java.io.IOException;
import java.io.Serial;

/// Reads a workflow edge. A missing `forward_condition` is read as unconditional.
///
/// @see WorkflowEdgeSerializer for the inverse operation
class WorkflowEdgeDeserializer extends StdDeserializer<WorkflowEdge> {

    @Serial private static final long serialVersionUID = -1187604290835117726L;

    WorkflowEdgeDeserializer() {
        super(WorkflowEdge.class);
    }

    @Override
    public WorkflowEdge deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        if (!root.hasNonNull("source") || !root.hasNonNull("target")) {
            throw new IOException("Workflow edge requires source and target");
        }
        ForwardCondition condition =
                root.hasNonNull("forward_condition")
                        ? mapper.treeToValue(root.get("forward_condition"), ForwardCondition.class)
                        : ForwardCondition.unconditional();
        return new WorkflowEdge(
                root.get("source").asText(), root.get("target").asText(), condition);
    }
}
