package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.callflow.core.workflow.WorkflowEdge;
import java.io.IOException;
import java.io.Serial;

/// Writes `{"source":..., "target":..., "forward_condition":{...}}`.
///
/// @see WorkflowEdgeDeserializer for the inverse operation
class WorkflowEdgeSerializer extends StdSerializer<WorkflowEdge> {

    @Serial private static final long serialVersionUID = 4158830162245519320L;

    WorkflowEdgeSerializer() {
        super(WorkflowEdge.class);
    }

    @Override
    public void serialize(WorkflowEdge edge, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("source", edge.source());
        gen.writeStringField("target", edge.target());
        provider.defaultSerializeField("forward_condition", edge.forwardCondition(), gen);
        gen.writeEndObject();
    }
}
