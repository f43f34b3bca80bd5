package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.callflow.core.workflow.condition.ExpressionCondition;
import io.callflow.core.workflow.condition.ForwardCondition;
import io.callflow.core.workflow.condition.LlmCondition;
import io.callflow.core.workflow.condition.ResultCondition;
import io.callflow.core.workflow.condition.UnconditionalCondition;
import java.io.IOException;
import java.io.Serial;

/// Deserializes `ForwardCondition` variants based on the `type` discriminator field.
///
/// @see ForwardConditionSerializer for the inverse operation
class ForwardConditionDeserializer extends StdDeserializer<ForwardCondition> {

    @Serial private static final long serialVersionUID = -3968221475090016342L;

    ForwardConditionDeserializer() {
        super(ForwardCondition.class);
    }

    @Override
    public ForwardCondition deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String type = root.path("type").asText(UnconditionalCondition.TYPE);

        return switch (type) {
            case UnconditionalCondition.TYPE -> ForwardCondition.unconditional();
            case LlmCondition.TYPE -> new LlmCondition(root.path("condition").asText());
            case ResultCondition.TYPE ->
                    new ResultCondition(root.path("successful").asBoolean(false));
            case ExpressionCondition.TYPE ->
                    new ExpressionCondition(
                            mapper.treeToValue(root.get("expression"), Object.class));
            default -> throw new IOException("Unknown ForwardCondition type: " + type);
        };
    }
}
