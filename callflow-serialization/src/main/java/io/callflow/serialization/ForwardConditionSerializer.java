package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.callflow.core.workflow.condition.ExpressionCondition;
import io.callflow.core.workflow.condition.ForwardCondition;
import io.callflow.core.workflow.condition.LlmCondition;
import io.callflow.core.workflow.condition.ResultCondition;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `ForwardCondition` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`UnconditionalCondition`**: `{"type":"unconditional"}`
/// - **`LlmCondition`**: `{"type":"llm","condition":"..."}`
/// - **`ResultCondition`**: `{"type":"result","successful":true}`
/// - **`ExpressionCondition`**: `{"type":"expression","expression":...}`, the expression tree
///   written as-is
///
/// @implNote Package-private. Registered by {@link CallflowJacksonModule}.
/// @see ForwardConditionDeserializer for the inverse operation
class ForwardConditionSerializer extends StdSerializer<ForwardCondition> {

    @Serial private static final long serialVersionUID = 7720594316028851163L;

    ForwardConditionSerializer() {
        super(ForwardCondition.class);
    }

    @Override
    public void serialize(
            ForwardCondition condition, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", condition.typeName());

        if (condition instanceof LlmCondition llm) {
            gen.writeStringField("condition", llm.condition());
        } else if (condition instanceof ResultCondition result) {
            gen.writeBooleanField("successful", result.successful());
        } else if (condition instanceof ExpressionCondition expression) {
            provider.defaultSerializeField("expression", expression.expression(), gen);
        }

        gen.writeEndObject();
    }
}
