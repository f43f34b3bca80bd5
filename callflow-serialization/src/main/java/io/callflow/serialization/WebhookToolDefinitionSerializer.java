package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.callflow.core.tool.WebhookToolDefinition;
import java.io.IOException;
import java.io.Serial;

/// Writes a tool definition in the platform's tool registration format:
/// `{"type":"webhook","name","description","api_schema":{"url","method","headers",
/// "request_body_schema"}}`.
class WebhookToolDefinitionSerializer extends StdSerializer<WebhookToolDefinition> {

    @Serial private static final long serialVersionUID = -5408832976410182256L;

    WebhookToolDefinitionSerializer() {
        super(WebhookToolDefinition.class);
    }

    @Override
    public void serialize(
            WebhookToolDefinition tool, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", tool.type());
        gen.writeStringField("name", tool.name());
        gen.writeStringField("description", tool.description());

        WebhookToolDefinition.ApiSchema schema = tool.apiSchema();
        gen.writeObjectFieldStart("api_schema");
        gen.writeStringField("url", schema.url());
        gen.writeStringField("method", schema.method());
        provider.defaultSerializeField("headers", schema.headers(), gen);
        provider.defaultSerializeField("request_body_schema", schema.requestBodySchema(), gen);
        gen.writeEndObject();

        gen.writeEndObject();
    }
}
