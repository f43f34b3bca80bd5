package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.callflow.core.form.FormDefinition;
import io.callflow.core.form.FormField;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Reads a stored form: `{"id", "name", "fields": [{"id", "question", "fieldType", ...}]}`.
///
/// Fields are parsed with the same rules as field lists embedded in a form node's config.
class FormDefinitionDeserializer extends StdDeserializer<FormDefinition> {

    @Serial private static final long serialVersionUID = -824471908153260311L;

    private static final TypeReference<List<Object>> OBJECT_LIST = new TypeReference<>() {};

    FormDefinitionDeserializer() {
        super(FormDefinition.class);
    }

    @Override
    public FormDefinition deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        if (!root.hasNonNull("id")) {
            throw new IOException("Form definition without id");
        }
        String id = root.get("id").asText();
        String name = root.path("name").asText(id);
        List<FormField> fields =
                root.path("fields").isArray()
                        ? FormField.fromList(mapper.convertValue(root.get("fields"), OBJECT_LIST))
                        : List.of();
        return new FormDefinition(id, name, fields);
    }
}
