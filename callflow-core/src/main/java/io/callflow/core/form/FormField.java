package io.callflow.core.form;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// One question of a data-collection form.
///
/// Field types understood by the prompt and tool generators: `text`, `number`,
/// `yes_no`, `multiple_choice`, `email`, `phone`, `date`, `rating`. Any other type is
/// treated as free text.
///
/// @param id field identifier, not null
/// @param question question spoken to the caller, not null
/// @param fieldType answer type, not null (defaults to `text`)
/// @param options choices for `multiple_choice` fields, never null
/// @param required whether the caller must answer
/// @param order sort position within the form
public record FormField(
        String id,
        String question,
        String fieldType,
        List<String> options,
        boolean required,
        int order) {

    public FormField {
        Objects.requireNonNull(id, "id must not be null");
        question = question != null ? question : "";
        fieldType = fieldType != null && !fieldType.isBlank() ? fieldType : "text";
        options = options != null ? List.copyOf(options) : List.of();
    }

    /// Reads a field from the loosely typed map stored in a form node's config.
    ///
    /// Accepts `isRequired` or `required` for the required flag. Missing ids fall back to
    /// `field_<index>` so that downstream schema keys stay unique.
    ///
    /// @param raw field map, not null
    /// @param index position of the field in its list, used for the id fallback
    /// @return parsed field, never null
    public static FormField fromMap(Map<?, ?> raw, int index) {
        Object id = raw.get("id");
        Object question = raw.get("question");
        Object fieldType = raw.get("fieldType");
        boolean required =
                Boolean.TRUE.equals(raw.get("isRequired")) || Boolean.TRUE.equals(raw.get("required"));
        int order = raw.get("order") instanceof Number n ? n.intValue() : 0;

        List<String> options = new ArrayList<>();
        if (raw.get("options") instanceof List<?> list) {
            for (Object option : list) {
                if (option != null) {
                    options.add(option.toString());
                }
            }
        }

        return new FormField(
                id != null ? id.toString() : "field_" + index,
                question != null ? question.toString() : null,
                fieldType != null ? fieldType.toString() : null,
                options,
                required,
                order);
    }

    /// Parses every map entry of a config `fields` list, skipping anything else.
    ///
    /// @param rawFields list as found in the node config, not null
    /// @return parsed fields in list order, never null
    public static List<FormField> fromList(List<?> rawFields) {
        List<FormField> fields = new ArrayList<>();
        for (int i = 0; i < rawFields.size(); i++) {
            if (rawFields.get(i) instanceof Map<?, ?> raw) {
                fields.add(fromMap(raw, i));
            }
        }
        return fields;
    }

    /// Returns the config-map form of this field, as written back into enriched nodes.
    ///
    /// @return mutable ordered map, never null
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("question", question);
        map.put("fieldType", fieldType);
        map.put("isRequired", required);
        map.put("options", new ArrayList<>(options));
        map.put("order", order);
        return map;
    }
}
