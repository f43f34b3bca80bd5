package io.callflow.core.form;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Form referenced by a compiled form node, reported so that its submit tool can be
/// registered with the voice platform.
///
/// @param formId form identifier, not null
/// @param formName display name, not null
/// @param fields questions as configured on the node, not null
public record FormNodeInfo(String formId, String formName, List<FormField> fields) {

    public FormNodeInfo {
        Objects.requireNonNull(formId, "formId must not be null");
        Objects.requireNonNull(formName, "formName must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    /// Returns the fields sorted by their `order`, ties kept in declaration order.
    ///
    /// @return sorted fields, never null
    public List<FormField> orderedFields() {
        return fields.stream().sorted(Comparator.comparingInt(FormField::order)).toList();
    }
}
