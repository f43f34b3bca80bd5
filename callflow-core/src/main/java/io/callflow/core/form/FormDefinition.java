package io.callflow.core.form;

import java.util.List;
import java.util.Objects;

/// A stored form: its name and the questions it collects.
///
/// @param id form identifier, not null
/// @param name display name, not null
/// @param fields questions in storage order, not null
public record FormDefinition(String id, String name, List<FormField> fields) {

    public FormDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        fields = fields != null ? List.copyOf(fields) : List.of();
    }
}
