package io.callflow.core.form;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Thread-safe in-memory form repository. Suitable for tests and embedded use.
public final class InMemoryFormRepository implements FormRepository {

    private final Map<String, FormDefinition> forms = new ConcurrentHashMap<>();

    /// Stores or replaces a form.
    ///
    /// @param form form to store, not null
    public void save(FormDefinition form) {
        Objects.requireNonNull(form, "form must not be null");
        forms.put(form.id(), form);
    }

    @Override
    public Optional<FormDefinition> findById(String formId) {
        return Optional.ofNullable(forms.get(formId));
    }
}
