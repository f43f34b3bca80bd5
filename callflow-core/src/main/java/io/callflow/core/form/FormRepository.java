package io.callflow.core.form;

import java.util.Optional;

/// Lookup of stored forms by id.
///
/// Implementations may hit a database or a directory of JSON files; the compiler only
/// consults them through {@link FormNodeEnricher} before compilation.
///
/// @see InMemoryFormRepository
public interface FormRepository {

    /// Finds a form by id.
    ///
    /// @param formId form identifier, not null
    /// @return the form, or empty if it does not exist
    Optional<FormDefinition> findById(String formId);
}
