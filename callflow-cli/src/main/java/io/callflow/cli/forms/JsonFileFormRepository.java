package io.callflow.cli.forms;

import io.callflow.core.form.FormDefinition;
import io.callflow.core.form.FormRepository;
import io.callflow.serialization.WorkflowSerializer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Form repository backed by `<formId>.json` files in a directory.
///
/// Ids that would escape the directory are treated as unknown forms.
///
/// @implNote Stateless apart from the directory; reads the file on every lookup.
public final class JsonFileFormRepository implements FormRepository {

    private static final Logger logger = Logger.getLogger(JsonFileFormRepository.class.getName());

    private final Path directory;

    /// @param directory folder holding one JSON file per form, not null (may not exist)
    public JsonFileFormRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /// Reads `<directory>/<formId>.json`.
    ///
    /// @param formId form identifier, not null
    /// @return the stored form, or empty if no such file exists
    /// @throws UncheckedIOException if the file exists but cannot be read
    /// @throws IllegalArgumentException if the file is not a valid form document
    @Override
    public Optional<FormDefinition> findById(String formId) {
        if (formId.isBlank()
                || formId.contains("/")
                || formId.contains("\\")
                || formId.contains("..")) {
            logger.warning("Ignoring form id that is not a plain file name: " + formId);
            return Optional.empty();
        }
        Path file = directory.resolve(formId + ".json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(WorkflowSerializer.readFormDefinition(Files.readString(file)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read form " + file, e);
        }
    }
}
