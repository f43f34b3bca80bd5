package io.callflow.cli.forms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileFormRepositoryTest {

    @TempDir Path tempDir;

    @Test
    void shouldReadFormFromJsonFile() throws Exception {
        Files.writeString(
                tempDir.resolve("intake.json"),
                """
                {"id": "intake", "name": "Intake",
                 "fields": [{"id": "name", "question": "Your name?", "required": true}]}
                """);

        var form = new JsonFileFormRepository(tempDir).findById("intake");

        assertThat(form).isPresent();
        assertThat(form.get().name()).isEqualTo("Intake");
        assertThat(form.get().fields()).hasSize(1);
        assertThat(form.get().fields().get(0).required()).isTrue();
    }

    @Test
    void shouldReturnEmptyForUnknownForm() {
        assertThat(new JsonFileFormRepository(tempDir).findById("missing")).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenDirectoryDoesNotExist() {
        var repository = new JsonFileFormRepository(tempDir.resolve("nowhere"));

        assertThat(repository.findById("intake")).isEmpty();
    }

    @Test
    void shouldIgnoreIdsThatEscapeTheDirectory() throws Exception {
        Files.writeString(tempDir.resolve("secret.json"), "{\"id\": \"secret\"}");
        Path forms = Files.createDirectories(tempDir.resolve("forms"));

        assertThat(new JsonFileFormRepository(forms).findById("../secret")).isEmpty();
    }

    @Test
    void shouldRejectMalformedFormDocument() throws Exception {
        Files.writeString(tempDir.resolve("bad.json"), "{\"name\": \"No id\"}");

        assertThatThrownBy(() -> new JsonFileFormRepository(tempDir).findById("bad"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
