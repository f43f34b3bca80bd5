package io.callflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.callflow.core.compiler.CompilerOptions;
import io.callflow.core.compiler.FlowCompiler;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowValidateCommandTest extends BaseFlowCommandTest {

    @TempDir Path tempDir;

    private FlowValidateCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new FlowValidateCommand();
        injectField(command, "compiler", new FlowCompiler());
        injectField(command, "workingDirPath", tempDir);
        injectField(command, "quiet", true);
    }

    @Test
    void shouldValidateFlowSuccessfully() throws Exception {
        writeFlow(tempDir, "support", SUPPORT_FLOW);
        injectField(command, "flowName", "support");

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("[OK] Workflow is valid!");
        assertThat(output).contains("Nodes: 5");
        assertThat(output).contains("First message: Hello");
        assertThat(output).doesNotContain("[WARN]");
        assertThat(errContent.toString()).doesNotContain("[FAIL]");
    }

    @Test
    void shouldWarnAboutConversationalDeadEnds() throws Exception {
        writeFlow(
                tempDir,
                "dead-end",
                """
                {"nodes": [{"id": "ask", "type": "question",
                            "data": {"config": {"question": "Anything else?"}}}],
                 "edges": []}
                """);
        injectField(command, "flowName", "dead-end");

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("[OK] Workflow is valid!");
        assertThat(output).contains("[WARN] Node ask has no outgoing edges");
    }

    @Test
    void shouldReportErrorsForWorkflowWithoutSteps() throws Exception {
        writeFlow(
                tempDir,
                "trigger-only",
                """
                {"nodes": [{"id": "trigger", "type": "start"}], "edges": []}
                """);
        injectField(command, "flowName", "trigger-only");

        command.run();

        String output = outContent.toString();
        assertThat(output).doesNotContain("[OK]");
        assertThat(output).contains("[ERROR] Workflow must have at least one node besides start");
    }

    @Test
    void shouldAcceptDirectFilePath() throws Exception {
        Path file = writeFlow(tempDir, "elsewhere", SUPPORT_FLOW);
        injectField(command, "flowName", file.toString());

        command.run();

        assertThat(outContent.toString()).contains("Workflow is valid");
    }

    @Test
    void shouldFailWhenFlowFileIsMissing() throws Exception {
        injectField(command, "flowName", "missing");

        command.run();

        String errOutput = errContent.toString();
        assertThat(errOutput).contains("[FAIL] Validation failed");
        assertThat(errOutput).contains("Flow file not found");
    }

    @Test
    void shouldFailWhenNoFlowNameIsConfigured() {
        command.run();

        assertThat(errContent.toString()).contains("No flow name specified");
        assertThat(errContent.toString()).contains("Validation failed");
    }

    @Test
    void shouldFailOnDanglingEdgeInStrictMode() throws Exception {
        injectField(command, "compiler", new FlowCompiler(CompilerOptions.strictMode()));
        writeFlow(
                tempDir,
                "dangling",
                """
                {"nodes": [{"id": "greet", "type": "message"}],
                 "edges": [{"id": "e1", "source": "greet", "target": "ghost"}]}
                """);
        injectField(command, "flowName", "dangling");

        command.run();

        assertThat(errContent.toString()).contains("[FAIL] Validation failed");
        assertThat(outContent.toString()).doesNotContain("[OK]");
    }
}
