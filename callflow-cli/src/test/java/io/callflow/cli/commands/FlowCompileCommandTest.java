package io.callflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.callflow.core.compiler.FlowCompiler;
import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.serialization.WorkflowSerializer;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowCompileCommandTest extends BaseFlowCommandTest {

    @TempDir Path tempDir;

    private FlowCompileCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new FlowCompileCommand();
        injectField(command, "compiler", new FlowCompiler());
        injectField(command, "workingDirPath", tempDir);
        injectField(command, "quiet", true);
    }

    @Test
    void shouldPrintWorkflowJsonToStdout() throws Exception {
        writeFlow(tempDir, "support", SUPPORT_FLOW);
        injectField(command, "flowName", "support");

        command.run();

        Workflow workflow = WorkflowSerializer.fromJson(outContent.toString());
        assertThat(workflow.getNodes())
                .containsOnlyKeys(Workflow.START_NODE_ID, "greet", "ask", "transfer", "bye");
        assertThat(workflow.getEdges()).containsKey("start_to_entry");
    }

    @Test
    void shouldWriteWorkflowToOutputFile() throws Exception {
        writeFlow(tempDir, "support", SUPPORT_FLOW);
        Path output = tempDir.resolve("build").resolve("support.workflow.json");
        injectField(command, "flowName", "support");
        injectField(command, "output", output);

        command.run();

        assertThat(outContent.toString()).contains("[OK] Workflow written to");
        assertThat(outContent.toString()).contains("Nodes: 5");
        Workflow workflow = WorkflowSerializer.fromJson(Files.readString(output));
        assertThat(workflow.getNodes().get("ask")).isInstanceOf(OverrideAgentNode.class);
    }

    @Test
    void shouldPrintSummaryWhenRequested() throws Exception {
        writeFlow(tempDir, "support", SUPPORT_FLOW);
        injectField(command, "flowName", "support");
        injectField(command, "summary", true);

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("\"hasTransferNodes\" : true");
        assertThat(output).contains("\"firstMessage\" : \"Hello\"");
    }

    @Test
    void shouldFillFormNodesFromFormsDirectory() throws Exception {
        writeForm(
                tempDir,
                "intake",
                """
                {"id": "intake", "name": "Patient intake", "fields": [
                  {"id": "dob", "question": "What is your date of birth?", "fieldType": "date",
                   "isRequired": true}
                ]}
                """);
        writeFlow(
                tempDir,
                "form-flow",
                """
                {"nodes": [{"id": "collect", "type": "form",
                            "data": {"config": {"formId": "intake"}}},
                           {"id": "bye", "type": "end"}],
                 "edges": [{"id": "e1", "source": "collect", "target": "bye"}]}
                """);
        injectField(command, "flowName", "form-flow");
        injectField(command, "summary", true);

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("Patient intake");
        assertThat(output).contains("What is your date of birth?");
    }

    @Test
    void shouldReportMalformedFlow() throws Exception {
        writeFlow(tempDir, "broken", "{\"nodes\": [");
        injectField(command, "flowName", "broken");

        command.run();

        assertThat(errContent.toString()).contains("[FAIL] Compilation failed");
    }
}
