package io.callflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.callflow.core.compiler.FlowCompiler;
import io.callflow.core.tool.SubmitFormToolFactory;
import io.callflow.core.tool.ToolEndpointConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowToolsCommandTest extends BaseFlowCommandTest {

    private static final String TOOL_FLOW =
            """
            {
              "nodes": [
                {"id": "collect", "type": "form",
                 "data": {"config": {"formId": "form-00000042", "formName": "Callback",
                   "fields": [{"id": "best-time", "question": "When should we call?"}]}}},
                {"id": "hook", "type": "webhook",
                 "data": {"config": {"toolId": "crm_sync", "url": "https://crm.example"}}},
                {"id": "bye", "type": "end"}
              ],
              "edges": [
                {"id": "e1", "source": "collect", "target": "hook"},
                {"id": "e2", "source": "hook", "target": "bye"}
              ]
            }
            """;

    @TempDir Path tempDir;

    private FlowToolsCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new FlowToolsCommand();
        injectField(command, "compiler", new FlowCompiler());
        injectField(command, "workingDirPath", tempDir);
        injectField(command, "quiet", true);
        command.toolFactory =
                new SubmitFormToolFactory(
                        new ToolEndpointConfig("https://calls.example", "secret", "agent-9"));
    }

    @Test
    void shouldListToolIdsAndPrintSubmitFormDefinitions() throws Exception {
        writeFlow(tempDir, "tools", TOOL_FLOW);
        injectField(command, "flowName", "tools");

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("[OK] Tools referenced: 2");
        assertThat(output).contains("- submit_form_00000042");
        assertThat(output).contains("- crm_sync");
        assertThat(output)
                .contains(
                        "https://calls.example/api/webhooks/elevenlabs/form/secret/form-00000042/agent-9");
        assertThat(output).contains("field_best_time");
    }

    @Test
    void shouldWriteDefinitionsToFile() throws Exception {
        writeFlow(tempDir, "tools", TOOL_FLOW);
        Path output = tempDir.resolve("tools.json");
        injectField(command, "flowName", "tools");
        injectField(command, "output", output);

        command.run();

        assertThat(outContent.toString()).contains("1 submit-form tool(s) written to");
        assertThat(Files.readString(output)).contains("\"type\" : \"webhook\"");
    }

    @Test
    void shouldSkipDefinitionsWhenFlowHasNoForms() throws Exception {
        writeFlow(tempDir, "support", SUPPORT_FLOW);
        injectField(command, "flowName", "support");

        command.run();

        String output = outContent.toString();
        assertThat(output).contains("[OK] Tools referenced: 0");
        assertThat(output).doesNotContain("api_schema");
    }
}
