package io.callflow.cli.commands;

import io.callflow.core.compiler.CompileResult;
import io.callflow.core.tool.SubmitFormToolFactory;
import io.callflow.core.tool.WebhookToolDefinition;
import io.callflow.serialization.WorkflowSerializer;
import jakarta.inject.Inject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

/// CLI command that lists the tools a compiled flow references and prints the submit-form
/// tool definitions to register with the voice platform.
///
/// Webhook and audio tools are only listed: they are registered from their own node
/// configuration, not generated here.
///
/// ### Usage
/// ```bash
/// callflow tools [-d <working-dir>] [-o <file>] <flow-name>
/// ```
@CommandLine.Command(name = "tools", description = "Print tool definitions for a flow")
class FlowToolsCommand extends FlowCommand {

    @CommandLine.Parameters(
            index = "0",
            description = "Flow name (from flows/ directory) or path to a flow file",
            arity = "0..1")
    private String flowName;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write the tool definitions to this file instead of stdout")
    private Path output;

    @Inject SubmitFormToolFactory toolFactory;

    @Override
    protected void execute() {
        try {
            CompileResult result = compileFlow(flowName);
            List<WebhookToolDefinition> tools = toolFactory.createAll(result.formNodes());

            System.out.println(" [OK] Tools referenced: " + result.toolIds().size());
            for (String toolId : result.toolIds()) {
                System.out.println("   - " + toolId);
            }
            if (!result.hasFormNodes()) {
                return;
            }

            String json = WorkflowSerializer.toolsToJson(tools);
            if (output != null) {
                Files.writeString(output, json);
                System.out.println(
                        " [OK] " + tools.size() + " submit-form tool(s) written to " + output);
            } else {
                System.out.println(json);
            }
        } catch (Exception e) {
            System.err.println(" [FAIL] Tool generation failed: " + e.getMessage());
        }
    }
}
