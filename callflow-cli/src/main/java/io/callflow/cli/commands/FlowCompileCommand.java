package io.callflow.cli.commands;

import io.callflow.core.compiler.CompileResult;
import io.callflow.serialization.WorkflowSerializer;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

/// CLI command that compiles an editor flow to the voice platform's workflow JSON.
///
/// ### Usage
/// ```bash
/// callflow compile [-d <working-dir>] [-o <file>] [--summary] <flow-name>
/// ```
///
/// Without `-o` the JSON goes to stdout; combine with `-q` to pipe it.
///
/// @see FlowCommand
@CommandLine.Command(name = "compile", description = "Compile a flow to workflow JSON")
class FlowCompileCommand extends FlowCommand {

    @CommandLine.Parameters(
            index = "0",
            description = "Flow name (from flows/ directory) or path to a flow file",
            arity = "0..1")
    private String flowName;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write the JSON to this file instead of stdout")
    private Path output;

    @CommandLine.Option(
            names = "--summary",
            description = "Emit the compile summary (workflow plus detected tools and forms)")
    private boolean summary;

    @Override
    protected void execute() {
        try {
            CompileResult result = compileFlow(flowName);
            String json =
                    summary
                            ? WorkflowSerializer.summaryToJson(result)
                            : WorkflowSerializer.toJson(result.workflow());

            if (output == null) {
                System.out.println(json);
                return;
            }
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, json);
            System.out.println(" [OK] Workflow written to " + output);
            System.out.println("   Nodes: " + result.workflow().getNodes().size());
            System.out.println("   Edges: " + result.workflow().getEdges().size());
        } catch (Exception e) {
            System.err.println(" [FAIL] Compilation failed: " + e.getMessage());
        }
    }
}
