package io.callflow.cli.commands;

import io.callflow.cli.visualizer.WorkflowVisualizer;
import io.callflow.core.compiler.CompileResult;
import jakarta.inject.Inject;
import picocli.CommandLine;

@CommandLine.Command(name = "visualize", description = "Visualize the compiled workflow graph")
class FlowVisualizeCommand extends FlowCommand {

    @CommandLine.Parameters(
            index = "0",
            description = "Flow name (from flows/ directory) or path to a flow file",
            arity = "0..1")
    String flowName;

    @CommandLine.Option(
            names = "--format",
            defaultValue = "text",
            description = "Output format: text, mermaid")
    String format;

    @Inject WorkflowVisualizer visualizer;

    @Override
    protected void execute() {
        try {
            CompileResult result = compileFlow(flowName);
            System.out.println(visualizer.visualize(result.workflow(), format));
        } catch (Exception e) {
            System.err.println(" [FAIL] Visualization failed: " + e.getMessage());
        }
    }
}
