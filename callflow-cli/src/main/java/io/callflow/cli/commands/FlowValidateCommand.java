package io.callflow.cli.commands;

import io.callflow.core.compiler.CompileResult;
import io.callflow.core.validation.ValidationResult;
import io.callflow.core.validation.WorkflowValidator;
import picocli.CommandLine;

/// CLI command that compiles a flow and reports structural problems of the result.
///
/// Reports:
/// - Missing start node, empty workflows and edges to missing nodes as errors
/// - Nodes unreachable from the start node as warnings
/// - Conversational nodes without an exit as warnings
///
/// ### Usage
/// ```bash
/// callflow validate [-d <working-dir>] <flow-name>
/// ```
///
/// @see FlowCommand
@CommandLine.Command(name = "validate", description = "Validate a compiled flow")
class FlowValidateCommand extends FlowCommand {

    @CommandLine.Parameters(
            index = "0",
            description = "Flow name (from flows/ directory) or path to a flow file",
            arity = "0..1")
    private String flowName;

    private final WorkflowValidator validator = new WorkflowValidator();

    @Override
    protected void execute() {
        try {
            CompileResult result = compileFlow(flowName);
            ValidationResult validation = validator.validate(result.workflow());

            if (validation.valid()) {
                System.out.println(" [OK] Workflow is valid!");
            } else {
                for (String error : validation.errors()) {
                    System.out.println(" [ERROR] " + error);
                }
            }
            System.out.println("   Nodes: " + result.workflow().getNodes().size());
            System.out.println("   Edges: " + result.workflow().getEdges().size());
            result.detectedFirstMessage()
                    .ifPresent(message -> System.out.println("   First message: " + message));

            for (String warning : validation.warnings()) {
                System.out.println(" [WARN] " + warning);
            }
        } catch (Exception e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
        }
    }
}
