package io.callflow.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import io.callflow.core.Position;
import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.node.EndNode;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.core.workflow.node.PhoneNumberNode;
import io.callflow.core.workflow.node.StartNode;
import io.callflow.core.workflow.node.TransferType;
import java.util.List;
import org.junit.jupiter.api.Test;

public class WorkflowValidatorTest {

    private final WorkflowValidator validator = new WorkflowValidator();

    @Test
    void acceptsConnectedWorkflow() {
        Workflow workflow =
                Workflow.builder()
                        .node(Workflow.START_NODE_ID, new StartNode(null, List.of("s")))
                        .node("greet", scripted(List.of("e1")))
                        .node("bye", EndNode.at(Position.origin()))
                        .edge("s", WorkflowEdge.unconditional(Workflow.START_NODE_ID, "greet"))
                        .edge("e1", WorkflowEdge.unconditional("greet", "bye"))
                        .build();

        ValidationResult result = validator.validate(workflow);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.hasWarnings()).isFalse();
    }

    @Test
    void startOnlyWorkflowIsInvalid() {
        Workflow workflow = Workflow.builder().node(Workflow.START_NODE_ID, StartNode.create()).build();

        assertThat(validator.validate(workflow).errors())
                .containsExactly("Workflow must have at least one node besides start");
    }

    @Test
    void reportsMissingStartAndDanglingEdges() {
        Workflow workflow =
                Workflow.builder()
                        .node("a", scripted(List.of("e1")))
                        .node("b", EndNode.at(null))
                        .edge("e1", WorkflowEdge.unconditional("ghost", "nowhere"))
                        .build();

        ValidationResult result = validator.validate(workflow);

        assertThat(result.valid()).isFalse();
        assertThat(result.errors())
                .containsExactly(
                        "Workflow must have a start node",
                        "Edge e1 targets non-existent node nowhere",
                        "Edge e1 has non-existent source ghost");
    }

    @Test
    void warnsAboutUnreachableNodesEvenWhenTheyHaveIncomingEdges() {
        Workflow workflow =
                Workflow.builder()
                        .node(Workflow.START_NODE_ID, new StartNode(null, List.of("s")))
                        .node("greet", scripted(List.of()))
                        .node("island", scripted(List.of("e2")))
                        .node("transfer", new PhoneNumberNode(null, List.of(), "+1555", TransferType.BLIND))
                        .edge("s", WorkflowEdge.unconditional(Workflow.START_NODE_ID, "greet"))
                        .edge("e2", WorkflowEdge.unconditional("island", "transfer"))
                        .build();

        ValidationResult result = validator.validate(workflow);

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings())
                .containsExactly(
                        "Node island is not reachable from the start node",
                        "Node transfer is not reachable from the start node",
                        "Node greet has no outgoing edges");
    }

    private static OverrideAgentNode scripted(List<String> edgeOrder) {
        return OverrideAgentNode.builder()
                .label("step")
                .additionalPrompt("Say exactly: 'Hi'")
                .edgeOrder(edgeOrder)
                .build();
    }
}
