package io.callflow.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;

import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.condition.ForwardCondition;
import io.callflow.core.workflow.condition.ResultCondition;
import io.callflow.core.workflow.node.EndNode;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.core.workflow.node.StartNode;
import io.callflow.core.workflow.node.ToolNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MermaidVisualizationFormatTest {

    private MermaidVisualizationFormat format;

    @BeforeEach
    void setUp() {
        format = new MermaidVisualizationFormat();
    }

    @Test
    void shouldReturnMermaidAsFormatName() {
        assertThat(format.getName()).isEqualTo("mermaid");
    }

    @Test
    void shouldWrapOutputInCodeBlock() {
        String result = format.render(createWorkflow());

        assertThat(result).startsWith("```mermaid\n");
        assertThat(result).contains("flowchart TD");
        assertThat(result).endsWith("```\n");
    }

    @Test
    void shouldUseShapesPerNodeType() {
        String result = format.render(createWorkflow());

        assertThat(result).contains("start_node((\"start\"))");
        assertThat(result).contains("greet[\"Greeting\"]");
        assertThat(result).contains("hook[/\"hook\\n(tool)\"/]");
    }

    @Test
    void shouldPrefixReservedKeywordIds() {
        String result = format.render(createWorkflow());

        assertThat(result).contains("node_end([\"end\"])");
        assertThat(result).contains("hook -.->|on success| node_end");
    }

    @Test
    void shouldLabelAndEscapeLlmConditions() {
        String result = format.render(createWorkflow());

        assertThat(result).contains("start_node --> greet");
        assertThat(result).contains("greet -->|\"User said #quot;go#quot;\"| hook");
    }

    @Test
    void shouldSanitizeNodeIds() {
        Workflow workflow =
                Workflow.builder()
                        .node("step-1.a", EndNode.at(null))
                        .build();

        assertThat(format.render(workflow)).contains("step_1_a([\"step-1.a\"])");
    }

    private Workflow createWorkflow() {
        return Workflow.builder()
                .node(Workflow.START_NODE_ID, StartNode.create())
                .node(
                        "greet",
                        OverrideAgentNode.builder()
                                .label("Greeting")
                                .additionalPrompt("Say hi")
                                .build())
                .node("hook", ToolNode.invoking(null, "crm_sync"))
                .node("end", EndNode.at(null))
                .edge("s", WorkflowEdge.unconditional(Workflow.START_NODE_ID, "greet"))
                .edge(
                        "g",
                        new WorkflowEdge("greet", "hook", ForwardCondition.llm("User said \"go\"")))
                .edge("h", new WorkflowEdge("hook", "end", new ResultCondition(true)))
                .build();
    }
}
