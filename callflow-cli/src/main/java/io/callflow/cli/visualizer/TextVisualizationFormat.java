package io.callflow.cli.visualizer;

import io.callflow.cli.ui.AnsiStyles;
import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.core.workflow.node.PhoneNumberNode;
import io.callflow.core.workflow.node.StandaloneAgentNode;
import io.callflow.core.workflow.node.ToolNode;
import io.callflow.core.workflow.node.WorkflowNode;
import io.callflow.core.workflow.node.WorkflowNodeType;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/// ASCII text visualization format for compiled workflows with ANSI color support.
///
/// Nodes are rendered breadth-first from the start node, indented by depth, each with its
/// outgoing transitions in `edge_order`. Nodes the traversal never reaches are listed at
/// the end.
///
/// ### Node Type Colors
/// - **Blue (accent)**: override_agent, tool
/// - **Green (success)**: start, end
/// - **Red (error)**: phone_number, standalone_agent
///
/// @implNote Thread-safe. Each render call creates its own AnsiStyles instance.
/// @see MermaidVisualizationFormat for diagram output
@ApplicationScoped
public class TextVisualizationFormat implements VisualizationFormat {

    private static final int PROMPT_PREVIEW = 60;
    private static final int CONDITION_PREVIEW = 70;

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(Workflow workflow) {
        return render(workflow, true);
    }

    /// Renders the workflow graph with configurable color support.
    ///
    /// @param workflow the workflow to visualize, not null
    /// @param useColor whether to apply ANSI color codes
    /// @return formatted text representation, never null
    public String render(Workflow workflow, boolean useColor) {
        AnsiStyles styles = AnsiStyles.of(useColor);
        StringBuilder sb = new StringBuilder();
        sb.append(
                String.format(
                        "%s %s nodes, %s edges%n",
                        styles.bold("Workflow:"),
                        styles.accent(String.valueOf(workflow.getNodes().size())),
                        styles.accent(String.valueOf(workflow.getEdges().size()))));
        sb.append(styles.gray("─".repeat(50))).append(System.lineSeparator());
        sb.append(System.lineSeparator());

        Set<String> visited = new HashSet<>();
        Deque<NodeLevel> queue = new ArrayDeque<>();
        queue.add(new NodeLevel(Workflow.START_NODE_ID, 0));

        while (!queue.isEmpty()) {
            NodeLevel current = queue.removeFirst();
            if (!visited.add(current.nodeId())) {
                continue;
            }
            WorkflowNode node = workflow.getNodes().get(current.nodeId());
            if (node == null) {
                continue;
            }

            String indent = "  ".repeat(current.level());
            sb.append(renderNode(workflow, current.nodeId(), node, indent, styles));
            sb.append(System.lineSeparator());

            for (String edgeId : node.edgeOrder()) {
                WorkflowEdge edge = workflow.getEdges().get(edgeId);
                if (edge != null) {
                    queue.add(new NodeLevel(edge.target(), current.level() + 1));
                }
            }
        }

        boolean headerWritten = false;
        for (var entry : workflow.getNodes().entrySet()) {
            if (visited.contains(entry.getKey())) {
                continue;
            }
            if (!headerWritten) {
                sb.append(styles.warn("Unreachable:")).append(System.lineSeparator());
                headerWritten = true;
            }
            sb.append(renderNode(workflow, entry.getKey(), entry.getValue(), "", styles));
        }

        return sb.toString();
    }

    private String renderNode(
            Workflow workflow,
            String nodeId,
            WorkflowNode node,
            String indent,
            AnsiStyles styles) {
        StringBuilder sb = new StringBuilder();
        WorkflowNodeType type = node.nodeType();

        sb.append(
                String.format(
                        "%s%s %s %s%n",
                        indent,
                        styles.boxTop(),
                        colorByNodeType(nodeId, type, styles),
                        styles.gray("(" + type.wireName() + ")")));

        switch (type) {
            case OVERRIDE_AGENT -> {
                OverrideAgentNode agent = (OverrideAgentNode) node;
                line(sb, indent, styles, "Label: " + styles.bold(agent.label()));
                line(
                        sb,
                        indent,
                        styles,
                        "Prompt: "
                                + ConditionLabels.truncate(
                                        agent.additionalPrompt(), PROMPT_PREVIEW));
                if (!agent.additionalToolIds().isEmpty()) {
                    line(
                            sb,
                            indent,
                            styles,
                            "Tools: " + String.join(", ", agent.additionalToolIds()));
                }
            }
            case PHONE_NUMBER -> {
                PhoneNumberNode phone = (PhoneNumberNode) node;
                line(
                        sb,
                        indent,
                        styles,
                        "Transfer: "
                                + styles.bold(phone.phoneNumber())
                                + " ("
                                + phone.transferType().wireName()
                                + ")");
            }
            case STANDALONE_AGENT -> {
                StandaloneAgentNode handoff = (StandaloneAgentNode) node;
                line(sb, indent, styles, "Agent: " + styles.bold(handoff.agentId()));
                if (handoff.delayMs() > 0) {
                    line(sb, indent, styles, "Delay: " + handoff.delayMs() + " ms");
                }
            }
            case TOOL -> {
                ToolNode tool = (ToolNode) node;
                line(
                        sb,
                        indent,
                        styles,
                        "Tools: " + styles.accent(String.join(", ", tool.toolIds())));
            }
            case START, END -> {}
        }

        appendTransitions(sb, workflow, node, indent, styles);
        sb.append(String.format("%s%s%n", indent, styles.boxBottom()));
        return sb.toString();
    }

    private void appendTransitions(
            StringBuilder sb,
            Workflow workflow,
            WorkflowNode node,
            String indent,
            AnsiStyles styles) {
        if (node.edgeOrder().isEmpty()) {
            return;
        }
        line(sb, indent, styles, "Transitions:");
        for (String edgeId : node.edgeOrder()) {
            WorkflowEdge edge = workflow.getEdges().get(edgeId);
            if (edge == null) {
                continue;
            }
            String label = ConditionLabels.describe(edge.forwardCondition(), CONDITION_PREVIEW);
            sb.append(
                    String.format(
                            "%s%s    %s %s %s%n",
                            indent,
                            styles.boxMid(),
                            styles.arrow(),
                            styles.bold(edge.target()),
                            label == null
                                    ? styles.success("(always)")
                                    : styles.accent("(" + label + ")")));
        }
    }

    private void line(StringBuilder sb, String indent, AnsiStyles styles, String text) {
        sb.append(String.format("%s%s  %s%n", indent, styles.boxMid(), text));
    }

    private String colorByNodeType(String text, WorkflowNodeType type, AnsiStyles styles) {
        return switch (type) {
            case OVERRIDE_AGENT, TOOL -> styles.accent(text);
            case START, END -> styles.success(text);
            case PHONE_NUMBER, STANDALONE_AGENT -> styles.error(text);
        };
    }

    private record NodeLevel(String nodeId, int level) {}
}
