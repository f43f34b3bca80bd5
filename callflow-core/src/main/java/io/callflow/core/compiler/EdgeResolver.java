package io.callflow.core.compiler;

import io.callflow.core.flow.FlowEdge;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.flow.FlowNode;
import io.callflow.core.flow.NodeCategory;
import io.callflow.core.flow.NodeConfig;
import io.callflow.core.workflow.condition.ForwardCondition;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Turns authoring edges into edges between real nodes with forward conditions.
///
/// Edges leaving a trigger are dropped; the assembler adds its own start edge. Edges into
/// a condition node produce nothing on their own. Each edge leaving a condition node is
/// expanded into one edge per real entering path of that node, walking back through
/// chains of condition nodes.
///
/// ### Condition priority for a plain edge
/// 1. an explicit condition authored on the edge
/// 2. a recognized handle ({@link HandleIntent})
/// 3. the source's wait-for-response setting: explicit `waitForResponse`, else the
///    category default
/// 4. no wait: unconditional
/// 5. wait: a category-specific rule
///
/// ### Condition for an expanded edge
/// The {@link BranchConditionResolver} rule of every hop along the path, joined with
/// ` AND ` in path order. A path whose hops carry no named rule is unconditional.
public final class EdgeResolver {

    private static final Logger logger = Logger.getLogger(EdgeResolver.class.getName());

    static final String CHAIN_SEPARATOR = " AND ";

    private final BranchConditionResolver branchResolver;

    public EdgeResolver() {
        this(new BranchConditionResolver());
    }

    /// @param branchResolver rule lookup for edges leaving condition nodes, not null
    public EdgeResolver(BranchConditionResolver branchResolver) {
        this.branchResolver = Objects.requireNonNull(branchResolver, "branchResolver");
    }

    /// Resolves all edges of the graph, in authoring edge order.
    ///
    /// Endpoints are not checked against the compiled node set here; dangling edges are
    /// dropped by the assembler.
    ///
    /// @param graph authoring graph, not null
    /// @return resolved edges, never null
    public List<ResolvedEdge> resolve(FlowGraph graph) {
        return resolve(graph, graph.indexNodes());
    }

    List<ResolvedEdge> resolve(FlowGraph graph, Map<String, FlowNode> index) {
        List<ResolvedEdge> resolved = new ArrayList<>();

        for (FlowEdge edge : graph.edges()) {
            FlowNode source = index.get(edge.source());
            NodeCategory sourceCategory = source != null ? source.category() : NodeCategory.UNKNOWN;
            if (sourceCategory == NodeCategory.START) {
                continue;
            }
            if (isCondition(index.get(edge.target()))) {
                continue;
            }
            if (sourceCategory == NodeCategory.CONDITION) {
                resolved.addAll(expand(source, edge, graph, index));
            } else {
                resolved.add(
                        new ResolvedEdge(
                                edge.source(),
                                edge.target(),
                                conditionFor(source, edge),
                                edge.id()));
            }
        }
        return resolved;
    }

    /// Synthesizes the condition of a plain edge.
    ///
    /// @param source source node, null when the edge's source does not exist
    /// @param edge the edge, not null
    /// @return forward condition, never null
    public ForwardCondition conditionFor(FlowNode source, FlowEdge edge) {
        if (edge.hasExplicitCondition()) {
            return ForwardCondition.llm(edge.condition());
        }

        Optional<HandleIntent> intent = HandleIntent.of(edge.sourceHandle());
        if (intent.isPresent()) {
            return ForwardCondition.llm(intent.get().condition());
        }

        NodeCategory category = source != null ? source.category() : NodeCategory.UNKNOWN;
        NodeConfig config = source != null ? source.config() : NodeConfig.empty();
        Boolean explicitWait = config.flag("waitForResponse");
        boolean waitForResponse =
                explicitWait != null ? explicitWait : category.waitsForResponseByDefault();
        if (!waitForResponse) {
            return ForwardCondition.unconditional();
        }
        return ForwardCondition.llm(waitCondition(category, config));
    }

    static String waitCondition(NodeCategory category, NodeConfig config) {
        switch (category) {
            case QUESTION -> {
                String question = config.text("message", "question", "text");
                return question != null
                        ? LlmConditions.answeredQuestion(question)
                        : LlmConditions.QUESTION_ANSWERED;
            }
            case FORM -> {
                return LlmConditions.FORM_COMPLETE;
            }
            case APPOINTMENT -> {
                return LlmConditions.APPOINTMENT_COMPLETE;
            }
            case MESSAGE, GREETING -> {
                String message = config.text("message", "text");
                return message != null
                        ? LlmConditions.repliedToMessage(message)
                        : LlmConditions.GENERIC_RESPONSE;
            }
            default -> {
                return LlmConditions.GENERIC_RESPONSE;
            }
        }
    }

    private List<ResolvedEdge> expand(
            FlowNode conditionNode, FlowEdge leaving, FlowGraph graph, Map<String, FlowNode> index) {
        Set<String> visiting = new HashSet<>();
        visiting.add(conditionNode.id());
        List<EnteringPath> paths = enteringPaths(conditionNode.id(), graph, index, visiting);
        if (paths.isEmpty()) {
            logger.fine(
                    "Condition node "
                            + conditionNode.id()
                            + " has no real incoming path, edge "
                            + leaving.id()
                            + " produces nothing");
            return List.of();
        }

        List<ResolvedEdge> result = new ArrayList<>(paths.size());
        for (EnteringPath path : paths) {
            List<String> texts = new ArrayList<>();
            for (Hop hop : path.then(new Hop(conditionNode, leaving)).hops()) {
                if (branchResolver.resolve(hop.conditionNode(), hop.leaving())
                        instanceof BranchCondition.Named named) {
                    texts.add(named.text());
                }
            }
            ForwardCondition condition =
                    texts.isEmpty()
                            ? ForwardCondition.unconditional()
                            : ForwardCondition.llm(String.join(CHAIN_SEPARATOR, texts));
            result.add(new ResolvedEdge(path.source(), leaving.target(), condition, leaving.id()));
        }
        return result;
    }

    // Paths from real nodes into the condition node, each with the condition hops taken
    // before reaching it. Cycles among condition nodes are cut by the visiting set.
    private List<EnteringPath> enteringPaths(
            String conditionId, FlowGraph graph, Map<String, FlowNode> index, Set<String> visiting) {
        List<EnteringPath> paths = new ArrayList<>();
        for (FlowEdge entering : graph.edges()) {
            if (!entering.target().equals(conditionId)) {
                continue;
            }
            FlowNode source = index.get(entering.source());
            if (source == null || source.category() == NodeCategory.START) {
                continue;
            }
            if (source.category() == NodeCategory.CONDITION) {
                if (!visiting.add(source.id())) {
                    continue;
                }
                for (EnteringPath upstream : enteringPaths(source.id(), graph, index, visiting)) {
                    paths.add(upstream.then(new Hop(source, entering)));
                }
                visiting.remove(source.id());
            } else {
                paths.add(new EnteringPath(source.id(), List.of()));
            }
        }
        return paths;
    }

    private static boolean isCondition(FlowNode node) {
        return node != null && node.category() == NodeCategory.CONDITION;
    }

    private record Hop(FlowNode conditionNode, FlowEdge leaving) {}

    private record EnteringPath(String source, List<Hop> hops) {
        EnteringPath then(Hop hop) {
            List<Hop> extended = new ArrayList<>(hops);
            extended.add(hop);
            return new EnteringPath(source, extended);
        }
    }
}
