package io.callflow.core.compiler;

import io.callflow.core.flow.FlowEdge;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.flow.FlowNode;
import io.callflow.core.flow.NodeCategory;
import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.node.WorkflowNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Compiles an authoring flow graph into a voice-agent workflow.
///
/// A single synchronous pass with no I/O:
/// 1. resolve the entry node ({@link EntryResolver})
/// 2. compile every node in declaration order ({@link NodeCompiler})
/// 3. resolve every edge, expanding condition nodes ({@link EdgeResolver})
/// 4. inject the start node, assign edge ids and edge orders ({@link WorkflowAssembler})
///
/// The compiler does not validate its output. Callers must run
/// {@link io.callflow.core.validation.WorkflowValidator} before trusting a workflow for
/// deployment.
///
/// ### Contracts
/// - **Stateless**: each call builds a fresh {@link CompilationContext}; the edge-id counter
///   restarts at 1 and concurrent compiles never interfere
/// - **Deterministic**: the same node and edge order yields the same workflow, edge ids
///   included
/// - **Lenient**: malformed content degrades to warnings; only a missing or empty graph
///   (or a dangling edge in strict mode) throws {@link FlowCompilationException}
///
/// @implNote Thread-safe.
public final class FlowCompiler {

    private static final Logger logger = Logger.getLogger(FlowCompiler.class.getName());

    private final EntryResolver entryResolver;
    private final NodeCompiler nodeCompiler;
    private final EdgeResolver edgeResolver;
    private final WorkflowAssembler assembler;

    /// Creates a lenient compiler.
    public FlowCompiler() {
        this(CompilerOptions.defaults());
    }

    /// Creates a compiler with the given options.
    ///
    /// @param options compiler switches, not null
    public FlowCompiler(CompilerOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        this.entryResolver = new EntryResolver();
        this.nodeCompiler = new NodeCompiler();
        this.edgeResolver = new EdgeResolver(new BranchConditionResolver());
        this.assembler = new WorkflowAssembler(options);
    }

    /// Compiles a flow graph.
    ///
    /// @param graph authoring graph, not null and not empty
    /// @return compiled workflow with its compile facts, never null
    /// @throws FlowCompilationException if the graph is null or has no nodes, or in strict
    ///     mode if an edge references a node missing from the compiled workflow
    public CompileResult compile(FlowGraph graph) {
        if (graph == null) {
            throw new FlowCompilationException("Flow graph must not be null");
        }
        if (graph.isEmpty()) {
            throw new FlowCompilationException("Flow graph has no nodes");
        }
        FlowGraph input = withoutReservedIds(graph);
        logger.info(
                "Compiling flow: "
                        + input.nodes().size()
                        + " nodes, "
                        + input.edges().size()
                        + " edges");

        CompilationContext context = new CompilationContext(input);

        Optional<FlowNode> entry = entryResolver.resolve(input, context.nodeIndex());
        entry.ifPresent(node -> recordFirstMessage(node, context.facts()));

        Set<String> seen = new HashSet<>();
        for (FlowNode node : input.nodes()) {
            if (!seen.add(node.id())) {
                continue;
            }
            Optional<WorkflowNode> compiled = nodeCompiler.compile(node, context.facts());
            compiled.ifPresent(n -> context.addCompiledNode(node.id(), n));
        }

        List<ResolvedEdge> edges = edgeResolver.resolve(input, context.nodeIndex());
        Workflow workflow =
                assembler.assemble(context, edges, entry.map(FlowNode::id).orElse(null));

        CompileResult result = context.facts().toResult(workflow);
        logger.info(
                "Compiled workflow: "
                        + workflow.getNodes().size()
                        + " nodes, "
                        + workflow.getEdges().size()
                        + " edges, tools: "
                        + (result.toolIds().isEmpty()
                                ? "none"
                                : String.join(", ", result.toolIds())));
        return result;
    }

    private static void recordFirstMessage(FlowNode entry, CompileFacts facts) {
        if (entry.category() != NodeCategory.MESSAGE) {
            return;
        }
        String message = entry.config().text("message");
        if (message != null) {
            facts.firstMessage(message);
            logger.fine("Entry node " + entry.id() + " speaks the first message");
        }
    }

    // The injected start node owns its id: an authored node with that id is dropped
    // together with its edges.
    private static FlowGraph withoutReservedIds(FlowGraph graph) {
        if (graph.findNode(Workflow.START_NODE_ID).isEmpty()) {
            return graph;
        }
        logger.warning("Dropping authored node with reserved id " + Workflow.START_NODE_ID);
        List<FlowNode> nodes = new ArrayList<>(graph.nodes());
        nodes.removeIf(n -> Workflow.START_NODE_ID.equals(n.id()));
        List<FlowEdge> edges = new ArrayList<>(graph.edges());
        edges.removeIf(
                e ->
                        Workflow.START_NODE_ID.equals(e.source())
                                || Workflow.START_NODE_ID.equals(e.target()));
        return FlowGraph.of(nodes, edges);
    }
}
