package io.callflow.core.compiler;

import io.callflow.core.flow.FlowGraph;
import io.callflow.core.flow.FlowNode;
import io.callflow.core.workflow.node.WorkflowNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Per-call state of one compilation: input index, compiled nodes, facts and the
/// edge-id counter.
///
/// A fresh context is created for every {@link FlowCompiler#compile} call, so edge ids
/// restart at 1 and nothing leaks between compiles on a shared compiler.
final class CompilationContext {

    private static final int ID_PREFIX_LENGTH = 8;

    private final FlowGraph graph;
    private final Map<String, FlowNode> nodeIndex;
    private final Map<String, WorkflowNode> compiledNodes = new LinkedHashMap<>();
    private final CompileFacts facts = new CompileFacts();
    private int edgeCounter;

    CompilationContext(FlowGraph graph) {
        this.graph = graph;
        this.nodeIndex = graph.indexNodes();
    }

    FlowGraph graph() {
        return graph;
    }

    FlowNode node(String id) {
        return nodeIndex.get(id);
    }

    /// Id index built once per compile and shared by the resolvers.
    Map<String, FlowNode> nodeIndex() {
        return Collections.unmodifiableMap(nodeIndex);
    }

    CompileFacts facts() {
        return facts;
    }

    void addCompiledNode(String id, WorkflowNode node) {
        compiledNodes.put(id, node);
    }

    boolean isCompiled(String id) {
        return compiledNodes.containsKey(id);
    }

    Map<String, WorkflowNode> compiledNodes() {
        return Collections.unmodifiableMap(compiledNodes);
    }

    /// Returns `edge_<n>_<first 8 of source>_to_<first 8 of target>`.
    String nextEdgeId(String source, String target) {
        edgeCounter++;
        return "edge_" + edgeCounter + "_" + prefix(source) + "_to_" + prefix(target);
    }

    private static String prefix(String id) {
        return id.length() <= ID_PREFIX_LENGTH ? id : id.substring(0, ID_PREFIX_LENGTH);
    }
}
