package io.callflow.core.compiler;

import static io.callflow.core.TestFlows.condition;
import static io.callflow.core.TestFlows.edge;
import static io.callflow.core.TestFlows.graph;
import static io.callflow.core.TestFlows.message;
import static io.callflow.core.TestFlows.node;
import static org.assertj.core.api.Assertions.assertThat;

import io.callflow.core.flow.FlowNode;
import java.util.List;
import org.junit.jupiter.api.Test;

public class EntryResolverTest {

    private final EntryResolver resolver = new EntryResolver();

    @Test
    void followsFirstEdgeOutOfTrigger() {
        var flow =
                graph(
                        List.of(message("orphan", "Hi"), node("s", "trigger"), message("first", "Hello")),
                        edge("s", "first"),
                        edge("s", "orphan"));

        assertThat(resolver.resolve(flow)).map(FlowNode::id).contains("first");
    }

    @Test
    void triggerIntoConditionFallsBackToNodeWithoutIncomingEdges() {
        var flow =
                graph(
                        List.of(node("s", "start"), condition("c"), message("a", "A"), message("b", "B")),
                        edge("s", "c"),
                        edge("c", "a"),
                        edge("a", "b"));

        // every real node has an incoming edge, so the first actionable node wins
        assertThat(resolver.resolve(flow)).map(FlowNode::id).contains("a");
    }

    @Test
    void picksFirstNodeWithoutIncomingEdges() {
        var flow =
                graph(
                        List.of(message("b", "B"), message("a", "A"), condition("c")),
                        edge("a", "b"));

        assertThat(resolver.resolve(flow)).map(FlowNode::id).contains("a");
    }

    @Test
    void triggerWithMissingTargetIsIgnored() {
        var flow = graph(List.of(node("s", "start"), message("m", "Hi")), edge("s", "ghost"));

        assertThat(resolver.resolve(flow)).map(FlowNode::id).contains("m");
    }

    @Test
    void emptyWhenOnlyStructuralNodes() {
        assertThat(resolver.resolve(graph(List.of(node("s", "start"), condition("c"))))).isEmpty();
    }
}
