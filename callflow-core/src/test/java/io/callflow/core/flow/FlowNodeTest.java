package io.callflow.core.flow;

import static org.assertj.core.api.Assertions.assertThat;

import io.callflow.core.Position;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class FlowNodeTest {

    @Test
    void categoryComesFromConfigTypeFirst() {
        FlowNode node = FlowNode.of("n", "default", Map.of("type", "question"));

        assertThat(node.rawCategory()).isEqualTo("question");
        assertThat(node.category()).isEqualTo(NodeCategory.QUESTION);
    }

    @Test
    void categoryFallsBackToNodeTypeThenUnknown() {
        assertThat(FlowNode.of("n", "end", null).category()).isEqualTo(NodeCategory.END);
        assertThat(new FlowNode("n", null, null, null).rawCategory()).isEqualTo("unknown");
    }

    @Test
    void missingPositionAndDataDefault() {
        FlowNode node = new FlowNode("n", "message", null, null);

        assertThat(node.position()).isEqualTo(Position.origin());
        assertThat(node.config().asMap()).isEmpty();
        assertThat(node.label()).isNull();
    }

    @Test
    void configLookupsSkipEmptyAndWrongTypes() {
        NodeConfig config =
                NodeConfig.of(
                        Map.of(
                                "phoneNumber", "",
                                "transferNumber", 5550100L,
                                "waitForResponse", "true",
                                "delay_ms", "250",
                                "fields", List.of("a")));

        assertThat(config.text("phoneNumber", "transferNumber")).isEqualTo("5550100");
        assertThat(config.flag("waitForResponse")).isNull();
        assertThat(config.numberOr(0, "delay_ms")).isEqualTo(250);
        assertThat(config.numberOr(30, "duration")).isEqualTo(30);
        assertThat(config.list("fields")).hasSize(1);
        assertThat(config.map("fields")).isNull();
    }

    @Test
    void whitespaceOnlyTextIsPresentButNotANumber() {
        NodeConfig config = NodeConfig.of(Map.of("message", " ", "duration", "  ", "delay_ms", " 45 "));

        assertThat(config.text("message", "text")).isEqualTo(" ");
        assertThat(config.textOr("fallback", "message")).isEqualTo(" ");
        assertThat(config.numberOr(30, "duration")).isEqualTo(30);
        assertThat(config.numberOr(0, "delay_ms")).isEqualTo(45);
    }

    @Test
    void duplicateNodeIdsKeepFirstDeclaration() {
        FlowNode first = FlowNode.of("dup", "message", Map.of("message", "one"));
        FlowNode second = FlowNode.of("dup", "message", Map.of("message", "two"));

        assertThat(FlowGraph.of(List.of(first, second), null).indexNodes().get("dup"))
                .isSameAs(first);
    }
}
