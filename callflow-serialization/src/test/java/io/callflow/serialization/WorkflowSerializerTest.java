package io.callflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.callflow.core.Position;
import io.callflow.core.compiler.CompileResult;
import io.callflow.core.compiler.FlowCompiler;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.condition.ExpressionCondition;
import io.callflow.core.workflow.condition.ForwardCondition;
import io.callflow.core.workflow.condition.ResultCondition;
import io.callflow.core.workflow.node.EndNode;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.core.workflow.node.PhoneNumberNode;
import io.callflow.core.workflow.node.StandaloneAgentNode;
import io.callflow.core.workflow.node.StartNode;
import io.callflow.core.workflow.node.ToolNode;
import io.callflow.core.workflow.node.TransferType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class WorkflowSerializerTest {

    private static final String EDITOR_JSON =
            """
            {
              "nodes": [
                {"id": "trigger", "type": "start", "position": {"x": 0, "y": 0}},
                {"id": "welcome", "type": "message", "position": {"x": 100, "y": 50},
                 "data": {"label": "Welcome", "config": {"message": "Hi there"}}},
                {"id": "ask", "type": "question",
                 "data": {"config": {"question": "Do you need help?"}}},
                {"id": "transfer", "type": "transfer",
                 "data": {"config": {"phoneNumber": "+15550100", "transferType": "blind"}}},
                {"id": "bye", "type": "end"}
              ],
              "edges": [
                {"id": "e0", "source": "trigger", "target": "welcome"},
                {"id": "e1", "source": "welcome", "target": "ask"},
                {"id": "e2", "source": "ask", "target": "transfer", "sourceHandle": "yes"},
                {"id": "e3", "source": "ask", "target": "bye", "sourceHandle": "no",
                 "data": {"condition": "Caller says they are done"}}
              ],
              "viewport": {"zoom": 1.5}
            }
            """;

    // -------------------------------------------------------------------------
    // Wire format
    // -------------------------------------------------------------------------

    @Nested
    class WireFormat {

        @Test
        void shouldWriteOverrideAgentNodeWithSnakeCaseFields() throws Exception {
            Workflow workflow =
                    Workflow.builder()
                            .node(Workflow.START_NODE_ID, StartNode.create())
                            .node(
                                    "welcome",
                                    OverrideAgentNode.builder()
                                            .position(new Position(10, 20))
                                            .edgeOrder(List.of("e1"))
                                            .label("Welcome")
                                            .additionalPrompt("Say hello")
                                            .build())
                            .build();

            JsonNode node =
                    WorkflowSerializer.createMapper()
                            .readTree(WorkflowSerializer.toJson(workflow))
                            .path("nodes")
                            .path("welcome");

            assertThat(node.path("type").asText()).isEqualTo("override_agent");
            assertThat(node.path("position").path("x").asDouble()).isEqualTo(10.0);
            assertThat(node.path("position").path("y").asDouble()).isEqualTo(20.0);
            assertThat(node.path("edge_order").get(0).asText()).isEqualTo("e1");
            assertThat(node.path("label").asText()).isEqualTo("Welcome");
            assertThat(node.path("override_prompt").asBoolean()).isTrue();
            assertThat(node.path("additional_prompt").asText()).isEqualTo("Say hello");
            assertThat(node.path("additional_tool_ids").isArray()).isTrue();
            assertThat(node.path("additional_knowledge_base").isArray()).isTrue();
            assertThat(node.path("additional_knowledge_base").size()).isZero();
            assertThat(node.path("conversation_config").isObject()).isTrue();
            assertThat(node.path("conversation_config").size()).isZero();
        }

        @Test
        void shouldWritePhoneTransferDestination() throws Exception {
            Workflow workflow =
                    Workflow.builder()
                            .node(
                                    "transfer",
                                    new PhoneNumberNode(
                                            null, List.of(), "+15550100", TransferType.BLIND))
                            .build();

            JsonNode node =
                    WorkflowSerializer.createMapper()
                            .readTree(WorkflowSerializer.toJson(workflow))
                            .path("nodes")
                            .path("transfer");

            assertThat(node.path("type").asText()).isEqualTo("phone_number");
            assertThat(node.path("transfer_destination").path("type").asText())
                    .isEqualTo("phone");
            assertThat(node.path("transfer_destination").path("phone_number").asText())
                    .isEqualTo("+15550100");
            assertThat(node.path("transfer_type").asText()).isEqualTo("blind");
        }

        @Test
        void shouldWriteToolAndAgentHandoffNodes() throws Exception {
            Workflow workflow =
                    Workflow.builder()
                            .node("hook", ToolNode.invoking(null, "webhook_hook"))
                            .node(
                                    "handoff",
                                    new StandaloneAgentNode(null, List.of(), "agent-7", 250, true))
                            .build();

            JsonNode nodes =
                    WorkflowSerializer.createMapper()
                            .readTree(WorkflowSerializer.toJson(workflow))
                            .path("nodes");

            assertThat(nodes.path("hook").path("tools").get(0).path("tool_id").asText())
                    .isEqualTo("webhook_hook");
            JsonNode handoff = nodes.path("handoff");
            assertThat(handoff.path("type").asText()).isEqualTo("standalone_agent");
            assertThat(handoff.path("agent_id").asText()).isEqualTo("agent-7");
            assertThat(handoff.path("delay_ms").asLong()).isEqualTo(250L);
            assertThat(handoff.path("enable_transferred_agent_first_message").asBoolean())
                    .isTrue();
        }

        @Test
        void shouldWriteEdgesWithForwardCondition() throws Exception {
            Workflow workflow =
                    Workflow.builder()
                            .edge("e1", new WorkflowEdge("a", "b", ForwardCondition.llm("yes")))
                            .edge("e2", WorkflowEdge.unconditional("b", "c"))
                            .build();

            JsonNode edges =
                    WorkflowSerializer.createMapper()
                            .readTree(WorkflowSerializer.toJson(workflow))
                            .path("edges");

            JsonNode first = edges.path("e1");
            assertThat(first.path("source").asText()).isEqualTo("a");
            assertThat(first.path("target").asText()).isEqualTo("b");
            assertThat(first.path("forward_condition").path("type").asText()).isEqualTo("llm");
            assertThat(first.path("forward_condition").path("condition").asText())
                    .isEqualTo("yes");
            assertThat(edges.path("e2").path("forward_condition").path("type").asText())
                    .isEqualTo("unconditional");
        }

        @Test
        void shouldKeepNodeAndEdgeInsertionOrder() throws Exception {
            CompileResult result =
                    new FlowCompiler().compile(WorkflowSerializer.readFlowGraph(EDITOR_JSON));

            JsonNode root =
                    WorkflowSerializer.createMapper()
                            .readTree(WorkflowSerializer.toJson(result.workflow()));

            List<String> nodeIds = fieldNames(root.path("nodes"));
            assertThat(nodeIds)
                    .containsExactly(Workflow.START_NODE_ID, "welcome", "ask", "transfer", "bye");
            List<String> edgeIds = fieldNames(root.path("edges"));
            assertThat(edgeIds.get(edgeIds.size() - 1)).isEqualTo("start_to_entry");
        }
    }

    // -------------------------------------------------------------------------
    // Round trip
    // -------------------------------------------------------------------------

    @Nested
    class RoundTrip {

        @Test
        void shouldRestoreCompiledWorkflow() {
            Workflow original =
                    new FlowCompiler()
                            .compile(WorkflowSerializer.readFlowGraph(EDITOR_JSON))
                            .workflow();

            Workflow restored = WorkflowSerializer.fromJson(WorkflowSerializer.toJson(original));

            assertThat(restored).isEqualTo(original);
            assertThat(restored.getNodes().keySet())
                    .containsExactlyElementsOf(original.getNodes().keySet());
        }

        @Test
        void shouldRestorePassThroughConditions() {
            Workflow original =
                    Workflow.builder()
                            .node(Workflow.START_NODE_ID, StartNode.create())
                            .node("end", EndNode.at(new Position(5, 5)))
                            .edge(
                                    "ok",
                                    new WorkflowEdge("start_node", "end", new ResultCondition(true)))
                            .edge(
                                    "expr",
                                    new WorkflowEdge(
                                            "start_node",
                                            "end",
                                            new ExpressionCondition(Map.of("op", "eq"))))
                            .build();

            Workflow restored = WorkflowSerializer.fromJson(WorkflowSerializer.toJson(original));

            assertThat(restored.getEdges().get("ok").forwardCondition())
                    .isEqualTo(new ResultCondition(true));
            assertThat(restored.getEdges().get("expr").forwardCondition())
                    .isEqualTo(new ExpressionCondition(Map.of("op", "eq")));
        }

        @Test
        void shouldReadMissingForwardConditionAsUnconditional() {
            Workflow restored =
                    WorkflowSerializer.fromJson(
                            """
                            {"nodes": {}, "edges": {"e": {"source": "a", "target": "b"}}}
                            """);

            assertThat(restored.getEdges().get("e"))
                    .isEqualTo(WorkflowEdge.unconditional("a", "b"));
        }

        @Test
        void shouldRejectUnknownNodeType() {
            assertThatThrownBy(
                            () ->
                                    WorkflowSerializer.fromJson(
                                            """
                                            {"nodes": {"x": {"type": "teleport"}}, "edges": {}}
                                            """))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("teleport");
        }

        @Test
        void shouldDefaultAgentHandoffFieldsLikeTheCompiler() {
            Workflow workflow =
                    WorkflowSerializer.fromJson(
                            """
                            {"nodes": {"handoff": {"type": "standalone_agent", "agent_id": "a-7"}},
                             "edges": {}}
                            """);

            StandaloneAgentNode handoff = (StandaloneAgentNode) workflow.getNodes().get("handoff");
            assertThat(handoff.agentId()).isEqualTo("a-7");
            assertThat(handoff.delayMs()).isZero();
            assertThat(handoff.enableTransferredAgentFirstMessage()).isTrue();
        }

        @Test
        void shouldRejectUnknownConditionType() {
            assertThatThrownBy(
                            () ->
                                    WorkflowSerializer.fromJson(
                                            """
                                            {"nodes": {}, "edges": {"e": {"source": "a",
                                             "target": "b", "forward_condition": {"type": "vibe"}}}}
                                            """))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("vibe");
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> WorkflowSerializer.fromJson("{not json"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize workflow");
        }
    }

    // -------------------------------------------------------------------------
    // Editor documents
    // -------------------------------------------------------------------------

    @Nested
    class EditorDocuments {

        @Test
        void shouldReadFlowGraph() {
            FlowGraph graph = WorkflowSerializer.readFlowGraph(EDITOR_JSON);

            assertThat(graph.nodes()).hasSize(5);
            assertThat(graph.nodes().get(1).position()).isEqualTo(new Position(100, 50));
            assertThat(graph.nodes().get(1).label()).isEqualTo("Welcome");
            assertThat(graph.nodes().get(1).config().text("message")).isEqualTo("Hi there");
            assertThat(graph.edges()).hasSize(4);
            assertThat(graph.edges().get(2).sourceHandle()).isEqualTo("yes");
            assertThat(graph.edges().get(3).condition()).isEqualTo("Caller says they are done");
        }

        @Test
        void shouldRejectEdgeWithoutTarget() {
            assertThatThrownBy(
                            () ->
                                    WorkflowSerializer.readFlowGraph(
                                            """
                                            {"nodes": [], "edges": [{"id": "e", "source": "a"}]}
                                            """))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldReadFormDefinition() {
            var form =
                    WorkflowSerializer.readFormDefinition(
                            """
                            {"id": "intake", "name": "Intake", "fields": [
                              {"id": "email", "question": "Your email?", "fieldType": "email",
                               "isRequired": true, "order": 1},
                              {"question": "Anything else?"}
                            ]}
                            """);

            assertThat(form.name()).isEqualTo("Intake");
            assertThat(form.fields()).hasSize(2);
            assertThat(form.fields().get(0).required()).isTrue();
            assertThat(form.fields().get(0).fieldType()).isEqualTo("email");
            assertThat(form.fields().get(1).id()).isEqualTo("field_1");
            assertThat(form.fields().get(1).fieldType()).isEqualTo("text");
        }
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
