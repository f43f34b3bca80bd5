package io.callflow.core.compiler;

import static io.callflow.core.TestFlows.condition;
import static io.callflow.core.TestFlows.config;
import static io.callflow.core.TestFlows.edge;
import static io.callflow.core.TestFlows.graph;
import static io.callflow.core.TestFlows.message;
import static io.callflow.core.TestFlows.node;
import static io.callflow.core.TestFlows.question;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.callflow.core.flow.FlowEdge;
import io.callflow.core.flow.FlowNode;
import io.callflow.core.workflow.condition.ForwardCondition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class EdgeResolverTest {

    private final EdgeResolver resolver = new EdgeResolver();

    // -------------------------------------------------------------------------
    // Plain edge priority
    // -------------------------------------------------------------------------

    @Nested
    class Priority {

        @ParameterizedTest
        @CsvSource({
            "yes, YES_ACCEPTANCE",
            "Agree, YES_ACCEPTANCE",
            "NO, NO_REJECTION",
            "decline, NO_REJECTION",
            "human, TRANSFER_INTENT",
            "clarify, CONFUSION",
            "timeout, SILENCE"
        })
        void semanticHandleSelectsIntent(String handle, String expected) {
            FlowNode source = message("m", "Hi");
            String text =
                    switch (expected) {
                        case "YES_ACCEPTANCE" -> LlmConditions.YES_ACCEPTANCE;
                        case "NO_REJECTION" -> LlmConditions.NO_REJECTION;
                        case "TRANSFER_INTENT" -> LlmConditions.TRANSFER_INTENT;
                        case "CONFUSION" -> LlmConditions.CONFUSION;
                        default -> LlmConditions.SILENCE;
                    };

            assertThat(resolver.conditionFor(source, edge("m", "t", handle)))
                    .isEqualTo(ForwardCondition.llm(text));
        }

        @Test
        void unknownHandleFallsThroughToWaitSetting() {
            assertThat(resolver.conditionFor(message("m", "Hi"), edge("m", "t", "output-1")))
                    .isEqualTo(ForwardCondition.unconditional());
        }

        @Test
        void explicitWaitOverridesCategoryDefault() {
            FlowNode waiting =
                    node("m", "message", config("message", "Any questions?", "waitForResponse", true));
            FlowNode proceeding =
                    node("q", "question", config("question", "Ready?", "waitForResponse", false));

            assertThat(resolver.conditionFor(waiting, edge("m", "t")))
                    .isEqualTo(
                            ForwardCondition.llm(
                                    "The agent said: \"Any questions?...\" and is waiting for the"
                                            + " user to respond before proceeding. Wait for the"
                                            + " user to speak."));
            assertThat(resolver.conditionFor(proceeding, edge("q", "t")))
                    .isEqualTo(ForwardCondition.unconditional());
        }

        @Test
        void nonBooleanWaitSettingIsIgnored() {
            FlowNode source = node("m", "message", config("message", "Hi", "waitForResponse", "yes"));

            assertThat(resolver.conditionFor(source, edge("m", "t")))
                    .isEqualTo(ForwardCondition.unconditional());
        }

        @Test
        void missingSourceIsUnconditional() {
            assertThat(resolver.conditionFor(null, edge("ghost", "t")))
                    .isEqualTo(ForwardCondition.unconditional());
        }
    }

    // -------------------------------------------------------------------------
    // Wait conditions per category
    // -------------------------------------------------------------------------

    @Nested
    class WaitConditions {

        @Test
        void questionQuoteIsTruncatedToHundredCharacters() {
            String longQuestion = "a".repeat(150) + "?";
            String condition =
                    EdgeResolver.waitCondition(
                            question("q", longQuestion).category(),
                            question("q", longQuestion).config());

            assertThat(condition).contains("\"" + "a".repeat(100) + "\" and the user");
        }

        @Test
        void questionWithoutTextUsesGenericAnswerRule() {
            FlowNode bare = node("q", "question");

            assertThat(EdgeResolver.waitCondition(bare.category(), bare.config()))
                    .isEqualTo(LlmConditions.QUESTION_ANSWERED);
        }

        @Test
        void formAndAppointmentWaitForCompletionPhrases() {
            FlowNode form = node("f", "collect_info");
            FlowNode appointment = node("a", "appointment");

            assertThat(EdgeResolver.waitCondition(form.category(), form.config()))
                    .isEqualTo(LlmConditions.FORM_COMPLETE);
            assertThat(EdgeResolver.waitCondition(appointment.category(), appointment.config()))
                    .isEqualTo(LlmConditions.APPOINTMENT_COMPLETE);
        }

        @Test
        void otherCategoriesWaitForAnyResponse() {
            FlowNode delay = node("d", "pause", Map.of("waitForResponse", true));

            assertThat(resolver.conditionFor(delay, edge("d", "t")))
                    .isEqualTo(ForwardCondition.llm(LlmConditions.GENERIC_RESPONSE));
        }
    }

    // -------------------------------------------------------------------------
    // Graph-level resolution and condition expansion
    // -------------------------------------------------------------------------

    @Nested
    class Expansion {

        @Test
        void dropsEdgesLeavingTriggers() {
            var edges =
                    resolver.resolve(
                            graph(List.of(node("s", "trigger"), message("m", "Hi")), edge("s", "m")));

            assertThat(edges).isEmpty();
        }

        @Test
        void everyEnteringEdgeIsPairedWithEveryLeavingEdge() {
            var edges =
                    resolver.resolve(
                            graph(
                                    List.of(
                                            question("x", "A?"),
                                            question("y", "B?"),
                                            condition("c"),
                                            message("a", "1"),
                                            message("b", "2")),
                                    edge("x", "c"),
                                    edge("y", "c"),
                                    edge("c", "a", "yes"),
                                    edge("c", "b", "else")));

            assertThat(edges)
                    .extracting(ResolvedEdge::source, ResolvedEdge::target)
                    .containsExactly(
                            tuple("x", "a"),
                            tuple("y", "a"),
                            tuple("x", "b"),
                            tuple("y", "b"));
            assertThat(edges.get(2).condition()).isEqualTo(ForwardCondition.llm("Other cases"));
        }

        @Test
        void enteringFromTriggerIsNotARealPath() {
            var edges =
                    resolver.resolve(
                            graph(
                                    List.of(node("s", "start"), condition("c"), message("a", "1")),
                                    edge("s", "c"),
                                    edge("c", "a", "yes")));

            assertThat(edges).isEmpty();
        }

        @Test
        void chainWithoutNamedHopsIsUnconditional() {
            FlowEdge plainOut = FlowEdge.of("out", "c2", "a");
            var edges =
                    resolver.resolve(
                            graph(
                                    List.of(
                                            message("x", "Hi"),
                                            condition("c1"),
                                            condition("c2"),
                                            message("a", "1")),
                                    edge("x", "c1"),
                                    FlowEdge.of("mid", "c1", "c2"),
                                    plainOut));

            assertThat(edges).hasSize(1);
            assertThat(edges.get(0).condition()).isEqualTo(ForwardCondition.unconditional());
            assertThat(edges.get(0).originEdgeId()).isEqualTo("out");
        }

        @Test
        void cyclesBetweenConditionNodesTerminate() {
            var edges =
                    resolver.resolve(
                            graph(
                                    List.of(
                                            message("x", "Hi"),
                                            condition("c1"),
                                            condition("c2"),
                                            message("a", "1")),
                                    edge("x", "c1"),
                                    FlowEdge.of("c1c2", "c1", "c2"),
                                    FlowEdge.of("c2c1", "c2", "c1"),
                                    edge("c2", "a", "done")));

            assertThat(edges).hasSize(1);
            assertThat(edges.get(0).source()).isEqualTo("x");
            assertThat(edges.get(0).condition())
                    .isEqualTo(ForwardCondition.llm("User mentioned \"done\""));
        }
    }
}
