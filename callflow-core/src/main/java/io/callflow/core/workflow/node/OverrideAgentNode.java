package io.callflow.core.workflow.node;

import io.callflow.core.Position;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Scripted conversational step: temporarily locks the agent to a fixed instruction.
///
/// The target platform only allows behavior customization at these checkpoints, so
/// every conversational action (speaking, asking, collecting data, booking) compiles to
/// this node kind with different prompt content. `overridePrompt` is always `true` for
/// compiled nodes: the node script replaces the agent's free-form behavior rather than
/// being appended to it.
///
/// The platform ignores a per-node first message, so the words to speak are embedded in
/// `additionalPrompt` as an instruction. `conversationConfig` must stay empty.
///
/// @param position canvas position, not null
/// @param edgeOrder ordered outgoing edge ids, not null
/// @param label display label, not null
/// @param overridePrompt whether the prompt replaces the agent's own behavior
/// @param additionalPrompt locked instruction text, not null
/// @param additionalToolIds ids of tools the step may call, not null
/// @param additionalKnowledgeBase knowledge base attachments, not null (empty when compiled)
/// @param conversationConfig inline config overrides, not null (empty when compiled)
public record OverrideAgentNode(
        Position position,
        List<String> edgeOrder,
        String label,
        boolean overridePrompt,
        String additionalPrompt,
        List<String> additionalToolIds,
        List<Object> additionalKnowledgeBase,
        Map<String, Object> conversationConfig)
        implements WorkflowNode {

    /// Compact constructor with validation and defensive copies.
    public OverrideAgentNode {
        position = position != null ? position : Position.origin();
        edgeOrder = edgeOrder != null ? List.copyOf(edgeOrder) : List.of();
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(additionalPrompt, "additionalPrompt must not be null");
        additionalToolIds = additionalToolIds != null ? List.copyOf(additionalToolIds) : List.of();
        additionalKnowledgeBase =
                additionalKnowledgeBase != null
                        ? Collections.unmodifiableList(new ArrayList<>(additionalKnowledgeBase))
                        : List.of();
        conversationConfig =
                conversationConfig != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(conversationConfig))
                        : Map.of();
    }

    /// Creates a new builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public WorkflowNodeType nodeType() {
        return WorkflowNodeType.OVERRIDE_AGENT;
    }

    @Override
    public OverrideAgentNode withEdgeOrder(List<String> edgeOrder) {
        return new OverrideAgentNode(
                position,
                edgeOrder,
                label,
                overridePrompt,
                additionalPrompt,
                additionalToolIds,
                additionalKnowledgeBase,
                conversationConfig);
    }

    /// Builder for scripted steps.
    ///
    /// Required fields: `label`, `additionalPrompt`. `overridePrompt` defaults to `true`.
    public static final class Builder {
        private Position position = Position.origin();
        private List<String> edgeOrder = List.of();
        private String label;
        private boolean overridePrompt = true;
        private String additionalPrompt;
        private List<String> additionalToolIds = List.of();
        private List<Object> additionalKnowledgeBase = List.of();
        private Map<String, Object> conversationConfig = Map.of();

        private Builder() {}

        /// Sets the canvas position.
        ///
        /// @param position canvas position, may be null for the origin
        /// @return this builder for chaining
        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        /// Sets the outgoing edge order.
        ///
        /// @param edgeOrder ordered edge ids, not null
        /// @return this builder for chaining
        public Builder edgeOrder(List<String> edgeOrder) {
            this.edgeOrder = edgeOrder;
            return this;
        }

        /// Sets the display label (required).
        ///
        /// @param label display label, not null
        /// @return this builder for chaining
        public Builder label(String label) {
            this.label = label;
            return this;
        }

        /// Sets whether the prompt replaces the agent's own behavior.
        ///
        /// @param overridePrompt override flag
        /// @return this builder for chaining
        public Builder overridePrompt(boolean overridePrompt) {
            this.overridePrompt = overridePrompt;
            return this;
        }

        /// Sets the locked instruction text (required).
        ///
        /// @param additionalPrompt instruction text, not null
        /// @return this builder for chaining
        public Builder additionalPrompt(String additionalPrompt) {
            this.additionalPrompt = additionalPrompt;
            return this;
        }

        /// Sets the tool ids available in this step.
        ///
        /// @param additionalToolIds tool ids, not null
        /// @return this builder for chaining
        public Builder additionalToolIds(List<String> additionalToolIds) {
            this.additionalToolIds = additionalToolIds;
            return this;
        }

        /// Sets knowledge base attachments.
        ///
        /// @param additionalKnowledgeBase attachments, not null
        /// @return this builder for chaining
        public Builder additionalKnowledgeBase(List<Object> additionalKnowledgeBase) {
            this.additionalKnowledgeBase = additionalKnowledgeBase;
            return this;
        }

        /// Sets inline conversation config overrides.
        ///
        /// @param conversationConfig overrides, not null
        /// @return this builder for chaining
        public Builder conversationConfig(Map<String, Object> conversationConfig) {
            this.conversationConfig = conversationConfig;
            return this;
        }

        /// Builds the immutable node.
        ///
        /// @return new node, never null
        /// @throws NullPointerException if `label` or `additionalPrompt` is null
        public OverrideAgentNode build() {
            return new OverrideAgentNode(
                    position,
                    edgeOrder,
                    label,
                    overridePrompt,
                    additionalPrompt,
                    additionalToolIds,
                    additionalKnowledgeBase,
                    conversationConfig);
        }
    }
}
