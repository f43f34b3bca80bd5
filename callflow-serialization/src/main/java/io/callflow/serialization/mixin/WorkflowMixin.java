package io.callflow.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.callflow.core.workflow.Workflow;

/// Jackson mixin that binds `Workflow` deserialization to its builder.
///
/// Applied to `Workflow.class` via `CallflowJacksonModule.setupModule()`. `Workflow` has
/// no public constructor, so reading goes through `Workflow.Builder`.
///
/// @apiNote The companion mixin {@link WorkflowBuilderMixin} must also be registered.
/// @see io.callflow.serialization.CallflowJacksonModule
@JsonDeserialize(builder = Workflow.Builder.class)
public abstract class WorkflowMixin {}
