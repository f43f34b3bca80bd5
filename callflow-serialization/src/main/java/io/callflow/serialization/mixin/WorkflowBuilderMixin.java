package io.callflow.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `Workflow.Builder`.
///
/// `withPrefix = ""` maps the `nodes` and `edges` JSON fields straight onto the builder
/// methods of the same name.
///
/// @see WorkflowMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowBuilderMixin {}
