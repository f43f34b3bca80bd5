package io.callflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.callflow.core.compiler.CompileResult;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.form.FormDefinition;
import io.callflow.core.tool.WebhookToolDefinition;
import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.condition.ForwardCondition;
import io.callflow.core.workflow.node.WorkflowNode;
import io.callflow.serialization.mixin.WorkflowBuilderMixin;
import io.callflow.serialization.mixin.WorkflowMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all callflow serialization configuration in one place.
///
/// **Wire format of the voice platform** (snake_case, bit-exact):
/// - `WorkflowNode` - `WorkflowNodeSerializer` / `WorkflowNodeDeserializer`, discriminator `"type"`
/// - `ForwardCondition` - `ForwardConditionSerializer` / `ForwardConditionDeserializer`,
///   discriminator `"type"`
/// - `WorkflowEdge` - `WorkflowEdgeSerializer` / `WorkflowEdgeDeserializer`
/// - `WebhookToolDefinition` - write only
/// - `Workflow` + `Workflow.Builder` via mixins
///
/// **Editor and local formats** (camelCase, as the visual editor stores them):
/// - `FlowGraph` - read only
/// - `FormDefinition` - read only
/// - `CompileResult` - write only, the compile summary
///
/// @see WorkflowSerializer for the convenience factory API
public class CallflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3141728305547108213L;

    public CallflowJacksonModule() {
        super("CallflowJacksonModule");

        addSerializer(WorkflowNode.class, new WorkflowNodeSerializer());
        addDeserializer(WorkflowNode.class, new WorkflowNodeDeserializer());

        addSerializer(ForwardCondition.class, new ForwardConditionSerializer());
        addDeserializer(ForwardCondition.class, new ForwardConditionDeserializer());

        addSerializer(WorkflowEdge.class, new WorkflowEdgeSerializer());
        addDeserializer(WorkflowEdge.class, new WorkflowEdgeDeserializer());

        addSerializer(WebhookToolDefinition.class, new WebhookToolDefinitionSerializer());
        addSerializer(CompileResult.class, new CompileResultSerializer());

        addDeserializer(FlowGraph.class, new FlowGraphDeserializer());
        addDeserializer(FormDefinition.class, new FormDefinitionDeserializer());
    }

    /// Applies the builder mixins to `Workflow`.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Workflow.class, WorkflowMixin.class);
        context.setMixInAnnotations(Workflow.Builder.class, WorkflowBuilderMixin.class);
    }
}
