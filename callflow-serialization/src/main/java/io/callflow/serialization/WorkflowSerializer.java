package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.callflow.core.compiler.CompileResult;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.form.FormDefinition;
import io.callflow.core.tool.WebhookToolDefinition;
import io.callflow.core.workflow.Workflow;
import java.util.List;

/// Utility class for reading and writing callflow documents as JSON.
///
/// Covers the editor's flow graph and stored forms on the way in, and the compiled
/// workflow, compile summary and tool definitions on the way out. Compiled workflows can
/// also be read back from their wire format.
///
/// ### Usage
/// {@snippet :
/// FlowGraph graph = WorkflowSerializer.readFlowGraph(editorJson);
/// CompileResult result = new FlowCompiler().compile(graph);
///
/// // Wire format for the voice platform
/// String json = WorkflowSerializer.toJson(result.workflow());
///
/// // Round trip
/// Workflow restored = WorkflowSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see CallflowJacksonModule for the registered type handlers
public final class WorkflowSerializer {

    private WorkflowSerializer() {}

    /// Serializes a workflow to pretty-printed wire JSON.
    ///
    /// @param workflow the workflow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Workflow workflow) {
        return write(workflow, "workflow");
    }

    /// Deserializes a workflow from wire JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized workflow, never null
    /// @throws IllegalArgumentException if the JSON is malformed or names an unknown node or
    ///     condition type
    public static Workflow fromJson(String json) {
        return read(json, Workflow.class, "workflow");
    }

    /// Reads the visual editor's flow graph.
    ///
    /// @param json editor JSON, not null
    /// @return parsed graph, never null
    /// @throws IllegalArgumentException if the JSON is malformed
    public static FlowGraph readFlowGraph(String json) {
        return read(json, FlowGraph.class, "flow graph");
    }

    /// Reads a stored form definition.
    ///
    /// @param json form JSON, not null
    /// @return parsed form, never null
    /// @throws IllegalArgumentException if the JSON is malformed or has no id
    public static FormDefinition readFormDefinition(String json) {
        return read(json, FormDefinition.class, "form definition");
    }

    /// Serializes a compile summary, including the workflow.
    ///
    /// @param result compile result, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String summaryToJson(CompileResult result) {
        return write(result, "compile result");
    }

    /// Serializes tool definitions as a JSON array in registration format.
    ///
    /// @param tools tool definitions, not null
    /// @return JSON array, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toolsToJson(List<WebhookToolDefinition> tools) {
        return write(tools, "tool definitions");
    }

    /// Creates an ObjectMapper configured for callflow documents.
    ///
    /// Registers:
    /// - `CallflowJacksonModule` for the workflow and flow graph type hierarchies
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled, since editor documents carry UI-only fields
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new CallflowJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return createMapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }
}
