package io.callflow.cli.visualizer;

import io.callflow.core.workflow.Workflow;

/// Strategy interface for rendering compiled workflows in different output formats.
///
/// Implementations are discovered via CDI and registered in {@link WorkflowVisualizer}.
///
/// ### Built-in Formats
/// - `text` - ASCII boxes with ANSI colors ({@link TextVisualizationFormat})
/// - `mermaid` - Mermaid diagram syntax ({@link MermaidVisualizationFormat})
public interface VisualizationFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name used for CLI selection, never null
    String getName();

    /// Renders the workflow graph in this format.
    ///
    /// @param workflow the workflow to visualize, not null
    /// @return formatted string representation, never null
    String render(Workflow workflow);
}
