package io.callflow.cli.visualizer;

import io.callflow.core.workflow.Workflow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.TreeMap;

/// Registry and dispatcher for workflow visualization formats.
///
/// @implNote Thread-safe after construction. Format map is immutable.
/// @see VisualizationFormat
@ApplicationScoped
public class WorkflowVisualizer {

    private final Map<String, VisualizationFormat> formats;

    /// Creates a visualizer with all CDI-discovered format implementations.
    ///
    /// @param formatInstances CDI-provided format implementations, not null
    @Inject
    public WorkflowVisualizer(Instance<VisualizationFormat> formatInstances) {
        this(formatInstances.stream().toList());
    }

    /// Creates a visualizer over an explicit set of formats.
    ///
    /// @param formats format implementations with unique names, not null
    public WorkflowVisualizer(Iterable<? extends VisualizationFormat> formats) {
        Map<String, VisualizationFormat> byName = new TreeMap<>();
        for (VisualizationFormat format : formats) {
            byName.put(format.getName(), format);
        }
        this.formats = Map.copyOf(byName);
    }

    /// Renders workflow using the specified format.
    ///
    /// @param workflow   the workflow to visualize, not null
    /// @param formatName the format name (e.g., "text", "mermaid"), not null
    /// @return formatted visualization string, never null
    /// @throws IllegalArgumentException if format is not registered
    public String visualize(Workflow workflow, String formatName) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", new TreeMap<>(formats).keySet()));
        }
        return format.render(workflow);
    }
}
