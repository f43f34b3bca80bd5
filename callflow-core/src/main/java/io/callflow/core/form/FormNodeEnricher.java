package io.callflow.core.form;

import io.callflow.core.flow.FlowGraph;
import io.callflow.core.flow.FlowNode;
import io.callflow.core.flow.NodeCategory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fills form nodes with the name and questions of the form they reference.
///
/// The editor stores only a `formId` on form nodes. Before compilation each such node
/// gets `formName` and `fields` written into its config from the {@link FormRepository},
/// so the compiler can generate the field-by-field collection prompt. Lookup failures
/// never abort the pass: the node is kept as authored and the compiler falls back to the
/// generic collection prompt.
public final class FormNodeEnricher {

    private static final Logger logger = Logger.getLogger(FormNodeEnricher.class.getName());

    private final FormRepository repository;

    /// @param repository form lookup, not null
    public FormNodeEnricher(FormRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    /// Returns a copy of the graph with every resolvable form node enriched.
    ///
    /// @param graph authoring graph, not null
    /// @return enriched graph, never null; edges are shared with the input
    public FlowGraph enrich(FlowGraph graph) {
        List<FlowNode> nodes = new ArrayList<>(graph.nodes().size());
        int enriched = 0;
        for (FlowNode node : graph.nodes()) {
            FlowNode result = enrichNode(node);
            if (result != node) {
                enriched++;
            }
            nodes.add(result);
        }
        if (enriched > 0) {
            logger.info("Enriched " + enriched + " form node(s) with stored field definitions");
        }
        return FlowGraph.of(nodes, graph.edges());
    }

    private FlowNode enrichNode(FlowNode node) {
        if (node.category() != NodeCategory.FORM) {
            return node;
        }
        String formId = node.config().text("formId");
        if (formId == null) {
            return node;
        }

        Optional<FormDefinition> form;
        try {
            form = repository.findById(formId);
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Form lookup failed for node " + node.id() + " (formId " + formId + ")",
                    e);
            return node;
        }
        if (form.isEmpty()) {
            logger.warning("Form " + formId + " referenced by node " + node.id() + " not found");
            return node;
        }

        FormDefinition definition = form.get();
        Map<String, Object> config = new LinkedHashMap<>(node.config().asMap());
        config.put("formName", definition.name());
        List<Map<String, Object>> fields = new ArrayList<>();
        for (FormField field : definition.fields()) {
            fields.add(field.toMap());
        }
        config.put("fields", fields);

        Map<String, Object> data = new LinkedHashMap<>(node.data());
        data.put("config", config);
        logger.fine(
                "Loaded form \""
                        + definition.name()
                        + "\" with "
                        + fields.size()
                        + " field(s) for node "
                        + node.id());
        return new FlowNode(node.id(), node.type(), node.position(), data);
    }
}
