package com.dataflow.sdg.util;

import com.dataflow.sdg.api.Node;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.engine.NodeCatalog;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;
import com.dataflow.sdg.node.DeclaredFold;
import com.dataflow.sdg.node.DeclaredUnfold;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Diagnostic utility for inspecting a node catalog.
 *
 * <p>
 * Edges are derived from the declarations: a node feeds another when one of
 * its outputs matches one of the other's input labels, and a predicate feeds
 * every node that names it in {@code when}. Inputs that no node produces are
 * drawn as coming from the source.
 *
 * <p>
 * Intended for debugging sessions and build logs. Do <b>not</b> use on the
 * execution path.
 */
public final class GraphExplain {
    private static final String SOURCE = "source";

    private final NodeCatalog catalog;

    public GraphExplain(NodeCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Dumps detailed declaration of a single node.
     *
     * @throws IllegalArgumentException if the catalog has no such node
     */
    public String explainNode(String fullName) {
        Node node = catalog.node(fullName);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + fullName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.fullName()).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n')
                .append("  Concurrency: ").append(node.concurrency()).append('\n')
                .append("  Inputs: ").append(node.inputs()).append('\n')
                .append("  Outputs: ").append(fullNames(node.outputs())).append('\n');
        if (!node.predicates().isEmpty())
            sb.append("  When: ").append(node.predicates()).append('\n');
        if (node instanceof DeclaredFold fold)
            sb.append("  Partition: ").append(fold.partition()).append(" (").append(fold.policy()).append(")\n");
        else if (node instanceof DeclaredUnfold unfold)
            sb.append("  Destination: ").append(unfold.destinationLevel()).append('\n');
        List<String> consumers = consumers(node);
        sb.append("  Consumers (").append(consumers.size()).append("): ").append(String.join(", ", consumers));
        return sb.append('\n').toString();
    }

    /** Dumps the whole catalog in declaration order. */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(catalog.size()).append(" nodes):\n");
        int i = 0;
        for (Node node : catalog.nodes()) {
            sb.append("  [").append(i++).append("] ").append(node.kind().name().toLowerCase()).append(' ')
                    .append(node.fullName());
            if (!node.inputs().isEmpty())
                sb.append(' ').append(node.inputs());
            if (!node.predicates().isEmpty())
                sb.append(" when ").append(node.predicates());
            List<String> consumers = consumers(node);
            if (!consumers.isEmpty())
                sb.append(" -> ").append(String.join(", ", consumers));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, suitable for embedding in
     * Markdown.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        boolean needsSource = false;
        for (Node node : catalog.nodes()) {
            for (Label label : node.inputs()) {
                if (producers(label).isEmpty())
                    needsSource = true;
            }
        }
        if (needsSource)
            sb.append("  ").append(SOURCE).append("[(\"").append(SOURCE).append("\")];\n");

        // 1. Nodes
        for (Node node : catalog.nodes()) {
            String safeName = sanitize(node.fullName());
            String title = node.fullName() + "<br/><i>" + node.kind().name().toLowerCase() + "</i>";
            if (node.kind() == NodeKind.PREDICATE)
                sb.append("  ").append(safeName).append("{\"").append(title).append("\"};\n");
            else if (node.kind() == NodeKind.OUTPUT)
                sb.append("  ").append(safeName).append("[/\"").append(title).append("\"/];\n");
            else
                sb.append("  ").append(safeName).append("[\"").append(title).append("\"];\n");
        }

        // 2. Edges afterwards
        for (Node node : catalog.nodes()) {
            String safeName = sanitize(node.fullName());
            for (Label label : node.inputs()) {
                List<Node> producers = producers(label);
                if (producers.isEmpty()) {
                    sb.append("  ").append(SOURCE).append(" -- \"").append(label.name()).append("\" --> ")
                            .append(safeName).append(";\n");
                }
                for (Node producer : producers) {
                    sb.append("  ").append(sanitize(producer.fullName())).append(" -- \"").append(label.name())
                            .append("\" --> ").append(safeName).append(";\n");
                }
            }
            for (String spec : node.predicates()) {
                for (Node predicate : catalog.matchingPredicates(spec))
                    sb.append("  ").append(sanitize(predicate.fullName())).append(" -.-> ").append(safeName)
                            .append(";\n");
            }
        }
        return sb.toString();
    }

    private List<Node> producers(Label label) {
        List<Node> result = new ArrayList<>();
        for (Node n : catalog.nodes()) {
            for (QualifiedName out : n.outputs()) {
                if (label.matches(out)) {
                    result.add(n);
                    break;
                }
            }
        }
        return result;
    }

    private List<String> consumers(Node producer) {
        Set<String> result = new LinkedHashSet<>();
        for (Node n : catalog.nodes()) {
            for (Label label : n.inputs()) {
                for (QualifiedName out : producer.outputs()) {
                    if (label.matches(out))
                        result.add(n.fullName());
                }
            }
            if (producer.kind() == NodeKind.PREDICATE) {
                for (String spec : n.predicates()) {
                    if (catalog.matchingPredicates(spec).contains(producer))
                        result.add(n.fullName());
                }
            }
        }
        return new ArrayList<>(result);
    }

    private static List<String> fullNames(List<QualifiedName> names) {
        List<String> result = new ArrayList<>(names.size());
        for (QualifiedName name : names)
            result.add(name.full());
        return result;
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
