package com.dataflow.sdg.engine;

import com.dataflow.sdg.api.Node;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;
import com.dataflow.sdg.node.DeclaredPredicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of all declared nodes, keyed by full algorithm name.
 *
 * <p>
 * The catalog is filled during the single-threaded build phase and is
 * read-only once bound into an execution substrate. Problems found while
 * filling it do not throw: they are appended to a shared error list so that
 * a single build reports every problem at once.
 *
 * <p>
 * Iteration order is declaration order.
 */
public final class NodeCatalog {
    private final Map<String, Node> nodesByName = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();

    /**
     * Inserts a node unless its name is taken.
     *
     * @return true if inserted; false if a node of the same name already exists,
     *         in which case the first node is kept and a diagnostic is recorded
     */
    public boolean tryInsert(Node node) {
        String name = node.fullName();
        if (nodesByName.putIfAbsent(name, node) != null) {
            errors.add("duplicate algorithm name: " + name);
            return false;
        }
        return true;
    }

    public void addError(String message) {
        errors.add(message);
    }

    /** Collected build diagnostics, in the order they were found. */
    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Node node(String fullName) {
        return nodesByName.get(fullName);
    }

    public boolean contains(String fullName) {
        return nodesByName.containsKey(fullName);
    }

    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodesByName.values());
    }

    public List<Node> nodes(NodeKind kind) {
        List<Node> result = new ArrayList<>();
        for (Node n : nodesByName.values()) {
            if (n.kind() == kind)
                result.add(n);
        }
        return result;
    }

    public int size() {
        return nodesByName.size();
    }

    public Map<NodeKind, Integer> countsByKind() {
        Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
        for (Node n : nodesByName.values())
            counts.merge(n.kind(), 1, Integer::sum);
        return counts;
    }

    /**
     * Returns every predicate node whose name matches {@code spec}, where the
     * spec may omit the plugin.
     */
    public List<DeclaredPredicate> matchingPredicates(String spec) {
        AlgorithmName wanted = AlgorithmName.create(spec);
        List<DeclaredPredicate> result = new ArrayList<>();
        for (Node n : nodesByName.values()) {
            if (n instanceof DeclaredPredicate p && wanted.match(p.name()))
                result.add(p);
        }
        return result;
    }

    /**
     * Resolves the single predicate named by {@code spec}.
     *
     * @throws IllegalStateException if no predicate or several predicates match
     */
    public DeclaredPredicate predicate(String spec) {
        List<DeclaredPredicate> matches = matchingPredicates(spec);
        if (matches.size() != 1)
            throw new IllegalStateException("Predicate '" + spec + "' resolves to " + matches.size() + " nodes");
        return matches.get(0);
    }

    /**
     * Checks the references between nodes and records a diagnostic for each
     * unresolved one: {@code when} names that match no predicate or several
     * predicates, and qualified input labels that no node and no external
     * producer can satisfy.
     *
     * @param externalProducers names of producers outside the graph, e.g. the
     *                          source
     * @return true if no new diagnostic was recorded
     */
    public boolean validate(Collection<AlgorithmName> externalProducers) {
        int before = errors.size();
        for (Node node : nodesByName.values()) {
            for (String spec : node.predicates())
                checkPredicate(spec, node);
            for (Label label : node.inputs()) {
                if (label.isQualified() && !hasProducer(label, externalProducers))
                    errors.add("no producer for input '" + label + "' of node " + node.fullName());
            }
        }
        return errors.size() == before;
    }

    private void checkPredicate(String spec, Node node) {
        List<DeclaredPredicate> matches;
        try {
            matches = matchingPredicates(spec);
        } catch (IllegalArgumentException e) {
            errors.add("invalid predicate name '" + spec + "' (required by " + node.fullName() + "): "
                    + e.getMessage());
            return;
        }
        if (matches.isEmpty()) {
            errors.add("no predicate matches '" + spec + "' (required by " + node.fullName() + ")");
        } else if (matches.size() > 1) {
            List<String> names = new ArrayList<>();
            for (DeclaredPredicate p : matches)
                names.add(p.fullName());
            errors.add("ambiguous predicate '" + spec + "' (required by " + node.fullName() + ") matches "
                    + names);
        }
    }

    private boolean hasProducer(Label label, Collection<AlgorithmName> externalProducers) {
        for (Node n : nodesByName.values()) {
            for (QualifiedName out : n.outputs()) {
                if (label.matches(out))
                    return true;
            }
        }
        for (AlgorithmName producer : externalProducers) {
            if (label.producer().match(producer))
                return true;
        }
        return false;
    }
}
