package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.Node;
import com.dataflow.sdg.engine.NodeCatalog;

import java.util.List;
import java.util.Objects;

/**
 * Completes the registration of one node once its declaration statement is
 * complete.
 *
 * <pre>
 * graph.transform("scale", (Integer x) -&gt; x * 2)
 *      .inputFamily("x")
 *      .when("accepted")
 *      .outputProducts("scaled");   // node created and committed here
 * </pre>
 *
 * <p>
 * A single registrar is created when the statement starts and handed forward
 * by every stage. Each stage adds what it knows (the node creator, the
 * predicate names, the output names). The node is created exactly once, at
 * the first of:
 * <ul>
 * <li>{@link #setOutputProducts(List)}, the last possible stage;</li>
 * <li>{@link #close()}, called by an explicit {@code register()} or by the
 * graph proxy when the module entry point returns.</li>
 * </ul>
 *
 * <p>
 * Not thread-safe; registration runs on the build thread only.
 */
public final class Registrar {

    /** Builds the node descriptor from the finalized predicates and outputs. */
    @FunctionalInterface
    public interface NodeCreator {
        Node create(List<String> predicates, List<String> outputProducts);
    }

    private final NodeCatalog catalog;
    private final String statement;
    private NodeCreator creator;
    private List<String> predicates;
    private RegistrationResult result;

    /**
     * @param catalog   catalog the node is committed to
     * @param statement description of the statement used in error messages,
     *                  e.g. {@code "transform 'scale'"}
     */
    public Registrar(NodeCatalog catalog, String statement) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.statement = statement;
    }

    public String statement() {
        return statement;
    }

    public boolean hasCreator() {
        return creator != null;
    }

    public boolean hasPredicates() {
        return predicates != null;
    }

    public boolean isCommitted() {
        return result != null;
    }

    /** @return the commit outcome, or null before the commit. */
    public RegistrationResult result() {
        return result;
    }

    public void setCreator(NodeCreator creator) {
        checkNotCommitted();
        this.creator = Objects.requireNonNull(creator, "creator");
    }

    public void setPredicates(List<String> predicates) {
        checkNotCommitted();
        this.predicates = List.copyOf(predicates);
    }

    /** Commits the node now, with the given output names. */
    public RegistrationResult setOutputProducts(List<String> outputProducts) {
        checkNotCommitted();
        if (creator == null)
            throw new IllegalStateException("Cannot set output products of " + statement
                    + " before its input family is declared");
        return commit(List.copyOf(outputProducts));
    }

    /**
     * Ends the statement. Commits with the predicates given so far and no
     * explicit output names unless already committed.
     *
     * @throws IllegalStateException if the statement never declared its inputs
     */
    public RegistrationResult close() {
        if (result != null)
            return result;
        if (creator == null)
            throw new IllegalStateException("Registration of " + statement
                    + " ended before its input family was declared");
        return commit(List.of());
    }

    private RegistrationResult commit(List<String> outputProducts) {
        Node node = creator.create(predicates == null ? List.of() : predicates, outputProducts);
        creator = null;
        boolean inserted = catalog.tryInsert(node);
        result = new RegistrationResult(node.fullName(), inserted);
        return result;
    }

    private void checkNotCommitted() {
        if (result != null)
            throw new IllegalStateException(statement + " is already registered as " + result.name());
    }
}
