package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.NodeKind;

import java.util.List;

/** Stage after the input family: optional predicate gating. */
public final class UpstreamPredicates extends StatementStage {
    private final NodeKind kind;

    UpstreamPredicates(Registrar registrar, NodeKind kind) {
        super(registrar);
        this.kind = kind;
    }

    /**
     * Runs the node only for scopes in which every named predicate evaluated to
     * true. A name may omit the plugin.
     */
    public OutputProducts when(String... predicates) {
        consume();
        registrar.setPredicates(List.of(predicates));
        return new OutputProducts(registrar, kind);
    }

    /** Names the created products and commits the statement. */
    public RegistrationResult outputProducts(String... labels) {
        consume();
        return OutputProducts.commit(registrar, kind, labels);
    }
}
