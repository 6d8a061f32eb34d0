package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.NodeKind;

import java.util.List;

/** Last stage of a statement: optional naming of the created products. */
public final class OutputProducts extends StatementStage {
    private final NodeKind kind;

    OutputProducts(Registrar registrar, NodeKind kind) {
        super(registrar);
        this.kind = kind;
    }

    /** Names the created products and commits the statement. */
    public RegistrationResult outputProducts(String... labels) {
        consume();
        return commit(registrar, kind, labels);
    }

    static RegistrationResult commit(Registrar registrar, NodeKind kind, String... labels) {
        if (labels.length == 0)
            throw new IllegalArgumentException("outputProducts of " + registrar.statement()
                    + " requires at least one label");
        if (!kind.createsProducts())
            throw new IllegalArgumentException(registrar.statement() + " does not create products");
        return registrar.setOutputProducts(List.of(labels));
    }
}
