package com.dataflow.sdg.dsl;

import java.util.List;

/**
 * Only stage of an output statement. Outputs take no input labels; the
 * optional predicate list is the whole remaining statement.
 */
public final class OutputApi extends StatementStage {

    OutputApi(Registrar registrar) {
        super(registrar);
    }

    /** Restricts the output to scopes where all predicates are true and commits. */
    public RegistrationResult when(String... predicates) {
        consume();
        registrar.setPredicates(List.of(predicates));
        return registrar.close();
    }
}
