package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;

import java.util.List;

/**
 * First stage of a transform, predicate or observer statement: selects the
 * input labels.
 */
public final class RegistrationApi extends StatementStage {
    static final int VARIADIC = -1;

    private final NodeKind kind;
    private final AlgorithmName name;
    private final int arity;
    private final NodeFactory factory;

    RegistrationApi(Registrar registrar, NodeKind kind, AlgorithmName name, int arity, NodeFactory factory) {
        super(registrar);
        this.kind = kind;
        this.name = name;
        this.arity = arity;
        this.factory = factory;
    }

    /**
     * Names the products passed to the algorithm, in parameter order. A label
     * is a bare product name ({@code "sum"}) or a name qualified by its producer
     * ({@code "adder/sum"}, {@code "plugin:adder/sum"}).
     *
     * @throws IllegalArgumentException if the number of labels differs from the
     *                                  algorithm's parameter count
     */
    public UpstreamPredicates inputFamily(String... labels) {
        consume();
        List<Label> inputs = checkedInputs(registrar, arity, labels);
        registrar.setCreator(Glue.creator(kind, name, inputs, factory));
        return new UpstreamPredicates(registrar, kind);
    }

    static List<Label> checkedInputs(Registrar registrar, int arity, String... labels) {
        if (labels.length == 0)
            throw new IllegalArgumentException(registrar.statement() + " requires at least one input label");
        if (arity != VARIADIC && labels.length != arity)
            throw new IllegalArgumentException("The number of input labels (" + labels.length + ") of "
                    + registrar.statement() + " is not the number of algorithm parameters (" + arity + ")");
        return Label.create(labels);
    }
}
