package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.fn.Unfold;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.node.DeclaredUnfold;

import java.util.List;
import java.util.function.Predicate;

/** First stage of an unfold statement: selects the initial state. */
public final class UnfoldApi extends StatementStage {
    private final AlgorithmName name;
    private final Concurrency concurrency;
    private final Predicate<Object> more;
    private final Unfold<Object, Object> step;
    private final String destinationLevel;

    UnfoldApi(Registrar registrar, AlgorithmName name, Concurrency concurrency, Predicate<Object> more,
            Unfold<Object, Object> step, String destinationLevel) {
        super(registrar);
        this.name = name;
        this.concurrency = concurrency;
        this.more = more;
        this.step = step;
        this.destinationLevel = destinationLevel;
    }

    /** Names the product that seeds the unfold. */
    public UpstreamPredicates inputFamily(String label) {
        consume();
        List<Label> inputs = RegistrationApi.checkedInputs(registrar, 1, label);
        registrar.setCreator(Glue.creator(NodeKind.UNFOLD, name, inputs,
                (in, predicates, outputs) -> new DeclaredUnfold(name, concurrency, in, outputs, predicates, more,
                        step, destinationLevel)));
        return new UpstreamPredicates(registrar, NodeKind.UNFOLD);
    }
}
