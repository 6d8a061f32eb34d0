package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.fn.FoldN;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.LevelId;
import com.dataflow.sdg.node.DeclaredFold;
import com.dataflow.sdg.node.FoldPolicy;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * First stage of a fold statement.
 *
 * <p>
 * The partition level defaults to the root level ({@value LevelId#ROOT_LEVEL_NAME})
 * and the policy to {@link FoldPolicy#RESET_ON_FLUSH}; both may be changed
 * before the input family is given.
 */
public final class FoldApi extends StatementStage {
    private final AlgorithmName name;
    private final Concurrency concurrency;
    private final int arity;
    private final FoldN<Object> body;
    private final Supplier<?> initial;
    private String partition = LevelId.ROOT_LEVEL_NAME;
    private FoldPolicy policy = FoldPolicy.RESET_ON_FLUSH;

    FoldApi(Registrar registrar, AlgorithmName name, Concurrency concurrency, int arity, FoldN<Object> body,
            Supplier<?> initial) {
        super(registrar);
        this.name = name;
        this.concurrency = concurrency;
        this.arity = arity;
        this.body = body;
        this.initial = Objects.requireNonNull(initial, "initial");
    }

    /** Accumulates separately for each scope instance at the given level. */
    public FoldApi partitionedBy(String levelName) {
        checkNotConsumed();
        if (levelName == null || levelName.isEmpty())
            throw new IllegalArgumentException("Partition level of " + registrar.statement() + " must not be empty");
        this.partition = levelName;
        return this;
    }

    public FoldApi policy(FoldPolicy policy) {
        checkNotConsumed();
        this.policy = Objects.requireNonNull(policy, "policy");
        return this;
    }

    /**
     * Names the folded products; the count excludes the accumulator.
     *
     * @throws IllegalArgumentException on an arity mismatch
     */
    public UpstreamPredicates inputFamily(String... labels) {
        consume();
        List<Label> inputs = RegistrationApi.checkedInputs(registrar, arity, labels);
        String level = partition;
        FoldPolicy foldPolicy = policy;
        registrar.setCreator(Glue.creator(NodeKind.FOLD, name, inputs,
                (in, predicates, outputs) -> new DeclaredFold(name, concurrency, in, outputs, predicates, body,
                        initial, level, foldPolicy)));
        return new UpstreamPredicates(registrar, NodeKind.FOLD);
    }
}
