package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.Node;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;

import java.util.List;

/** Kind-specific descriptor constructor captured by a statement's first stage. */
@FunctionalInterface
interface NodeFactory {
    Node create(List<Label> inputs, List<String> predicates, List<QualifiedName> outputs);
}
