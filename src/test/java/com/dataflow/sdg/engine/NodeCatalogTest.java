package com.dataflow.sdg.engine;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;
import com.dataflow.sdg.node.DeclaredObserver;
import com.dataflow.sdg.node.DeclaredPredicate;
import com.dataflow.sdg.node.DeclaredTransform;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class NodeCatalogTest {

    private NodeCatalog catalog;

    @Before
    public void setUp() {
        catalog = new NodeCatalog();
    }

    private static DeclaredTransform transform(String name, String input, String output, String... predicates) {
        AlgorithmName alg = AlgorithmName.create(name);
        return new DeclaredTransform(alg, Concurrency.SERIAL, List.of(Label.create(input)),
                QualifiedName.toQualifiedNames(alg, List.of(output)), List.of(predicates), args -> args[0]);
    }

    private static DeclaredPredicate predicate(String name, String input) {
        return new DeclaredPredicate(AlgorithmName.create(name), Concurrency.SERIAL, List.of(Label.create(input)),
                List.of(), args -> Boolean.TRUE);
    }

    @Test
    public void testDuplicateKeepsFirstAndRecordsError() {
        DeclaredTransform first = transform("p:scale", "x", "y");
        assertTrue(catalog.tryInsert(first));
        assertFalse(catalog.tryInsert(transform("p:scale", "z", "w")));

        assertSame(first, catalog.node("p:scale"));
        assertEquals(1, catalog.size());
        assertEquals(List.of("duplicate algorithm name: p:scale"), catalog.errors());
    }

    @Test
    public void testSameAlgorithmInDifferentPluginsIsNotDuplicate() {
        assertTrue(catalog.tryInsert(transform("a:scale", "x", "y")));
        assertTrue(catalog.tryInsert(transform("b:scale", "x", "z")));
        assertFalse(catalog.hasErrors());
    }

    @Test
    public void testCountsByKind() {
        catalog.tryInsert(transform("t1", "x", "y"));
        catalog.tryInsert(transform("t2", "y", "z"));
        catalog.tryInsert(predicate("ok", "x"));
        assertEquals(Integer.valueOf(2), catalog.countsByKind().get(NodeKind.TRANSFORM));
        assertEquals(Integer.valueOf(1), catalog.countsByKind().get(NodeKind.PREDICATE));
        assertEquals(1, catalog.nodes(NodeKind.PREDICATE).size());
    }

    @Test
    public void testPredicateResolvesPartialName() {
        catalog.tryInsert(predicate("sel:accept", "x"));
        assertEquals("sel:accept", catalog.predicate("accept").fullName());
        assertEquals("sel:accept", catalog.predicate("sel:accept").fullName());
        assertTrue(catalog.matchingPredicates("other:accept").isEmpty());
    }

    @Test
    public void testValidateReportsUnknownPredicate() {
        catalog.tryInsert(transform("t", "x", "y", "missing"));
        assertFalse(catalog.validate(List.of()));
        assertEquals(List.of("no predicate matches 'missing' (required by t)"), catalog.errors());
    }

    @Test
    public void testValidateReportsAmbiguousPredicate() {
        catalog.tryInsert(predicate("a:accept", "x"));
        catalog.tryInsert(predicate("b:accept", "x"));
        catalog.tryInsert(transform("t", "x", "y", "accept"));
        assertFalse(catalog.validate(List.of()));
        assertEquals(1, catalog.errors().size());
        assertTrue(catalog.errors().get(0).startsWith("ambiguous predicate 'accept' (required by t)"));
    }

    @Test
    public void testValidateReportsQualifiedInputWithoutProducer() {
        catalog.tryInsert(transform("t", "tracker/hits", "y"));
        assertFalse(catalog.validate(List.of()));
        assertEquals(List.of("no producer for input 'tracker/hits' of node t"), catalog.errors());
    }

    @Test
    public void testValidateAcceptsExternalAndInternalProducers() {
        catalog.tryInsert(transform("tracker", "src/raw", "hits"));
        catalog.tryInsert(new DeclaredObserver(AlgorithmName.create("dump"), Concurrency.SERIAL,
                List.of(Label.create("tracker/hits")), List.of(), args -> {
                }));
        assertTrue(catalog.validate(List.of(AlgorithmName.create("src"))));
        assertFalse(catalog.hasErrors());
    }
}
