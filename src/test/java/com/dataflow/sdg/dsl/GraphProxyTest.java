package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.Concurrency;
import com.dataflow.sdg.api.Node;
import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.config.Configuration;
import com.dataflow.sdg.engine.NodeCatalog;
import com.dataflow.sdg.fn.UnfoldStep;
import com.dataflow.sdg.model.QualifiedName;
import com.dataflow.sdg.node.DeclaredFold;
import com.dataflow.sdg.node.DeclaredTransform;
import com.dataflow.sdg.node.DeclaredUnfold;
import com.dataflow.sdg.node.FoldPolicy;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.junit.Assert.*;

public class GraphProxyTest {

    private NodeCatalog catalog;
    private GraphProxy graph;

    @Before
    public void setUp() {
        catalog = new NodeCatalog();
        graph = new GraphProxy(catalog, Configuration.empty());
    }

    private static List<String> outputNames(Node node) {
        List<String> names = new ArrayList<>();
        for (QualifiedName name : node.outputs())
            names.add(name.full());
        return names;
    }

    @Test
    public void testOutputProductsCommitsTransform() {
        RegistrationResult result = graph.transform("scale", (Integer x) -> x * 2)
                .inputFamily("x")
                .outputProducts("scaled");

        assertTrue(result.inserted());
        Node node = catalog.node("scale");
        assertEquals(NodeKind.TRANSFORM, node.kind());
        assertEquals(List.of("scale/scaled"), outputNames(node));
        assertEquals("x", node.inputs().get(0).name());
    }

    @Test
    public void testOpenStatementCommittedOnClose() {
        graph.transform("square", (Integer x) -> x * x).inputFamily("x");
        assertEquals(0, catalog.size());
        graph.close();
        assertEquals(1, catalog.size());
    }

    @Test
    public void testDefaultOutputIsAlgorithmName() {
        graph.transform("square", (Integer x) -> x * x).inputFamily("x").register();
        assertEquals(List.of("square/square"), outputNames(catalog.node("square")));
    }

    @Test
    public void testObserverAndPredicateCreateNoProducts() {
        graph.predicate("positive", (Integer x) -> x > 0).inputFamily("x").register();
        graph.observe("print", (Integer x) -> {
        }).inputFamily("x").when("positive").register();

        assertTrue(catalog.node("positive").outputs().isEmpty());
        assertTrue(catalog.node("print").outputs().isEmpty());
        assertEquals(List.of("positive"), catalog.node("print").predicates());
    }

    @Test
    public void testModuleLabelQualifiesNames() {
        GraphProxy labelled = new GraphProxy(catalog, Configuration.of(Map.of("module_label", "reco")));
        labelled.transform("scale", (Integer x) -> x * 2).inputFamily("x").outputProducts("y");
        labelled.transform("other:keep", (Integer x) -> x).inputFamily("x").outputProducts("z");

        assertTrue(catalog.contains("reco:scale"));
        assertTrue(catalog.contains("other:keep"));
        assertEquals(List.of("reco:scale/y"), outputNames(catalog.node("reco:scale")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testArityMismatchFailsImmediately() {
        graph.transform("add", (Integer a, Integer b) -> a + b).inputFamily("a");
    }

    @Test
    public void testVariadicAcceptsAnyCount() {
        graph.transformN("sum", args -> args.length).inputFamily("a", "b", "c", "d").register();
        assertEquals(4, catalog.node("sum").inputs().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testVariadicNeedsAtLeastOneLabel() {
        graph.transformN("sum", args -> args.length).inputFamily();
    }

    @Test(expected = IllegalStateException.class)
    public void testEmptyStatementFailsAtClose() {
        graph.transform("orphan", (Integer x) -> x);
        graph.close();
    }

    @Test
    public void testCloseCommitsValidStatementsAndNamesEveryEmptyOne() {
        graph.transform("orphan", (Integer x) -> x);
        graph.transform("square", (Integer x) -> x * x).inputFamily("x");
        graph.observe("stray", (Integer x) -> {
        });
        try {
            graph.close();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("transform 'orphan'"));
            assertTrue(e.getMessage().contains("observe 'stray'"));
        }
        assertTrue(catalog.contains("square"));
        assertEquals(1, catalog.size());
    }

    @Test(expected = IllegalStateException.class)
    public void testStageCannotBeReused() {
        RegistrationApi api = graph.transform("scale", (Integer x) -> x * 2);
        api.inputFamily("x");
        api.inputFamily("y");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testObserverCannotNameOutputs() {
        graph.observe("print", (Integer x) -> {
        }).inputFamily("x").outputProducts("y");
    }

    @Test
    public void testDuplicateReportedInCatalog() {
        graph.transform("scale", (Integer x) -> x).inputFamily("x").outputProducts("a");
        RegistrationResult second = graph.transform("scale", (Integer x) -> x).inputFamily("y")
                .outputProducts("b");
        assertFalse(second.inserted());
        assertEquals(List.of("duplicate algorithm name: scale"), catalog.errors());
    }

    @Test
    public void testFoldSettings() {
        graph.fold("sum", (Integer acc, Integer x) -> acc + x, () -> 0)
                .partitionedBy("run")
                .policy(FoldPolicy.CARRY_OVER)
                .inputFamily("x")
                .register();

        DeclaredFold fold = (DeclaredFold) catalog.node("sum");
        assertEquals("run", fold.partition());
        assertEquals(FoldPolicy.CARRY_OVER, fold.policy());
        assertEquals(0, fold.initialValue());
        assertEquals(List.of("sum/sum"), outputNames(fold));
    }

    @Test
    public void testFoldDefaultsToRootPartition() {
        graph.fold("count", (Long acc, Object x) -> acc + 1, () -> 0L).inputFamily("x").register();
        DeclaredFold fold = (DeclaredFold) catalog.node("count");
        assertEquals("job", fold.partition());
        assertEquals(FoldPolicy.RESET_ON_FLUSH, fold.policy());
    }

    @Test
    public void testUnfoldDeclaration() {
        graph.unfold("split", (Integer n) -> n > 0, (Integer n) -> new UnfoldStep<Integer, Integer>(n - 1, n),
                "slice").inputFamily("count").outputProducts("piece");

        DeclaredUnfold unfold = (DeclaredUnfold) catalog.node("split");
        assertEquals("slice", unfold.destinationLevel());
        assertTrue(unfold.hasMore(2));
        assertEquals(1, unfold.next(2).state());
        assertEquals(List.of("split/piece"), outputNames(unfold));
    }

    @Test
    public void testOutputWhenCommits() {
        graph.predicate("keep", (Integer x) -> true).inputFamily("x").register();
        RegistrationResult result = graph.output("writer", store -> {
        }).when("keep");
        assertTrue(result.inserted());
        assertEquals(NodeKind.OUTPUT, catalog.node("writer").kind());
        assertEquals(List.of("keep"), catalog.node("writer").predicates());
    }

    @Test
    public void testOutputWithoutPredicatesCommittedOnClose() {
        graph.output("writer", store -> {
        });
        graph.close();
        assertTrue(catalog.contains("writer"));
    }

    @Test
    public void testMultipleOutputsReturnList() {
        graph.transform("split", (Integer x) -> List.of(x / 2, x % 2)).inputFamily("x")
                .outputProducts("half", "rest");
        DeclaredTransform transform = (DeclaredTransform) catalog.node("split");
        assertEquals(List.of(2, 1), transform.invoke(new Object[] { 5 }));
    }

    @Test
    public void testConcurrencyRecorded() {
        graph.transform("fast", (Integer x) -> x, Concurrency.UNLIMITED).inputFamily("x").register();
        assertTrue(catalog.node("fast").concurrency().isUnlimited());
        graph.transform("slow", (Integer x) -> x).inputFamily("x").register();
        assertTrue(catalog.node("slow").concurrency().isSerial());
    }

    @Test
    public void testBoundProxySharesReceiver() {
        Supplier<List<Integer>> factory = ArrayList::new;
        BoundGraphProxy<List<Integer>> bound = graph.make(factory);
        bound.observe("collect", (List<Integer> self, Integer x) -> self.add(x)).inputFamily("x").register();
        bound.transform("size", (List<Integer> self, Integer x) -> self.size()).inputFamily("x")
                .outputProducts("n");

        assertTrue(catalog.contains("collect"));
        DeclaredTransform size = (DeclaredTransform) catalog.node("size");
        bound.receiver().add(1);
        assertEquals(List.of(1), size.invoke(new Object[] { 7 }));
    }
}
