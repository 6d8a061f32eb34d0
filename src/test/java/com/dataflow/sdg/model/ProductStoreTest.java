package com.dataflow.sdg.model;

import org.junit.Test;

import java.util.Set;

import static org.junit.Assert.*;

public class ProductStoreTest {

    private final ProductStore job = ProductStore.base("src", Products.of("geometry", "v1"));
    private final ProductStore run = job.makeChild(0, "run", "src", Products.of("calibration", 2.5));
    private final ProductStore event = run.makeChild(4, "event", "src", Products.of("hits", 12));

    @Test
    public void testStoreForProductFindsNearestOwner() {
        assertSame(event, event.storeForProduct("hits").get());
        assertSame(run, event.storeForProduct("calibration").get());
        assertSame(job, event.storeForProduct("geometry").get());
        assertFalse(event.storeForProduct("missing").isPresent());
    }

    @Test
    public void testContainsProductIsLocalOnly() {
        assertTrue(event.containsProduct("hits"));
        assertFalse(event.containsProduct("calibration"));
    }

    @Test
    public void testParentByLevelName() {
        assertSame(run, event.parent("run"));
        assertSame(event, event.parent("event"));
        assertSame(job, event.parent("job"));
        assertNull(event.parent("subrun"));
    }

    @Test
    public void testTypedAccess() {
        assertEquals(Integer.valueOf(12), event.getProduct("hits", Integer.class));
        Handle<Number> handle = event.getHandle("hits", Number.class);
        assertEquals(12, handle.get().intValue());
        assertEquals(event.id(), handle.id());
    }

    @Test(expected = TypeMismatchException.class)
    public void testWrongTypeRejected() {
        event.getProduct("hits", String.class);
    }

    @Test(expected = ProductNotFoundException.class)
    public void testMissingLocalProductRejected() {
        event.getProduct("calibration", Double.class);
    }

    @Test
    public void testContinuationKeepsIdAndParentAndAddsProducts() {
        ProductStore cont = event.makeContinuation("tracker", Products.of("tracks", 3));
        assertEquals(event.id(), cont.id());
        assertSame(run, cont.parent());
        assertEquals("tracker", cont.source());
        assertEquals(Set.of("hits", "tracks"), cont.productNames());
        assertEquals(Set.of("tracks"), cont.createdProductNames());
        assertEquals(Set.of("hits"), event.createdProductNames());
        assertFalse(event.containsProduct("tracks"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testContinuationRejectsDuplicateProduct() {
        event.makeContinuation("tracker", Products.of("hits", 1));
    }

    @Test
    public void testFlushCarriesNoProducts() {
        ProductStore flush = event.makeFlush();
        assertTrue(flush.isFlush());
        assertEquals(Stage.FLUSH, flush.stage());
        assertEquals(event.id(), flush.id());
        assertTrue(flush.productNames().isEmpty());
    }

    @Test
    public void testMostDerivedPicksDescendant() {
        assertSame(event, ProductStore.mostDerived(job, event, run));
        assertSame(event, ProductStore.moreDerived(run, event));
        assertSame(run, ProductStore.moreDerived(run, run));
    }

    @Test(expected = IllegalStateException.class)
    public void testMostDerivedRejectsSiblingBranches() {
        ProductStore otherRun = job.makeChild(1, "run");
        ProductStore.moreDerived(event, otherRun);
    }

    @Test
    public void testHandlesCompareByIdentity() {
        String value = new String("x");
        Handle<String> a = new Handle<>(value, event.id());
        Handle<String> b = new Handle<>(value, event.id());
        Handle<String> c = new Handle<>(new String("x"), event.id());
        assertEquals(a, b);
        assertNotEquals(a, c);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testProductsRejectDuplicateKeys() {
        new Products().add("a", 1).add("a", 2);
    }
}
