package com.dataflow.sdg.persistence;

import com.dataflow.sdg.model.ProductNotFoundException;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class FormInterfaceTest {

    private InMemoryPersistence persistence;
    private FormInterface form;

    @Before
    public void setUp() {
        OutputItemConfig items = new OutputItemConfig()
                .addItem("trackStart", "toy.mem", Technology.IN_MEMORY)
                .addItem("trackNumberHits", "toy.mem", Technology.IN_MEMORY)
                .addItem("vertex", "vertex.mem", Technology.IN_MEMORY);
        TechSettingConfig settings = new TechSettingConfig()
                .addFileSetting(Technology.IN_MEMORY, "toy.mem", "compression", "none");
        persistence = new InMemoryPersistence();
        form = new FormInterface(persistence, items, settings);
    }

    @Test
    public void testSingleWriteIsReadable() {
        form.write("tracker", FormProduct.of("trackStart", "[run:0, event:1]", 4.5));
        assertEquals(Double.valueOf(4.5), form.read("tracker", "trackStart", "[run:0, event:1]", Double.class));
        assertEquals(1, persistence.committedCount("tracker", "trackStart"));
    }

    @Test
    public void testBatchSharesOneCommit() {
        form.write("tracker", List.of(
                FormProduct.of("trackStart", "e1", 1.0),
                FormProduct.of("trackNumberHits", "e1", 7)));

        assertEquals(Integer.valueOf(7), form.read("tracker", "trackNumberHits", "e1", Integer.class));
        assertEquals(Double.valueOf(1.0), form.read("tracker", "trackStart", "e1", Double.class));
        assertEquals(java.util.Set.of("tracker/trackStart", "tracker/trackNumberHits"),
                persistence.containerNames("toy.mem"));
    }

    @Test
    public void testEmptyBatchIsIgnored() {
        form.write("tracker", List.of());
        assertTrue(persistence.fileNames().isEmpty());
    }

    @Test
    public void testUnconfiguredWriteRejected() {
        try {
            form.write("tracker", FormProduct.of("unknown", "e1", 1));
            fail("Expected UnconfiguredProductException");
        } catch (UnconfiguredProductException e) {
            assertEquals("No configuration found for product: unknown", e.getMessage());
            assertEquals("unknown", e.productName());
        }
    }

    @Test(expected = UnconfiguredProductException.class)
    public void testUnconfiguredReadRejected() {
        form.read("tracker", "unknown", "e1", Integer.class);
    }

    @Test(expected = UnconfiguredProductException.class)
    public void testBatchWithUnconfiguredProductRejected() {
        form.write("tracker", List.of(
                FormProduct.of("trackStart", "e1", 1.0),
                FormProduct.of("unknown", "e1", 2)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBatchWithMixedIdsRejected() {
        form.write("tracker", List.of(
                FormProduct.of("trackStart", "e1", 1.0),
                FormProduct.of("trackNumberHits", "e2", 2)));
    }

    @Test(expected = ProductNotFoundException.class)
    public void testReadOfUncommittedIdFails() {
        form.write("tracker", FormProduct.of("trackStart", "e1", 1.0));
        form.read("tracker", "trackStart", "e2", Double.class);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReadWithWrongTypeFails() {
        form.write("tracker", FormProduct.of("trackStart", "e1", 1.0));
        form.read("tracker", "trackStart", "e1", Integer.class);
    }

    @Test
    public void testProductsRoutedToTheirFiles() {
        form.write("tracker", FormProduct.of("trackStart", "e1", 1.0));
        form.write("finder", FormProduct.of("vertex", "e1", "v"));
        assertEquals(java.util.Set.of("toy.mem", "vertex.mem"), persistence.fileNames());
        assertEquals(java.util.Set.of("finder/vertex"), persistence.containerNames("vertex.mem"));
    }

    @Test
    public void testFailedBatchCommitsNothing() {
        form.write("tracker", FormProduct.of("trackStart", "e1", 1.0));
        try {
            form.write("tracker", List.of(
                    FormProduct.of("trackNumberHits", "e1", 7),
                    FormProduct.of("trackStart", "e1", 2.0)));
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("tracker/trackStart"));
        }
        assertEquals(0, persistence.committedCount("tracker", "trackNumberHits"));
        assertEquals(Double.valueOf(1.0), form.read("tracker", "trackStart", "e1", Double.class));

        // Nothing stays staged from the failed batch
        form.write("tracker", FormProduct.of("trackNumberHits", "e2", 3));
        assertEquals(1, persistence.committedCount("tracker", "trackNumberHits"));
    }
}
