package com.dataflow.sdg.persistence;

import com.dataflow.sdg.model.ProductNotFoundException;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class InMemoryPersistenceTest {

    private InMemoryPersistence persistence;

    @Before
    public void setUp() {
        persistence = new InMemoryPersistence();
        persistence.configureOutputItems(new OutputItemConfig()
                .addItem("hits", "out.mem", Technology.IN_MEMORY)
                .addItem("tracks", "out.mem", Technology.HDF5)
                .addItem("clusters", "clusters.h5", Technology.HDF5));
        persistence.configureTechSettings(new TechSettingConfig());
    }

    @Test
    public void testWritesVisibleOnlyAfterCommit() {
        persistence.createContainers("tracker", Map.of("hits", "java.lang.Integer"));
        persistence.registerWrite("tracker", "hits", 5, "java.lang.Integer");
        try {
            persistence.read("tracker", "hits", "e1", "java.lang.Integer");
            fail("Uncommitted write must not be readable");
        } catch (ProductNotFoundException expected) {
            // staged only
        }
        persistence.commitOutput("tracker", "e1");
        assertEquals(5, persistence.read("tracker", "hits", "e1", "java.lang.Integer"));
    }

    @Test
    public void testContainerOfOtherTechnologyInSameFileRejected() {
        persistence.createContainers("tracker", Map.of("hits", "java.lang.Integer"));
        try {
            persistence.createContainers("tracker", Map.of("tracks", "java.lang.Integer"));
            fail("Expected TechnologyMismatchException");
        } catch (TechnologyMismatchException e) {
            assertTrue(e.getMessage().contains("out.mem"));
        }
    }

    @Test(expected = TechnologyMismatchException.class)
    public void testForeignTechnologyRejected() {
        persistence.createContainers("tracker", Map.of("clusters", "java.lang.Integer"));
    }

    @Test(expected = UnconfiguredProductException.class)
    public void testUnconfiguredContainerRejected() {
        persistence.createContainers("tracker", Map.of("unknown", "java.lang.Integer"));
    }

    @Test(expected = IllegalStateException.class)
    public void testWriteWithoutContainerRejected() {
        persistence.registerWrite("tracker", "hits", 5, "java.lang.Integer");
    }

    @Test(expected = IllegalStateException.class)
    public void testSecondCommitOfSameIdRejected() {
        persistence.createContainers("tracker", Map.of("hits", "java.lang.Integer"));
        persistence.registerWrite("tracker", "hits", 5, "java.lang.Integer");
        persistence.commitOutput("tracker", "e1");
        persistence.registerWrite("tracker", "hits", 6, "java.lang.Integer");
        persistence.commitOutput("tracker", "e1");
    }

    @Test
    public void testCreatorsHaveSeparateContainers() {
        persistence.createContainers("a", Map.of("hits", "java.lang.Integer"));
        persistence.createContainers("b", Map.of("hits", "java.lang.Integer"));
        persistence.registerWrite("a", "hits", 1, "java.lang.Integer");
        persistence.registerWrite("b", "hits", 2, "java.lang.Integer");
        persistence.commitOutput("a", "e1");
        persistence.commitOutput("b", "e1");
        assertEquals(1, persistence.read("a", "hits", "e1", "java.lang.Integer"));
        assertEquals(2, persistence.read("b", "hits", "e1", "java.lang.Integer"));
    }

    @Test
    public void testTechSettingsLookup() {
        TechSettingConfig settings = new TechSettingConfig()
                .addFileSetting(Technology.HDF5, "clusters.h5", "chunk", "1024")
                .addContainerSetting(Technology.HDF5, "tracker/clusters", "split", "99");
        assertEquals(Map.of("chunk", "1024"), settings.fileSettings(Technology.HDF5, "clusters.h5"));
        assertEquals(Map.of("split", "99"), settings.containerSettings(Technology.HDF5, "tracker/clusters"));
        assertTrue(settings.fileSettings(Technology.IN_MEMORY, "clusters.h5").isEmpty());
    }
}
