package com.dataflow.sdg.model;

import org.junit.Test;

import java.util.TreeMap;

import static org.junit.Assert.*;

public class AlgorithmNameTest {

    @Test
    public void testCreateWithPlugin() {
        AlgorithmName name = AlgorithmName.create("reco:tracker");
        assertEquals("reco", name.plugin());
        assertEquals("tracker", name.algorithm());
        assertEquals(AlgorithmName.SpecifiedFields.BOTH, name.fields());
        assertEquals("reco:tracker", name.full());
    }

    @Test
    public void testCreateAlgorithmOnly() {
        AlgorithmName name = AlgorithmName.create("tracker");
        assertEquals("", name.plugin());
        assertEquals(AlgorithmName.SpecifiedFields.EITHER, name.fields());
        assertFalse(name.hasPlugin());
        assertEquals("tracker", name.full());
    }

    @Test(expected = NameParseException.class)
    public void testEmptySpecRejected() {
        AlgorithmName.create("");
    }

    @Test(expected = NameParseException.class)
    public void testTwoSeparatorsRejected() {
        AlgorithmName.create("a:b:c");
    }

    @Test(expected = NameParseException.class)
    public void testEmptyPartRejected() {
        AlgorithmName.create(":tracker");
    }

    @Test
    public void testMatchTreatsUnsetFieldsAsWildcards() {
        AlgorithmName full = AlgorithmName.create("reco:tracker");
        assertTrue(AlgorithmName.create("tracker").match(full));
        assertTrue(full.match(AlgorithmName.create("tracker")));
        assertTrue(AlgorithmName.unspecified().match(full));
        assertFalse(AlgorithmName.create("other:tracker").match(full));
        assertFalse(AlgorithmName.create("fitter").match(full));
    }

    @Test
    public void testEqualityIgnoresSpecifiedFields() {
        AlgorithmName explicit = new AlgorithmName("", "tracker", AlgorithmName.SpecifiedFields.EITHER);
        AlgorithmName both = new AlgorithmName("", "tracker");
        assertEquals(explicit, both);
        assertEquals(explicit.hashCode(), both.hashCode());
    }

    @Test
    public void testOrderingIsLexicographicOnPluginThenAlgorithm() {
        TreeMap<AlgorithmName, Integer> map = new TreeMap<>();
        map.put(AlgorithmName.create("b:a"), 3);
        map.put(AlgorithmName.create("a:z"), 2);
        map.put(AlgorithmName.create("a:b"), 1);
        map.put(AlgorithmName.create("zz"), 0);
        assertEquals("zz", map.firstKey().full());
        assertEquals("b:a", map.lastKey().full());
        assertEquals(Integer.valueOf(1), map.get(AlgorithmName.create("a:b")));
    }
}
