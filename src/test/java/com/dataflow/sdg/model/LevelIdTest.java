package com.dataflow.sdg.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class LevelIdTest {

    @Test
    public void testBaseIsTheJobLevel() {
        LevelId base = LevelId.base();
        assertEquals("job", base.levelName());
        assertEquals(0, base.depth());
        assertFalse(base.hasParent());
        assertTrue(base.path().isEmpty());
    }

    @Test
    public void testChildExtendsPathByOneSegment() {
        LevelId run = LevelId.base().makeChild(3, "run");
        LevelId event = run.makeChild(7, "event");
        assertEquals(2, event.depth());
        assertSame(run, event.parent());
        assertEquals("[run:3, event:7]", event.toString());
        assertSame(run, event.parent("run"));
        assertNull(event.parent("subrun"));
    }

    @Test
    public void testEqualityFollowsPath() {
        LevelId a = LevelId.base().makeChild(1, "run").makeChild(2, "event");
        LevelId b = LevelId.base().makeChild(1, "run").makeChild(2, "event");
        LevelId c = LevelId.base().makeChild(1, "run").makeChild(3, "event");
        assertEquals(a, b);
        assertEquals(a.hash(), b.hash());
        assertNotEquals(a, c);
        assertNotEquals(a.hash(), c.hash());
    }

    @Test
    public void testLevelHashSharedByAllInstancesOfALevel() {
        LevelId e1 = LevelId.base().makeChild(0, "run").makeChild(0, "event");
        LevelId e2 = LevelId.base().makeChild(5, "run").makeChild(9, "event");
        LevelId other = LevelId.base().makeChild(0, "calibration").makeChild(0, "event");
        assertEquals(e1.levelHash(), e2.levelHash());
        assertNotEquals(e1.levelHash(), other.levelHash());
    }

    @Test
    public void testPrefixRelations() {
        LevelId run = LevelId.base().makeChild(0, "run");
        LevelId event = run.makeChild(1, "event");
        assertTrue(event.hasPrefix(run));
        assertTrue(event.hasPrefix(event));
        assertTrue(run.isAncestorOf(event));
        assertFalse(event.isAncestorOf(event));
        assertFalse(LevelId.base().makeChild(1, "run").isAncestorOf(event));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeNumberRejected() {
        LevelId.base().makeChild(-1, "run");
    }
}
