package com.dataflow.sdg.model;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class LevelHierarchyTest {

    @Test
    public void testCountsPerLevelPosition() {
        LevelHierarchy hierarchy = new LevelHierarchy();
        LevelId job = LevelId.base();
        hierarchy.incrementCount(job);
        for (int r = 0; r < 2; r++) {
            LevelId run = job.makeChild(r, "run");
            hierarchy.incrementCount(run);
            for (int e = 0; e < 3; e++)
                hierarchy.incrementCount(run.makeChild(e, "event"));
        }
        hierarchy.incrementCount(job.makeChild(0, "calibration").makeChild(0, "event"));

        assertEquals(1, hierarchy.countFor("job"));
        assertEquals(2, hierarchy.countFor("run"));
        assertEquals(7, hierarchy.countFor("event"));
        assertEquals(0, hierarchy.countFor("subrun"));
    }

    @Test
    public void testGraphLayoutIndentsChildren() {
        LevelHierarchy hierarchy = new LevelHierarchy();
        LevelId run = LevelId.base().makeChild(0, "run");
        hierarchy.incrementCount(LevelId.base());
        hierarchy.incrementCount(run);
        hierarchy.incrementCount(run.makeChild(0, "event"));
        hierarchy.incrementCount(run.makeChild(1, "event"));

        assertEquals("job: 1\n  run: 1\n    event: 2\n", hierarchy.graphLayout());
    }

    @Test
    public void testConcurrentIncrements() throws InterruptedException {
        LevelHierarchy hierarchy = new LevelHierarchy();
        LevelId run = LevelId.base().makeChild(0, "run");
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int offset = t * 1000;
            Thread thread = new Thread(() -> {
                for (int i = 0; i < 1000; i++)
                    hierarchy.incrementCount(run.makeChild(offset + i, "event"));
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads)
            thread.join();
        assertEquals(4000, hierarchy.countFor("event"));
    }
}
