package com.dataflow.sdg.api;

/** Callable that drives a source through the whole run. */
@FunctionalInterface
public interface NextStore {
    void next(FrameworkDriver driver);
}
