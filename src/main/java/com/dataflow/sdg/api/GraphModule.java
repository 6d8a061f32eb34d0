package com.dataflow.sdg.api;

import com.dataflow.sdg.config.Configuration;
import com.dataflow.sdg.dsl.GraphProxy;

/**
 * Entry point of a plugin module.
 *
 * <p>
 * Invoked once per loaded module during the single-threaded build phase. An
 * implementation issues zero or more complete declaration statements on the
 * given graph and returns.
 */
@FunctionalInterface
public interface GraphModule {
    void create(GraphProxy graph, Configuration config);
}
