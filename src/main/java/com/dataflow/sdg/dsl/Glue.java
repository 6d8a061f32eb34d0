package com.dataflow.sdg.dsl;

import com.dataflow.sdg.api.NodeKind;
import com.dataflow.sdg.config.Configuration;
import com.dataflow.sdg.engine.NodeCatalog;
import com.dataflow.sdg.model.AlgorithmName;
import com.dataflow.sdg.model.Label;
import com.dataflow.sdg.model.QualifiedName;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Registration context shared by a graph proxy and the bound proxies made
 * from it.
 *
 * <p>
 * Qualifies algorithm names with the module's plugin label, opens one
 * registrar per statement and remembers every registrar it opened so the
 * statements left without an explicit commit can be finalized when the
 * module entry point returns.
 */
@Log4j2
final class Glue {
    static final String MODULE_LABEL_KEY = "module_label";

    private final NodeCatalog catalog;
    private final Configuration config;
    private final String plugin;
    private final List<Registrar> opened = new ArrayList<>();

    Glue(NodeCatalog catalog, Configuration config) {
        this.catalog = catalog;
        this.config = config;
        this.plugin = config.getString(MODULE_LABEL_KEY, "");
    }

    NodeCatalog catalog() {
        return catalog;
    }

    Configuration config() {
        return config;
    }

    /** Parses a statement's name, adding the module's plugin if it has none. */
    AlgorithmName algorithmName(String name) {
        AlgorithmName parsed = AlgorithmName.create(name);
        if (parsed.hasPlugin() || plugin.isEmpty())
            return parsed;
        return new AlgorithmName(plugin, parsed.algorithm());
    }

    Registrar open(NodeKind kind, AlgorithmName name) {
        Registrar registrar = new Registrar(catalog, kind.name().toLowerCase() + " '" + name.full() + "'");
        opened.add(registrar);
        return registrar;
    }

    /**
     * Builds the registrar's creator: outputs are qualified by the node's name
     * and default to the algorithm name for product-creating kinds.
     */
    static Registrar.NodeCreator creator(NodeKind kind, AlgorithmName name, List<Label> inputs,
            NodeFactory factory) {
        return (predicates, outputProducts) -> {
            List<String> outputs = outputProducts;
            if (outputs.isEmpty() && kind.createsProducts())
                outputs = List.of(name.algorithm());
            return factory.create(inputs, predicates, QualifiedName.toQualifiedNames(name, outputs));
        };
    }

    /**
     * Commits every statement still open, in declaration order.
     *
     * @throws IllegalStateException naming every statement that never declared
     *                               its inputs; the other statements are
     *                               committed first
     */
    void sweep() {
        int committed = 0;
        List<String> empty = new ArrayList<>();
        for (Registrar registrar : opened) {
            if (registrar.isCommitted())
                continue;
            if (!registrar.hasCreator()) {
                empty.add(registrar.statement());
                continue;
            }
            registrar.close();
            committed++;
        }
        opened.clear();
        if (committed > 0)
            log.debug("Finalized {} open statement(s) at end of module", committed);
        if (!empty.isEmpty())
            throw new IllegalStateException("Registration ended before the input family was declared for "
                    + String.join(", ", empty));
    }
}
