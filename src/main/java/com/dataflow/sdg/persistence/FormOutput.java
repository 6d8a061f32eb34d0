package com.dataflow.sdg.persistence;

import com.dataflow.sdg.fn.OutputFn;
import com.dataflow.sdg.model.ProductStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Output body persisting the configured products of every store it
 * receives.
 *
 * <p>
 * Only the products a store introduced are written, so a product is stored
 * once even though later continuations of the scope still carry it. The
 * creator is the store's source and the product id is the scope id, e.g.
 * {@code [run:0, event:3]}.
 *
 * <pre>
 * FormInterface form = FormInterface.inMemory(items);
 * graph.output("persist", new FormOutput(form));
 * </pre>
 */
public final class FormOutput implements OutputFn {
    static final String UNNAMED_SOURCE = "source";

    private final FormInterface form;

    public FormOutput(FormInterface form) {
        this.form = form;
    }

    @Override
    public void write(ProductStore store) {
        String id = store.id().toString();
        List<FormProduct> batch = new ArrayList<>();
        for (String name : store.createdProductNames()) {
            if (form.isConfigured(name))
                batch.add(new FormProduct(name, id, store.getValue(name), store.productType(name)));
        }
        if (!batch.isEmpty())
            form.write(creator(store), batch);
    }

    static String creator(ProductStore store) {
        return store.source().isEmpty() ? UNNAMED_SOURCE : store.source();
    }
}
