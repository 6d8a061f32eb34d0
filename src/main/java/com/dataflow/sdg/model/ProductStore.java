package com.dataflow.sdg.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Hierarchical container of named, typed products for one scope instance.
 *
 * <p>
 * Stores form an immutable tree: every store keeps a reference to its parent
 * store, so a node working on an event can transparently read a product that
 * was produced for the enclosing run (see {@link #storeForProduct(String)}).
 *
 * <h3>Thread-safety</h3>
 * <p>
 * A store is populated exactly once, from a {@link Products} instance filled
 * by a single writer before the store is constructed. After construction the
 * product map is read-only and the store may be shared freely between
 * execution threads. A store never mutates its parent.
 *
 * <h3>Stages</h3>
 * <p>
 * A {@link Stage#FLUSH} store carries no products. It signals that the scope
 * identified by its id is complete, which triggers finalization of partitioned
 * state such as fold accumulators.
 */
public final class ProductStore {
    private final ProductStore parent;
    private final LevelId id;
    private final String source;
    private final Stage stage;
    private final Map<String, Products.Product> products;
    private final Set<String> created;

    private ProductStore(ProductStore parent, LevelId id, String source, Stage stage, Products products) {
        this(parent, id, source, stage, products, null);
    }

    private ProductStore(ProductStore parent, LevelId id, String source, Stage stage, Products products,
            Set<String> created) {
        this.parent = parent;
        this.id = id;
        this.source = source == null ? "" : source;
        this.stage = stage;
        this.products = products == null ? Map.of() : products.freeze();
        this.created = created == null ? this.products.keySet() : created;
    }

    /** Creates the root store of a run: root id, no products, process stage. */
    public static ProductStore base() {
        return base("");
    }

    public static ProductStore base(String source) {
        return new ProductStore(null, LevelId.base(), source, Stage.PROCESS, null);
    }

    /** Creates the root store of a run holding the given products. */
    public static ProductStore base(String source, Products products) {
        return new ProductStore(null, LevelId.base(), source, Stage.PROCESS, products);
    }

    // ── Derived stores ───────────────────────────────────────────

    /**
     * Creates a store one level below this one holding the given products.
     *
     * @param levelNumber number of the new scope within its level
     * @param levelName   name of the new level (e.g. "event")
     * @param source      tag of the creator
     * @param newProducts products installed at construction
     */
    public ProductStore makeChild(long levelNumber, String levelName, String source, Products newProducts) {
        return new ProductStore(this, id.makeChild(levelNumber, levelName), source, Stage.PROCESS, newProducts);
    }

    /** Creates an empty store one level below this one, e.g. a scope boundary. */
    public ProductStore makeChild(long levelNumber, String levelName, String source, Stage stage) {
        return new ProductStore(this, id.makeChild(levelNumber, levelName), source, stage, null);
    }

    public ProductStore makeChild(long levelNumber, String levelName) {
        return makeChild(levelNumber, levelName, "", Stage.PROCESS);
    }

    /**
     * Creates a store for the same scope holding this store's products plus the
     * new ones. The continuation has the same id and parent as this store.
     *
     * @throws IllegalArgumentException if a new product name already exists here
     */
    public ProductStore makeContinuation(String source, Products newProducts) {
        Products merged = new Products();
        for (Map.Entry<String, Products.Product> e : products.entrySet())
            merged.put(e.getKey(), e.getValue());
        Set<String> added = Set.of();
        if (newProducts != null) {
            for (Map.Entry<String, Products.Product> e : newProducts.entries().entrySet())
                merged.put(e.getKey(), e.getValue());
            added = Set.copyOf(newProducts.keys());
        }
        return new ProductStore(parent, id, source, stage, merged, added);
    }

    /** Creates the flush signal for this store's scope. */
    public ProductStore makeFlush() {
        return new ProductStore(parent, id, source, Stage.FLUSH, null);
    }

    // ── Navigation ───────────────────────────────────────────────

    /** @return the parent store, or null for the root. */
    public ProductStore parent() {
        return parent;
    }

    /** Nearest store (this one or an ancestor) at the given level, or null. */
    public ProductStore parent(String levelName) {
        for (ProductStore s = this; s != null; s = s.parent) {
            if (s.id.levelName().equals(levelName))
                return s;
        }
        return null;
    }

    /**
     * Walks from this store up through its ancestors and returns the nearest
     * store whose own products contain {@code productName}.
     */
    public Optional<ProductStore> storeForProduct(String productName) {
        for (ProductStore s = this; s != null; s = s.parent) {
            if (s.products.containsKey(productName))
                return Optional.of(s);
        }
        return Optional.empty();
    }

    public LevelId id() {
        return id;
    }

    public String levelName() {
        return id.levelName();
    }

    public String source() {
        return source;
    }

    public Stage stage() {
        return stage;
    }

    public boolean isFlush() {
        return stage == Stage.FLUSH;
    }

    // ── Product access ───────────────────────────────────────────

    /** True if this store's own products contain the key (no ancestor walk). */
    public boolean containsProduct(String key) {
        return products.containsKey(key);
    }

    public Set<String> productNames() {
        return products.keySet();
    }

    /**
     * Products introduced by this store: all local products for a new scope,
     * only the added ones for a continuation.
     */
    public Set<String> createdProductNames() {
        return created;
    }

    /** Declared type of a local product. */
    public Class<?> productType(String key) {
        return entry(key).type();
    }

    public <T> T getProduct(String key, Class<T> type) {
        return getHandle(key, type).get();
    }

    /**
     * Returns a typed handle to a local product.
     *
     * @throws ProductNotFoundException if the product is not held by this store
     * @throws TypeMismatchException    if the declared type is not assignable to
     *                                  {@code type}
     */
    public <T> Handle<T> getHandle(String key, Class<T> type) {
        Products.Product p = entry(key);
        if (!type.isAssignableFrom(p.type()))
            throw new TypeMismatchException(key, p.type(), type);
        return new Handle<>(type.cast(p.value()), id);
    }

    /** Untyped access used by the execution substrate. */
    public Object getValue(String key) {
        return entry(key).value();
    }

    private Products.Product entry(String key) {
        Products.Product p = products.get(key);
        if (p == null)
            throw new ProductNotFoundException(key, " in store " + id);
        return p;
    }

    // ── Join resolution ──────────────────────────────────────────

    /**
     * Returns the more derived of two stores: the one whose id extends the
     * other's. Equal ids resolve to {@code a}.
     *
     * @throws IllegalStateException if neither id is a prefix of the other
     */
    public static ProductStore moreDerived(ProductStore a, ProductStore b) {
        if (b.id.depth() > a.id.depth()) {
            if (b.id.hasPrefix(a.id))
                return b;
        } else if (a.id.hasPrefix(b.id)) {
            return a;
        }
        throw new IllegalStateException("Cannot determine the more derived store: " + a.id + " and " + b.id
                + " are on different branches of the hierarchy");
    }

    /** Descendant-most store among several that share one ancestor path. */
    public static ProductStore mostDerived(List<ProductStore> stores) {
        if (stores.isEmpty())
            throw new IllegalArgumentException("mostDerived requires at least one store");
        ProductStore result = stores.get(0);
        for (int i = 1; i < stores.size(); i++)
            result = moreDerived(result, stores.get(i));
        return result;
    }

    public static ProductStore mostDerived(ProductStore first, ProductStore... rest) {
        ProductStore result = Objects.requireNonNull(first);
        for (ProductStore s : rest)
            result = moreDerived(result, s);
        return result;
    }

    @Override
    public String toString() {
        return "ProductStore{id=" + id + ", source=" + source + ", stage=" + stage + ", products="
                + products.keySet() + "}";
    }
}
