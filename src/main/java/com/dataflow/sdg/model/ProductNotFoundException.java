package com.dataflow.sdg.model;

/**
 * Thrown when a product is requested from a store that does not hold it
 * locally.
 */
public class ProductNotFoundException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String productName;

    public ProductNotFoundException(String productName, String context) {
        super("No product exists with the name '" + productName + "'" + context);
        this.productName = productName;
    }

    public String productName() {
        return productName;
    }
}
