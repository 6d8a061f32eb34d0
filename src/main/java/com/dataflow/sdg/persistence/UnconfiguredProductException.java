package com.dataflow.sdg.persistence;

/** A product was written or read that has no persistence configuration. */
public class UnconfiguredProductException extends RuntimeException {
    private final String productName;

    public UnconfiguredProductException(String productName) {
        super("No configuration found for product: " + productName);
        this.productName = productName;
    }

    public String productName() {
        return productName;
    }
}
