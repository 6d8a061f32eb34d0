package com.dataflow.sdg.model;

/**
 * Thrown when a product is requested with a type that its declared type is
 * not assignable to.
 */
public class TypeMismatchException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String productName;
    private final Class<?> declaredType;
    private final Class<?> requestedType;

    public TypeMismatchException(String productName, Class<?> declaredType, Class<?> requestedType) {
        super("Cannot get product '" + productName + "' with type '" + requestedType.getName()
                + "' -- must specify type '" + declaredType.getName() + "'.");
        this.productName = productName;
        this.declaredType = declaredType;
        this.requestedType = requestedType;
    }

    public String productName() {
        return productName;
    }

    public Class<?> declaredType() {
        return declaredType;
    }

    public Class<?> requestedType() {
        return requestedType;
    }
}
