package com.runtree.model;

/**
 * Thrown when constructing or configuring a model object fails: the attribute does not exist,
 * the value cannot be coerced to the attribute's shape, or a read-only attribute would change.
 */
public final class AttributeException extends DataException {

    private final String modelType;
    private final String attribute;

    public AttributeException(String modelType, String attribute, String message) {
        super(message);
        this.modelType = modelType;
        this.attribute = attribute;
    }

    public AttributeException(String modelType, String attribute, String message, Throwable cause) {
        super(message, cause);
        this.modelType = modelType;
        this.attribute = attribute;
    }

    /** Simple name of the model type being configured (e.g. {@code Keyword}). */
    public String getModelType() {
        return modelType;
    }

    /** Offending attribute name, or null when the failure is not tied to one attribute. */
    public String getAttribute() {
        return attribute;
    }
}
