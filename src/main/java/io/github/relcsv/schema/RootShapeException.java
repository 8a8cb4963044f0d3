package io.github.relcsv.schema;

/**
 * Thrown when the top-level JSON value is not an object or an array.
 */
public class RootShapeException extends RelationalSchemaException {

    private final String actualType;

    public RootShapeException(String actualType) {
        super("$", "Root of JSON data must be an object or an array, but was " + actualType);
        this.actualType = actualType;
    }

    /**
     * Returns the node type found at the root.
     */
    public String getActualType() {
        return actualType;
    }
}
