package io.github.relcsv.schema;

/**
 * A non-fatal issue found while inferring a schema.
 *
 * @param kind what went wrong
 * @param jsonPath where in the document it happened
 * @param tableName the table involved
 * @param message human readable detail
 */
public record Diagnostic(Kind kind, String jsonPath, String tableName, String message) {

    public enum Kind {
        /** An object's field set, or a field's scalar/container kind, differs from the table it was routed to */
        STRUCTURAL_DRIFT,
        /** An array element's type differs from the type of the array's first element */
        MIXED_ARRAY_ELEMENT,
        /** An array nested directly inside a scalar array; written as an empty cell */
        NESTED_ARRAY,
        /** A table name is already used by a table of the other kind */
        TABLE_KIND_CONFLICT
    }

    @Override
    public String toString() {
        return kind + " [" + tableName + "] " + (jsonPath != null ? jsonPath + ": " : "") + message;
    }
}
