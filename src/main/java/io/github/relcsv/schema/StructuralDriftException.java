package io.github.relcsv.schema;

/**
 * Thrown when an object routed to an existing table does not match the table's shape
 * and the registry is configured with {@link InferenceConfig.DriftPolicy#FAIL}.
 */
public class StructuralDriftException extends RelationalSchemaException {

    private final String tableName;

    public StructuralDriftException(String jsonPath, String tableName, String message) {
        super(jsonPath, message);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
