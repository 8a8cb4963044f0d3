package io.github.relcsv.schema;

/**
 * Base exception for all schema inference errors.
 */
public class RelationalSchemaException extends RuntimeException {

    private final String jsonPath;

    public RelationalSchemaException(String jsonPath, String message) {
        super(message);
        this.jsonPath = jsonPath;
    }

    /**
     * Returns the JSON path of the node that caused the error, if known.
     */
    public String getJsonPath() {
        return jsonPath;
    }

    @Override
    public String getMessage() {
        if (jsonPath != null && !jsonPath.isEmpty()) {
            return jsonPath + ": " + super.getMessage();
        }
        return super.getMessage();
    }
}
