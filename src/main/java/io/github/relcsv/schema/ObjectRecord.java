package io.github.relcsv.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One JSON object assigned to a table, together with the identifiers needed to write it as a row.
 */
public final class ObjectRecord {

    private final ObjectNode node;
    private final long rowId;
    private final Long parentRowId;
    private final ObjectTableDefinition table;
    private final String jsonPath;

    ObjectRecord(ObjectNode node, long rowId, Long parentRowId, ObjectTableDefinition table, String jsonPath) {
        this.node = node;
        this.rowId = rowId;
        this.parentRowId = parentRowId;
        this.table = table;
        this.jsonPath = jsonPath;
    }

    public ObjectNode getNode() {
        return node;
    }

    public long getRowId() {
        return rowId;
    }

    /**
     * Returns the row id of the object this one was nested in, or null when it has none.
     */
    public Long getParentRowId() {
        return parentRowId;
    }

    public ObjectTableDefinition getTable() {
        return table;
    }

    public String getJsonPath() {
        return jsonPath;
    }

    /**
     * Returns the value of a field, or null when the object does not have it.
     */
    public JsonNode get(String fieldName) {
        return node.get(fieldName);
    }

    @Override
    public String toString() {
        return "ObjectRecord{table=" + table.getName() + ", id=" + rowId + ", parentId=" + parentRowId
                + ", path=" + jsonPath + "}";
    }
}
