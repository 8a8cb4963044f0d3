package io.github.relcsv.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A table whose rows are JSON objects of one structural shape.
 *
 * <p>Columns are {@code id}, then {@code <parent>_id} when the table has a structural parent,
 * then one column per scalar-valued field in the order the fields were first seen. Fields
 * holding objects or arrays are part of the shape but become child tables, not columns.</p>
 *
 * <p>A field whose name equals one of the key columns is written under the header
 * {@code source_<field>} so headers stay unique.</p>
 */
public class ObjectTableDefinition extends TableDefinition {

    private static final String SOURCE_PREFIX = "source_";

    private final Set<String> fieldSignature;
    private final List<String> dataColumns;
    private final Deque<ObjectRecord> rows = new ArrayDeque<>();

    ObjectTableDefinition(String name, String parentTableName, ObjectNode firstObject) {
        super(name, parentTableName);
        this.fieldSignature = fieldNames(firstObject);
        this.dataColumns = new ArrayList<>();
        extendWith(firstObject);
    }

    @Override
    public List<String> getColumns() {
        List<String> columns = new ArrayList<>(dataColumns.size() + 2);
        columns.add(TableNames.ID_COLUMN);
        if (hasParentForeignKey()) {
            columns.add(getForeignKeyColumn());
        }
        Set<String> taken = new HashSet<>(columns);
        for (String field : dataColumns) {
            String header = field;
            while (taken.contains(header)) {
                header = SOURCE_PREFIX + header;
            }
            taken.add(header);
            columns.add(header);
        }
        return columns;
    }

    /**
     * Returns the name of the parent id column, or null when the table has no parent.
     */
    public String getForeignKeyColumn() {
        return hasParentForeignKey() ? TableNames.foreignKeyColumn(parentTableName) : null;
    }

    public List<String> getDataColumns() {
        return Collections.unmodifiableList(dataColumns);
    }

    /**
     * Returns every field name of the objects this table was built from, nested ones included.
     */
    public Set<String> getFieldSignature() {
        return Collections.unmodifiableSet(fieldSignature);
    }

    public boolean matches(Set<String> fieldNames) {
        return fieldSignature.equals(fieldNames);
    }

    /**
     * Returns the rows in output order.
     */
    public List<ObjectRecord> getRows() {
        return new ArrayList<>(rows);
    }

    @Override
    public int getRowCount() {
        return rows.size();
    }

    @Override
    public boolean isJunction() {
        return false;
    }

    void addRow(ObjectRecord record, InferenceConfig.RowOrder order) {
        if (order == InferenceConfig.RowOrder.PREPEND) {
            rows.addFirst(record);
        } else {
            rows.addLast(record);
        }
    }

    /**
     * Adds the fields of {@code object} this table does not know yet. Returns the new data columns.
     */
    List<String> extendWith(ObjectNode object) {
        List<String> added = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            fieldSignature.add(field.getKey());
            if (!field.getValue().isContainerNode() && !dataColumns.contains(field.getKey())) {
                dataColumns.add(field.getKey());
                added.add(field.getKey());
            }
        }
        return added;
    }

    /**
     * Returns the fields of {@code object} holding a non-null scalar that this table has no
     * column for, such as a field that held an object or an array when the table was created.
     */
    Set<String> scalarFieldsWithoutColumn(ObjectNode object) {
        Set<String> uncovered = new LinkedHashSet<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isContainerNode() && !value.isNull() && !dataColumns.contains(field.getKey())) {
                uncovered.add(field.getKey());
            }
        }
        return uncovered;
    }

    static Set<String> fieldNames(ObjectNode object) {
        Set<String> names = new LinkedHashSet<>();
        object.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
