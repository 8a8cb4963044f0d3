package io.github.relcsv.schema;

import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A table for arrays of scalars: one row per element, linked to the object holding the array.
 *
 * <p>Rows are not stored. The arrays themselves are kept with the id of their owning row
 * and expanded when the table is written.</p>
 */
public class JunctionTableDefinition extends TableDefinition {

    private final Deque<ScalarArraySource> sources = new ArrayDeque<>();

    JunctionTableDefinition(String name, String ownerTableName) {
        super(name, ownerTableName);
    }

    @Override
    public List<String> getColumns() {
        return List.of(getOwnerColumn(), TableNames.ITEM_INDEX_COLUMN, TableNames.VALUE_COLUMN);
    }

    public String getOwnerTableName() {
        return parentTableName;
    }

    public String getOwnerColumn() {
        return TableNames.foreignKeyColumn(parentTableName);
    }

    /**
     * Returns the recorded arrays in output order.
     */
    public List<ScalarArraySource> getSources() {
        return new ArrayList<>(sources);
    }

    @Override
    public int getRowCount() {
        int count = 0;
        for (ScalarArraySource source : sources) {
            count += source.values().size();
        }
        return count;
    }

    @Override
    public boolean isJunction() {
        return true;
    }

    void addSource(Long ownerRowId, ArrayNode values, String jsonPath, InferenceConfig.RowOrder order) {
        ScalarArraySource source = new ScalarArraySource(ownerRowId, values, jsonPath);
        if (order == InferenceConfig.RowOrder.PREPEND) {
            sources.addFirst(source);
        } else {
            sources.addLast(source);
        }
    }
}
