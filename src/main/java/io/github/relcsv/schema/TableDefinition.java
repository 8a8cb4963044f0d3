package io.github.relcsv.schema;

import java.util.List;

/**
 * An inferred relational table: a unique name and an ordered column layout.
 */
public abstract class TableDefinition {

    protected final String name;
    protected final String parentTableName;

    protected TableDefinition(String name, String parentTableName) {
        this.name = name;
        this.parentTableName = parentTableName;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the table whose rows this table's rows point at, or null for a top-level table.
     */
    public String getParentTableName() {
        return parentTableName;
    }

    public boolean hasParentForeignKey() {
        return parentTableName != null;
    }

    /**
     * Returns the column names in output order.
     */
    public abstract List<String> getColumns();

    /**
     * Returns the number of data rows the table will materialize.
     */
    public abstract int getRowCount();

    public abstract boolean isJunction();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', columns=" + getColumns()
                + ", rows=" + getRowCount() + "}";
    }
}
