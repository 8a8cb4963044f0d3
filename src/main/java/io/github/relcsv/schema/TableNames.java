package io.github.relcsv.schema;

/**
 * Naming rules for inferred tables and their key columns.
 */
public final class TableNames {

    public static final String ID_COLUMN = "id";
    public static final String ITEM_INDEX_COLUMN = "item_index";
    public static final String VALUE_COLUMN = "value";

    private static final String SEPARATOR = "_";
    private static final String FOREIGN_KEY_SUFFIX = "_id";

    private TableNames() {
    }

    /**
     * Name of the table holding values found under {@code key} in a row of {@code parentTable}.
     * Children of the root table are named by their key alone, unless the key is the root
     * table's own name.
     */
    public static String childName(String rootTableName, String parentTable, String key) {
        if (parentTable == null || parentTable.equals(rootTableName)) {
            return key.equals(rootTableName) ? rootTableName + SEPARATOR + key : key;
        }
        return parentTable + SEPARATOR + key;
    }

    /**
     * Name of the column referencing a row of {@code tableName}.
     */
    public static String foreignKeyColumn(String tableName) {
        return tableName + FOREIGN_KEY_SUFFIX;
    }
}
