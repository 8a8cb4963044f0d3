package io.github.relcsv.schema;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The ordered set of tables built by one inference run.
 *
 * <p>Tables are looked up by name. A name, once created, always resolves to the same
 * definition; tables are never renamed, merged or removed. The registry also owns the
 * run's row id sequence and its diagnostics.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class TableRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TableRegistry.class);

    private final InferenceConfig config;
    private final Map<String, TableDefinition> tables = new LinkedHashMap<>();
    private final IdentifierSequence ids = new IdentifierSequence();
    private final InferenceDiagnostics diagnostics = new InferenceDiagnostics();

    public TableRegistry() {
        this(InferenceConfig.defaults());
    }

    public TableRegistry(InferenceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Returns the table for objects named {@code candidateName}, creating it from {@code object}'s
     * fields on first use.
     *
     * <p>When the table exists but {@code object} has a different field set, the drift is handled
     * according to {@link InferenceConfig#getDriftPolicy()}.</p>
     *
     * @param candidateName table name derived from the object's position in the document
     * @param object the object needing a table
     * @param parentTableName table of the enclosing object, or null when the object has none
     * @return the table, or null when the name is held by a junction table and the object must be skipped
     * @throws StructuralDriftException on drift under {@link InferenceConfig.DriftPolicy#FAIL}
     */
    public ObjectTableDefinition findOrCreate(String candidateName, ObjectNode object, String parentTableName) {
        TableDefinition existing = tables.get(candidateName);
        if (existing == null) {
            ObjectTableDefinition table = new ObjectTableDefinition(candidateName, parentTableName, object);
            tables.put(candidateName, table);
            LOG.debug("Created table {} with columns {}", candidateName, table.getColumns());
            return table;
        }

        if (existing.isJunction()) {
            reportDrift(Diagnostic.Kind.TABLE_KIND_CONFLICT, candidateName,
                    "an object cannot be stored in junction table '" + candidateName + "'; object skipped");
            return null;
        }

        ObjectTableDefinition table = (ObjectTableDefinition) existing;
        Set<String> fieldNames = ObjectTableDefinition.fieldNames(object);
        Set<String> withoutColumn = table.scalarFieldsWithoutColumn(object);
        if (!table.matches(fieldNames) || !withoutColumn.isEmpty()) {
            reportDrift(Diagnostic.Kind.STRUCTURAL_DRIFT, candidateName,
                    describeDrift(table, fieldNames, withoutColumn));
            if (config.getDriftPolicy() == InferenceConfig.DriftPolicy.EXTEND) {
                List<String> added = table.extendWith(object);
                if (!added.isEmpty()) {
                    LOG.debug("Extended table {} with columns {}", candidateName, added);
                }
            }
        }
        if (!Objects.equals(table.getParentTableName(), parentTableName)) {
            reportDrift(Diagnostic.Kind.STRUCTURAL_DRIFT, candidateName,
                    "reached from table '" + parentTableName + "' but its parent is '"
                            + table.getParentTableName() + "'");
        }
        return table;
    }

    /**
     * Returns the junction table named {@code name}, creating it on first use.
     *
     * @return the table, or null when the name is held by an object table and the array must be skipped
     */
    public JunctionTableDefinition findOrCreateJunction(String name, String ownerTableName) {
        TableDefinition existing = tables.get(name);
        if (existing == null) {
            JunctionTableDefinition junction = new JunctionTableDefinition(name, ownerTableName);
            tables.put(name, junction);
            LOG.debug("Created junction table {} with columns {}", name, junction.getColumns());
            return junction;
        }
        if (!existing.isJunction()) {
            reportDrift(Diagnostic.Kind.TABLE_KIND_CONFLICT, name,
                    "a scalar array cannot be stored in object table '" + name + "'; array skipped");
            return null;
        }
        return (JunctionTableDefinition) existing;
    }

    /**
     * Assigns the next row id to {@code object} and adds it to {@code table}.
     */
    public ObjectRecord addRow(ObjectTableDefinition table, ObjectNode object, Long parentRowId) {
        ObjectRecord record = new ObjectRecord(object, ids.nextId(), parentRowId, table,
                diagnostics.getCurrentPath());
        table.addRow(record, config.getRowOrder());
        return record;
    }

    /**
     * Records a scalar array for {@code junction}, to be expanded into rows when written.
     */
    public void addArray(JunctionTableDefinition junction, ArrayNode values, Long ownerRowId) {
        junction.addSource(ownerRowId, values, diagnostics.getCurrentPath(), config.getRowOrder());
    }

    /**
     * Returns all tables in creation order.
     */
    public List<TableDefinition> getTables() {
        return new ArrayList<>(tables.values());
    }

    public TableDefinition getTable(String name) {
        return tables.get(name);
    }

    public boolean hasTable(String name) {
        return tables.containsKey(name);
    }

    public List<ObjectTableDefinition> getObjectTables() {
        return tables.values().stream()
                .filter(t -> !t.isJunction())
                .map(ObjectTableDefinition.class::cast)
                .collect(Collectors.toList());
    }

    public List<JunctionTableDefinition> getJunctionTables() {
        return tables.values().stream()
                .filter(TableDefinition::isJunction)
                .map(JunctionTableDefinition.class::cast)
                .collect(Collectors.toList());
    }

    public int size() {
        return tables.size();
    }

    /**
     * Returns the number of row ids issued by this registry.
     */
    public long getIssuedIdCount() {
        return ids.issued();
    }

    public InferenceDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public InferenceConfig getConfig() {
        return config;
    }

    void reportDrift(Diagnostic.Kind kind, String tableName, String message) {
        if (config.getDriftPolicy() == InferenceConfig.DriftPolicy.FAIL) {
            throw new StructuralDriftException(diagnostics.getCurrentPath(), tableName,
                    "table '" + tableName + "': " + message);
        }
        diagnostics.warn(kind, tableName, message);
    }

    private static String describeDrift(ObjectTableDefinition table, Set<String> fieldNames,
                                        Set<String> withoutColumn) {
        Set<String> missing = new LinkedHashSet<>(table.getFieldSignature());
        missing.removeAll(fieldNames);
        Set<String> unexpected = new LinkedHashSet<>(fieldNames);
        unexpected.removeAll(table.getFieldSignature());

        StringBuilder sb = new StringBuilder("field set differs from table");
        if (!missing.isEmpty()) {
            sb.append(", missing ").append(missing);
        }
        if (!unexpected.isEmpty()) {
            sb.append(", unexpected ").append(unexpected);
        }
        // Fields already in the signature that arrive as scalars where the table saw containers
        withoutColumn.removeAll(unexpected);
        if (!withoutColumn.isEmpty()) {
            sb.append(", scalar values without a column ").append(withoutColumn);
        }
        return sb.toString();
    }
}
