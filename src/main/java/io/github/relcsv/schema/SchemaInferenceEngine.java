package io.github.relcsv.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Infers a relational schema from a JSON tree.
 *
 * <p>Every JSON object becomes a row of a table named after its position in the document.
 * Nested objects and arrays of objects become child tables whose rows carry the id of the
 * enclosing row; arrays of scalars become junction tables with one row per element.</p>
 *
 * <p>Naming: a child of the root table is named by its field alone ({@code tags}), any other
 * child by {@code <parent table>_<field>} ({@code books_author}). A top-level array is treated
 * as the field {@link InferenceConfig#getRootArrayField()} of a root that has no row.</p>
 *
 * <p>Arrays are typed by their first element. Elements of a different kind are skipped (object
 * arrays) or written as empty cells (scalar arrays), with a diagnostic either way.</p>
 *
 * <p>Each call to {@link #infer(JsonNode)} builds a fresh {@link TableRegistry}, so ids start at 1
 * on every run. Instances hold only configuration and may be reused.</p>
 */
public class SchemaInferenceEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaInferenceEngine.class);

    private final InferenceConfig config;

    public SchemaInferenceEngine() {
        this(InferenceConfig.defaults());
    }

    public SchemaInferenceEngine(InferenceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Infers the tables of a document.
     *
     * @param root the parsed document
     * @return the populated registry
     * @throws RootShapeException if root is not an object or an array
     * @throws StructuralDriftException on drift when configured to fail on it
     */
    public TableRegistry infer(JsonNode root) {
        if (root == null || !root.isContainerNode()) {
            throw new RootShapeException(root == null ? "MISSING" : root.getNodeType().name());
        }

        TableRegistry registry = new TableRegistry(config);
        Traversal traversal = new Traversal(registry);
        if (root.isObject()) {
            traversal.processObject((ObjectNode) root, config.getRootTableName(), null, null);
        } else {
            traversal.processArray((ArrayNode) root, config.getRootTableName(), config.getRootArrayField(), null);
        }

        LOG.info("Inferred {} tables ({} junction) and {} rows with {} diagnostics",
                registry.size(), registry.getJunctionTables().size(), registry.getIssuedIdCount(),
                registry.getDiagnostics().getDiagnostics().size());
        return registry;
    }

    public InferenceConfig getConfig() {
        return config;
    }

    /**
     * State of one run: the registry being filled and the path diagnostics are reported against.
     */
    private final class Traversal {

        private final TableRegistry registry;
        private final InferenceDiagnostics diagnostics;

        Traversal(TableRegistry registry) {
            this.registry = registry;
            this.diagnostics = registry.getDiagnostics();
        }

        void processObject(ObjectNode object, String tableName, String parentTableName, Long parentRowId) {
            ObjectTableDefinition table = registry.findOrCreate(tableName, object, parentTableName);
            if (table == null) {
                return;
            }
            ObjectRecord record = registry.addRow(table, object, parentRowId);

            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (!value.isContainerNode()) {
                    continue;
                }
                try (InferenceDiagnostics.PathContext ignored = diagnostics.pushField(field.getKey())) {
                    if (value.isObject()) {
                        String childTable = TableNames.childName(config.getRootTableName(), table.getName(), field.getKey());
                        processObject((ObjectNode) value, childTable, table.getName(), record.getRowId());
                    } else {
                        processArray((ArrayNode) value, table.getName(), field.getKey(), record.getRowId());
                    }
                }
            }
        }

        /**
         * @param ownerRowId id of the object holding the array, or null for a top-level array
         */
        void processArray(ArrayNode array, String ownerTableName, String fieldName, Long ownerRowId) {
            if (array.isEmpty()) {
                return;
            }
            String tableName = TableNames.childName(config.getRootTableName(), ownerTableName, fieldName);

            if (array.get(0).isObject()) {
                String parentTableName = ownerRowId != null ? ownerTableName : null;
                for (int i = 0; i < array.size(); i++) {
                    JsonNode element = array.get(i);
                    try (InferenceDiagnostics.PathContext ignored = diagnostics.pushIndex(i)) {
                        if (element.isObject()) {
                            processObject((ObjectNode) element, tableName, parentTableName, ownerRowId);
                        } else {
                            registry.reportDrift(Diagnostic.Kind.MIXED_ARRAY_ELEMENT, tableName,
                                    "expected an object but found " + element.getNodeType() + "; element skipped");
                        }
                    }
                }
                return;
            }

            JunctionTableDefinition junction = registry.findOrCreateJunction(tableName, ownerTableName);
            if (junction == null) {
                return;
            }
            for (int i = 0; i < array.size(); i++) {
                JsonNode element = array.get(i);
                if (!element.isContainerNode()) {
                    continue;
                }
                try (InferenceDiagnostics.PathContext ignored = diagnostics.pushIndex(i)) {
                    if (element.isArray()) {
                        registry.reportDrift(Diagnostic.Kind.NESTED_ARRAY, tableName,
                                "nested array is not expanded; written as an empty value");
                    } else {
                        registry.reportDrift(Diagnostic.Kind.MIXED_ARRAY_ELEMENT, tableName,
                                "expected a scalar but found OBJECT; written as an empty value");
                    }
                }
            }
            registry.addArray(junction, array, ownerRowId);
        }
    }
}
