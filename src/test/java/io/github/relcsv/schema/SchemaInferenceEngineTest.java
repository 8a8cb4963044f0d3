package io.github.relcsv.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class SchemaInferenceEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SchemaInferenceEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SchemaInferenceEngine();
    }

    private TableRegistry infer(String json) throws IOException {
        return engine.infer(MAPPER.readTree(json));
    }

    private static ObjectTableDefinition objectTable(TableRegistry registry, String name) {
        TableDefinition table = registry.getTable(name);
        assertThat(table).as("table " + name).isInstanceOf(ObjectTableDefinition.class);
        return (ObjectTableDefinition) table;
    }

    private static JunctionTableDefinition junction(TableRegistry registry, String name) {
        TableDefinition table = registry.getTable(name);
        assertThat(table).as("junction " + name).isInstanceOf(JunctionTableDefinition.class);
        return (JunctionTableDefinition) table;
    }

    private static List<Long> rowIds(ObjectTableDefinition table) {
        return table.getRows().stream().map(ObjectRecord::getRowId).collect(Collectors.toList());
    }

    // ==================== Root Shape ====================

    @Nested
    @DisplayName("Root shape")
    class RootShapeTests {

        @ParameterizedTest
        @ValueSource(strings = {"42", "\"text\"", "true", "null", "1.5"})
        @DisplayName("rejects scalar roots")
        void rejectsScalarRoot(String json) {
            assertThatThrownBy(() -> infer(json))
                    .isInstanceOf(RootShapeException.class)
                    .hasMessageContaining("must be an object or an array");
        }

        @Test
        @DisplayName("rejects a missing root")
        void rejectsMissingRoot() {
            assertThatThrownBy(() -> engine.infer(MissingNode.getInstance()))
                    .isInstanceOf(RootShapeException.class);
            assertThatThrownBy(() -> engine.infer(null))
                    .isInstanceOf(RootShapeException.class)
                    .extracting(e -> ((RootShapeException) e).getActualType())
                    .isEqualTo("MISSING");
        }

        @Test
        @DisplayName("empty root object still gets a root row")
        void emptyRootObject() throws IOException {
            TableRegistry registry = infer("{}");

            ObjectTableDefinition root = objectTable(registry, "root");
            assertThat(root.getColumns()).containsExactly("id");
            assertThat(rowIds(root)).containsExactly(1L);
        }

        @Test
        @DisplayName("empty root array produces no tables")
        void emptyRootArray() throws IOException {
            TableRegistry registry = infer("[]");

            assertThat(registry.getTables()).isEmpty();
            assertThat(registry.getIssuedIdCount()).isZero();
        }

        @Test
        @DisplayName("root array of objects goes to 'items' without a parent key")
        void rootArrayOfObjects() throws IOException {
            TableRegistry registry = infer("[{\"a\": 1}, {\"a\": 2}]");

            assertThat(registry.hasTable("root")).isFalse();
            ObjectTableDefinition items = objectTable(registry, "items");
            assertThat(items.getColumns()).containsExactly("id", "a");
            assertThat(items.hasParentForeignKey()).isFalse();
            assertThat(rowIds(items)).containsExactly(1L, 2L);
            assertThat(items.getRows()).allSatisfy(r -> assertThat(r.getParentRowId()).isNull());
        }

        @Test
        @DisplayName("root array of scalars becomes an ownerless junction")
        void rootArrayOfScalars() throws IOException {
            TableRegistry registry = infer("[1, 2, 3]");

            JunctionTableDefinition items = junction(registry, "items");
            assertThat(items.getColumns()).containsExactly("root_id", "item_index", "value");
            assertThat(items.getSources()).hasSize(1);
            assertThat(items.getSources().get(0).ownerRowId()).isNull();
            assertThat(items.getRowCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("root names are configurable")
        void configurableRootNames() throws IOException {
            engine = new SchemaInferenceEngine(InferenceConfig.builder()
                    .rootTableName("doc")
                    .rootArrayField("entries")
                    .build());

            assertThat(infer("{\"tags\": [\"x\"]}").getTable("tags").getColumns())
                    .containsExactly("doc_id", "item_index", "value");
            assertThat(infer("[{\"a\": 1}]").hasTable("entries")).isTrue();
        }
    }

    // ==================== Table Layout ====================

    @Nested
    @DisplayName("Table layout")
    class TableLayoutTests {

        @Test
        @DisplayName("a root field named like the root table gets a prefixed child table")
        void rootNamedField() throws IOException {
            TableRegistry registry = infer("{\"id\": 7, \"root\": {\"x\": 1}}");

            assertThat(registry.getTables()).extracting(TableDefinition::getName)
                    .containsExactly("root", "root_root");
            assertThat(objectTable(registry, "root").getColumns()).containsExactly("id", "source_id");
            assertThat(objectTable(registry, "root_root").getColumns()).containsExactly("id", "root_id", "x");
            assertThat(objectTable(registry, "root_root").getRows())
                    .extracting(ObjectRecord::getRowId, ObjectRecord::getParentRowId)
                    .containsExactly(tuple(2L, 1L));
            assertThat(registry.getDiagnostics().hasDiagnostics()).isFalse();
        }

        @Test
        @DisplayName("scalar fields become columns after the id")
        void flatObject() throws IOException {
            TableRegistry registry = infer("{\"id\": 1, \"name\": \"Ali\", \"age\": 19}");

            assertThat(registry.size()).isEqualTo(1);
            ObjectTableDefinition root = objectTable(registry, "root");
            assertThat(root.getDataColumns()).containsExactly("id", "name", "age");
            assertThat(root.getColumns()).containsExactly("id", "source_id", "name", "age");
        }

        @Test
        @DisplayName("nested object becomes a child table named after its field")
        void nestedObjectUnderRoot() throws IOException {
            TableRegistry registry = infer("{\"postId\": 101, \"author\": {\"uid\": \"u1\", \"name\": \"Sara\"}}");

            ObjectTableDefinition root = objectTable(registry, "root");
            assertThat(root.getColumns()).containsExactly("id", "postId");
            assertThat(root.getFieldSignature()).containsExactly("postId", "author");

            ObjectTableDefinition author = objectTable(registry, "author");
            assertThat(author.getColumns()).containsExactly("id", "root_id", "uid", "name");
            assertThat(author.getRows()).singleElement().satisfies(r -> {
                assertThat(r.getRowId()).isEqualTo(2L);
                assertThat(r.getParentRowId()).isEqualTo(1L);
            });
        }

        @Test
        @DisplayName("deeper children are prefixed with their parent table")
        void deepNesting() throws IOException {
            TableRegistry registry = infer("{\"a\": {\"b\": {\"c\": {\"v\": true}}}}");

            assertThat(registry.getTables()).extracting(TableDefinition::getName)
                    .containsExactly("root", "a", "a_b", "a_b_c");
            assertThat(objectTable(registry, "a_b_c").getColumns()).containsExactly("id", "a_b_id", "v");
            assertThat(objectTable(registry, "a_b_c").getRows().get(0).getParentRowId()).isEqualTo(3L);
        }

        @Test
        @DisplayName("column count is data columns plus id plus parent key")
        void columnCountInvariant() throws IOException {
            TableRegistry registry = infer(readFixture("bookstore.json"));

            for (ObjectTableDefinition table : registry.getObjectTables()) {
                int expected = table.getDataColumns().size() + 1 + (table.hasParentForeignKey() ? 1 : 0);
                assertThat(table.getColumns()).as(table.getName()).hasSize(expected);
            }
        }

        @Test
        @DisplayName("null fields are columns")
        void nullFieldIsColumn() throws IOException {
            ObjectTableDefinition root = objectTable(infer("{\"a\": null, \"b\": 1}"), "root");

            assertThat(root.getColumns()).containsExactly("id", "a", "b");
        }
    }

    // ==================== Arrays ====================

    @Nested
    @DisplayName("Arrays")
    class ArrayTests {

        @Test
        @DisplayName("empty arrays create nothing")
        void emptyArray() throws IOException {
            TableRegistry registry = infer("{\"tags\": []}");

            assertThat(registry.getTables()).extracting(TableDefinition::getName).containsExactly("root");
        }

        @Test
        @DisplayName("scalar array becomes a junction table owned by the enclosing row")
        void scalarArray() throws IOException {
            TableRegistry registry = infer("{\"name\": \"A\", \"tags\": [\"x\", \"y\"]}");

            assertThat(objectTable(registry, "root").getColumns()).containsExactly("id", "name");
            JunctionTableDefinition tags = junction(registry, "tags");
            assertThat(tags.getColumns()).containsExactly("root_id", "item_index", "value");
            assertThat(tags.getOwnerTableName()).isEqualTo("root");
            assertThat(tags.getSources()).singleElement().satisfies(s -> {
                assertThat(s.ownerRowId()).isEqualTo(1L);
                assertThat(s.values()).hasSize(2);
                assertThat(s.jsonPath()).isEqualTo("$.tags");
            });
        }

        @Test
        @DisplayName("array of objects becomes a child table and never a junction")
        void objectArray() throws IOException {
            TableRegistry registry = infer("{\"items\": [{\"a\": 1}, {\"a\": 2}]}");

            assertThat(registry.getJunctionTables()).isEmpty();
            ObjectTableDefinition items = objectTable(registry, "items");
            assertThat(items.getColumns()).containsExactly("id", "root_id", "a");
            assertThat(rowIds(items)).containsExactly(2L, 3L);
            assertThat(items.getRows()).allSatisfy(r -> assertThat(r.getParentRowId()).isEqualTo(1L));
        }

        @Test
        @DisplayName("scalar arrays of sibling rows share one junction table")
        void junctionSharedAcrossRows() throws IOException {
            TableRegistry registry = infer(
                    "{\"books\": [{\"t\": \"a\", \"tags\": [\"x\"]}, {\"t\": \"b\", \"tags\": [\"y\", \"z\"]}]}");

            JunctionTableDefinition tags = junction(registry, "books_tags");
            assertThat(tags.getColumns()).containsExactly("books_id", "item_index", "value");
            assertThat(tags.getSources()).extracting(ScalarArraySource::ownerRowId).containsExactly(2L, 3L);
            assertThat(tags.getRowCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("non-object elements of an object array are skipped with a diagnostic")
        void mixedObjectArray() throws IOException {
            TableRegistry registry = infer("{\"xs\": [{\"a\": 1}, 5, {\"a\": 2}]}");

            assertThat(rowIds(objectTable(registry, "xs"))).containsExactly(2L, 3L);
            assertThat(registry.getDiagnostics().getDiagnostics(Diagnostic.Kind.MIXED_ARRAY_ELEMENT))
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.jsonPath()).isEqualTo("$.xs[1]");
                        assertThat(d.tableName()).isEqualTo("xs");
                    });
        }

        @Test
        @DisplayName("containers inside a scalar array are kept as empty values with a diagnostic")
        void mixedScalarArray() throws IOException {
            TableRegistry registry = infer("{\"xs\": [1, {\"a\": 1}, [2]]}");

            JunctionTableDefinition xs = junction(registry, "xs");
            assertThat(xs.getRowCount()).isEqualTo(3);
            assertThat(registry.getIssuedIdCount()).isEqualTo(1);
            assertThat(registry.getDiagnostics().getDiagnostics())
                    .extracting(Diagnostic::kind, Diagnostic::jsonPath)
                    .containsExactly(
                            tuple(Diagnostic.Kind.MIXED_ARRAY_ELEMENT, "$.xs[1]"),
                            tuple(Diagnostic.Kind.NESTED_ARRAY, "$.xs[2]"));
        }

        @Test
        @DisplayName("scalars of different types in one array are not a diagnostic")
        void heterogeneousScalars() throws IOException {
            TableRegistry registry = infer("{\"xs\": [1, \"a\", true, null]}");

            assertThat(junction(registry, "xs").getRowCount()).isEqualTo(4);
            assertThat(registry.getDiagnostics().hasDiagnostics()).isFalse();
        }

        @Test
        @DisplayName("a name used by both a junction and an object table keeps the first kind")
        void tableKindConflict() throws IOException {
            TableRegistry registry = infer("{\"list\": [{\"v\": [1]}, {\"v\": [{\"k\": 1}]}]}");

            assertThat(registry.getTable("list_v").isJunction()).isTrue();
            assertThat(registry.getIssuedIdCount()).isEqualTo(3);
            assertThat(registry.getDiagnostics().getDiagnostics(Diagnostic.Kind.TABLE_KIND_CONFLICT))
                    .singleElement()
                    .extracting(Diagnostic::jsonPath)
                    .isEqualTo("$.list[1].v[0]");
        }
    }

    // ==================== Identifiers ====================

    @Nested
    @DisplayName("Row identifiers")
    class IdentifierTests {

        @Test
        @DisplayName("ids are unique across all tables and follow document order")
        void globallyUniqueIds() throws IOException {
            TableRegistry registry = infer(readFixture("bookstore.json"));

            Set<Long> seen = new HashSet<>();
            for (ObjectTableDefinition table : registry.getObjectTables()) {
                for (ObjectRecord record : table.getRows()) {
                    assertThat(seen.add(record.getRowId())).as("duplicate id " + record.getRowId()).isTrue();
                }
            }
            assertThat(seen).containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L);
            assertThat(registry.getIssuedIdCount()).isEqualTo(9);
        }

        @Test
        @DisplayName("every run starts again at 1")
        void idsResetPerRun() throws IOException {
            String json = "{\"a\": {\"b\": 1}}";

            TableRegistry first = infer(json);
            TableRegistry second = infer(json);

            assertThat(rowIds(objectTable(first, "a"))).containsExactly(2L);
            assertThat(rowIds(objectTable(second, "a"))).containsExactly(2L);
            assertThat(second).isNotSameAs(first);
        }

        @Test
        @DisplayName("rows remember the path they were found at")
        void recordPaths() throws IOException {
            TableRegistry registry = infer("{\"store\": {\"books\": [{\"t\": 1}, {\"t\": 2}]}}");

            assertThat(objectTable(registry, "store_books").getRows())
                    .extracting(ObjectRecord::getJsonPath)
                    .containsExactly("$.store.books[0]", "$.store.books[1]");
            assertThat(objectTable(registry, "root").getRows().get(0).getJsonPath()).isEqualTo("$");
        }
    }

    // ==================== Row Order ====================

    @Nested
    @DisplayName("Row order")
    class RowOrderTests {

        private static final String JSON =
                "{\"books\": [{\"t\": \"a\", \"tags\": [\"x\"]}, {\"t\": \"b\", \"tags\": [\"y\"]}, {\"t\": \"c\", \"tags\": []}]}";

        @Test
        @DisplayName("append keeps document order")
        void appendOrder() throws IOException {
            TableRegistry registry = infer(JSON);

            assertThat(rowIds(objectTable(registry, "books"))).containsExactly(2L, 3L, 4L);
            assertThat(junction(registry, "books_tags").getSources())
                    .extracting(ScalarArraySource::ownerRowId).containsExactly(2L, 3L);
        }

        @Test
        @DisplayName("prepend reverses document order but not the ids")
        void prependOrder() throws IOException {
            engine = new SchemaInferenceEngine(InferenceConfig.legacy());
            TableRegistry registry = infer(JSON);

            assertThat(rowIds(objectTable(registry, "books"))).containsExactly(4L, 3L, 2L);
            assertThat(junction(registry, "books_tags").getSources())
                    .extracting(ScalarArraySource::ownerRowId).containsExactly(3L, 2L);
        }
    }

    // ==================== Structural Drift ====================

    @Nested
    @DisplayName("Structural drift")
    class DriftTests {

        private static final String DRIFTING = "{\"people\": [{\"a\": 1, \"b\": 2}, {\"a\": 3, \"c\": 4}]}";

        @Test
        @DisplayName("warn keeps the first shape and reports the difference")
        void warnPolicy() throws IOException {
            TableRegistry registry = infer(DRIFTING);

            ObjectTableDefinition people = objectTable(registry, "people");
            assertThat(people.getColumns()).containsExactly("id", "root_id", "a", "b");
            assertThat(people.getRowCount()).isEqualTo(2);
            assertThat(registry.getDiagnostics().getDiagnostics(Diagnostic.Kind.STRUCTURAL_DRIFT))
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.jsonPath()).isEqualTo("$.people[1]");
                        assertThat(d.message()).contains("missing [b]").contains("unexpected [c]");
                    });
        }

        @Test
        @DisplayName("extend grows the table to the union of fields")
        void extendPolicy() throws IOException {
            engine = new SchemaInferenceEngine(InferenceConfig.builder()
                    .driftPolicy(InferenceConfig.DriftPolicy.EXTEND)
                    .build());
            TableRegistry registry = infer(DRIFTING);

            assertThat(objectTable(registry, "people").getColumns())
                    .containsExactly("id", "root_id", "a", "b", "c");
            assertThat(registry.getDiagnostics().getDiagnostics(Diagnostic.Kind.STRUCTURAL_DRIFT)).hasSize(1);
        }

        @Test
        @DisplayName("fail stops at the first drifting object")
        void failPolicy() {
            engine = new SchemaInferenceEngine(InferenceConfig.strict());

            assertThatThrownBy(() -> infer(DRIFTING))
                    .isInstanceOf(StructuralDriftException.class)
                    .hasMessageStartingWith("$.people[1]: ")
                    .satisfies(e -> assertThat(((StructuralDriftException) e).getTableName()).isEqualTo("people"));
        }

        @Test
        @DisplayName("fail also applies to mixed arrays")
        void failOnMixedArray() {
            engine = new SchemaInferenceEngine(InferenceConfig.strict());

            assertThatThrownBy(() -> infer("{\"xs\": [{\"a\": 1}, 2]}"))
                    .isInstanceOf(StructuralDriftException.class);
        }

        @Test
        @DisplayName("same shape in a different field order is not drift")
        void fieldOrderIsNotDrift() throws IOException {
            TableRegistry registry = infer("{\"p\": [{\"a\": 1, \"b\": 2}, {\"b\": 3, \"a\": 4}]}");

            assertThat(registry.getDiagnostics().hasDiagnostics()).isFalse();
            assertThat(objectTable(registry, "p").getDataColumns()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("a table reached from two parents is reported")
        void parentMismatch() throws IOException {
            TableRegistry registry = infer("{\"a\": {\"b\": {\"q\": 1}}, \"a_b\": {\"q\": 2}}");

            ObjectTableDefinition ab = objectTable(registry, "a_b");
            assertThat(ab.getParentTableName()).isEqualTo("a");
            assertThat(ab.getRowCount()).isEqualTo(2);
            assertThat(registry.getDiagnostics().getDiagnostics(Diagnostic.Kind.STRUCTURAL_DRIFT))
                    .singleElement()
                    .satisfies(d -> assertThat(d.message()).contains("reached from table 'root'"));
        }

        private static final String OBJECT_THEN_SCALAR = "{\"items\": [{\"a\": {\"x\": 1}}, {\"a\": 5}]}";

        @Test
        @DisplayName("a field that turns from an object into a scalar is reported")
        void objectThenScalarWarn() throws IOException {
            TableRegistry registry = infer(OBJECT_THEN_SCALAR);

            ObjectTableDefinition items = objectTable(registry, "items");
            assertThat(items.getColumns()).containsExactly("id", "root_id");
            assertThat(objectTable(registry, "items_a").getRowCount()).isEqualTo(1);
            assertThat(registry.getDiagnostics().getDiagnostics(Diagnostic.Kind.STRUCTURAL_DRIFT))
                    .singleElement()
                    .satisfies(d -> {
                        assertThat(d.jsonPath()).isEqualTo("$.items[1]");
                        assertThat(d.tableName()).isEqualTo("items");
                        assertThat(d.message()).contains("scalar values without a column [a]");
                    });
        }

        @Test
        @DisplayName("extend adds a column for a field that turns scalar")
        void objectThenScalarExtend() throws IOException {
            engine = new SchemaInferenceEngine(InferenceConfig.builder()
                    .driftPolicy(InferenceConfig.DriftPolicy.EXTEND)
                    .build());
            TableRegistry registry = infer(OBJECT_THEN_SCALAR);

            ObjectTableDefinition items = objectTable(registry, "items");
            assertThat(items.getColumns()).containsExactly("id", "root_id", "a");
            assertThat(items.getRows())
                    .extracting(r -> r.get("a").isObject() ? "object" : r.get("a").asText())
                    .containsExactly("object", "5");
            assertThat(registry.getDiagnostics().getDiagnostics(Diagnostic.Kind.STRUCTURAL_DRIFT)).hasSize(1);
        }

        @Test
        @DisplayName("fail rejects a field that turns scalar")
        void objectThenScalarFail() {
            engine = new SchemaInferenceEngine(InferenceConfig.strict());

            assertThatThrownBy(() -> infer(OBJECT_THEN_SCALAR))
                    .isInstanceOf(StructuralDriftException.class)
                    .hasMessageStartingWith("$.items[1]: ")
                    .hasMessageContaining("[a]");
        }

        @Test
        @DisplayName("a null where the table saw an object is not drift")
        void objectThenNull() throws IOException {
            TableRegistry registry = infer("{\"items\": [{\"a\": {\"x\": 1}}, {\"a\": null}]}");

            assertThat(registry.getDiagnostics().hasDiagnostics()).isFalse();
            assertThat(objectTable(registry, "items").getColumns()).containsExactly("id", "root_id");
        }
    }

    // ==================== Documents ====================

    @Test
    void testBookstoreTables() throws IOException {
        TableRegistry registry = infer(readFixture("bookstore.json"));

        assertThat(registry.getTables()).extracting(TableDefinition::getName).containsExactly(
                "root", "store", "store_location", "store_categories", "store_books",
                "store_books_author", "store_books_tags", "store_employees");

        assertThat(objectTable(registry, "store").getColumns())
                .containsExactly("id", "root_id", "name", "established");
        assertThat(objectTable(registry, "store_books").getColumns())
                .containsExactly("id", "store_id", "title", "price");
        assertThat(objectTable(registry, "store_books_author").getColumns())
                .containsExactly("id", "store_books_id", "name", "birthYear");
        assertThat(objectTable(registry, "store_employees").getColumns())
                .containsExactly("id", "store_id", "source_id", "name", "position");
        assertThat(junction(registry, "store_books_tags").getColumns())
                .containsExactly("store_books_id", "item_index", "value");

        assertThat(objectTable(registry, "store_books_author").getRows())
                .extracting(ObjectRecord::getRowId, ObjectRecord::getParentRowId)
                .containsExactly(tuple(5L, 4L), tuple(7L, 6L));
        assertThat(registry.getDiagnostics().hasDiagnostics()).isFalse();
    }

    @Test
    void testBlogPostTables() throws IOException {
        TableRegistry registry = infer(readFixture("blog_post.json"));

        assertThat(objectTable(registry, "root").getColumns()).containsExactly("id", "postId");
        assertThat(objectTable(registry, "author").getColumns()).containsExactly("id", "root_id", "uid", "name");
        assertThat(objectTable(registry, "comments").getColumns()).containsExactly("id", "root_id", "uid", "text");
        assertThat(rowIds(objectTable(registry, "comments"))).containsExactly(3L, 4L);
    }

    static String readFixture(String name) throws IOException {
        try (InputStream is = SchemaInferenceEngineTest.class.getClassLoader()
                .getResourceAsStream("fixtures/" + name)) {
            assertThat(is).as("fixture " + name).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
