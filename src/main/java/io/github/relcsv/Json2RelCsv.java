package io.github.relcsv;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.relcsv.csv.CsvMaterializer;
import io.github.relcsv.schema.InferenceConfig;
import io.github.relcsv.schema.SchemaInferenceEngine;
import io.github.relcsv.schema.TableRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts JSON documents into linked CSV tables.
 *
 * <p>This class uses Jackson for JSON parsing (Apache 2.0 License).</p>
 *
 * <pre>{@code
 * Json2RelCsv converter = new Json2RelCsv(InferenceConfig.defaults());
 * TableRegistry tables = converter.convert(Json2RelCsv.parse(json), Paths.get("out"));
 * }</pre>
 */
public class Json2RelCsv {

    // Thread-safe ObjectMapper for JSON parsing
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final SchemaInferenceEngine engine;
    private final CsvMaterializer materializer;

    public Json2RelCsv() {
        this(InferenceConfig.defaults());
    }

    public Json2RelCsv(InferenceConfig config) {
        this(new SchemaInferenceEngine(config), new CsvMaterializer());
    }

    public Json2RelCsv(SchemaInferenceEngine engine, CsvMaterializer materializer) {
        this.engine = engine;
        this.materializer = materializer;
    }

    /**
     * Parses a complete JSON document. Content after the first value is an error.
     */
    public static JsonNode parse(InputStream in) throws IOException {
        return OBJECT_MAPPER.readTree(in);
    }

    public static JsonNode parse(String json) throws IOException {
        return OBJECT_MAPPER.readTree(json);
    }

    /**
     * Returns the shared mapper, e.g. for printing a parsed tree.
     */
    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    /**
     * Infers the tables of {@code root} without writing anything.
     */
    public TableRegistry infer(JsonNode root) {
        return engine.infer(root);
    }

    /**
     * Infers the tables of {@code root} and writes them to {@code outputDirectory}.
     *
     * @param outputDirectory target directory, or null for the working directory
     * @return the inferred tables
     */
    public TableRegistry convert(JsonNode root, Path outputDirectory) throws IOException {
        TableRegistry registry = engine.infer(root);
        materializer.materialize(registry, outputDirectory);
        return registry;
    }

    public TableRegistry convert(String json, Path outputDirectory) throws IOException {
        return convert(parse(json), outputDirectory);
    }

    /**
     * Writes an already inferred registry.
     */
    public List<Path> materialize(TableRegistry registry, Path outputDirectory) throws IOException {
        return materializer.materialize(registry, outputDirectory);
    }

    public SchemaInferenceEngine getEngine() {
        return engine;
    }
}
