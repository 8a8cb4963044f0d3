package io.github.relcsv.config;

import io.github.relcsv.schema.InferenceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Run settings for json2relcsv: the inference options plus the output directory.
 *
 * <p>Settings come from a properties file ({@value #DEFAULT_CONFIG_FILE} on the classpath by
 * default), then environment variables, then whatever the caller sets explicitly.</p>
 */
public final class Json2RelCsvConfig {

    private static final Logger LOG = LoggerFactory.getLogger(Json2RelCsvConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "json2relcsv.properties";

    // Property keys
    static final String ROW_ORDER = "json2relcsv.row.order";
    static final String DRIFT_POLICY = "json2relcsv.drift.policy";
    static final String ROOT_TABLE = "json2relcsv.root.table";
    static final String ROOT_ARRAY_FIELD = "json2relcsv.root.array.field";
    static final String OUTPUT_DIRECTORY = "json2relcsv.output.directory";

    // Environment variables
    static final String ENV_ROW_ORDER = "JSON2RELCSV_ROW_ORDER";
    static final String ENV_DRIFT_POLICY = "JSON2RELCSV_DRIFT_POLICY";
    static final String ENV_OUT_DIR = "JSON2RELCSV_OUT_DIR";

    private final InferenceConfig inferenceConfig;
    private final Path outputDirectory;

    public Json2RelCsvConfig(InferenceConfig inferenceConfig, Path outputDirectory) {
        this.inferenceConfig = inferenceConfig;
        this.outputDirectory = outputDirectory;
    }

    public static Json2RelCsvConfig defaults() {
        return new Json2RelCsvConfig(InferenceConfig.defaults(), null);
    }

    /**
     * Loads the default properties file from the classpath if present, then applies the environment.
     */
    public static Json2RelCsvConfig load() {
        Properties props = new Properties();
        try (InputStream is = Json2RelCsvConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                LOG.debug("Loaded {} from classpath", DEFAULT_CONFIG_FILE);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {} from classpath, using defaults: {}", DEFAULT_CONFIG_FILE, e.getMessage());
            props.clear();
        }
        return fromProperties(props).withEnvironment(System.getenv());
    }

    /**
     * Loads settings from a properties file on disk.
     */
    public static Json2RelCsvConfig fromFile(Path propertiesFile) throws IOException {
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(propertiesFile)) {
            props.load(is);
        }
        return fromProperties(props);
    }

    /**
     * Builds settings from properties; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is not recognised
     */
    public static Json2RelCsvConfig fromProperties(Properties props) {
        InferenceConfig.Builder builder = InferenceConfig.builder();

        String rowOrder = props.getProperty(ROW_ORDER);
        if (isSet(rowOrder)) {
            builder.rowOrder(InferenceConfig.RowOrder.parse(rowOrder));
        }
        String driftPolicy = props.getProperty(DRIFT_POLICY);
        if (isSet(driftPolicy)) {
            builder.driftPolicy(InferenceConfig.DriftPolicy.parse(driftPolicy));
        }
        String rootTable = props.getProperty(ROOT_TABLE);
        if (isSet(rootTable)) {
            builder.rootTableName(rootTable);
        }
        String rootArrayField = props.getProperty(ROOT_ARRAY_FIELD);
        if (isSet(rootArrayField)) {
            builder.rootArrayField(rootArrayField);
        }

        String outDir = props.getProperty(OUTPUT_DIRECTORY);
        return new Json2RelCsvConfig(builder.build(), isSet(outDir) ? Paths.get(outDir.trim()) : null);
    }

    /**
     * Returns a copy with the values of the given environment applied on top.
     */
    public Json2RelCsvConfig withEnvironment(Map<String, String> env) {
        InferenceConfig.Builder builder = inferenceConfig.toBuilder();

        String rowOrder = env.get(ENV_ROW_ORDER);
        if (isSet(rowOrder)) {
            builder.rowOrder(InferenceConfig.RowOrder.parse(rowOrder));
        }
        String driftPolicy = env.get(ENV_DRIFT_POLICY);
        if (isSet(driftPolicy)) {
            builder.driftPolicy(InferenceConfig.DriftPolicy.parse(driftPolicy));
        }
        String outDir = env.get(ENV_OUT_DIR);
        return new Json2RelCsvConfig(builder.build(), isSet(outDir) ? Paths.get(outDir.trim()) : outputDirectory);
    }

    public Json2RelCsvConfig withInferenceConfig(InferenceConfig config) {
        return new Json2RelCsvConfig(config, outputDirectory);
    }

    public Json2RelCsvConfig withOutputDirectory(Path directory) {
        return new Json2RelCsvConfig(inferenceConfig, directory);
    }

    public InferenceConfig getInferenceConfig() {
        return inferenceConfig;
    }

    /**
     * Returns the output directory, or null for the working directory.
     */
    public Path getOutputDirectory() {
        return outputDirectory;
    }

    private static boolean isSet(String value) {
        return value != null && !value.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "Json2RelCsvConfig{" + inferenceConfig + ", outputDirectory=" + outputDirectory + "}";
    }
}
