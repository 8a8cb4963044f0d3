package io.github.relcsv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.relcsv.config.Json2RelCsvConfig;
import io.github.relcsv.schema.InferenceConfig;
import io.github.relcsv.schema.RelationalSchemaException;
import io.github.relcsv.schema.TableDefinition;
import io.github.relcsv.schema.TableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: reads a JSON document from stdin and writes one CSV file per table.
 *
 * <pre>
 * json2relcsv [--print-ast] [--out-dir DIR] [--row-order append|prepend] [--drift-policy warn|extend|fail]
 * </pre>
 *
 * Exit codes: 0 on success, 1 when the input cannot be converted or written, 2 on bad usage.
 */
public final class Json2RelCsvApp {

    private static final Logger LOG = LoggerFactory.getLogger(Json2RelCsvApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE =
            "Usage: json2relcsv [--print-ast] [--out-dir DIR] [--row-order append|prepend] "
                    + "[--drift-policy warn|extend|fail] < input.json";

    private Json2RelCsvApp() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        CommandLineArgs cli;
        try {
            cli = CommandLineArgs.parse(args);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (cli.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        Json2RelCsvConfig config;
        try {
            config = cli.applyTo(Json2RelCsvConfig.load());
        } catch (IllegalArgumentException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        LOG.debug("Running with {}", config);

        JsonNode root;
        try {
            root = Json2RelCsv.parse(in);
        } catch (JsonProcessingException e) {
            err.println("Error: invalid JSON: " + e.getOriginalMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error: failed to read input: " + e.getMessage());
            return EXIT_FAILURE;
        }
        if (root == null || root.isMissingNode()) {
            err.println("Error: no JSON content on input");
            return EXIT_FAILURE;
        }

        try {
            if (cli.printAst) {
                out.println(Json2RelCsv.objectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(root));
            }
            Json2RelCsv converter = new Json2RelCsv(config.getInferenceConfig());
            TableRegistry registry = converter.infer(root);
            converter.materialize(registry, config.getOutputDirectory());
            for (TableDefinition table : registry.getTables()) {
                LOG.info("{}: {} columns, {} rows", table.getName(), table.getColumns().size(), table.getRowCount());
            }
            return EXIT_OK;
        } catch (RelationalSchemaException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Thrown for unusable command line arguments.
     */
    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    static final class CommandLineArgs {
        boolean printAst;
        boolean help;
        Path outDir;
        InferenceConfig.RowOrder rowOrder;
        InferenceConfig.DriftPolicy driftPolicy;

        static CommandLineArgs parse(String[] args) throws UsageException {
            CommandLineArgs cli = new CommandLineArgs();
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--print-ast":
                        cli.printAst = true;
                        break;
                    case "--out-dir":
                        cli.outDir = Paths.get(requireValue(args, ++i, "--out-dir requires a directory path"));
                        break;
                    case "--row-order":
                        String order = requireValue(args, ++i, "--row-order requires append or prepend");
                        try {
                            cli.rowOrder = InferenceConfig.RowOrder.parse(order);
                        } catch (IllegalArgumentException e) {
                            throw new UsageException("Unknown row order '" + order + "'");
                        }
                        break;
                    case "--drift-policy":
                        String policy = requireValue(args, ++i, "--drift-policy requires warn, extend or fail");
                        try {
                            cli.driftPolicy = InferenceConfig.DriftPolicy.parse(policy);
                        } catch (IllegalArgumentException e) {
                            throw new UsageException("Unknown drift policy '" + policy + "'");
                        }
                        break;
                    case "-h":
                    case "--help":
                        cli.help = true;
                        break;
                    default:
                        throw new UsageException("Unknown option '" + args[i] + "'");
                }
            }
            return cli;
        }

        Json2RelCsvConfig applyTo(Json2RelCsvConfig base) {
            InferenceConfig.Builder builder = base.getInferenceConfig().toBuilder();
            if (rowOrder != null) {
                builder.rowOrder(rowOrder);
            }
            if (driftPolicy != null) {
                builder.driftPolicy(driftPolicy);
            }
            Json2RelCsvConfig config = base.withInferenceConfig(builder.build());
            return outDir != null ? config.withOutputDirectory(outDir) : config;
        }

        private static String requireValue(String[] args, int index, String message) throws UsageException {
            if (index >= args.length) {
                throw new UsageException(message);
            }
            return args[index];
        }
    }
}
