package io.github.relcsv.csv;

import com.fasterxml.jackson.databind.JsonNode;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import io.github.relcsv.schema.JunctionTableDefinition;
import io.github.relcsv.schema.ObjectRecord;
import io.github.relcsv.schema.ObjectTableDefinition;
import io.github.relcsv.schema.ScalarArraySource;
import io.github.relcsv.schema.TableDefinition;
import io.github.relcsv.schema.TableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the tables of a {@link TableRegistry} as CSV files, one {@code <table>.csv} per table.
 *
 * <p>Files are UTF-8, comma separated, with a header row and a {@code \n} after every row.
 * Cells are rendered by {@link CsvValueFormatter}; the writer itself adds no quoting.
 * Existing files are overwritten. Tables are written one after the other and the first
 * failure ends the run.</p>
 */
public class CsvMaterializer {

    private static final Logger LOG = LoggerFactory.getLogger(CsvMaterializer.class);

    public static final String FILE_EXTENSION = ".csv";
    private static final String LINE_END = "\n";

    private final CsvValueFormatter formatter;

    public CsvMaterializer() {
        this(new CsvValueFormatter());
    }

    public CsvMaterializer(CsvValueFormatter formatter) {
        this.formatter = formatter;
    }

    /**
     * Writes every table of {@code registry}.
     *
     * @param registry the inferred tables
     * @param outputDirectory target directory, created when missing; null for the working directory
     * @return the files written, in table order
     * @throws IOException if the directory cannot be created or a file cannot be written
     */
    public List<Path> materialize(TableRegistry registry, Path outputDirectory) throws IOException {
        Path directory = ensureDirectory(outputDirectory);
        List<Path> written = new ArrayList<>();
        for (TableDefinition table : registry.getTables()) {
            written.add(writeTable(table, directory));
        }
        LOG.info("Wrote {} CSV files to {}", written.size(), directory.toAbsolutePath());
        return written;
    }

    /**
     * Writes a single table into {@code directory}.
     */
    public Path writeTable(TableDefinition table, Path directory) throws IOException {
        Path file = directory.resolve(table.getName() + FILE_EXTENSION);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(out, ICSVWriter.DEFAULT_SEPARATOR, ICSVWriter.NO_QUOTE_CHARACTER,
                     ICSVWriter.NO_ESCAPE_CHARACTER, LINE_END)) {

            csv.writeNext(header(table), false);
            if (table.isJunction()) {
                writeJunctionRows((JunctionTableDefinition) table, csv);
            } else {
                writeObjectRows((ObjectTableDefinition) table, csv);
            }

            if (csv.checkError()) {
                throw new IOException("Failed to write " + file, csv.getException());
            }
        } catch (IOException e) {
            LOG.error("Failed to write table {} to {}: {}", table.getName(), file, e.getMessage());
            throw e;
        }
        LOG.debug("Wrote {} rows to {}", table.getRowCount(), file);
        return file;
    }

    private void writeObjectRows(ObjectTableDefinition table, CSVWriter csv) {
        List<String> dataColumns = table.getDataColumns();
        boolean hasParent = table.hasParentForeignKey();
        int width = dataColumns.size() + (hasParent ? 2 : 1);

        for (ObjectRecord record : table.getRows()) {
            String[] row = new String[width];
            int col = 0;
            row[col++] = formatter.formatId(record.getRowId());
            if (hasParent) {
                row[col++] = formatter.formatId(record.getParentRowId());
            }
            for (String column : dataColumns) {
                row[col++] = formatter.format(record.get(column));
            }
            csv.writeNext(row, false);
        }
    }

    private void writeJunctionRows(JunctionTableDefinition table, CSVWriter csv) {
        for (ScalarArraySource source : table.getSources()) {
            String owner = formatter.formatId(source.ownerRowId());
            int index = 0;
            for (JsonNode element : source.values()) {
                csv.writeNext(new String[]{owner, Integer.toString(index++), formatter.format(element)}, false);
            }
        }
    }

    private String[] header(TableDefinition table) {
        List<String> columns = table.getColumns();
        String[] header = new String[columns.size()];
        for (int i = 0; i < header.length; i++) {
            header[i] = formatter.formatHeader(columns.get(i));
        }
        return header;
    }

    private static Path ensureDirectory(Path outputDirectory) throws IOException {
        if (outputDirectory == null) {
            return Paths.get("");
        }
        if (Files.isDirectory(outputDirectory)) {
            return outputDirectory;
        }
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new IOException("Failed to create output directory " + outputDirectory, e);
        }
        LOG.debug("Created output directory {}", outputDirectory);
        return outputDirectory;
    }
}
