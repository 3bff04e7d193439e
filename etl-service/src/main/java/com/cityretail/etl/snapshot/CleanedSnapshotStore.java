package com.cityretail.etl.snapshot;

import com.cityretail.etl.config.EtlProperties;
import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseTable;
import com.cityretail.etl.ingestion.RawDataLoader.CsvTables;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Durable cleaned copies of the warehouse tables, one CSV per table under the cleaned
 * directory. A full clean overwrites them; incremental runs only ever append new rows, so a
 * file can hold rows the warehouse has since updated.
 */
@Component
public class CleanedSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(CleanedSnapshotStore.class);

    private final Path directory;

    @Autowired
    public CleanedSnapshotStore(EtlProperties properties) {
        this(properties.cleanedPath());
    }

    CleanedSnapshotStore(Path directory) {
        this.directory = directory;
    }

    public Path pathOf(WarehouseTable table) {
        return directory.resolve(table.snapshotName() + ".csv");
    }

    public boolean allExist() {
        boolean exists = Arrays.stream(WarehouseTable.values()).allMatch(t -> Files.exists(pathOf(t)));
        if (exists) {
            log.info("Detected all cleaned CSV files.");
        } else {
            log.info("Missing or outdated cleaned files. Triggering preprocessing.");
        }
        return exists;
    }

    public void saveAll(Map<WarehouseTable, DataTable> cleaned) {
        createDirectory();
        for (Map.Entry<WarehouseTable, DataTable> entry : cleaned.entrySet()) {
            Path path = pathOf(entry.getKey());
            DataTable table = entry.getValue();
            CSVFormat format = CSVFormat.DEFAULT.builder()
                    .setHeader(table.columns().toArray(String[]::new))
                    .build();
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                printRows(printer, table.columns(), table);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write cleaned file " + path, e);
            }
            log.info("Saved cleaned file: {}", path);
        }
    }

    /**
     * Appends rows to the table's snapshot. A new file gets a header; an existing file keeps
     * its own column order and rows are written to match it.
     */
    public void append(WarehouseTable table, DataTable rows) {
        createDirectory();
        Path path = pathOf(table);
        boolean exists = Files.exists(path) && path.toFile().length() > 0;
        List<String> columns = exists ? readHeader(path) : rows.columns();

        CSVFormat.Builder format = CSVFormat.DEFAULT.builder();
        if (!exists) {
            format.setHeader(columns.toArray(String[]::new));
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             CSVPrinter printer = new CSVPrinter(writer, format.build())) {
            printRows(printer, columns, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to cleaned file " + path, e);
        }
        log.info("[{}] Appended {} rows to {}", table.tableName(), rows.size(), path);
    }

    public DataTable read(WarehouseTable table) {
        Path path = pathOf(table);
        try {
            return CsvTables.read(table.snapshotName(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cleaned file " + path, e);
        }
    }

    private static void printRows(CSVPrinter printer, List<String> columns, DataTable table) throws IOException {
        for (Map<String, Object> row : table.rows()) {
            for (String column : columns) {
                Object value = row.get(column);
                printer.print(value == null ? null : value.toString());
            }
            printer.println();
        }
    }

    private static List<String> readHeader(Path path) {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, format)) {
            return parser.getHeaderNames().stream()
                    .map(h -> h.trim().toLowerCase(Locale.ROOT))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header of " + path, e);
        }
    }

    private void createDirectory() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cleaned directory " + directory, e);
        }
    }
}
