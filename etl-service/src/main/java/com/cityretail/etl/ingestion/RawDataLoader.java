package com.cityretail.etl.ingestion;

import com.cityretail.etl.config.EtlProperties;
import com.cityretail.etl.domain.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the fixed set of raw CSV extracts. A file that is missing or cannot be parsed is
 * logged and left out of the result; the other files are still loaded.
 */
@Component
@Slf4j
public class RawDataLoader {

    public static final List<String> RAW_TABLES = List.of(
            "calendar", "cities_lookup", "products", "sales", "stores");

    private final EtlProperties properties;

    public RawDataLoader(EtlProperties properties) {
        this.properties = properties;
    }

    public RawDataset load() {
        return load(properties.rawPath());
    }

    public RawDataset load(Path directory) {
        Map<String, DataTable> tables = new LinkedHashMap<>();
        for (String name : RAW_TABLES) {
            String fileName = name + ".csv";
            Path path = directory.resolve(fileName);
            try {
                DataTable table = CsvTables.read(name, path);
                tables.put(name, table);
                log.info("Loaded '{}' ({} rows, {} columns)", name, table.size(), table.columns().size());
            } catch (NoSuchFileException e) {
                log.error("File not found -> {}", fileName);
            } catch (IllegalArgumentException | UncheckedIOException e) {
                log.error("Failed to parse -> {}: {}", fileName, e.getMessage());
            } catch (IOException e) {
                log.error("Error loading '{}'", fileName, e);
            }
        }
        RawDataset dataset = new RawDataset(tables);
        log.info("Raw tables loaded: {}", dataset.names());
        return dataset;
    }

    /**
     * CSV reading shared with the snapshot store. A UTF-8 byte-order mark is dropped, headers
     * are trimmed and lowercased, blank or missing trailing cells become {@code null}, and a
     * row with more cells than the header is rejected.
     */
    public static final class CsvTables {

        private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        private CsvTables() {
        }

        public static DataTable read(String name, Path path) throws IOException {
            try (InputStream in = BOMInputStream.builder().setInputStream(Files.newInputStream(path)).get();
                 Reader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
                 CSVParser parser = new CSVParser(reader, FORMAT)) {

                List<String> headers = parser.getHeaderNames();
                if (headers.isEmpty()) {
                    throw new IllegalArgumentException("CSV file has no headers");
                }
                List<String> columns = headers.stream()
                        .map(h -> h.trim().toLowerCase(Locale.ROOT))
                        .toList();

                List<Map<String, Object>> rows = new ArrayList<>();
                for (CSVRecord record : parser) {
                    if (record.size() > headers.size()) {
                        throw new IllegalArgumentException("Expected " + headers.size() + " fields in line "
                                + record.getRecordNumber() + " but saw " + record.size());
                    }
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 0; i < columns.size(); i++) {
                        // short rows leave their trailing cells empty
                        String value = i < record.size() ? record.get(i) : null;
                        row.put(columns.get(i), value == null || value.isEmpty() ? null : value);
                    }
                    rows.add(row);
                }
                return new DataTable(name, columns, rows);
            }
        }
    }
}
