package com.cityretail.etl.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Getter
@Setter
@ConfigurationProperties("etl")
public class EtlProperties {

    /** Root of the raw, cleaned and logs directories. */
    private String dataPath = "data";

    /** Location of kpi_views.sql and kpi_indexes.sql. */
    private String sqlLocation = "classpath:sql/";

    public Path rawPath() {
        return Path.of(dataPath, "raw");
    }

    public Path cleanedPath() {
        return Path.of(dataPath, "cleaned");
    }

    public Path logsPath() {
        return Path.of(dataPath, "logs");
    }

    public void createDirectories() {
        for (Path path : new Path[]{rawPath(), cleanedPath(), logsPath()}) {
            try {
                Files.createDirectories(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create directory " + path, e);
            }
        }
    }
}
