package com.cityretail.etl.config;

import com.cityretail.etl.exception.EtlConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Warehouse connection settings, bound from {@code warehouse.*} (DB_HOST, DB_PORT, DB_NAME,
 * DB_USER, DB_PASS). Credentials carry no defaults.
 */
@Getter
@Setter
@ConfigurationProperties("warehouse")
public class WarehouseProperties {

    private String host;
    private String port;
    private String database;
    private String user;
    private String password;

    private int retries = 5;
    private int initialDelaySeconds = 2;

    public void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(host)) {
            missing.add("DB_HOST");
        }
        if (isBlank(port)) {
            missing.add("DB_PORT");
        }
        if (isBlank(database)) {
            missing.add("DB_NAME");
        }
        if (isBlank(user)) {
            missing.add("DB_USER");
        }
        if (isBlank(password)) {
            missing.add("DB_PASS");
        }
        if (!missing.isEmpty()) {
            throw new EtlConfigurationException("Missing warehouse configuration: " + String.join(", ", missing));
        }
        if (!port.trim().chars().allMatch(Character::isDigit)) {
            throw new EtlConfigurationException("DB_PORT is not a number: " + port);
        }
        if (retries < 1) {
            throw new EtlConfigurationException("warehouse.retries must be at least 1");
        }
    }

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%s/%s", host.trim(), port.trim(), database.trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
