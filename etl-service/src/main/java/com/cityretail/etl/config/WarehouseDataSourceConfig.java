package com.cityretail.etl.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the PostgreSQL warehouse DataSource.
 * Credentials are validated here, before anything touches the network or the file system.
 * DriverManagerDataSource opens a fresh physical connection per transaction.
 */
@Configuration
@EnableConfigurationProperties({WarehouseProperties.class, EtlProperties.class})
public class WarehouseDataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(WarehouseDataSourceConfig.class);

    @Bean
    @Primary
    public DataSource warehouseDataSource(WarehouseProperties properties) {
        properties.validate();
        log.info("Creating warehouse DataSource with URL: {}", properties.jdbcUrl());
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                properties.jdbcUrl(), properties.getUser(), properties.getPassword());
        dataSource.setDriverClassName("org.postgresql.Driver");
        return dataSource;
    }

    @Bean
    @Primary
    public JdbcTemplate warehouseJdbcTemplate(DataSource warehouseDataSource) {
        return new JdbcTemplate(warehouseDataSource);
    }

    @Bean
    public DataSourceTransactionManager warehouseTransactionManager(DataSource warehouseDataSource) {
        return new DataSourceTransactionManager(warehouseDataSource);
    }

    @Bean
    public TransactionTemplate warehouseTransactionTemplate(DataSourceTransactionManager warehouseTransactionManager) {
        return new TransactionTemplate(warehouseTransactionManager);
    }
}
