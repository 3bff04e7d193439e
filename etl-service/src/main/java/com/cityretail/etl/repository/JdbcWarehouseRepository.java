package com.cityretail.etl.repository;

import com.cityretail.etl.domain.ColumnType;
import com.cityretail.etl.domain.DataTable;
import com.cityretail.etl.domain.WarehouseColumn;
import com.cityretail.etl.domain.WarehouseTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JdbcTemplate access to the PostgreSQL star schema.
 * All statements run on the connection bound to the caller's transaction, if any.
 */
@Repository
public class JdbcWarehouseRepository implements WarehouseRepository {

    private static final Logger logger = LoggerFactory.getLogger(JdbcWarehouseRepository.class);

    static final int BATCH_SIZE = 500;

    private final JdbcTemplate jdbcTemplate;

    public JdbcWarehouseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Set<Long> fetchExistingKeys(WarehouseTable table) {
        return jdbcTemplate.queryForList(WarehouseSqlBuilder.selectKeys(table), Long.class)
                .stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    @Override
    public long countRows(WarehouseTable table) {
        Long count = jdbcTemplate.queryForObject(WarehouseSqlBuilder.countRows(table), Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public void deleteAll(WarehouseTable table) {
        int deleted = jdbcTemplate.update(WarehouseSqlBuilder.deleteAll(table));
        logger.debug("[{}] Deleted {} rows", table.tableName(), deleted);
    }

    @Override
    public int insertAll(WarehouseTable table, DataTable rows) {
        List<WarehouseColumn> columns = boundColumns(table, rows);
        String sql = WarehouseSqlBuilder.insert(table, names(columns));
        return batch(table, sql, columns, rows);
    }

    @Override
    public int upsertAll(WarehouseTable table, DataTable rows) {
        List<WarehouseColumn> columns = boundColumns(table, rows);
        String sql = WarehouseSqlBuilder.upsert(table, names(columns));
        return batch(table, sql, columns, rows);
    }

    @Override
    public void executeScript(String sql) {
        jdbcTemplate.execute(sql);
    }

    private int batch(WarehouseTable table, String sql, List<WarehouseColumn> columns, DataTable rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        logger.debug("[{}] Writing {} rows: {}", table.tableName(), rows.size(), sql);

        jdbcTemplate.batchUpdate(sql, rows.rows(), BATCH_SIZE, (ps, row) -> bind(ps, columns, row));
        return rows.size();
    }

    private static void bind(PreparedStatement ps, List<WarehouseColumn> columns, Map<String, Object> row)
            throws SQLException {
        for (int i = 0; i < columns.size(); i++) {
            WarehouseColumn column = columns.get(i);
            Object value = column.type().toSqlValue(row.get(column.name()));
            if (value == null) {
                ps.setNull(i + 1, jdbcType(column.type()));
            } else {
                ps.setObject(i + 1, value, jdbcType(column.type()));
            }
        }
    }

    /**
     * The registered columns present in {@code rows}, in the table's column order. Columns the
     * registry does not know are rejected by {@link WarehouseSqlBuilder}.
     */
    private static List<WarehouseColumn> boundColumns(WarehouseTable table, DataTable rows) {
        WarehouseSqlBuilder.validate(table, rows.columns());
        return table.columns().stream()
                .filter(c -> rows.hasColumn(c.name()))
                .toList();
    }

    private static List<String> names(List<WarehouseColumn> columns) {
        return columns.stream().map(WarehouseColumn::name).toList();
    }

    private static int jdbcType(ColumnType type) {
        return switch (type) {
            case INTEGER -> Types.BIGINT;
            case DECIMAL -> Types.NUMERIC;
            case TEXT -> Types.VARCHAR;
            case DATE -> Types.DATE;
            case BOOLEAN -> Types.BOOLEAN;
        };
    }
}
