package com.tapas.dwh.analytics.repository;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.dto.TableColumn;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Explores the warehouse catalog (tables and columns of the Gold schema)
 * through information_schema.
 */
@Repository
public class WarehouseCatalogRepository {

    private final JdbcTemplate warehouseJdbcTemplate;
    private final String schema;

    public WarehouseCatalogRepository(@Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate,
                                      AnalyticsProperties properties) {
        this.warehouseJdbcTemplate = warehouseJdbcTemplate;
        this.schema = GoldTableRepository.requireIdentifier(properties.getSchema());
    }

    public List<String> findTableNames() {
        String sql = """
                SELECT table_name
                FROM information_schema.tables
                WHERE table_schema = ?
                ORDER BY table_name
                """;

        return warehouseJdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("table_name"), schema);
    }

    public List<TableColumn> findColumns(String tableName) {
        String sql = """
                SELECT column_name, data_type
                FROM information_schema.columns
                WHERE table_schema = ? AND table_name = ?
                ORDER BY ordinal_position
                """;

        return warehouseJdbcTemplate.query(sql,
                (rs, rowNum) -> new TableColumn(
                        rs.getString("column_name"),
                        rs.getString("data_type")),
                schema,
                tableName);
    }

    public String schema() {
        return schema;
    }
}
