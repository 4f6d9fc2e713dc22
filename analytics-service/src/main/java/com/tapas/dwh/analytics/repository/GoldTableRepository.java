package com.tapas.dwh.analytics.repository;

import com.tapas.dwh.analytics.config.AnalyticsProperties;
import com.tapas.dwh.analytics.domain.CustomerDimension;
import com.tapas.dwh.analytics.domain.GoldSnapshot;
import com.tapas.dwh.analytics.domain.ProductDimension;
import com.tapas.dwh.analytics.domain.SalesFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Read-only access to the Gold tables in the DuckDB warehouse.
 * Monetary columns are read at the precision the warehouse stores them; rounding happens in the reports.
 */
@Repository
public class GoldTableRepository {

    private static final Logger logger = LoggerFactory.getLogger(GoldTableRepository.class);

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate warehouseJdbcTemplate;
    private final String schema;

    public GoldTableRepository(@Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate,
                               AnalyticsProperties properties) {
        this.warehouseJdbcTemplate = warehouseJdbcTemplate;
        this.schema = requireIdentifier(properties.getSchema());
    }

    static String requireIdentifier(String schema) {
        if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalStateException("Invalid warehouse schema name: " + schema);
        }
        return schema;
    }

    public List<CustomerDimension> findAllCustomers() {
        String sql = """
                SELECT customer_key, customer_id, customer_number, first_name, last_name,
                       country, gender, birthdate
                FROM %s.dim_customers
                """.formatted(schema);

        return warehouseJdbcTemplate.query(sql,
                (rs, rowNum) -> new CustomerDimension(
                        getLong(rs, "customer_key"),
                        getLong(rs, "customer_id"),
                        rs.getString("customer_number"),
                        rs.getString("first_name"),
                        rs.getString("last_name"),
                        rs.getString("country"),
                        rs.getString("gender"),
                        getLocalDate(rs, "birthdate")));
    }

    public List<ProductDimension> findAllProducts() {
        String sql = """
                SELECT product_key, product_id, product_number, product_name, category,
                       subcategory, cost
                FROM %s.dim_products
                """.formatted(schema);

        return warehouseJdbcTemplate.query(sql,
                (rs, rowNum) -> new ProductDimension(
                        getLong(rs, "product_key"),
                        getLong(rs, "product_id"),
                        rs.getString("product_number"),
                        rs.getString("product_name"),
                        rs.getString("category"),
                        rs.getString("subcategory"),
                        getDecimal(rs, "cost")));
    }

    public List<SalesFact> findAllSales() {
        String sql = """
                SELECT order_number, product_key, customer_key, order_date,
                       sales_amount, quantity, price
                FROM %s.fact_sales
                """.formatted(schema);

        return warehouseJdbcTemplate.query(sql,
                (rs, rowNum) -> new SalesFact(
                        rs.getString("order_number"),
                        getLong(rs, "product_key"),
                        getLong(rs, "customer_key"),
                        getLocalDate(rs, "order_date"),
                        getDecimal(rs, "sales_amount"),
                        getInteger(rs, "quantity"),
                        getDecimal(rs, "price")));
    }

    /**
     * Reads the three tables for one report computation.
     */
    public GoldSnapshot loadSnapshot() {
        var customers = findAllCustomers();
        var products = findAllProducts();
        var sales = findAllSales();

        logger.debug("Loaded Gold snapshot from schema {}: {} customers, {} products, {} sales lines",
                schema, customers.size(), products.size(), sales.size());

        return new GoldSnapshot(customers, products, sales);
    }

    /**
     * Health check - verify the warehouse connection and the fact table.
     */
    public boolean healthCheck() {
        try {
            var count = warehouseJdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM %s.fact_sales".formatted(schema), Long.class);
            return count != null;
        } catch (Exception e) {
            logger.error("Warehouse health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Maps DECIMAL, integer and floating point columns to BigDecimal without changing their scale.
     */
    static BigDecimal getDecimal(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double) {
            return BigDecimal.valueOf((Double) value);
        }
        return new BigDecimal(value.toString());
    }

    private static LocalDate getLocalDate(ResultSet rs, String column) throws SQLException {
        Date value = rs.getDate(column);
        return value == null ? null : value.toLocalDate();
    }
}
