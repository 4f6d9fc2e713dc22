package com.tapas.dwh.analytics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Properties;

/**
 * Configuration for the DuckDB warehouse connection.
 * The Gold layer (dim_customers, dim_products, fact_sales) is only ever read.
 */
@Configuration
public class DuckDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBConfig.class);

    static final String READ_ONLY_PROPERTY = "duckdb.read_only";

    @Value("${duckdb.path:/data/warehouse.duckdb}")
    private String duckdbPath;

    @Value("${duckdb.read-only:true}")
    private boolean readOnly;

    /**
     * Creates a DataSource wrapper for DuckDB.
     * Note: a new connection is opened for each request.
     */
    @Bean(name = "warehouseDataSource")
    public DataSource warehouseDataSource() {
        logger.info("Initializing DuckDB warehouse DataSource with path: {} (read-only: {})", duckdbPath, readOnly);
        return new DuckDBDataSource(duckdbPath, readOnly);
    }

    @Bean(name = "warehouseJdbcTemplate")
    public JdbcTemplate warehouseJdbcTemplate() {
        return new JdbcTemplate(warehouseDataSource());
    }

    /**
     * Simple DataSource wrapper for DuckDB.
     * Creates new connections on demand (DuckDB handles concurrency internally).
     */
    static class DuckDBDataSource implements DataSource {
        private final String dbPath;
        private final boolean readOnly;
        private PrintWriter logWriter;
        private int loginTimeout = 0;

        DuckDBDataSource(String dbPath, boolean readOnly) {
            this.dbPath = dbPath;
            this.readOnly = readOnly;
        }

        String getUrl() {
            return "jdbc:duckdb:" + dbPath;
        }

        Properties connectionProperties() {
            Properties properties = new Properties();
            if (readOnly) {
                properties.setProperty(READ_ONLY_PROPERTY, "true");
            }
            return properties;
        }

        @Override
        public Connection getConnection() throws SQLException {
            return DriverManager.getConnection(getUrl(), connectionProperties());
        }

        @Override
        public Connection getConnection(String username, String password) throws SQLException {
            return getConnection();
        }

        @Override
        public PrintWriter getLogWriter() {
            return logWriter;
        }

        @Override
        public void setLogWriter(PrintWriter out) {
            this.logWriter = out;
        }

        @Override
        public void setLoginTimeout(int seconds) {
            this.loginTimeout = seconds;
        }

        @Override
        public int getLoginTimeout() {
            return loginTimeout;
        }

        @Override
        public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
            return java.util.logging.Logger.getLogger(java.util.logging.Logger.GLOBAL_LOGGER_NAME);
        }

        @Override
        public <T> T unwrap(Class<T> iface) throws SQLException {
            if (iface.isInstance(this)) {
                return iface.cast(this);
            }
            throw new SQLException("Cannot unwrap to " + iface);
        }

        @Override
        public boolean isWrapperFor(Class<?> iface) {
            return iface.isInstance(this);
        }
    }
}
