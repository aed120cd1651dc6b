package com.tapas.smartsales.olap.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * The DuckDB file that materialized cubes are written to, one
 * {@code cube_<name>} table per cube, so BI tools can query a cube without
 * recomputing it from the warehouse.
 * <p>
 * The file location comes from {@code duckdb.path}; its parent directory is
 * created on startup. Only {@code DuckDBCubeRepository} uses these beans, and
 * always by qualifier.
 */
@Configuration
public class DuckDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBConfig.class);

    private final String duckdbPath;

    public DuckDBConfig(@Value("${duckdb.path:data/olap/smart_sales_cubes.duckdb}") String duckdbPath) {
        this.duckdbPath = duckdbPath;
    }

    /**
     * DuckDB allows one writing process per file, so connections are opened per
     * materialization and closed afterwards instead of being pooled. That lets
     * a BI tool open the file between two materializations.
     */
    @Bean(name = "duckdbDataSource")
    public DataSource duckdbDataSource() {
        logger.info("Initializing DuckDB DataSource with path: {}", duckdbPath);
        Path parent = Path.of(duckdbPath).toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create DuckDB directory " + parent, e);
        }
        return new DuckDBDataSource(duckdbPath);
    }

    @Bean(name = "duckdbJdbcTemplate")
    public JdbcTemplate duckdbJdbcTemplate() {
        return new JdbcTemplate(duckdbDataSource());
    }

    private static class DuckDBDataSource implements DataSource {
        private final String dbPath;
        private PrintWriter logWriter;
        private int loginTimeout = 0;

        DuckDBDataSource(String dbPath) {
            this.dbPath = dbPath;
        }

        @Override
        public Connection getConnection() throws SQLException {
            return DriverManager.getConnection("jdbc:duckdb:" + dbPath);
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
            throw new SQLFeatureNotSupportedException("DuckDB does not use java.util.logging");
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
