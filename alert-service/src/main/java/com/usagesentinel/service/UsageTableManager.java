package com.usagesentinel.service;

import com.usagesentinel.core.exception.DataAccessException;
import com.usagesentinel.core.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Creates and checks the {@code usage_records} table.
 *
 * <p>
 * One row per (region, sub-region, item, date). A region-level row without a
 * sub-region stores an empty string in {@code sub_region} so the primary key
 * stays unique. Dates are ISO-8601 text, which orders correctly under string
 * comparison.
 * </p>
 */
public class UsageTableManager {

    private static final Logger LOG = LoggerFactory.getLogger(UsageTableManager.class);

    private static final String CREATE_USAGE_TABLE = """
            CREATE TABLE IF NOT EXISTS usage_records (
                region      TEXT NOT NULL,
                sub_region  TEXT NOT NULL DEFAULT '',
                item        TEXT NOT NULL,
                usage_date  TEXT NOT NULL,
                quantity    REAL NOT NULL,
                PRIMARY KEY (region, sub_region, item, usage_date)
            )
            """;

    private static final String CREATE_INDEXES = """
            CREATE INDEX IF NOT EXISTS idx_usage_item_date ON usage_records(item, usage_date);
            CREATE INDEX IF NOT EXISTS idx_usage_region_item ON usage_records(region, item)
            """;

    private final DataSource dataSource;

    public UsageTableManager(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Create the table and its indexes if they do not exist yet.
     *
     * @throws DataAccessException if the statements fail
     */
    public void initializeTables() {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_USAGE_TABLE);
                for (String indexSql : CREATE_INDEXES.split(";")) {
                    if (!indexSql.isBlank()) {
                        stmt.execute(indexSql);
                    }
                }
                conn.commit();
                LOG.debug("Usage table initialized");
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            LOG.error("Failed to initialize usage table", e);
            throw new DataAccessException("Usage table initialization failed",
                    ErrorCode.SCHEMA_INITIALIZATION_FAILED, e);
        }
    }

    /**
     * Check that the table has the expected columns.
     *
     * @throws DataAccessException if a column is missing
     */
    public void validateSchema() {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement("""
                        SELECT region, sub_region, item, usage_date, quantity
                        FROM usage_records WHERE 1=0
                        """)) {
            stmt.executeQuery().close();
            LOG.debug("Usage table schema validated");
        } catch (SQLException e) {
            LOG.error("Usage table schema validation failed", e);
            throw new DataAccessException("Invalid usage table schema",
                    ErrorCode.SCHEMA_INITIALIZATION_FAILED, e);
        }
    }
}
