package com.usagesentinel.service;

import com.usagesentinel.core.exception.DataAccessException;
import com.usagesentinel.core.exception.ErrorCode;
import com.usagesentinel.core.exception.InvalidInputException;
import com.usagesentinel.core.loader.SeriesLoader;
import com.usagesentinel.core.model.SeriesKey;
import com.usagesentinel.core.model.UsageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link SeriesLoader} reading the {@code usage_records} table over JDBC.
 *
 * <p>
 * Every call opens its own connection, so the loader is safe to share across
 * the fleet scan worker pool. {@link SQLException}s surface as
 * {@link DataAccessException}; a stored quantity that is not a non-negative
 * finite number surfaces as {@link InvalidInputException}.
 * </p>
 *
 * @since 1.0.0
 */
public class JdbcSeriesLoader implements SeriesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcSeriesLoader.class);

    private static final String SELECT_SUB_REGION = """
            SELECT usage_date, quantity FROM usage_records
            WHERE region = ? AND sub_region = ? AND item = ? AND usage_date BETWEEN ? AND ?
            ORDER BY usage_date
            """;

    private static final String SELECT_REGION = """
            SELECT usage_date, quantity FROM usage_records
            WHERE region = ? AND item = ? AND usage_date BETWEEN ? AND ?
            ORDER BY usage_date
            """;

    private static final String SELECT_KEYS = """
            SELECT DISTINCT region, sub_region, item FROM usage_records
            WHERE (? IS NULL OR region = ?) AND (? IS NULL OR item = ?)
            ORDER BY region, sub_region, item
            """;

    private static final String UPSERT = """
            INSERT OR REPLACE INTO usage_records (region, sub_region, item, usage_date, quantity)
            VALUES (?, ?, ?, ?, ?)
            """;

    private final DataSource dataSource;

    public JdbcSeriesLoader(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    @Override
    public List<UsageRecord> load(String region, String subRegion, String item,
            LocalDate startDate, LocalDate endDate) {
        Objects.requireNonNull(region, "region must not be null");
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(startDate, "startDate must not be null");
        Objects.requireNonNull(endDate, "endDate must not be null");

        boolean aggregate = subRegion == null;
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(aggregate ? SELECT_REGION : SELECT_SUB_REGION)) {
            int i = 1;
            stmt.setString(i++, region);
            if (!aggregate) {
                stmt.setString(i++, subRegion);
            }
            stmt.setString(i++, item);
            stmt.setString(i++, startDate.toString());
            stmt.setString(i, endDate.toString());

            Map<LocalDate, Double> perDay = new TreeMap<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    LocalDate date = parseDate(rs.getString("usage_date"), region, item);
                    double quantity = parseQuantity(rs.getObject("quantity"), region, item, date);
                    perDay.merge(date, quantity, Double::sum);
                }
            }

            List<UsageRecord> records = new ArrayList<>(perDay.size());
            perDay.forEach((date, qty) -> records.add(new UsageRecord(region, subRegion, item, date, qty)));
            return records;
        } catch (SQLException e) {
            LOG.error("Failed to load usage for {}/{}/{}", region, subRegion, item, e);
            throw new DataAccessException("Failed to load usage for " + item + " in " + region, e);
        }
    }

    @Override
    public List<UsageRecord> loadKey(SeriesKey key, LocalDate startDate, LocalDate endDate) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(startDate, "startDate must not be null");
        Objects.requireNonNull(endDate, "endDate must not be null");

        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SELECT_SUB_REGION)) {
            stmt.setString(1, key.getRegion());
            stmt.setString(2, toColumn(key.getSubRegion()));
            stmt.setString(3, key.getItem());
            stmt.setString(4, startDate.toString());
            stmt.setString(5, endDate.toString());

            List<UsageRecord> records = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    LocalDate date = parseDate(rs.getString("usage_date"), key.getRegion(), key.getItem());
                    double quantity = parseQuantity(rs.getObject("quantity"), key.getRegion(), key.getItem(), date);
                    records.add(new UsageRecord(key.getRegion(), key.getSubRegion(), key.getItem(), date, quantity));
                }
            }
            return records;
        } catch (SQLException e) {
            LOG.error("Failed to load usage for {}", key, e);
            throw new DataAccessException("Failed to load usage for " + key, e);
        }
    }

    @Override
    public List<SeriesKey> listKeys(String regionFilter, String itemFilter) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SELECT_KEYS)) {
            stmt.setString(1, regionFilter);
            stmt.setString(2, regionFilter);
            stmt.setString(3, itemFilter);
            stmt.setString(4, itemFilter);

            List<SeriesKey> keys = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(new SeriesKey(rs.getString("region"),
                            fromColumn(rs.getString("sub_region")),
                            rs.getString("item")));
                }
            }
            return keys;
        } catch (SQLException e) {
            LOG.error("Failed to list series keys", e);
            throw new DataAccessException("Failed to list series keys", e);
        }
    }

    /**
     * Insert or replace records in one transaction.
     *
     * @param records records to store; must not be {@code null}
     * @return number of records written
     * @throws DataAccessException if the batch fails; nothing is written
     */
    public int save(Collection<UsageRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(UPSERT)) {
                for (UsageRecord r : records) {
                    stmt.setString(1, r.getRegion());
                    stmt.setString(2, toColumn(r.getSubRegion()));
                    stmt.setString(3, r.getItem());
                    stmt.setString(4, r.getDate().toString());
                    stmt.setDouble(5, r.getQuantity());
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.debug("Stored {} usage record(s)", records.size());
            return records.size();
        } catch (SQLException e) {
            LOG.error("Failed to store {} usage record(s)", records.size(), e);
            throw new DataAccessException("Failed to store usage records", e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    // A missing sub-region is stored as '' so the primary key stays total.
    private static String toColumn(String subRegion) {
        return subRegion == null ? "" : subRegion;
    }

    private static String fromColumn(String subRegion) {
        return subRegion == null || subRegion.isEmpty() ? null : subRegion;
    }

    private static LocalDate parseDate(String raw, String region, String item) {
        if (raw == null) {
            throw new DataAccessException("Missing usage date for " + item + " in " + region);
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new DataAccessException("Unreadable usage date '" + raw + "' for " + item + " in " + region,
                    ErrorCode.DATA_ACCESS_FAILED, e);
        }
    }

    private static double parseQuantity(Object raw, String region, String item, LocalDate date) {
        if (raw instanceof Number n) {
            double value = n.doubleValue();
            if (value >= 0 && !Double.isInfinite(value)) {
                return value;
            }
        }
        throw new InvalidInputException(
                "Invalid quantity '" + raw + "' for " + item + " in " + region + " on " + date,
                ErrorCode.INVALID_QUANTITY);
    }
}
