package io.barsync.marketdata.target;

import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Target store over plain JDBC. Rows are upserted with {@code MERGE ... KEY(ts, exchange, symbol, bar_interval)}
 * (H2 dialect), so replaying the same rows leaves one row per key.
 */
public class JdbcTargetStore implements TargetStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcTargetStore.class);

    private final String jdbcUrl;
    private final String user;
    private final String password;

    public JdbcTargetStore(String jdbcUrl, String user, String password) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
    }

    @Override
    public void ensureSchema() throws TargetStoreException {
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            for (MarketSegment segment : MarketSegment.values()) {
                s.execute("CREATE TABLE IF NOT EXISTS " + TargetTables.tableFor(segment) + " ("
                        + "ts TIMESTAMP WITH TIME ZONE NOT NULL, exchange VARCHAR(16) NOT NULL, symbol VARCHAR(64) NOT NULL, "
                        + "bar_interval VARCHAR(16) NOT NULL, open DOUBLE PRECISION, high DOUBLE PRECISION, "
                        + "low DOUBLE PRECISION, close DOUBLE PRECISION, volume BIGINT, oi BIGINT, data_source VARCHAR(64), "
                        + "PRIMARY KEY (" + TargetTables.KEY_COLUMNS + "))");
            }
        } catch (SQLException e) {
            throw new TargetStoreException("Could not create target tables at " + jdbcUrl, e);
        }
    }

    @Override
    public TargetWriter openWriter() throws TargetStoreException {
        try {
            Connection c = getConnection();
            c.setAutoCommit(false);
            return new Writer(c);
        } catch (SQLException e) {
            throw new TargetStoreException("Could not open target connection to " + jdbcUrl, e);
        }
    }

    @Override
    public long countRows(SeriesKey key) throws TargetStoreException {
        return countRows(this::getConnection, key);
    }

    interface ConnectionFactory {
        Connection get() throws SQLException;
    }

    static long countRows(ConnectionFactory connections, SeriesKey key) throws TargetStoreException {
        try (Connection c = connections.get(); PreparedStatement ps = c.prepareStatement(TargetTables.countSql(key))) {
            ps.setString(1, key.exchange().name());
            ps.setString(2, key.symbol());
            ps.setString(3, key.interval().code());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new TargetStoreException("Could not count rows for " + key, e);
        }
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }

    private static final class Writer implements TargetWriter {
        private final Connection connection;
        private final Map<MarketSegment, PreparedStatement> statements = new EnumMap<>(MarketSegment.class);

        Writer(Connection connection) { this.connection = connection; }

        @Override
        public int write(List<MigrationRecord> batch) throws TargetStoreException {
            if (batch.isEmpty()) return 0;
            try {
                for (MigrationRecord r : batch) bind(statement(r.key().segment()), r).addBatch();
                for (PreparedStatement ps : statements.values()) ps.executeBatch();
                connection.commit();
                return batch.size();
            } catch (SQLException e) {
                for (PreparedStatement ps : statements.values()) {
                    try {
                        ps.clearBatch();
                    } catch (SQLException clear) {
                        e.addSuppressed(clear);
                    }
                }
                try {
                    connection.rollback();
                } catch (SQLException rollback) {
                    e.addSuppressed(rollback);
                }
                throw new TargetStoreException("Batch of " + batch.size() + " row(s) rejected by target", e);
            }
        }

        private PreparedStatement statement(MarketSegment segment) throws SQLException {
            PreparedStatement ps = statements.get(segment);
            if (ps == null) {
                ps = connection.prepareStatement("MERGE INTO " + TargetTables.tableFor(segment) + " (" + TargetTables.COLUMNS
                        + ") KEY (" + TargetTables.KEY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
                statements.put(segment, ps);
            }
            return ps;
        }

        private static PreparedStatement bind(PreparedStatement ps, MigrationRecord r) throws SQLException {
            ps.setObject(1, OffsetDateTime.ofInstant(Instant.ofEpochSecond(r.timestamp()), ZoneOffset.UTC));
            ps.setString(2, r.key().exchange().name());
            ps.setString(3, r.key().symbol());
            ps.setString(4, r.key().interval().code());
            ps.setDouble(5, r.open());
            ps.setDouble(6, r.high());
            ps.setDouble(7, r.low());
            ps.setDouble(8, r.close());
            ps.setLong(9, r.volume());
            if (r.openInterest().isPresent()) ps.setLong(10, r.openInterest().getAsLong());
            else ps.setNull(10, Types.BIGINT);
            ps.setString(11, r.dataSource());
            return ps;
        }

        @Override
        public void flush() {}

        @Override
        public void close() throws TargetStoreException {
            SQLException failure = null;
            for (PreparedStatement ps : statements.values()) {
                try {
                    ps.close();
                } catch (SQLException e) {
                    failure = e;
                }
            }
            try {
                connection.close();
            } catch (SQLException e) {
                if (failure != null) e.addSuppressed(failure);
                failure = e;
            }
            if (failure != null) throw new TargetStoreException("Could not close target writer", failure);
            log.debug("Closed target writer");
        }
    }
}
