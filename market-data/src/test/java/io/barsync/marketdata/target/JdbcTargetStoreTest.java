package io.barsync.marketdata.target;

import io.barsync.marketdata.model.Exchange;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcTargetStoreTest {
    private static final SeriesKey INFY = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.DAY);
    private static final SeriesKey FUT = SeriesKey.of(Exchange.NFO, "NIFTY24JANFUT", SamplingInterval.DAY);

    private String url;
    private JdbcTargetStore target;

    @BeforeEach
    void setUp() throws Exception {
        url = "jdbc:h2:mem:target_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        target = new JdbcTargetStore(url, "sa", "");
        target.ensureSchema();
    }

    private static MigrationRecord row(SeriesKey key, long ts, double close, OptionalLong oi) {
        return new MigrationRecord(key, ts, close, close + 1, close - 1, close, 100, oi, "local-store");
    }

    @Test
    void ensure_schema_is_repeatable() throws Exception {
        target.ensureSchema();
        assertEquals(0, target.countRows(INFY));
    }

    @Test
    void replayed_rows_are_upserted_not_duplicated() throws Exception {
        List<MigrationRecord> batch = List.of(row(INFY, 1_000, 10, OptionalLong.empty()), row(INFY, 2_000, 11, OptionalLong.empty()));
        try (TargetWriter w = target.openWriter()) {
            assertEquals(2, w.write(batch));
            assertEquals(2, w.write(batch));
            w.write(List.of(row(INFY, 2_000, 12, OptionalLong.empty())));
        }
        assertEquals(2, target.countRows(INFY));
        try (Connection c = DriverManager.getConnection(url, "sa", "");
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT close, oi FROM ohlcv_equity WHERE symbol = 'INFY' ORDER BY ts")) {
            assertTrue(rs.next());
            assertEquals(10.0, rs.getDouble(1));
            rs.getLong(2);
            assertTrue(rs.wasNull());
            assertTrue(rs.next());
            assertEquals(12.0, rs.getDouble(1));
        }
    }

    @Test
    void segments_land_in_their_own_tables() throws Exception {
        try (TargetWriter w = target.openWriter()) {
            w.write(List.of(row(INFY, 1_000, 10, OptionalLong.empty()), row(FUT, 1_000, 20, OptionalLong.of(5_000))));
        }
        assertEquals(1, target.countRows(INFY));
        assertEquals(1, target.countRows(FUT));
        try (Connection c = DriverManager.getConnection(url, "sa", "");
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT oi, data_source FROM ohlcv_derivatives")) {
            assertTrue(rs.next());
            assertEquals(5_000, rs.getLong(1));
            assertEquals("local-store", rs.getString(2));
        }
    }

    @Test
    void same_timestamp_for_different_symbols_is_kept() throws Exception {
        SeriesKey tcs = SeriesKey.of(Exchange.NSE, "TCS", SamplingInterval.DAY);
        SeriesKey infyMinute = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.MINUTE);
        try (TargetWriter w = target.openWriter()) {
            w.write(List.of(row(INFY, 1_000, 10, OptionalLong.empty()), row(tcs, 1_000, 10, OptionalLong.empty()),
                    row(infyMinute, 1_000, 10, OptionalLong.empty())));
        }
        assertEquals(1, target.countRows(INFY));
        assertEquals(1, target.countRows(tcs));
        assertEquals(1, target.countRows(infyMinute));
    }

    @Test
    void rejected_batch_leaves_nothing_behind_for_the_next_write() throws Exception {
        MigrationRecord tooLong = new MigrationRecord(INFY, 1_000, 10, 11, 9, 10, 100, OptionalLong.empty(), "x".repeat(100));
        try (TargetWriter w = target.openWriter()) {
            assertThrows(TargetStoreException.class, () -> w.write(List.of(tooLong, row(FUT, 1_000, 20, OptionalLong.of(7)))));
            assertEquals(1, w.write(List.of(row(INFY, 2_000, 10, OptionalLong.empty()))));
        }
        assertEquals(1, target.countRows(INFY));
        assertEquals(0, target.countRows(FUT));
    }

    @Test
    void unreachable_database_is_a_target_failure() {
        JdbcTargetStore broken = new JdbcTargetStore("jdbc:nosuchdriver:target", "sa", "");
        assertThrows(TargetStoreException.class, broken::ensureSchema);
    }
}
