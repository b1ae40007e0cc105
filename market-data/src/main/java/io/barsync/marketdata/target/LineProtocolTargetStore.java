package io.barsync.marketdata.target;

import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SeriesKey;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Time-series target written over line protocol (TCP) and read over SQL (PostgreSQL wire). Deduplication is
 * declared on each table with {@code DEDUP UPSERT KEYS}, so re-sent rows replace what is stored.
 */
public class LineProtocolTargetStore implements TargetStore {
    private final String host;
    private final int port;
    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final int connectTimeoutMillis;

    public LineProtocolTargetStore(String host, int port, String jdbcUrl, String user, String password) {
        this(host, port, jdbcUrl, user, password, 5_000);
    }

    public LineProtocolTargetStore(String host, int port, String jdbcUrl, String user, String password, int connectTimeoutMillis) {
        this.host = host;
        this.port = port;
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    @Override
    public void ensureSchema() throws TargetStoreException {
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            for (MarketSegment segment : MarketSegment.values()) s.execute(createTableSql(segment));
        } catch (SQLException e) {
            throw new TargetStoreException("Could not create target tables at " + jdbcUrl, e);
        }
    }

    static String createTableSql(MarketSegment segment) {
        return "CREATE TABLE IF NOT EXISTS " + TargetTables.tableFor(segment) + " ("
                + "ts TIMESTAMP, exchange SYMBOL, symbol SYMBOL, bar_interval SYMBOL, "
                + "open DOUBLE, high DOUBLE, low DOUBLE, close DOUBLE, volume LONG, oi LONG, data_source SYMBOL"
                + ") TIMESTAMP(ts) PARTITION BY MONTH WAL DEDUP UPSERT KEYS(" + TargetTables.KEY_COLUMNS + ")";
    }

    @Override
    public TargetWriter openWriter() throws TargetStoreException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMillis);
            Writer out = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8), 1 << 16);
            return new LineWriter(socket, out);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closing) {
                e.addSuppressed(closing);
            }
            throw new TargetStoreException("Could not connect to line protocol endpoint " + host + ":" + port, e);
        }
    }

    @Override
    public long countRows(SeriesKey key) throws TargetStoreException {
        return JdbcTargetStore.countRows(this::getConnection, key);
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }

    private static final class LineWriter implements TargetWriter {
        private final Socket socket;
        private final Writer out;

        LineWriter(Socket socket, Writer out) {
            this.socket = socket;
            this.out = out;
        }

        @Override
        public int write(List<MigrationRecord> batch) throws TargetStoreException {
            try {
                for (MigrationRecord r : batch) out.write(LineProtocolEncoder.encode(r));
                out.flush();
                return batch.size();
            } catch (IOException e) {
                throw new TargetStoreException("Line protocol write of " + batch.size() + " row(s) failed", e);
            }
        }

        @Override
        public void flush() throws TargetStoreException {
            try {
                out.flush();
            } catch (IOException e) {
                throw new TargetStoreException("Line protocol flush failed", e);
            }
        }

        @Override
        public void close() throws TargetStoreException {
            try (Socket s = socket) {
                out.flush();
            } catch (IOException e) {
                throw new TargetStoreException("Could not close line protocol connection", e);
            }
        }
    }
}
