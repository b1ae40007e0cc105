package io.barsync.marketdata.target;

import java.util.concurrent.TimeUnit;

/**
 * Renders rows as InfluxDB line protocol:
 * {@code table,exchange=..,symbol=..,bar_interval=..,data_source=.. open=..,high=..,low=..,close=..,volume=..i[,oi=..i] <nanos>}.
 */
public final class LineProtocolEncoder {
    private LineProtocolEncoder() {}

    public static String encode(MigrationRecord r) {
        StringBuilder sb = new StringBuilder(160);
        sb.append(r.table());
        tag(sb, "exchange", r.key().exchange().name());
        tag(sb, "symbol", r.key().symbol());
        tag(sb, "bar_interval", r.key().interval().code());
        if (r.dataSource() != null && !r.dataSource().isEmpty()) tag(sb, "data_source", r.dataSource());
        sb.append(' ')
                .append("open=").append(r.open())
                .append(",high=").append(r.high())
                .append(",low=").append(r.low())
                .append(",close=").append(r.close())
                .append(",volume=").append(r.volume()).append('i');
        if (r.openInterest().isPresent()) sb.append(",oi=").append(r.openInterest().getAsLong()).append('i');
        sb.append(' ').append(TimeUnit.SECONDS.toNanos(r.timestamp())).append('\n');
        return sb.toString();
    }

    private static void tag(StringBuilder sb, String name, String value) {
        sb.append(',').append(name).append('=');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ',' || c == '=' || c == ' ' || c == '\\') sb.append('\\');
            sb.append(c);
        }
    }
}
