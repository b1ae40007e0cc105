package io.barsync.marketdata.plan;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.Set;

/**
 * Trading days of an exchange: weekdays minus configured holidays. Also converts calendar dates into
 * epoch-second request bounds in the exchange's time zone.
 */
public class TradingCalendar {
    private final Set<LocalDate> holidays;

    public TradingCalendar(Set<LocalDate> holidays) { this.holidays = Set.copyOf(holidays); }

    public static TradingCalendar weekdays() { return new TradingCalendar(Set.of()); }

    /** One {@code yyyy-MM-dd} holiday per line, {@code #} comments allowed. A missing file means weekdays only. */
    public static TradingCalendar load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) return weekdays();
        Set<LocalDate> holidays = new HashSet<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String t = line.strip();
            if (t.isEmpty() || t.startsWith("#")) continue;
            try {
                holidays.add(LocalDate.parse(t));
            } catch (DateTimeParseException e) {
                throw new IOException(file + ": not a date: " + t, e);
            }
        }
        return new TradingCalendar(holidays);
    }

    public int holidayCount() { return holidays.size(); }

    static boolean isWeekday(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    public boolean isTradingDay(LocalDate d) { return isWeekday(d) && !holidays.contains(d); }

    /** Whether any day touched by the range is a trading day in {@code zone}. */
    public boolean containsTradingDay(CoverageRange range, ZoneId zone) {
        LocalDate first = toDate(range.start(), zone);
        LocalDate last = toDate(range.end(), zone);
        for (LocalDate d = first; !d.isAfter(last); d = d.plusDays(1)) {
            if (isTradingDay(d)) return true;
        }
        return false;
    }

    /**
     * Request bounds for the dates {@code from..to} inclusive. Daily bars are stamped at the start of their day;
     * intraday requests run to the last unit of {@code to}.
     */
    public static CoverageRange span(SeriesKey key, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) throw new IllegalArgumentException("start " + from + " is after end " + to);
        ZoneId zone = key.exchange().zone();
        SamplingInterval interval = key.interval();
        long start = from.atStartOfDay(zone).toEpochSecond();
        long end = interval == SamplingInterval.DAY
                ? to.atStartOfDay(zone).toEpochSecond()
                : to.plusDays(1).atStartOfDay(zone).toEpochSecond() - interval.unitSeconds();
        return new CoverageRange(start, end);
    }

    public static LocalDate toDate(long epochSecond, ZoneId zone) {
        return LocalDate.ofInstant(Instant.ofEpochSecond(epochSecond), zone);
    }
}
