package io.barsync.marketdata.validate;

import io.barsync.marketdata.model.DerivativeBar;
import io.barsync.marketdata.model.EquityBar;
import io.barsync.marketdata.model.RawBar;
import io.barsync.marketdata.model.SamplingInterval;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.barsync.marketdata.BarFixtures.dailyRaw;
import static io.barsync.marketdata.BarFixtures.day;
import static io.barsync.marketdata.BarFixtures.days;
import static org.junit.jupiter.api.Assertions.*;

public class BarValidatorTest {
    private final BarValidator validator = new BarValidator();

    @Test
    void clean_batch_passes_and_converts_to_equity_bars() {
        ValidationReport report = validator.validate(dailyRaw(day("2024-01-01"), day("2024-01-05")), SegmentRules.EQUITY,
                days("2024-01-01", "2024-01-05"), SamplingInterval.DAY);
        assertEquals(Verdict.PASS, report.verdict());
        assertEquals(5, report.bars().size());
        assertTrue(report.bars().get(0) instanceof EquityBar);
        assertTrue(report.messages().isEmpty());
    }

    @Test
    void low_above_open_fails_the_whole_batch() {
        List<RawBar> rows = new ArrayList<>(dailyRaw(day("2024-01-01"), day("2024-01-05")));
        rows.set(2, RawBar.of(day("2024-01-03"), 100, 105, 101, 102, 1_000));
        ValidationReport report = validator.validate(rows, SegmentRules.EQUITY);
        assertEquals(Verdict.FAIL, report.verdict());
        assertTrue(report.bars().isEmpty());
        assertEquals(1, report.stats().errorRows());
        assertTrue(report.errors().get(0).contains("OHLC"), report.errors().toString());
        assertThrows(ValidationFailureException.class, report::requireStorable);
    }

    @Test
    void missing_fields_are_errors() {
        List<RawBar> rows = List.of(new RawBar(day("2024-01-01"), null, 101.0, 99.0, 100.0, 10L, null));
        ValidationReport report = validator.validate(rows, SegmentRules.EQUITY);
        assertEquals(Verdict.FAIL, report.verdict());
        assertTrue(report.errors().get(0).contains("missing open"));
    }

    @Test
    void duplicate_and_decreasing_timestamps_fail() {
        long t = day("2024-01-02");
        ValidationReport dup = validator.validate(List.of(RawBar.of(t, 10, 11, 9, 10, 1), RawBar.of(t, 10, 11, 9, 10, 1)),
                SegmentRules.EQUITY);
        assertEquals(Verdict.FAIL, dup.verdict());
        assertEquals(1, dup.stats().duplicateTimestamps());

        ValidationReport back = validator.validate(List.of(RawBar.of(t, 10, 11, 9, 10, 1), RawBar.of(t - 86_400, 10, 11, 9, 10, 1)),
                SegmentRules.EQUITY);
        assertEquals(Verdict.FAIL, back.verdict());
    }

    @Test
    void warnings_below_ratio_are_stored_above_ratio_fail() {
        List<RawBar> rows = zeroVolume(dailyRaw(day("2024-01-01"), day("2024-01-10")), 4);
        ValidationReport ok = validator.validate(rows, SegmentRules.EQUITY);
        assertEquals(Verdict.WARN, ok.verdict());
        assertEquals(10, ok.bars().size());
        assertEquals(4, ok.stats().zeroVolumeRows());

        ValidationReport tooMany = validator.validate(zeroVolume(dailyRaw(day("2024-01-01"), day("2024-01-10")), 6), SegmentRules.EQUITY);
        assertEquals(Verdict.FAIL, tooMany.verdict());
        assertEquals(0.6, tooMany.stats().warningRatio(), 1e-9);
    }

    @Test
    void strict_mode_fails_on_any_warning() {
        List<RawBar> rows = zeroVolume(dailyRaw(day("2024-01-01"), day("2024-01-10")), 1);
        assertEquals(Verdict.WARN, validator.validate(rows, SegmentRules.EQUITY).verdict());
        ValidationReport strict = new BarValidator(0.5, true).validate(rows, SegmentRules.EQUITY);
        assertEquals(Verdict.FAIL, strict.verdict());
        assertTrue(strict.errors().get(0).startsWith("strict mode"));
    }

    @Test
    void price_spike_and_gap_are_warnings() {
        List<RawBar> rows = List.of(
                RawBar.of(day("2024-01-01"), 100, 101, 99, 100, 10),
                RawBar.of(day("2024-01-02"), 100, 140, 99, 135, 10),
                RawBar.of(day("2024-01-15"), 135, 136, 134, 135, 10));
        ValidationReport report = new BarValidator(1.0, false).validate(rows, SegmentRules.EQUITY, null, SamplingInterval.DAY);
        assertEquals(Verdict.WARN, report.verdict());
        assertEquals(1, report.stats().priceSpikes());
        assertEquals(1, report.stats().gaps());
        assertEquals(2, report.stats().warningRows());
    }

    @Test
    void rows_outside_requested_window_are_dropped() {
        ValidationReport report = validator.validate(dailyRaw(day("2024-01-01"), day("2024-01-06")), SegmentRules.EQUITY,
                days("2024-01-01", "2024-01-05"), SamplingInterval.DAY);
        assertEquals(Verdict.WARN, report.verdict());
        assertEquals(5, report.bars().size());
        assertEquals(1, report.stats().outsideRange());
        assertEquals(day("2024-01-05"), report.bars().get(4).timestamp());
    }

    @Test
    void zero_price_is_an_error_for_equity_but_allowed_for_derivatives() {
        List<RawBar> rows = List.of(RawBar.of(day("2024-01-25"), 0.0, 0.0, 0.0, 0.0, 10, 500));
        assertEquals(Verdict.FAIL, validator.validate(rows, SegmentRules.EQUITY).verdict());

        ValidationReport derivative = validator.validate(rows, SegmentRules.DERIVATIVES);
        assertEquals(Verdict.PASS, derivative.verdict());
        assertEquals(new DerivativeBar(day("2024-01-25"), 0.0, 0.0, 0.0, 0.0, 10, 500), derivative.bars().get(0));
    }

    @Test
    void missing_open_interest_is_stored_as_zero_with_one_warning() {
        ValidationReport report = validator.validate(dailyRaw(day("2024-01-01"), day("2024-01-04")), SegmentRules.DERIVATIVES);
        assertEquals(Verdict.WARN, report.verdict());
        assertEquals(4, report.bars().size());
        assertEquals(0, report.stats().warningRows());
        assertEquals(4, report.stats().missingOpenInterest());
        assertEquals(List.of("4 row(s) without open interest, stored as 0"), report.warnings());
        assertEquals(0L, report.bars().get(0).openInterest());
    }

    @Test
    void open_interest_on_equity_rows_is_dropped() {
        List<RawBar> rows = List.of(RawBar.of(day("2024-01-02"), 10, 11, 9, 10, 5, 77));
        ValidationReport report = validator.validate(rows, SegmentRules.EQUITY);
        assertEquals(Verdict.WARN, report.verdict());
        assertEquals(1, report.stats().droppedOpenInterest());
        assertEquals(new EquityBar(day("2024-01-02"), 10, 11, 9, 10, 5), report.bars().get(0));
    }

    @Test
    void message_lists_are_capped() {
        List<RawBar> rows = new ArrayList<>();
        for (int i = 0; i < 80; i++) rows.add(RawBar.of(day("2024-01-01") + i * 86_400L, 10, 11, 12, 10, 1));
        ValidationReport report = validator.validate(rows, SegmentRules.EQUITY);
        assertEquals(BarValidator.MAX_MESSAGES + 1, report.errors().size());
        assertEquals("... 30 more", report.errors().get(BarValidator.MAX_MESSAGES));
    }

    private static List<RawBar> zeroVolume(List<RawBar> rows, int count) {
        List<RawBar> out = new ArrayList<>(rows);
        for (int i = 0; i < count; i++) {
            RawBar r = out.get(i);
            out.set(i, RawBar.of(r.timestamp(), r.open(), r.high(), r.low(), r.close(), 0));
        }
        return out;
    }
}
