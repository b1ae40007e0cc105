package io.barsync.marketdata.validate;

import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.DerivativeBar;
import io.barsync.marketdata.model.EquityBar;
import io.barsync.marketdata.model.RawBar;
import io.barsync.marketdata.model.SamplingInterval;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Record- and batch-level checks for upstream rows.
 * <p>
 * Any error fails the batch. Quality warnings (zero volume, close-to-close spikes, gaps) are tolerated until
 * the share of accepted rows carrying one exceeds {@code maxWarningRatio}; strict mode fails on any warning.
 */
public class BarValidator {
    static final int MAX_MESSAGES = 50;

    private final double maxWarningRatio;
    private final boolean strict;

    public BarValidator() { this(0.5, false); }

    public BarValidator(double maxWarningRatio, boolean strict) {
        this.maxWarningRatio = maxWarningRatio;
        this.strict = strict;
    }

    public ValidationReport validate(List<RawBar> rows, SegmentRules rules) {
        return validate(rows, rules, null, null);
    }

    /**
     * @param window   rows outside it are dropped with a warning; null accepts any timestamp
     * @param interval enables gap detection; null skips it
     */
    public ValidationReport validate(List<RawBar> rows, SegmentRules rules, CoverageRange window, SamplingInterval interval) {
        Messages errors = new Messages();
        Messages warnings = new Messages();
        List<Bar> bars = new ArrayList<>(rows.size());
        int errorRows = 0, warningRows = 0, outside = 0, zeroVolume = 0, duplicates = 0, spikes = 0, gaps = 0,
                missingOi = 0, droppedOi = 0;
        Long prevTs = null;
        Double prevClose = null;
        long gapLimit = interval == null ? Long.MAX_VALUE : interval.gapTolerance().getSeconds();

        for (int i = 0; i < rows.size(); i++) {
            RawBar r = rows.get(i);
            String missing = missingFields(r);
            if (!missing.isEmpty()) {
                errors.add("row " + i + ": missing " + missing);
                errorRows++;
                continue;
            }
            long ts = r.timestamp();
            String at = "row " + i + " (" + Instant.ofEpochSecond(ts) + ")";
            if (window != null && !window.contains(ts)) {
                warnings.add(at + ": outside requested range " + window + ", dropped");
                outside++;
                continue;
            }
            boolean error = false;
            boolean warn = false;
            if (ts < rules.minTimestamp() || ts > rules.maxTimestamp()) {
                errors.add(at + ": timestamp out of bounds");
                error = true;
            }
            if (prevTs != null && ts <= prevTs) {
                if (ts == prevTs) duplicates++;
                errors.add(at + (ts == prevTs ? ": duplicate timestamp" : ": timestamp not increasing"));
                error = true;
            }
            double o = r.open(), h = r.high(), l = r.low(), c = r.close();
            String priceProblem = priceProblem(rules, o, h, l, c);
            if (priceProblem != null) {
                errors.add(at + ": " + priceProblem);
                error = true;
            } else if (!(l <= Math.min(o, c) && Math.max(o, c) <= h)) {
                errors.add(at + ": OHLC relationship violated (o=" + o + " h=" + h + " l=" + l + " c=" + c + ")");
                error = true;
            }
            long v = r.volume();
            if (v < 0 || v > rules.maxVolume()) {
                errors.add(at + ": volume " + v + " out of bounds");
                error = true;
            }
            long oi = 0;
            if (rules.openInterestExpected()) {
                if (r.openInterest() == null) {
                    missingOi++;
                } else if (r.openInterest() < 0 || r.openInterest() > rules.maxOpenInterest()) {
                    errors.add(at + ": open interest " + r.openInterest() + " out of bounds");
                    error = true;
                } else {
                    oi = r.openInterest();
                }
            } else if (r.openInterest() != null) {
                droppedOi++;
            }
            prevTs = prevTs == null ? ts : Math.max(prevTs, ts);
            if (error) {
                errorRows++;
                continue;
            }
            if (v == 0) {
                zeroVolume++;
                warnings.add(at + ": zero volume");
                warn = true;
            }
            if (prevClose != null && prevClose > 0 && Math.abs(c / prevClose - 1.0) > rules.spikeThreshold()) {
                spikes++;
                warnings.add(String.format("%s: close moved %.1f%% from previous bar", at, (c / prevClose - 1.0) * 100));
                warn = true;
            }
            if (!bars.isEmpty() && ts - bars.get(bars.size() - 1).timestamp() > gapLimit) {
                gaps++;
                warnings.add(at + ": gap of " + (ts - bars.get(bars.size() - 1).timestamp()) / 3600 + "h since previous bar");
                warn = true;
            }
            if (warn) warningRows++;
            bars.add(rules.openInterestExpected() ? new DerivativeBar(ts, o, h, l, c, v, oi) : new EquityBar(ts, o, h, l, c, v));
            prevClose = c;
        }

        if (missingOi > 0) warnings.add(missingOi + " row(s) without open interest, stored as 0");
        if (droppedOi > 0) warnings.add(droppedOi + " row(s) carried open interest for " + rules.name() + ", dropped");

        ValidationStats stats = new ValidationStats(rows.size(), bars.size(), errorRows, warningRows, outside, zeroVolume,
                duplicates, spikes, gaps, missingOi, droppedOi);
        Verdict verdict;
        if (errorRows > 0) {
            verdict = Verdict.FAIL;
        } else if (warnings.total() == 0) {
            verdict = Verdict.PASS;
        } else if (strict) {
            errors.add("strict mode: " + warnings.total() + " warning(s)");
            verdict = Verdict.FAIL;
        } else if (stats.warningRatio() > maxWarningRatio) {
            errors.add(String.format("%d of %d rows carry warnings (%.0f%%), above the %.0f%% limit",
                    warningRows, bars.size(), stats.warningRatio() * 100, maxWarningRatio * 100));
            verdict = Verdict.FAIL;
        } else {
            verdict = Verdict.WARN;
        }
        return new ValidationReport(verdict, stats, errors.list(), warnings.list(),
                verdict == Verdict.FAIL ? List.of() : bars);
    }

    private static String missingFields(RawBar r) {
        List<String> missing = new ArrayList<>();
        if (r.timestamp() == null) missing.add("timestamp");
        if (r.open() == null) missing.add("open");
        if (r.high() == null) missing.add("high");
        if (r.low() == null) missing.add("low");
        if (r.close() == null) missing.add("close");
        if (r.volume() == null) missing.add("volume");
        return String.join(", ", missing);
    }

    private static String priceProblem(SegmentRules rules, double... prices) {
        for (double p : prices) {
            if (Double.isNaN(p) || Double.isInfinite(p)) return "non-finite price " + p;
            if (p == 0.0) {
                if (!rules.zeroPriceAllowed()) return "zero price";
            } else if (p < rules.minPrice() || p > rules.maxPrice()) {
                return "price " + p + " outside [" + rules.minPrice() + ", " + rules.maxPrice() + "]";
            }
        }
        return null;
    }

    /** Keeps the first {@link #MAX_MESSAGES} messages and a count of the rest. */
    private static final class Messages {
        private final List<String> kept = new ArrayList<>();
        private int total;

        void add(String m) {
            total++;
            if (kept.size() < MAX_MESSAGES) kept.add(m);
        }

        int total() { return total; }

        List<String> list() {
            if (total <= kept.size()) return kept;
            List<String> out = new ArrayList<>(kept);
            out.add("... " + (total - kept.size()) + " more");
            return out;
        }
    }
}
