package io.barsync.marketdata.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for fetching and storing bars. Each value is read from a system property, then the matching
 * environment variable, then a default.
 */
public record SyncConfig(
        Path dataDir,
        int requestsPerMinute,
        int rateSafetyMargin,
        int retryMaxAttempts,
        long retryBaseMillis,
        double retryMultiplier,
        long retryMaxMillis,
        int fetchWorkers,
        double maxWarningRatio,
        boolean strictValidation,
        int maxBackups,
        URI upstreamBaseUrl,
        String apiKey,
        String accessToken,
        Duration upstreamTimeout,
        Path instrumentsFile,
        Path holidaysFile
) {
    public static SyncConfig fromEnv() {
        Path data = Path.of(get("barsync.data", "BARSYNC_DATA", "./data"));
        int rpm = Integer.parseInt(get("barsync.rpm", "BARSYNC_RPM", "180"));
        int margin = Integer.parseInt(get("barsync.rpm.margin", "BARSYNC_RPM_MARGIN", "30"));
        int attempts = Integer.parseInt(get("barsync.retry.max-attempts", "BARSYNC_RETRY_MAX_ATTEMPTS", "7"));
        long base = Long.parseLong(get("barsync.retry.base-millis", "BARSYNC_RETRY_BASE_MILLIS", "2000"));
        double mult = Double.parseDouble(get("barsync.retry.multiplier", "BARSYNC_RETRY_MULTIPLIER", "1.3"));
        long max = Long.parseLong(get("barsync.retry.max-millis", "BARSYNC_RETRY_MAX_MILLIS", "60000"));
        int workers = Integer.parseInt(get("barsync.fetch.workers", "BARSYNC_FETCH_WORKERS", "3"));
        double ratio = Double.parseDouble(get("barsync.validation.max-warning-ratio", "BARSYNC_VALIDATION_MAX_WARNING_RATIO", "0.5"));
        boolean strict = Boolean.parseBoolean(get("barsync.validation.strict", "BARSYNC_VALIDATION_STRICT", "false"));
        int backups = Integer.parseInt(get("barsync.backups.max", "BARSYNC_BACKUPS_MAX", "3"));
        URI url = URI.create(get("barsync.upstream.url", "BARSYNC_UPSTREAM_URL", "https://api.kite.trade"));
        String apiKey = get("barsync.upstream.api-key", "BARSYNC_UPSTREAM_API_KEY", "");
        String token = get("barsync.upstream.access-token", "BARSYNC_UPSTREAM_ACCESS_TOKEN", "");
        Duration timeout = Duration.ofSeconds(Long.parseLong(get("barsync.upstream.timeout-seconds", "BARSYNC_UPSTREAM_TIMEOUT_SECONDS", "30")));
        Path instruments = data.resolve(get("barsync.upstream.instruments", "BARSYNC_UPSTREAM_INSTRUMENTS", "instruments.properties"));
        Path holidays = data.resolve(get("barsync.calendar.holidays", "BARSYNC_CALENDAR_HOLIDAYS", "holidays.txt"));
        return new SyncConfig(data, rpm, margin, attempts, base, mult, max, workers, ratio, strict, backups,
                url, apiKey, token, timeout, instruments, holidays);
    }

    /** Copy pointing at another data directory; the instrument and holiday files keep their paths. */
    public SyncConfig withDataDir(Path dir) {
        return new SyncConfig(dir, requestsPerMinute, rateSafetyMargin, retryMaxAttempts, retryBaseMillis, retryMultiplier,
                retryMaxMillis, fetchWorkers, maxWarningRatio, strictValidation, maxBackups, upstreamBaseUrl, apiKey,
                accessToken, upstreamTimeout, instrumentsFile, holidaysFile);
    }

    static String get(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}
