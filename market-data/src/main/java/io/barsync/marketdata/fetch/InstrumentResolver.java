package io.barsync.marketdata.fetch;

import io.barsync.marketdata.model.SeriesKey;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps {@code EXCHANGE:SYMBOL} to the upstream's numeric instrument token.
 */
public class InstrumentResolver {
    private final Map<String, String> tokens;

    public InstrumentResolver(Map<String, String> tokens) {
        Map<String, String> normalized = new HashMap<>();
        tokens.forEach((k, v) -> normalized.put(normalizeKey(k), v.trim()));
        this.tokens = Map.copyOf(normalized);
    }

    /**
     * Reads {@code NSE:RELIANCE=738561} lines; blank lines and {@code #} comments are skipped.
     * A missing file resolves nothing.
     */
    public static InstrumentResolver load(Path file) throws IOException {
        Map<String, String> map = new HashMap<>();
        if (file == null || !Files.exists(file)) return new InstrumentResolver(map);
        int lineNo = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNo++;
            String t = line.strip();
            if (t.isEmpty() || t.startsWith("#")) continue;
            int eq = t.indexOf('=');
            if (eq <= 0 || eq == t.length() - 1 || t.indexOf(':') <= 0) {
                throw new IOException(file + ":" + lineNo + ": expected EXCHANGE:SYMBOL=token");
            }
            map.put(t.substring(0, eq), t.substring(eq + 1));
        }
        return new InstrumentResolver(map);
    }

    public Optional<String> tokenFor(SeriesKey key) {
        return Optional.ofNullable(tokens.get(key.exchange().name() + ":" + key.symbol()));
    }

    public int size() { return tokens.size(); }

    /** Same symbol spelling as series keys, so {@code NSE:M&M} finds {@code NSE:M_M}. */
    private static String normalizeKey(String k) {
        return k.trim().toUpperCase(Locale.ROOT).replace('&', '_').replace('-', '_').replace(' ', '_');
    }
}
