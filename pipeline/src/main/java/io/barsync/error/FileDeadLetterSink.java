package io.barsync.error;

import io.barsync.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.function.Function;

/**
 * Appends one JSON line per failure. The payload is rendered through a describer so domain records
 * can report their identity rather than their full content.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;
    private final Function<T, String> describer;
    private final Clock clock;
    private long written;

    public FileDeadLetterSink(Path file) throws IOException {
        this(file, String::valueOf, Clock.systemUTC());
    }

    public FileDeadLetterSink(Path file, Function<T, String> describer, Clock clock) throws IOException {
        this.file = file;
        this.describer = describer;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, Exception e) {
        String payload = record == null || record.payload() == null ? "" : describer.apply(record.payload());
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"seq\":%d,\"subSeq\":%d,\"payload\":\"%s\",\"error\":\"%s\"}%n",
                clock.instant(), safe(stage), record == null ? -1 : record.seq(), record == null ? -1 : record.subSeq(),
                safe(payload), safe(String.valueOf(e))
        );
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
            written++;
        } catch (IOException io) {
            log.warn("Could not append dead letter for stage {} to {}: {}", stage, file, io.getMessage());
        }
    }

    public synchronized long written() { return written; }

    public Path file() { return file; }

    private static String safe(String s) {
        return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", " ").replace("\r", " ");
    }
}
