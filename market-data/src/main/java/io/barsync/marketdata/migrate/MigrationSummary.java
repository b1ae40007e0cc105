package io.barsync.marketdata.migrate;

import io.barsync.marketdata.model.OutcomeStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Totals of one migration run. {@code verification} is null when verification was not requested
 * or the run was a dry run. A source file that could not be opened counts as one failed unit.
 */
public record MigrationSummary(int datasetsProcessed, int datasetsSkipped, long rowsRead, long rowsWritten,
                               long duplicatesSkipped, long rowErrors, List<DatasetOutcome> failures,
                               List<SourceFailure> sourceFailures, OutcomeStatus status,
                               VerificationReport verification, boolean dryRun) {

    public MigrationSummary {
        failures = List.copyOf(failures);
        sourceFailures = List.copyOf(sourceFailures);
    }

    static MigrationSummary of(List<DatasetOutcome> outcomes, List<SourceFailure> sourceFailures,
                               VerificationReport verification, boolean dryRun) {
        int processed = 0;
        int skipped = 0;
        long read = 0;
        long written = 0;
        long dups = 0;
        long rowErrors = 0;
        List<DatasetOutcome> failures = new ArrayList<>();
        for (DatasetOutcome o : outcomes) {
            switch (o.status()) {
                case MIGRATED -> processed++;
                case SKIPPED -> skipped++;
                case FAILED -> failures.add(o);
            }
            read += o.rowsRead();
            written += o.rowsWritten();
            dups += o.duplicatesSkipped();
            rowErrors += o.rowErrors();
        }
        OutcomeStatus status = OutcomeStatus.of(processed + skipped, outcomes.size() + sourceFailures.size());
        if (status == OutcomeStatus.SUCCEEDED && verification != null && !verification.passed()) status = OutcomeStatus.PARTIAL;
        return new MigrationSummary(processed, skipped, read, written, dups, rowErrors, failures, sourceFailures, status,
                verification, dryRun);
    }
}
