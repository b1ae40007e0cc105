package io.barsync.marketdata.validate;

import io.barsync.marketdata.model.Bar;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating one batch. {@code bars} holds the accepted rows converted to the segment's bar variant
 * and is empty when the verdict is FAIL.
 */
public record ValidationReport(Verdict verdict, ValidationStats stats, List<String> errors, List<String> warnings, List<Bar> bars) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        bars = List.copyOf(bars);
    }

    public List<String> messages() {
        List<String> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }

    public ValidationReport requireStorable() throws ValidationFailureException {
        if (!verdict.storable()) throw new ValidationFailureException(this);
        return this;
    }
}
