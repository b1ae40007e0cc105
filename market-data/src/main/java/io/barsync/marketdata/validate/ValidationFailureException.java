package io.barsync.marketdata.validate;

public class ValidationFailureException extends Exception {
    private final transient ValidationReport report;

    public ValidationFailureException(ValidationReport report) {
        super("validation failed: " + (report.errors().isEmpty() ? report.warnings() : report.errors()));
        this.report = report;
    }

    public ValidationReport report() { return report; }
}
