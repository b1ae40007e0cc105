package io.barsync.marketdata.fetch;

/** Failure that may succeed when repeated: timeouts, throttling, server errors, broken connections. */
public class TransientFetchException extends FetchException {
    public enum Reason { TIMEOUT, RATE_LIMITED, SERVER_ERROR, NETWORK }

    private final Reason reason;

    public TransientFetchException(Reason reason, String message) { this(reason, message, null); }

    public TransientFetchException(Reason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = reason;
    }

    public Reason reason() { return reason; }
}
