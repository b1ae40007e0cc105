package io.barsync.marketdata.fetch;

/** Failure that will not go away by retrying: unknown instrument, rejected request, malformed response. */
public class PermanentFetchException extends FetchException {
    public PermanentFetchException(String message) { this(message, null); }
    public PermanentFetchException(String message, Throwable cause) { super(message, cause); }
}
