package io.barsync.marketdata.fetch;

/** Upstream request failed. */
public abstract class FetchException extends Exception {
    protected FetchException(String message, Throwable cause) { super(message, cause); }
}
