package io.barsync.marketdata.target;

public class TargetStoreException extends Exception {
    public TargetStoreException(String message, Throwable cause) { super(message, cause); }
}
