package io.barsync.marketdata.store;

import java.io.IOException;

/** Base class for local store failures. */
public class StoreException extends IOException {
    public StoreException(String message) { super(message); }
    public StoreException(String message, Throwable cause) { super(message, cause); }
}
