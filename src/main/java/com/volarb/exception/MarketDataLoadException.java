package com.volarb.exception;

/**
 * Thrown when a market data file cannot be opened or read. Individual malformed rows are
 * skipped by the reader; only file-level failures (unreadable, or no parseable row) surface here.
 */
public class MarketDataLoadException extends BaseException {

    public MarketDataLoadException(String message) {
        super(ErrorCode.IO_ERROR, message);
    }

    public MarketDataLoadException(String message, Throwable cause) {
        super(ErrorCode.IO_ERROR, message, cause);
    }
}
