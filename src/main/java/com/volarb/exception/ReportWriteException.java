package com.volarb.exception;

/** Thrown when a backtest report cannot be serialized or written. */
public class ReportWriteException extends BaseException {

    public ReportWriteException(String message, Throwable cause) {
        super(ErrorCode.IO_ERROR, message, cause);
    }
}
