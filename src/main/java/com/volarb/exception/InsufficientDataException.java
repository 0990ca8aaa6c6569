package com.volarb.exception;

/**
 * Thrown when a statistic, a calibration or a lag needs more observations than are available.
 */
public class InsufficientDataException extends BaseException {

    public InsufficientDataException(String message) {
        super(ErrorCode.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(int required, int actual, String what) {
        super(
                ErrorCode.INSUFFICIENT_DATA,
                String.format("%s requires at least %d observations, got %d", what, required, actual));
    }
}
