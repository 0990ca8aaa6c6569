package com.volarb.exception;

import java.util.Map;

/**
 * Thrown when construction arguments or run parameters are malformed: non-positive strike or
 * shares, an inverted date range, non-stationary GARCH parameters, negative costs.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
