package com.volarb.exception;

/**
 * Thrown when a volatility model is asked to forecast before it has been calibrated.
 */
public class ModelNotCalibratedException extends InsufficientDataException {

    public ModelNotCalibratedException(String modelName) {
        super(modelName + " must be calibrated before forecasting");
    }
}
