package com.volarb.volatility;

import com.volarb.core.processor.BsmPricingModel;
import com.volarb.core.processor.ImpliedVolatilitySolver;
import com.volarb.core.processor.PricingModel;
import com.volarb.exception.ValidationException;

/**
 * Builds volatility and pricing models outside of a Spring context (tests, batch tools).
 */
public final class ModelFactory {

    private ModelFactory() {}

    public static GarchModel createGarchModel() {
        return new GarchModel();
    }

    public static GarchModel createGarchModel(double omega, double alpha, double beta) {
        return new GarchModel(omega, alpha, beta);
    }

    public static PricingModel createBsmPricingModel() {
        return new BsmPricingModel(new ImpliedVolatilitySolver());
    }

    /** True when the triple would be accepted by {@link GarchModel#GarchModel(double, double, double)}. */
    public static boolean validateGarchParameters(double omega, double alpha, double beta) {
        try {
            GarchModel.validateParameters(omega, alpha, beta);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }
}
