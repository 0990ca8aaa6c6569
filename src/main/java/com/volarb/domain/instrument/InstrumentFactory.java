package com.volarb.domain.instrument;

import com.volarb.domain.enums.ExerciseStyle;
import com.volarb.domain.enums.OptionType;
import java.time.LocalDateTime;

/**
 * Static constructors for the instrument variants used by strategies, hedgers and tests.
 */
public final class InstrumentFactory {

    private InstrumentFactory() {}

    public static Equity createEquity(String symbol) {
        return new Equity(symbol, 1.0);
    }

    public static Equity createEquity(String symbol, double shares) {
        return new Equity(symbol, shares);
    }

    public static Option createEuropeanCall(String underlying, LocalDateTime expiry, double strike) {
        return new Option(underlying, expiry, strike, OptionType.CALL, ExerciseStyle.EUROPEAN);
    }

    public static Option createEuropeanPut(String underlying, LocalDateTime expiry, double strike) {
        return new Option(underlying, expiry, strike, OptionType.PUT, ExerciseStyle.EUROPEAN);
    }

    public static Option createAmericanCall(String underlying, LocalDateTime expiry, double strike) {
        return new Option(underlying, expiry, strike, OptionType.CALL, ExerciseStyle.AMERICAN);
    }

    public static Option createAmericanPut(String underlying, LocalDateTime expiry, double strike) {
        return new Option(underlying, expiry, strike, OptionType.PUT, ExerciseStyle.AMERICAN);
    }
}
