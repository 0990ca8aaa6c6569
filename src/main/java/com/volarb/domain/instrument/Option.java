package com.volarb.domain.instrument;

import com.volarb.core.processor.BlackScholes;
import com.volarb.domain.enums.ExerciseStyle;
import com.volarb.domain.enums.InstrumentType;
import com.volarb.domain.enums.OptionType;
import com.volarb.domain.model.Greeks;
import com.volarb.domain.model.MarketObservation;
import com.volarb.exception.ValidationException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Call or put on an underlying symbol, priced with Black-Scholes-Merton from the bar's close.
 *
 * <p>Volatility comes from the bar's quoted implied volatility when it lies in (0, 3.0],
 * otherwise 20%. The risk-free rate is 5% unless the bar carries one.
 *
 * <p>American exercise is approximated as {@code max(european price, intrinsic value)}. This
 * is a floor, not an early-exercise model; Greeks for American options are the European ones.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Option implements Instrument {

    private static final DateTimeFormatter EXPIRY_CODE = DateTimeFormatter.ofPattern("yyyyMMdd");

    // 365.25 days expressed in seconds
    private static final double SECONDS_PER_YEAR = 365.25 * 24 * 60 * 60;

    private final String underlyingSymbol;
    private final LocalDateTime expiry;
    private double strike;
    private final OptionType optionType;
    private final ExerciseStyle exerciseStyle;

    public Option(
            String underlyingSymbol,
            LocalDateTime expiry,
            double strike,
            OptionType optionType,
            ExerciseStyle exerciseStyle) {
        this.underlyingSymbol = underlyingSymbol;
        this.expiry = expiry;
        this.strike = requirePositive(strike);
        this.optionType = optionType;
        this.exerciseStyle = exerciseStyle;
    }

    public void setStrike(double strike) {
        this.strike = requirePositive(strike);
    }

    /**
     * Identifier in the form {@code SPY_C_100_20250131}. The strike is truncated to whole units,
     * so strikes 100.2 and 100.9 on the same expiry map to one id and the strategy treats them as
     * the same open position.
     */
    @Override
    public String getSymbol() {
        return underlyingSymbol + "_" + optionType.getCode() + "_" + (int) strike + "_" + expiry.format(EXPIRY_CODE);
    }

    @Override
    public InstrumentType getType() {
        return exerciseStyle == ExerciseStyle.EUROPEAN ? InstrumentType.EUROPEAN_OPTION : InstrumentType.AMERICAN_OPTION;
    }

    /** Year fraction between {@code now} and expiry; zero once expiry is reached. */
    public double timeToExpiry(LocalDateTime now) {
        if (!now.isBefore(expiry)) {
            return 0.0;
        }
        return Duration.between(now, expiry).getSeconds() / SECONDS_PER_YEAR;
    }

    @Override
    public double price(MarketObservation observation) {
        double S = observation.getClose();
        double T = timeToExpiry(observation.getTimestamp());
        double r = BlackScholes.resolveRiskFreeRate(observation);
        double sigma = BlackScholes.resolveVolatility(observation);

        double europeanPrice = BlackScholes.price(S, strike, T, r, sigma, optionType);
        if (exerciseStyle == ExerciseStyle.AMERICAN) {
            return Math.max(europeanPrice, BlackScholes.intrinsicValue(S, strike, optionType));
        }
        return europeanPrice;
    }

    @Override
    public Optional<Greeks> greeks(MarketObservation observation) {
        double T = timeToExpiry(observation.getTimestamp());
        return Optional.of(BlackScholes.greeks(
                observation.getClose(),
                strike,
                T,
                BlackScholes.resolveRiskFreeRate(observation),
                BlackScholes.resolveVolatility(observation),
                optionType));
    }

    @Override
    public Map<String, Double> calculateRiskMetrics(MarketObservation observation) {
        Greeks greeks = greeks(observation).orElse(Greeks.ZERO);
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("value", price(observation));
        metrics.put("delta", greeks.getDelta());
        metrics.put("gamma", greeks.getGamma());
        metrics.put("vega", greeks.getVega());
        metrics.put("theta", greeks.getTheta());
        metrics.put("rho", greeks.getRho());
        return metrics;
    }

    public boolean isCall() {
        return optionType == OptionType.CALL;
    }

    @Override
    public Option copy() {
        return new Option(underlyingSymbol, expiry, strike, optionType, exerciseStyle);
    }

    private static double requirePositive(double strike) {
        if (strike <= 0) {
            throw new ValidationException("Strike price must be positive, got " + strike);
        }
        return strike;
    }
}
