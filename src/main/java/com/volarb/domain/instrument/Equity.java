package com.volarb.domain.instrument;

import com.volarb.domain.enums.InstrumentType;
import com.volarb.domain.model.Greeks;
import com.volarb.domain.model.MarketObservation;
import com.volarb.exception.ValidationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A block of shares in one listed symbol. Priced at {@code close * shares}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Equity implements Instrument {

    private final String symbol;
    private double shares;

    public Equity(String symbol, double shares) {
        this.symbol = symbol;
        this.shares = requirePositive(shares);
    }

    public void setShares(double shares) {
        this.shares = requirePositive(shares);
    }

    @Override
    public String getUnderlyingSymbol() {
        return symbol;
    }

    @Override
    public InstrumentType getType() {
        return InstrumentType.EQUITY;
    }

    @Override
    public double price(MarketObservation observation) {
        if (!symbol.equals(observation.getSymbol())) {
            throw new ValidationException(String.format(
                    "Market data symbol %s does not match equity symbol %s", observation.getSymbol(), symbol));
        }
        return observation.getClose() * shares;
    }

    @Override
    public Optional<Greeks> greeks(MarketObservation observation) {
        return Optional.empty();
    }

    @Override
    public Map<String, Double> calculateRiskMetrics(MarketObservation observation) {
        double currentValue = price(observation);
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("value", currentValue);
        metrics.put("intraday_pnl", currentValue - shares * observation.getOpen());
        metrics.put("delta", shares);
        metrics.put("gamma", 0.0);
        return metrics;
    }

    @Override
    public Equity copy() {
        return new Equity(symbol, shares);
    }

    private static double requirePositive(double shares) {
        if (shares <= 0) {
            throw new ValidationException("Number of shares must be positive, got " + shares);
        }
        return shares;
    }
}
