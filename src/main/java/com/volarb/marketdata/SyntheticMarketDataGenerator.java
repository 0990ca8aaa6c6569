package com.volarb.marketdata;

import com.volarb.domain.model.MarketObservation;
import com.volarb.exception.ValidationException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;

/**
 * Seeded random-walk bar generator for Monte Carlo runs and tests.
 *
 * <p>Closes follow {@code close_t = close_{t-1} * (1 + drift + dailyVolatility * z)} with
 * standard normal {@code z}. Each bar opens at the previous close; high and low widen the
 * open/close range by a small random amount. The same path settings always yield the same path.
 */
@Slf4j
@Component
public class SyntheticMarketDataGenerator {

    private static final double RANGE_FACTOR = 0.005;
    private static final double MIN_PRICE = 0.01;
    private static final double BASE_VOLUME = 1_000_000;

    public List<MarketObservation> generate(String symbol, LocalDateTime start, int bars, long seed) {
        return generate(SyntheticPathSpec.builder()
                .symbol(symbol)
                .start(start)
                .bars(bars)
                .seed(seed)
                .build());
    }

    public List<MarketObservation> generate(SyntheticPathSpec spec) {
        if (spec.getSymbol() == null || spec.getStart() == null) {
            throw new ValidationException("Symbol and start timestamp are required");
        }
        if (spec.getBars() <= 0 || spec.getStartPrice() <= 0 || spec.getDailyVolatility() < 0) {
            throw new ValidationException("Bars and start price must be positive, volatility non-negative");
        }

        RandomGenerator random = new Well19937c(spec.getSeed());
        List<MarketObservation> observations = new ArrayList<>(spec.getBars());
        double previousClose = spec.getStartPrice();

        for (int i = 0; i < spec.getBars(); i++) {
            double open = previousClose;
            double close = i == 0
                    ? spec.getStartPrice()
                    : Math.max(MIN_PRICE, open * (1.0 + spec.getDrift() + spec.getDailyVolatility() * random.nextGaussian()));
            double high = Math.max(open, close) * (1.0 + RANGE_FACTOR * Math.abs(random.nextGaussian()));
            double low = Math.min(open, close) * (1.0 - RANGE_FACTOR * Math.abs(random.nextGaussian()));
            double volume = BASE_VOLUME * (0.5 + random.nextDouble());

            MarketObservation.MarketObservationBuilder bar = MarketObservation.builder()
                    .symbol(spec.getSymbol())
                    .timestamp(spec.getStart().plusDays(i))
                    .open(open)
                    .high(high)
                    .low(low)
                    .close(close)
                    .volume(volume);
            if (spec.getImpliedVolatility() > 0) {
                double quoted = spec.getImpliedVolatility() + spec.getImpliedVolatilityNoise() * random.nextGaussian();
                bar.auxiliary(Map.of(MarketObservation.IMPLIED_VOLATILITY, Math.max(quoted, 0.001)));
            }
            observations.add(bar.build());
            previousClose = close;
        }

        log.debug("Generated {} bars for {} (seed {})", observations.size(), spec.getSymbol(), spec.getSeed());
        return observations;
    }
}
