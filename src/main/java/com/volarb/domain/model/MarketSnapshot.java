package com.volarb.domain.model;

import com.volarb.exception.MissingDataException;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest observation per symbol as of the simulation clock. Used to mark a multi-symbol
 * portfolio to market, since every position must be priced against its own underlying.
 */
public class MarketSnapshot {

    private final Map<String, MarketObservation> latest = new HashMap<>();
    private LocalDateTime asOf;

    public void update(MarketObservation observation) {
        latest.put(observation.getSymbol(), observation);
        if (asOf == null || observation.getTimestamp().isAfter(asOf)) {
            asOf = observation.getTimestamp();
        }
    }

    public MarketObservation get(String symbol) {
        MarketObservation observation = latest.get(symbol);
        if (observation == null) {
            throw new MissingDataException(symbol);
        }
        return observation;
    }

    public Optional<MarketObservation> find(String symbol) {
        return Optional.ofNullable(latest.get(symbol));
    }

    public LocalDateTime getAsOf() {
        return asOf;
    }

    public Map<String, MarketObservation> asMap() {
        return Collections.unmodifiableMap(latest);
    }

    public static MarketSnapshot of(MarketObservation... observations) {
        MarketSnapshot snapshot = new MarketSnapshot();
        for (MarketObservation observation : observations) {
            snapshot.update(observation);
        }
        return snapshot;
    }
}
