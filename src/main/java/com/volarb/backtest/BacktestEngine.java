package com.volarb.backtest;

import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.MarketSnapshot;
import com.volarb.domain.model.Trade;
import com.volarb.exception.MarketDataLoadException;
import com.volarb.exception.MissingDataException;
import com.volarb.exception.ValidationException;
import com.volarb.marketdata.MarketDataCsvReader;
import com.volarb.portfolio.Portfolio;
import com.volarb.strategy.base.TradingStrategy;
import com.volarb.timeseries.TimeSeries;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bar-by-bar backtest driver over an in-memory table of market data.
 *
 * <p>A run works on its own copy of the caller's strategy. The simulation clock is the sorted
 * union of all timestamps of the requested symbols inside the date range; at each timestamp
 * every symbol with a bar at exactly that time is fed to the strategy in the order the symbols
 * were requested, then the portfolio is marked to market against the latest bar of every
 * symbol to produce one equity-curve point.
 *
 * <p>The data table is only read during a run, so runs on different strategies may execute
 * concurrently. Loading or clearing data while runs are in flight is not supported.
 */
@Slf4j
@Component
public class BacktestEngine {

    private final MarketDataCsvReader csvReader;
    private final Map<String, List<MarketObservation>> marketData = new ConcurrentHashMap<>();

    public BacktestEngine(MarketDataCsvReader csvReader) {
        this.csvReader = csvReader;
    }

    // ---- Market data table ----

    /**
     * Registers the bars of {@code symbol}, replacing any previously loaded ones. Bars are
     * stored sorted by timestamp.
     */
    public void addMarketData(String symbol, List<MarketObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new ValidationException("Cannot add empty market data for symbol: " + symbol);
        }
        List<MarketObservation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparing(MarketObservation::getTimestamp));
        marketData.put(symbol, Collections.unmodifiableList(sorted));
    }

    /** Reads {@code csvFile} and registers its bars under {@code symbol}. */
    public void loadMarketData(String symbol, Path csvFile) {
        List<MarketObservation> observations = csvReader.read(csvFile);
        if (observations.isEmpty()) {
            throw new MarketDataLoadException("No market data for " + symbol + " in " + csvFile);
        }
        addMarketData(symbol, observations);
        log.info("Loaded {} data points for {}", observations.size(), symbol);
    }

    public void clearMarketData() {
        marketData.clear();
    }

    public boolean hasMarketData(String symbol) {
        return marketData.containsKey(symbol);
    }

    public List<String> getAvailableSymbols() {
        return marketData.keySet().stream().sorted().toList();
    }

    public List<MarketObservation> getMarketData(String symbol) {
        List<MarketObservation> observations = marketData.get(symbol);
        if (observations == null) {
            throw new MissingDataException(symbol);
        }
        return observations;
    }

    public String getEngineInfo() {
        StringBuilder info = new StringBuilder("BacktestEngine: ")
                .append(marketData.size())
                .append(" symbol(s) loaded");
        for (String symbol : getAvailableSymbols()) {
            List<MarketObservation> observations = marketData.get(symbol);
            info.append("\n  ")
                    .append(symbol)
                    .append(": ")
                    .append(observations.size())
                    .append(" bars [")
                    .append(observations.get(0).getTimestamp())
                    .append(" .. ")
                    .append(observations.get(observations.size() - 1).getTimestamp())
                    .append(']');
        }
        return info.toString();
    }

    // ---- Simulation ----

    /**
     * Runs {@code strategy} over the loaded data.
     *
     * <p>The caller's strategy instance is never mutated.
     *
     * @throws ValidationException  if the parameters are invalid
     * @throws MissingDataException if a requested symbol has no loaded data
     */
    public BacktestResult run(TradingStrategy strategy, BacktestParameters parameters) {
        parameters.validate();
        for (String symbol : parameters.getSymbols()) {
            if (!hasMarketData(symbol)) {
                throw new MissingDataException(symbol);
            }
        }

        TradingStrategy runStrategy = strategy.copy();
        runStrategy.initialize(parameters);

        NavigableMap<LocalDateTime, List<MarketObservation>> clock = buildClock(parameters);
        log.info(
                "Starting backtest of {} on {} from {} to {}: {} timestamps, capital {}",
                runStrategy.getName(),
                parameters.getSymbols(),
                parameters.getStartDate(),
                parameters.getEndDate(),
                clock.size(),
                parameters.getInitialCapital());

        TimeSeries equityCurve = new TimeSeries("Equity");
        List<Trade> trades = new ArrayList<>();
        MarketSnapshot snapshot = new MarketSnapshot();

        int step = 0;
        int progressInterval = Math.max(1, clock.size() / 10);
        for (Map.Entry<LocalDateTime, List<MarketObservation>> tick : clock.entrySet()) {
            for (MarketObservation observation : tick.getValue()) {
                snapshot.update(observation);
                trades.addAll(runStrategy.processBar(observation));
            }

            Portfolio portfolio = runStrategy.getPortfolio();
            equityCurve.put(tick.getKey(), portfolio.getTotalValue(snapshot));

            step++;
            if (step % progressInterval == 0) {
                log.info("Backtest progress: {}% ({}/{})", step * 100 / clock.size(), step, clock.size());
            }
        }

        BacktestResult result = new BacktestResult(equityCurve, trades);
        log.info(
                "Backtest of {} finished: {} trades, total return {}, final value {}",
                runStrategy.getName(),
                result.getTradeCount(),
                result.getTotalReturn(),
                equityCurve.isEmpty() ? parameters.getInitialCapital() : equityCurve.lastValue());
        return result;
    }

    /** Observations inside the date range grouped by timestamp, symbols in request order. */
    private NavigableMap<LocalDateTime, List<MarketObservation>> buildClock(BacktestParameters parameters) {
        NavigableMap<LocalDateTime, List<MarketObservation>> clock = new TreeMap<>();
        for (String symbol : parameters.getSymbols()) {
            int inRange = 0;
            for (MarketObservation observation : marketData.get(symbol)) {
                LocalDateTime timestamp = observation.getTimestamp();
                if (timestamp.isBefore(parameters.getStartDate()) || timestamp.isAfter(parameters.getEndDate())) {
                    continue;
                }
                clock.computeIfAbsent(timestamp, t -> new ArrayList<>()).add(observation);
                inRange++;
            }
            if (inRange == 0) {
                log.warn("No data for {} between {} and {}", symbol, parameters.getStartDate(), parameters.getEndDate());
            }
        }
        return clock;
    }
}
