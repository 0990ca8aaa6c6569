package com.volarb.strategy.impl;

import com.volarb.backtest.BacktestParameters;
import com.volarb.domain.enums.SignalType;
import com.volarb.domain.enums.TradeAction;
import com.volarb.domain.instrument.Instrument;
import com.volarb.domain.instrument.InstrumentFactory;
import com.volarb.domain.instrument.Option;
import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.Position;
import com.volarb.domain.model.Signal;
import com.volarb.domain.model.Trade;
import com.volarb.exception.ValidationException;
import com.volarb.pnl.TransactionCostCalculator;
import com.volarb.portfolio.Portfolio;
import com.volarb.strategy.base.HedgingStrategy;
import com.volarb.strategy.base.SignalGenerator;
import com.volarb.strategy.base.TradingStrategy;
import com.volarb.timeseries.TimeSeries;
import com.volarb.volatility.VolatilityModel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Volatility arbitrage on synthesized at-the-money calls, delta hedged in the underlying.
 *
 * <p>Per bar, in order:
 * <ol>
 *   <li><b>Update:</b> advance the holding counter of every open option on the bar's symbol and
 *       close at market any position that reached the holding period or expired.</li>
 *   <li><b>Calibrate:</b> record the bar's log return; the symbol's volatility model is
 *       calibrated once enough returns exist, then filtered forward one return per bar.</li>
 *   <li><b>Signal:</b> synthesize a European call struck at the close with a fixed tenor and ask
 *       the signal generator for a view. Skipped while the model is uncalibrated.</li>
 *   <li><b>Entry:</b> on an actionable signal for an instrument not already held, buy (BUY) or
 *       write (SELL) a fixed number of calls, unless the premium plus cost exceeds cash.</li>
 *   <li><b>Hedge:</b> delegate to the hedging strategy.</li>
 * </ol>
 *
 * <p>The configured volatility model is a prototype: each symbol gets its own copy so returns
 * of different underlyings never mix in one variance recursion.
 */
@Slf4j
public class VolatilityArbitrageStrategy implements TradingStrategy {

    public static final String SIGNAL_STRENGTH = "signal_strength";
    public static final String ENTRY_SIGNAL_TYPE = "entry_signal_type";

    @Getter
    private final VolatilityModel volatilityModel;

    @Getter
    private final SignalGenerator signalGenerator;

    @Getter
    private final HedgingStrategy hedgingStrategy;

    @Getter
    private final VolatilityArbitrageConfig config;

    @Getter
    private Portfolio portfolio;

    private TransactionCostCalculator costs = TransactionCostCalculator.FREE;

    /** Bars held, keyed by instrument symbol, in entry order. */
    private final Map<String, Integer> daysInPosition = new LinkedHashMap<>();

    private final Map<String, VolatilityModel> symbolModels = new HashMap<>();
    private final Map<String, TimeSeries> symbolReturns = new HashMap<>();
    private final Map<String, Double> lastClose = new HashMap<>();

    public VolatilityArbitrageStrategy(
            VolatilityModel volatilityModel,
            SignalGenerator signalGenerator,
            HedgingStrategy hedgingStrategy,
            VolatilityArbitrageConfig config) {
        if (config.getHoldingPeriod() <= 0) {
            throw new ValidationException("Holding period must be positive, got " + config.getHoldingPeriod());
        }
        if (config.getContractsPerTrade() <= 0) {
            throw new ValidationException("Contracts per trade must be positive, got " + config.getContractsPerTrade());
        }
        if (config.getOptionTenorDays() <= 0) {
            throw new ValidationException("Option tenor must be positive, got " + config.getOptionTenorDays());
        }
        this.volatilityModel = volatilityModel;
        this.signalGenerator = signalGenerator;
        this.hedgingStrategy = hedgingStrategy;
        this.config = config;
        this.portfolio = new Portfolio(0.0);
    }

    @Override
    public String getName() {
        return "VolatilityArbitrage";
    }

    @Override
    public void initialize(BacktestParameters parameters) {
        portfolio = new Portfolio(parameters.getInitialCapital());
        costs = parameters.costCalculator();
        daysInPosition.clear();
        symbolModels.clear();
        symbolReturns.clear();
        lastClose.clear();
        log.debug("{} initialized with capital {}", getName(), parameters.getInitialCapital());
    }

    @Override
    public List<Trade> processBar(MarketObservation observation) {
        List<Trade> trades = new ArrayList<>();

        trades.addAll(updatePositions(observation));

        VolatilityModel model = recordReturn(observation);
        if (model.isCalibrated()) {
            Option candidate = InstrumentFactory.createEuropeanCall(
                    observation.getSymbol(),
                    observation.getTimestamp().plusDays(config.getOptionTenorDays()),
                    observation.getClose());
            Signal signal = signalGenerator.generateSignal(candidate, model, observation);
            if (signal.isActionable() && !daysInPosition.containsKey(candidate.getSymbol())) {
                enterPosition(candidate, signal, observation).ifPresent(trades::add);
            }
        }

        trades.addAll(hedgingStrategy.applyHedge(portfolio, observation, costs));
        return trades;
    }

    /** Bars held per open option, keyed by instrument symbol. */
    public Map<String, Integer> getDaysInPosition() {
        return Collections.unmodifiableMap(daysInPosition);
    }

    /** The per-symbol model driving signals for {@code symbol}, or the prototype if none yet. */
    public VolatilityModel getVolatilityModel(String symbol) {
        return symbolModels.getOrDefault(symbol, volatilityModel);
    }

    private List<Trade> updatePositions(MarketObservation observation) {
        List<Trade> exits = new ArrayList<>();
        Iterator<Map.Entry<String, Integer>> it = daysInPosition.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Integer> entry = it.next();
            OptionalInt index = indexOf(entry.getKey());
            if (index.isEmpty()) {
                it.remove();
                continue;
            }
            Instrument instrument = portfolio.getPosition(index.getAsInt()).getInstrument();
            if (!instrument.getUnderlyingSymbol().equals(observation.getSymbol())) {
                continue;
            }

            int days = entry.getValue() + 1;
            entry.setValue(days);
            boolean expired = instrument instanceof Option option && option.timeToExpiry(observation.getTimestamp()) <= 0;
            if (days >= config.getHoldingPeriod() || expired) {
                exits.add(closePosition(index.getAsInt(), observation));
                it.remove();
            }
        }
        return exits;
    }

    private Trade closePosition(int index, MarketObservation observation) {
        Position position = portfolio.removePosition(index);
        double quantity = position.getQuantity();
        double price = position.getInstrument().price(observation);
        double cost = costs.calculate(quantity, price);
        portfolio.addCash(quantity * price - cost);

        log.debug(
                "Closed {} x {} @ {} (entry {}), pnl={}",
                quantity,
                position.getInstrument().getSymbol(),
                price,
                position.getEntryPrice(),
                quantity * (price - position.getEntryPrice()));

        return Trade.builder()
                .instrumentId(position.getInstrument().getSymbol())
                .action(TradeAction.forQuantityChange(-quantity))
                .quantity(Math.abs(quantity))
                .price(price)
                .timestamp(observation.getTimestamp())
                .transactionCost(cost)
                .build();
    }

    private Optional<Trade> enterPosition(Option option, Signal signal, MarketObservation observation) {
        double contracts = config.getContractsPerTrade();
        double price = option.price(observation);
        double premium = contracts * price;
        double cost = costs.calculate(contracts, price);

        if (premium + cost > portfolio.getCash()) {
            log.warn(
                    "Entry rejected for {}: requires {} but cash is {}",
                    option.getSymbol(),
                    premium + cost,
                    portfolio.getCash());
            return Optional.empty();
        }

        boolean buy = signal.getType() == SignalType.BUY;
        double quantity = buy ? contracts : -contracts;

        Position position = new Position(option, quantity, price, observation.getTimestamp());
        position.setMetadata(SIGNAL_STRENGTH, signal.getStrength());
        position.setMetadata(ENTRY_SIGNAL_TYPE, buy ? 1.0 : -1.0);
        portfolio.addPosition(position);
        portfolio.removeCash(quantity * price + cost);
        daysInPosition.put(option.getSymbol(), 0);

        log.debug("Opened {} x {} @ {} on {} signal", quantity, option.getSymbol(), price, signal.getType());

        return Optional.of(Trade.builder()
                .instrumentId(option.getSymbol())
                .action(buy ? TradeAction.BUY : TradeAction.SELL)
                .quantity(contracts)
                .price(price)
                .timestamp(observation.getTimestamp())
                .transactionCost(cost)
                .build());
    }

    /**
     * Appends the bar's log return to the symbol's history and keeps the symbol's model
     * current: calibrate once the history is long enough, then filter each further return.
     */
    private VolatilityModel recordReturn(MarketObservation observation) {
        String symbol = observation.getSymbol();
        VolatilityModel model = symbolModels.computeIfAbsent(symbol, s -> volatilityModel.copy());
        Double previous = lastClose.put(symbol, observation.getClose());
        if (previous == null || previous <= 0 || observation.getClose() <= 0) {
            return model;
        }

        double logReturn = Math.log(observation.getClose() / previous);
        TimeSeries returns = symbolReturns.computeIfAbsent(symbol, s -> new TimeSeries(s + "_returns"));
        returns.put(observation.getTimestamp(), logReturn);

        if (model.isCalibrated()) {
            model.update(logReturn);
        } else if (returns.size() >= config.getMinCalibrationReturns()) {
            model.calibrate(returns);
            log.info("{} calibrated for {} on {} returns: {}", model.getModelName(), symbol, returns.size(),
                    model.getParameters());
        }
        return model;
    }

    private OptionalInt indexOf(String instrumentSymbol) {
        return portfolio.findPositionIndex(p -> p.getInstrument().getSymbol().equals(instrumentSymbol));
    }

    @Override
    public VolatilityArbitrageStrategy copy() {
        VolatilityArbitrageStrategy copy = new VolatilityArbitrageStrategy(
                volatilityModel.copy(), signalGenerator.copy(), hedgingStrategy.copy(), config.toBuilder().build());
        copy.portfolio = portfolio.copy();
        copy.costs = costs;
        copy.daysInPosition.putAll(daysInPosition);
        symbolModels.forEach((symbol, model) -> copy.symbolModels.put(symbol, model.copy()));
        symbolReturns.forEach((symbol, series) -> copy.symbolReturns.put(symbol, series.copy()));
        copy.lastClose.putAll(lastClose);
        return copy;
    }
}
