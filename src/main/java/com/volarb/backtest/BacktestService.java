package com.volarb.backtest;

import com.volarb.domain.model.MarketObservation;
import com.volarb.exception.BaseException;
import com.volarb.marketdata.MarketDataCsvReader;
import com.volarb.marketdata.SyntheticMarketDataGenerator;
import com.volarb.marketdata.SyntheticPathSpec;
import com.volarb.strategy.base.TradingStrategy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs batches of independent backtests in parallel.
 *
 * <p>The unit of parallelism is one {@link BacktestEngine#run} call: every run works on its
 * own strategy copy, so tasks share nothing but read-only market data. A failing run fails
 * the whole batch with the run's own exception.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final BacktestEngine backtestEngine;
    private final MarketDataCsvReader csvReader;
    private final SyntheticMarketDataGenerator dataGenerator;
    private final Executor backtestExecutor;

    public BacktestService(
            BacktestEngine backtestEngine,
            MarketDataCsvReader csvReader,
            SyntheticMarketDataGenerator dataGenerator,
            @Qualifier("backtestExecutor") Executor backtestExecutor) {
        this.backtestEngine = backtestEngine;
        this.csvReader = csvReader;
        this.dataGenerator = dataGenerator;
        this.backtestExecutor = backtestExecutor;
    }

    /** Single run on the shared engine's loaded data. */
    public BacktestResult run(TradingStrategy strategy, BacktestParameters parameters) {
        return backtestEngine.run(strategy, parameters);
    }

    /**
     * Runs every strategy variant against the shared engine's data.
     *
     * @param variants labelled strategy variants, e.g. one per threshold setting
     * @return results keyed by label, in the variants' iteration order
     */
    public Map<String, BacktestResult> runParameterSweep(
            Map<String, ? extends TradingStrategy> variants, BacktestParameters parameters) {
        log.info("Starting parameter sweep over {} variants", variants.size());

        Map<String, CompletableFuture<BacktestResult>> futures = new LinkedHashMap<>();
        variants.forEach((label, strategy) -> futures.put(
                label,
                CompletableFuture.supplyAsync(() -> backtestEngine.run(strategy, parameters), backtestExecutor)));

        Map<String, BacktestResult> results = new LinkedHashMap<>();
        futures.forEach((label, future) -> results.put(label, await(future)));

        log.info("Parameter sweep finished: {} results", results.size());
        return results;
    }

    /**
     * Runs {@code strategy} over {@code paths} synthetic price paths. Path {@code i} uses base
     * seed {@code template.seed + i}, offset per symbol so symbols never share a path; each path
     * gets a private engine, so the shared engine's data is untouched.
     *
     * @param template shape of the generated paths; symbol and start are taken from the run
     */
    public List<BacktestResult> runMonteCarlo(
            TradingStrategy strategy, BacktestParameters parameters, SyntheticPathSpec template, int paths) {
        parameters.validate();
        int bars = (int) Duration.between(parameters.getStartDate(), parameters.getEndDate()).toDays() + 1;
        log.info("Starting Monte Carlo: {} paths of {} bars, base seed {}", paths, bars, template.getSeed());

        List<CompletableFuture<BacktestResult>> futures = new ArrayList<>();
        for (int i = 0; i < paths; i++) {
            long seed = template.getSeed() + i;
            futures.add(CompletableFuture.supplyAsync(
                    () -> runSyntheticPath(strategy, parameters, template, bars, seed), backtestExecutor));
        }

        List<BacktestResult> results = futures.stream().map(this::await).toList();
        log.info(
                "Monte Carlo finished: mean total return {}",
                results.stream().mapToDouble(BacktestResult::getTotalReturn).average().orElse(0.0));
        return results;
    }

    private BacktestResult runSyntheticPath(
            TradingStrategy strategy, BacktestParameters parameters, SyntheticPathSpec template, int bars, long seed) {
        BacktestEngine pathEngine = new BacktestEngine(csvReader);
        List<String> symbols = parameters.getSymbols();
        for (int j = 0; j < symbols.size(); j++) {
            String symbol = symbols.get(j);
            List<MarketObservation> path = dataGenerator.generate(template.toBuilder()
                    .symbol(symbol)
                    .start(parameters.getStartDate())
                    .bars(bars)
                    .seed(seed * 31 + j)
                    .build());
            pathEngine.addMarketData(symbol, path);
        }
        return pathEngine.run(strategy, parameters);
    }

    private BacktestResult await(CompletableFuture<BacktestResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof BaseException cause) {
                log.warn("Batch backtest failed: {}", cause.describe());
                throw cause;
            }
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
