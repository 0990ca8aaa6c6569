package com.volarb.config;

import com.volarb.backtest.BacktestEngine;
import com.volarb.backtest.BacktestParameters;
import com.volarb.backtest.BacktestResult;
import com.volarb.reporting.BacktestReportWriter;
import com.volarb.strategy.StrategyFactory;
import com.volarb.strategy.impl.VolatilityArbitrageStrategy;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line backtest: loads one CSV per configured symbol, runs the volatility arbitrage
 * strategy over the configured range, logs the summary and writes the JSON report.
 *
 * <p>Enabled with {@code volarb.runner.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "volarb.runner", name = "enabled", havingValue = "true")
public class BacktestRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private final BacktestProperties backtestProperties;
    private final BacktestEngine backtestEngine;
    private final StrategyFactory strategyFactory;
    private final BacktestReportWriter reportWriter;

    public BacktestRunner(
            BacktestProperties backtestProperties,
            BacktestEngine backtestEngine,
            StrategyFactory strategyFactory,
            BacktestReportWriter reportWriter) {
        this.backtestProperties = backtestProperties;
        this.backtestEngine = backtestEngine;
        this.strategyFactory = strategyFactory;
        this.reportWriter = reportWriter;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path dataDirectory = Path.of(backtestProperties.getDataDirectory());
        for (String symbol : backtestProperties.getSymbols()) {
            backtestEngine.loadMarketData(symbol, dataDirectory.resolve(symbol + ".csv"));
        }
        log.info(backtestEngine.getEngineInfo());

        BacktestParameters parameters = toParameters(backtestProperties);
        VolatilityArbitrageStrategy strategy = strategyFactory.createVolatilityArbitrage();
        BacktestResult result = backtestEngine.run(strategy, parameters);
        log.info("\n{}", result.getSummary());

        String reportFile = backtestProperties.getReportFile();
        if (reportFile != null && !reportFile.isBlank()) {
            reportWriter.write(reportWriter.toReport(strategy.getName(), parameters, result), Path.of(reportFile));
        }
    }

    static BacktestParameters toParameters(BacktestProperties properties) {
        return BacktestParameters.builder()
                .startDate(properties.getStartDate().atStartOfDay())
                .endDate(properties.getEndDate().atTime(LocalTime.MAX))
                .initialCapital(properties.getInitialCapital())
                .symbols(new ArrayList<>(properties.getSymbols()))
                .includeTransactionCosts(properties.isIncludeTransactionCosts())
                .transactionCostPerTrade(properties.getTransactionCostPerTrade())
                .transactionCostPercentage(properties.getTransactionCostPercentage())
                .build();
    }
}
