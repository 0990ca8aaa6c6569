package com.volarb.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.volarb.backtest.BacktestEngine;
import com.volarb.backtest.BacktestParameters;
import com.volarb.backtest.BacktestResult;
import com.volarb.config.BacktestProperties;
import com.volarb.config.BacktestRunner;
import com.volarb.config.StrategyProperties;
import com.volarb.domain.model.MarketObservation;
import com.volarb.exception.MarketDataLoadException;
import com.volarb.marketdata.MarketDataCsvReader;
import com.volarb.marketdata.SyntheticMarketDataGenerator;
import com.volarb.marketdata.SyntheticPathSpec;
import com.volarb.reporting.BacktestReportWriter;
import com.volarb.strategy.StrategyFactory;
import com.volarb.strategy.impl.VolatilityArbitrageStrategy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.ApplicationArguments;

/**
 * End-to-end backtest flow wired by hand: CSV on disk -> engine -> volatility arbitrage
 * strategy -> metrics -> JSON report.
 */
class BacktestFlowIntegrationTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 1, 1, 16, 0);

    @TempDir
    Path dataDirectory;

    private MarketDataCsvReader csvReader;
    private BacktestEngine engine;
    private BacktestReportWriter reportWriter;

    @BeforeEach
    void setUp() throws IOException {
        csvReader = new MarketDataCsvReader();
        engine = new BacktestEngine(csvReader);
        reportWriter = new BacktestReportWriter();
        writeCsv(dataDirectory.resolve("SPY.csv"), "SPY", 120, 3);
    }

    private static void writeCsv(Path file, String symbol, int bars, long seed) throws IOException {
        List<MarketObservation> path = new SyntheticMarketDataGenerator().generate(SyntheticPathSpec.builder()
                .symbol(symbol)
                .start(START)
                .bars(bars)
                .impliedVolatility(0.25)
                .impliedVolatilityNoise(0.03)
                .seed(seed)
                .build());
        StringBuilder csv = new StringBuilder("symbol,timestamp,open,high,low,close,volume,implied_volatility\n");
        for (MarketObservation bar : path) {
            csv.append(String.format(
                    Locale.ROOT,
                    "%s,%s,%.6f,%.6f,%.6f,%.6f,%.0f,%.6f%n",
                    bar.getSymbol(),
                    bar.getTimestamp().format(MarketDataCsvReader.TIMESTAMP_FORMAT),
                    bar.getOpen(),
                    bar.getHigh(),
                    bar.getLow(),
                    bar.getClose(),
                    bar.getVolume(),
                    bar.getAuxiliary(MarketObservation.IMPLIED_VOLATILITY)));
        }
        Files.writeString(file, csv.toString(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("CSV data drives trades, metrics and a report")
    void csvToReport() throws IOException {
        engine.loadMarketData("SPY", dataDirectory.resolve("SPY.csv"));
        VolatilityArbitrageStrategy strategy = new StrategyFactory(new StrategyProperties()).createVolatilityArbitrage();
        BacktestParameters parameters = BacktestParameters.builder()
                .startDate(START)
                .endDate(START.plusDays(119))
                .symbols(List.of("SPY"))
                .transactionCostPerTrade(5.0)
                .build();

        BacktestResult result = engine.run(strategy, parameters);

        assertThat(result.getEquityCurve().size()).isEqualTo(120);
        assertThat(result.getTradeCount()).isPositive();
        assertThat(result.getTrades()).allSatisfy(trade -> assertThat(trade.getTransactionCost()).isPositive());
        assertThat(result.getSummary()).contains("Total Trades: " + result.getTradeCount());

        Path reportFile = dataDirectory.resolve("out/report.json");
        reportWriter.write(reportWriter.toReport(strategy.getName(), parameters, result), reportFile);

        JsonNode report = new ObjectMapper().readTree(Files.readString(reportFile));
        assertThat(report.get("strategyName").asText()).isEqualTo("VolatilityArbitrage");
        assertThat(report.get("equityCurve").size()).isEqualTo(120);
        assertThat(report.get("trades").size()).isEqualTo(result.getTradeCount());
    }

    @Test
    @DisplayName("command-line runner loads configured symbols and writes the report")
    void runner() throws IOException {
        Path reportFile = dataDirectory.resolve("runner-report.json");
        BacktestProperties properties = new BacktestProperties();
        properties.setDataDirectory(dataDirectory.toString());
        properties.setSymbols(List.of("SPY"));
        properties.setStartDate(LocalDate.of(2025, 1, 1));
        properties.setEndDate(LocalDate.of(2025, 3, 31));
        properties.setReportFile(reportFile.toString());

        BacktestRunner runner = new BacktestRunner(
                properties, engine, new StrategyFactory(new StrategyProperties()), reportWriter);
        runner.run(mock(ApplicationArguments.class));

        JsonNode report = new ObjectMapper().readTree(Files.readString(reportFile));
        assertThat(report.get("symbols").get(0).asText()).isEqualTo("SPY");
        // Jan 1 .. Mar 31 inclusive
        assertThat(report.get("equityCurve").size()).isEqualTo(90);
        assertThat(engine.hasMarketData("SPY")).isTrue();
    }

    @Test
    @DisplayName("runner fails when a configured symbol has no file")
    void runnerMissingFile() {
        BacktestProperties properties = new BacktestProperties();
        properties.setDataDirectory(dataDirectory.toString());
        properties.setSymbols(List.of("QQQ"));

        BacktestRunner runner = new BacktestRunner(
                properties, engine, new StrategyFactory(new StrategyProperties()), reportWriter);

        assertThatThrownBy(() -> runner.run(mock(ApplicationArguments.class)))
                .isInstanceOf(MarketDataLoadException.class);
    }
}
