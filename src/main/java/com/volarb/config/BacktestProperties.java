package com.volarb.config;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings of the command-line backtest run.
 *
 * <p>Market data for each symbol is read from {@code <dataDirectory>/<SYMBOL>.csv}.
 */
@Configuration
@ConfigurationProperties(prefix = "volarb.backtest")
@Getter
@Setter
public class BacktestProperties {

    private double initialCapital = 100_000.0;

    private List<String> symbols = new ArrayList<>(List.of("SPY"));

    private LocalDate startDate = LocalDate.of(2025, 1, 1);

    private LocalDate endDate = LocalDate.of(2025, 12, 31);

    private boolean includeTransactionCosts = true;

    private double transactionCostPerTrade = 5.0;

    private double transactionCostPercentage = 0.001;

    /** Directory holding one CSV file per symbol. */
    private String dataDirectory = "data";

    /** JSON report destination. Blank disables the report. */
    private String reportFile = "backtest-report.json";
}
