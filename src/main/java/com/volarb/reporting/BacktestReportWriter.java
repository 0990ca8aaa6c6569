package com.volarb.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.volarb.backtest.BacktestParameters;
import com.volarb.backtest.BacktestResult;
import com.volarb.domain.model.Trade;
import com.volarb.exception.ReportWriteException;
import com.volarb.timeseries.TimeSeries;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds {@link BacktestReport}s and writes them as pretty-printed JSON with ISO-8601
 * timestamps. Non-finite metrics (an infinite profit factor) are written as strings.
 */
@Component
public class BacktestReportWriter {

    private static final Logger log = LoggerFactory.getLogger(BacktestReportWriter.class);

    private final ObjectMapper objectMapper;

    public BacktestReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules();
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public BacktestReport toReport(String strategyName, BacktestParameters parameters, BacktestResult result) {
        TimeSeries curve = result.getEquityCurve();
        List<BacktestReport.EquityPoint> points = new ArrayList<>(curve.size());
        for (Map.Entry<LocalDateTime, Double> point : curve.entries()) {
            points.add(new BacktestReport.EquityPoint(point.getKey(), point.getValue()));
        }

        List<BacktestReport.TradeRecord> trades = new ArrayList<>(result.getTradeCount());
        for (Trade trade : result.getTrades()) {
            trades.add(new BacktestReport.TradeRecord(
                    trade.getTimestamp(),
                    trade.getInstrumentId(),
                    trade.getAction().name(),
                    trade.getQuantity(),
                    trade.getPrice(),
                    trade.getTransactionCost(),
                    trade.getNetValue()));
        }

        return BacktestReport.builder()
                .strategyName(strategyName)
                .symbols(List.copyOf(parameters.getSymbols()))
                .startDate(parameters.getStartDate())
                .endDate(parameters.getEndDate())
                .initialCapital(parameters.getInitialCapital())
                .finalValue(curve.isEmpty() ? parameters.getInitialCapital() : curve.lastValue())
                .tradeCount(result.getTradeCount())
                .metrics(result.getAllMetrics())
                .equityCurve(points)
                .trades(trades)
                .build();
    }

    public String toJson(BacktestReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ReportWriteException("Failed to serialize backtest report for " + report.getStrategyName(), e);
        }
    }

    public void write(BacktestReport report, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toJson(report), StandardCharsets.UTF_8);
            log.info("Backtest report written to {}", file);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write backtest report to " + file, e);
        }
    }
}
