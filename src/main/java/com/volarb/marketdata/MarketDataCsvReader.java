package com.volarb.marketdata;

import com.volarb.domain.model.MarketObservation;
import com.volarb.exception.MarketDataLoadException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads bar data from CSV files.
 *
 * <p>Row format: {@code symbol,timestamp,open,high,low,close,volume[,extra...]}. Timestamps are
 * {@code yyyy-MM-dd HH:mm:ss} or a bare {@code yyyy-MM-dd} (start of day). A first line
 * mentioning {@code symbol} is treated as the header; header names of columns past
 * {@code volume} become auxiliary keys (e.g. {@code implied_volatility}, {@code risk_free_rate}).
 * Without a header extra columns are ignored.
 *
 * <p>Blank lines are skipped. Lines that cannot be parsed are skipped with a warning.
 * Observations are returned in file order.
 */
@Component
public class MarketDataCsvReader {

    private static final Logger log = LoggerFactory.getLogger(MarketDataCsvReader.class);

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int CORE_COLUMNS = 7;

    /**
     * Reads every parseable observation from {@code file}.
     *
     * @throws MarketDataLoadException if the file cannot be opened or read
     */
    public List<MarketObservation> read(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<MarketObservation> observations = new ArrayList<>();
            List<String> auxiliaryKeys = List.of();
            boolean firstLine = true;
            int lineNumber = 0;
            int skipped = 0;

            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                if (firstLine) {
                    firstLine = false;
                    if (line.toLowerCase(Locale.ROOT).contains("symbol")) {
                        auxiliaryKeys = parseAuxiliaryKeys(line);
                        continue;
                    }
                }

                MarketObservation observation = parseLine(line, auxiliaryKeys, file, lineNumber);
                if (observation == null) {
                    skipped++;
                } else {
                    observations.add(observation);
                }
            }

            log.info("Read {} observations from {} ({} lines skipped)", observations.size(), file, skipped);
            return observations;
        } catch (IOException e) {
            throw new MarketDataLoadException("Unable to read market data file: " + file, e);
        }
    }

    private List<String> parseAuxiliaryKeys(String header) {
        String[] columns = header.split(",", -1);
        List<String> keys = new ArrayList<>();
        for (int i = CORE_COLUMNS; i < columns.length; i++) {
            keys.add(columns[i].trim());
        }
        return keys;
    }

    /** Parsed observation, or null when the line is malformed. */
    private MarketObservation parseLine(String line, List<String> auxiliaryKeys, Path file, int lineNumber) {
        String[] cells = line.split(",", -1);
        if (cells.length < CORE_COLUMNS) {
            log.warn("Skipping {}:{}: expected at least {} columns, got {}", file, lineNumber, CORE_COLUMNS, cells.length);
            return null;
        }
        try {
            MarketObservation.MarketObservationBuilder builder = MarketObservation.builder()
                    .symbol(cells[0].trim())
                    .timestamp(parseTimestamp(cells[1].trim()))
                    .open(Double.parseDouble(cells[2].trim()))
                    .high(Double.parseDouble(cells[3].trim()))
                    .low(Double.parseDouble(cells[4].trim()))
                    .close(Double.parseDouble(cells[5].trim()))
                    .volume(Double.parseDouble(cells[6].trim()));

            Map<String, Double> auxiliary = new HashMap<>();
            for (int i = 0; i < auxiliaryKeys.size() && CORE_COLUMNS + i < cells.length; i++) {
                String cell = cells[CORE_COLUMNS + i].trim();
                if (!cell.isEmpty()) {
                    auxiliary.put(auxiliaryKeys.get(i), Double.parseDouble(cell));
                }
            }
            return builder.auxiliary(auxiliary).build();
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Skipping {}:{}: {}", file, lineNumber, e.getMessage());
            return null;
        }
    }

    static LocalDateTime parseTimestamp(String text) {
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay();
        }
        return LocalDateTime.parse(text, TIMESTAMP_FORMAT);
    }
}
