package com.gridbot.backtest;

import com.gridbot.exception.DataFetchException;
import com.gridbot.model.PriceTick;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads historical close prices from CSV.
 * <p>
 * The header row must contain a {@code timestamp} and a {@code close} column (case-insensitive);
 * other columns are ignored. Timestamps are epoch milliseconds.
 */
@Slf4j
public final class PriceTickLoader {

    private PriceTickLoader() {
    }

    public static List<PriceTick> load(Path csvFile) {
        try (BufferedReader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            List<PriceTick> ticks = read(reader);
            log.info("[BACKTEST] Loaded {} price ticks from {}", ticks.size(), csvFile);
            return ticks;
        } catch (IOException e) {
            throw new DataFetchException("Failed to read price data from " + csvFile + ": " + e.getMessage(), e);
        }
    }

    static List<PriceTick> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        String header = reader.readLine();
        if (header == null) {
            return List.of();
        }
        List<String> columns = Arrays.stream(header.split(",")).map(c -> c.trim().toLowerCase()).toList();
        int timestampIndex = columns.indexOf("timestamp");
        int closeIndex = columns.indexOf("close");
        if (timestampIndex < 0 || closeIndex < 0) {
            throw new DataFetchException("Price data header must contain 'timestamp' and 'close' columns, got: " + header);
        }

        List<PriceTick> ticks = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] values = line.split(",");
            try {
                ticks.add(new PriceTick(Long.parseLong(values[timestampIndex].trim()),
                        new BigDecimal(values[closeIndex].trim())));
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                log.warn("Skipping malformed price row {}: '{}'", lineNumber, line);
            }
        }
        return ticks;
    }
}
