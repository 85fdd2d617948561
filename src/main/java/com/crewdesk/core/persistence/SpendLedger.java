package com.crewdesk.core.persistence;

import com.crewdesk.core.config.CrewdeskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.YearMonth;
import java.util.Locale;

/**
 * Month-to-date spend, persisted to {@code spend.json}. The total resets
 * when the calendar month rolls over.
 */
@Service
public class SpendLedger {

    private static final Logger log = LoggerFactory.getLogger(SpendLedger.class);

    public record Ledger(String month, double spentUsd) {}

    private final Path file;
    private final Clock clock;
    private Ledger ledger;

    @Autowired
    public SpendLedger(CrewdeskProperties properties) {
        this(properties.homePath().resolve("spend.json"), Clock.systemDefaultZone());
    }

    public SpendLedger(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
        this.ledger = JsonFiles.read(file, Ledger.class).orElse(new Ledger(currentMonth(), 0));
    }

    public synchronized double monthToDate() {
        rollover();
        return ledger.spentUsd();
    }

    public synchronized void commit(double usd) {
        rollover();
        ledger = new Ledger(ledger.month(), ledger.spentUsd() + usd);
        try {
            JsonFiles.write(file, ledger);
        } catch (IOException e) {
            throw new CheckpointException("Failed to persist spend ledger " + file, e);
        }
        log.info("Committed ${} to spend ledger; month-to-date ${}",
                String.format(Locale.US, "%.4f", usd), String.format(Locale.US, "%.4f", ledger.spentUsd()));
    }

    private void rollover() {
        String month = currentMonth();
        if (!month.equals(ledger.month())) {
            ledger = new Ledger(month, 0);
        }
    }

    private String currentMonth() {
        return YearMonth.now(clock).toString();
    }
}
