package com.errorsentinel.service;

import com.errorsentinel.core.model.ErrorReport;
import com.errorsentinel.core.model.LogRecord;
import com.errorsentinel.core.signature.SignatureExtractor;
import com.errorsentinel.engine.api.LogRecordSource;
import com.errorsentinel.engine.run.HistoryPersistenceException;
import com.errorsentinel.engine.run.RunCoordinator;
import com.errorsentinel.service.config.AlertConfig;
import com.errorsentinel.service.config.ConfigLoader;
import com.errorsentinel.service.report.ConsoleReportPrinter;
import com.errorsentinel.service.source.JsonlLogRecordSource;
import com.errorsentinel.service.store.JsonFileHistoryStore;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_INPUT = 2;
    static final int EXIT_HISTORY_NOT_SAVED = 3;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, Clock.systemUTC()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Clock clock) {
        Path configDir = Path.of("config");
        Path input = null;
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) && i + 1 < args.length) {
                configDir = Path.of(args[++i]);
            } else if (args[i].startsWith("--") || input != null) {
                out.println("Usage: Main [--config DIR] <records.jsonl>");
                return EXIT_USAGE;
            } else {
                input = Path.of(args[i]);
            }
        }
        if (input == null) {
            out.println("Usage: Main [--config DIR] <records.jsonl>");
            return EXIT_USAGE;
        }

        RunCoordinator coordinator;
        List<LogRecord> records;
        LocalDate today;
        try {
            AlertConfig config = ConfigLoader.loadAlertConfig(configDir);
            today = LocalDate.now(clock.withZone(config.zoneId()));
            coordinator = new RunCoordinator(
                    SignatureExtractor.from(config.extractorSettings()),
                    new JsonFileHistoryStore(config.historyPath()),
                    config.engineSettings()
            );
            LogRecordSource source = new JsonlLogRecordSource(input);
            records = source.fetch();
            LOGGER.info("Fetched " + records.size() + " log records from " + source.name());
        } catch (RuntimeException e) {
            err.println(e.getMessage());
            return EXIT_INPUT;
        }

        try {
            ConsoleReportPrinter.print(coordinator.run(records, today), out);
            return EXIT_OK;
        } catch (HistoryPersistenceException e) {
            LOGGER.log(Level.WARNING, "Error history not saved; new-signature tracking lost for this run", e);
            ErrorReport report = e.report();
            ConsoleReportPrinter.print(report, out);
            err.println(e.getMessage());
            return EXIT_HISTORY_NOT_SAVED;
        }
    }
}
