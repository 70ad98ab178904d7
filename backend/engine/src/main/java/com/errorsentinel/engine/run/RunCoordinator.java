package com.errorsentinel.engine.run;

import com.errorsentinel.core.model.ErrorReport;
import com.errorsentinel.core.model.HistoryEntry;
import com.errorsentinel.core.model.LogRecord;
import com.errorsentinel.core.model.SignatureAggregate;
import com.errorsentinel.core.signature.SignatureExtractor;
import com.errorsentinel.engine.api.HistoryStore;
import com.errorsentinel.engine.classify.Classification;
import com.errorsentinel.engine.classify.NoiseClassifier;
import com.errorsentinel.engine.group.ErrorGrouper;
import com.errorsentinel.engine.history.HistoryUpdate;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

public class RunCoordinator {
    private static final Logger LOGGER = Logger.getLogger(RunCoordinator.class.getName());

    private final ErrorGrouper grouper;
    private final NoiseClassifier classifier;
    private final HistoryStore historyStore;
    private final int retentionDays;

    public RunCoordinator(SignatureExtractor extractor, HistoryStore historyStore, EngineSettings settings) {
        Objects.requireNonNull(extractor, "extractor is required");
        Objects.requireNonNull(settings, "settings is required");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore is required");
        this.grouper = new ErrorGrouper(extractor);
        // Compiled up front so a bad pattern fails before any record is touched.
        this.classifier = new NoiseClassifier(settings.customNoisePatterns());
        this.retentionDays = settings.retentionDays();
    }

    public ErrorReport run(List<LogRecord> records, LocalDate today) {
        Objects.requireNonNull(records, "records are required");
        Objects.requireNonNull(today, "today is required");

        Map<String, SignatureAggregate> aggregates = grouper.group(records);
        Classification classification = classifier.classify(aggregates);

        Map<String, HistoryEntry> history = historyStore.load();
        HistoryUpdate update = historyStore.update(history, classification.all(), today);
        Map<String, HistoryEntry> retained = historyStore.expire(update.history(), today, retentionDays);

        ErrorReport report = new ErrorReport(
                classification.attention(),
                classification.noise(),
                update.newSignatures(),
                records.size()
        );
        LOGGER.info("Run " + today + ": " + report.totalRecords() + " records -> " + report.patternCount()
                + " patterns (" + report.attention().size() + " attention, " + report.noise().size()
                + " noise, " + report.newSignatures().size() + " new); history "
                + update.history().size() + " -> " + retained.size() + " entries");

        try {
            historyStore.save(retained);
        } catch (RuntimeException e) {
            throw new HistoryPersistenceException("Run completed but history was not saved: " + e.getMessage(), report, e);
        }
        return report;
    }
}
