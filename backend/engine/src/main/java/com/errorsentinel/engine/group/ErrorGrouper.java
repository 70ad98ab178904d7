package com.errorsentinel.engine.group;

import com.errorsentinel.core.model.LogRecord;
import com.errorsentinel.core.model.SignatureAggregate;
import com.errorsentinel.core.signature.SignatureExtractor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ErrorGrouper {
    private static final Logger LOGGER = Logger.getLogger(ErrorGrouper.class.getName());
    static final int SAMPLE_MAX_LENGTH = 200;

    private final SignatureExtractor extractor;

    public ErrorGrouper(SignatureExtractor extractor) {
        this.extractor = extractor;
    }

    public Map<String, SignatureAggregate> group(List<LogRecord> records) {
        Map<String, Accumulator> accumulators = new LinkedHashMap<>();
        int skipped = 0;
        for (LogRecord record : records) {
            Optional<String> signature = record == null ? Optional.empty() : extractor.extract(record.message());
            if (signature.isEmpty()) {
                skipped++;
                continue;
            }
            accumulators.computeIfAbsent(signature.get(), ignored -> new Accumulator(sample(record.message())))
                    .add(record);
        }
        if (skipped > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Skipped " + skipped + " of " + records.size() + " records without a signature");
        }

        Map<String, SignatureAggregate> aggregates = new LinkedHashMap<>();
        accumulators.forEach((signature, acc) -> aggregates.put(signature, new SignatureAggregate(
                signature,
                acc.count,
                acc.sources,
                acc.lastSeen,
                acc.sampleMessage
        )));
        return aggregates;
    }

    private static String sample(String message) {
        return message.length() > SAMPLE_MAX_LENGTH ? message.substring(0, SAMPLE_MAX_LENGTH) : message;
    }

    private static final class Accumulator {
        private final String sampleMessage;
        private final Set<String> sources = new TreeSet<>();
        private int count;
        private String lastSeen = "";

        private Accumulator(String sampleMessage) {
            this.sampleMessage = sampleMessage;
        }

        private void add(LogRecord record) {
            count++;
            if (record.source() != null) {
                sources.add(record.source());
            }
            String timestamp = record.timestamp() == null ? "" : record.timestamp();
            if (timestamp.compareTo(lastSeen) > 0) {
                lastSeen = timestamp;
            }
        }
    }
}
