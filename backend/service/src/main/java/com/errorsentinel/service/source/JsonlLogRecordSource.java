package com.errorsentinel.service.source;

import com.errorsentinel.core.model.LogRecord;
import com.errorsentinel.core.util.JsonUtils;
import com.errorsentinel.engine.api.LogRecordSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public class JsonlLogRecordSource implements LogRecordSource {
    private static final Logger LOGGER = Logger.getLogger(JsonlLogRecordSource.class.getName());

    private final Path file;

    public JsonlLogRecordSource(Path file) {
        this.file = file;
    }

    @Override
    public String name() {
        return file.getFileName().toString();
    }

    @Override
    public List<LogRecord> fetch() {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading log records from " + file, e);
        }

        // decoded line by line so one badly encoded line cannot sink the file
        List<LogRecord> records = new ArrayList<>();
        int lineNumber = 0;
        int invalid = 0;
        int start = 0;
        while (start < content.length) {
            int end = start;
            while (end < content.length && content[end] != '\n') {
                end++;
            }
            lineNumber++;
            if (!isBlank(content, start, end)) {
                try {
                    LogRecord record = JsonUtils.objectMapper().readValue(content, start, end - start, LogRecord.class);
                    if (record != null) {
                        records.add(record);
                    }
                } catch (IOException decodeError) {
                    invalid++;
                    LOGGER.warning("Skipping invalid log record at " + name() + ":" + lineNumber
                            + " (" + decodeError.getMessage() + ")");
                }
            }
            start = end + 1;
        }
        if (invalid > 0) {
            LOGGER.warning("Skipped " + invalid + " invalid lines in " + name());
        }
        return records;
    }

    private static boolean isBlank(byte[] content, int start, int end) {
        for (int i = start; i < end; i++) {
            byte b = content[i];
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }
}
