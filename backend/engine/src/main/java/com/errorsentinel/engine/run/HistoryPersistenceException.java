package com.errorsentinel.engine.run;

import com.errorsentinel.core.model.ErrorReport;

public class HistoryPersistenceException extends IllegalStateException {
    private final transient ErrorReport report;

    public HistoryPersistenceException(String message, ErrorReport report, Throwable cause) {
        super(message, cause);
        this.report = report;
    }

    public ErrorReport report() {
        return report;
    }
}
