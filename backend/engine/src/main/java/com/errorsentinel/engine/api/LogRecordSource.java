package com.errorsentinel.engine.api;

import com.errorsentinel.core.model.LogRecord;

import java.util.List;

public interface LogRecordSource {
    String name();

    List<LogRecord> fetch();
}
