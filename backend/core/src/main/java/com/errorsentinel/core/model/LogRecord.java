package com.errorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

// aliases accept CloudWatch Logs Insights rows as-is
public record LogRecord(
        @JsonAlias("@timestamp") String timestamp,
        @JsonAlias("@message") String message,
        @JsonAlias("log_group") String source
) {
}
