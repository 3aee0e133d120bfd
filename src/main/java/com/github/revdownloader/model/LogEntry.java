package com.github.revdownloader.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class LogEntry {

    private String sessionId;
    private LogLevel level;
    private String message;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
