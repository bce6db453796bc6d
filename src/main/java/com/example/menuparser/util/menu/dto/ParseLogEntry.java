package com.example.menuparser.util.menu.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;
import org.slf4j.event.Level;

/**
 * 结构化日志条目 (phase, severity, message)
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseLogEntry {

    ProcessingPhase phase;

    Level severity;

    FailureKind failureKind;

    String message;

    long timestamp;
}
