package com.example.tssconverter.service.quality;

import java.time.Instant;
import java.util.Map;

public record QualityIssue(
        IssueLevel level,
        String step,
        String category,
        String message,
        Map<String, Object> details,
        Instant timestamp
) {
    public QualityIssue {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
