package com.example.tssconverter.service.quality;

import java.util.List;
import java.util.Map;

public record QualitySummary(
        int qualityScore,
        int errorCount,
        int warningCount,
        int infoCount,
        Map<String, Integer> categories,
        List<QualityIssue> warnings,
        List<QualityIssue> errors,
        Map<String, Object> statistics,
        List<String> recommendations
) {
}
