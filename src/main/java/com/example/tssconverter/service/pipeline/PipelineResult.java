package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.service.quality.QualityReport;
import com.example.tssconverter.service.quality.QualitySummary;

import java.nio.file.Path;
import java.util.Map;

public record PipelineResult(
        boolean success,
        Path output,
        String errorCode,
        String failureReason,
        int stepsCompleted,
        QualitySummary quality,
        Map<String, Object> statistics
) {
    public PipelineResult {
        statistics = statistics == null ? Map.of() : Map.copyOf(statistics);
    }

    static PipelineResult succeeded(Path output, int stepsCompleted, QualityReport report) {
        return new PipelineResult(true, output, null, null, stepsCompleted, report.summary(), report.statistics());
    }

    static PipelineResult failed(String errorCode, String reason, int stepsCompleted, QualityReport report) {
        return new PipelineResult(false, null, errorCode, reason, stepsCompleted, report.summary(), report.statistics());
    }

    public int statistic(String key) {
        Object value = statistics.get(key);
        return value instanceof Number number ? number.intValue() : 0;
    }
}
