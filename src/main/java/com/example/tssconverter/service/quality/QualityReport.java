package com.example.tssconverter.service.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates data-quality findings for one pipeline run.
 * <p>
 * One instance per document. Stages append to it; nothing here aborts processing.
 */
@Slf4j
public class QualityReport {

    public static final String MISSING_HEADERS = "missing_headers";
    public static final String FORMULA_ERRORS = "formula_errors";
    public static final String EMPTY_EXTRACTION = "empty_extraction";
    public static final String VALIDATION_WARNING = "validation_warning";
    public static final String VALIDATION_FAILED = "validation_failed";
    public static final String FILE_VALIDATION_FAILED = "file_validation_failed";
    public static final String PROCESSING_FAILED = "processing_failed";
    public static final String FALLBACK_APPLIED = "fallback_applied";

    private static final Set<String> CRITICAL_ERRORS = Set.of(FILE_VALIDATION_FAILED, PROCESSING_FAILED);
    private static final Set<String> STRUCTURAL_WARNINGS = Set.of(MISSING_HEADERS, FORMULA_ERRORS);
    private static final Set<String> VALIDATION_WARNINGS = Set.of(VALIDATION_WARNING, VALIDATION_FAILED);

    private final List<QualityIssue> issues = new ArrayList<>();
    private final Map<String, Object> statistics = new LinkedHashMap<>();

    public void warn(String step, String category, String message) {
        warn(step, category, message, Map.of());
    }

    public void warn(String step, String category, String message, Map<String, Object> details) {
        add(IssueLevel.WARNING, step, category, message, details);
        log.warn("[{}] {}: {}", step, category, message);
    }

    public void error(String step, String category, String message) {
        error(step, category, message, Map.of());
    }

    public void error(String step, String category, String message, Map<String, Object> details) {
        add(IssueLevel.ERROR, step, category, message, details);
        log.error("[{}] {}: {}", step, category, message);
    }

    public void info(String step, String category, String message) {
        add(IssueLevel.INFO, step, category, message, Map.of());
        log.info("[{}] {}: {}", step, category, message);
    }

    public void recordStatistic(String key, Object value) {
        statistics.put(key, value);
    }

    public Map<String, Object> statistics() {
        return Collections.unmodifiableMap(statistics);
    }

    public List<QualityIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    public List<QualityIssue> issues(IssueLevel level) {
        return issues.stream().filter(issue -> issue.level() == level).toList();
    }

    public long count(IssueLevel level, String category) {
        return issues.stream()
                .filter(issue -> issue.level() == level && issue.category().equals(category))
                .count();
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(issue -> issue.level() == IssueLevel.ERROR);
    }

    public int qualityScore() {
        int score = 100;
        for (QualityIssue issue : issues) {
            if (issue.level() == IssueLevel.ERROR) {
                score -= CRITICAL_ERRORS.contains(issue.category()) ? 30 : 15;
            } else if (issue.level() == IssueLevel.WARNING) {
                if (STRUCTURAL_WARNINGS.contains(issue.category())) {
                    score -= 10;
                } else if (VALIDATION_WARNINGS.contains(issue.category())) {
                    score -= 15;
                } else {
                    score -= 5;
                }
            }
        }
        if (count(IssueLevel.WARNING, MISSING_HEADERS) >= 2) {
            score -= 20;
        }
        return Math.max(0, Math.min(100, score));
    }

    public QualitySummary summary() {
        Map<String, Integer> categories = new LinkedHashMap<>();
        for (QualityIssue issue : issues) {
            categories.merge(issue.category(), 1, Integer::sum);
        }
        List<QualityIssue> warnings = issues(IssueLevel.WARNING);
        List<QualityIssue> errors = issues(IssueLevel.ERROR);
        return new QualitySummary(
                qualityScore(),
                errors.size(),
                warnings.size(),
                issues(IssueLevel.INFO).size(),
                categories,
                warnings,
                errors,
                new LinkedHashMap<>(statistics),
                recommendations()
        );
    }

    public List<String> recommendations() {
        List<String> recommendations = new ArrayList<>();
        if (count(IssueLevel.WARNING, MISSING_HEADERS) > 0) {
            recommendations.add("Check that the input contains the expected header rows "
                    + "(Article name / Product name, Product combination).");
        }
        if (count(IssueLevel.WARNING, FORMULA_ERRORS) > 0) {
            recommendations.add("Fix the formula errors in the source workbook; affected cells were treated as empty.");
        }
        if (count(IssueLevel.WARNING, EMPTY_EXTRACTION) > 0) {
            recommendations.add("No article data was found; verify the sheet names and their layout.");
        }
        if (hasErrors()) {
            recommendations.add("Processing reported errors; review the error list before using the output.");
        }
        int score = qualityScore();
        if (score < 50) {
            recommendations.add("Low quality score: manual review of the output is strongly recommended.");
        } else if (score < 80) {
            recommendations.add("Moderate quality score: spot-check the output before use.");
        }
        return recommendations;
    }

    public String toJson() {
        ObjectMapper mapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            return mapper.writeValueAsString(summary());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Quality report export failed: " + e.getMessage(), e);
        }
    }

    private void add(IssueLevel level, String step, String category, String message, Map<String, Object> details) {
        issues.add(new QualityIssue(level, step, category, message, details, Instant.now()));
    }
}
