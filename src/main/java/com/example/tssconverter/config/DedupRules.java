package com.example.tssconverter.config;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record DedupRules(
        String indicatorColumn,
        List<String> naValues,
        String markerValue,
        List<String> comparisonColumns,
        List<String> clearColumns,
        String summaryColumn,
        String defaultSummary
) {
    public DedupRules {
        naValues = naValues == null ? List.of("", "NA", "-") : List.copyOf(naValues);
        comparisonColumns = comparisonColumns == null ? List.of() : List.copyOf(comparisonColumns);
        clearColumns = clearColumns == null ? List.of() : List.copyOf(clearColumns);
    }

    public Set<String> normalizedNaValues() {
        return naValues.stream()
                .map(value -> value == null ? "" : value.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
