package com.example.tssconverter.config;

import com.example.tssconverter.service.grid.ColumnLetters;

import java.util.ArrayList;
import java.util.List;

/**
 * One source-to-destination entry. A key such as {@code "K+L"} combines several source columns
 * into one destination cell.
 */
public record ColumnMapping(
        String sourceKey,
        List<Integer> sourceColumns,
        int destinationColumn
) {
    public ColumnMapping {
        sourceColumns = List.copyOf(sourceColumns);
    }

    public static ColumnMapping parse(String sourceKey, String destination) {
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new IllegalArgumentException("Empty source column");
        }
        List<Integer> sources = new ArrayList<>();
        for (String part : sourceKey.split("\\+")) {
            sources.add(ColumnLetters.toIndex(part));
        }
        return new ColumnMapping(sourceKey.trim(), sources, ColumnLetters.toIndex(destination));
    }

    public boolean isCombination() {
        return sourceColumns.size() > 1;
    }
}
