package com.example.tssconverter.service.dedup;

import com.example.tssconverter.config.DedupRules;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellWriter;
import com.example.tssconverter.service.grid.ColumnLetters;
import com.example.tssconverter.service.grid.SheetRowCompactor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Drops rows without a usable indicator and collapses duplicate marker rows.
 * <p>
 * Deletions are collected first and applied in one {@link SheetRowCompactor} pass, so row
 * numbers stay stable while the sheet is inspected.
 */
@Slf4j
public class DuplicateGrouper {

    private final int indicatorColumn;
    private final Set<String> naValues;
    private final String markerValue;
    private final List<Integer> comparisonColumns;
    private final List<Integer> clearColumns;
    private final int summaryColumn;
    private final String defaultSummary;

    public DuplicateGrouper(DedupRules rules) {
        this.indicatorColumn = ColumnLetters.toIndex(rules.indicatorColumn());
        this.naValues = rules.normalizedNaValues();
        this.markerValue = rules.markerValue();
        this.comparisonColumns = ColumnLetters.toIndexes(rules.comparisonColumns());
        this.clearColumns = ColumnLetters.toIndexes(rules.clearColumns());
        this.summaryColumn = ColumnLetters.toIndex(rules.summaryColumn());
        this.defaultSummary = rules.defaultSummary();
    }

    /**
     * Deletes every row from {@code firstRow} on whose indicator is empty or an NA value
     * (case-insensitive).
     *
     * @return number of rows removed
     */
    public int removeRows(CellGridReader grid, int firstRow) {
        List<Integer> doomed = new ArrayList<>();
        int lastRow = grid.lastRow();
        for (int r = firstRow; r <= lastRow; r++) {
            String indicator = grid.read(r, indicatorColumn).trim().toUpperCase(Locale.ROOT);
            if (naValues.contains(indicator)) {
                doomed.add(r);
            }
        }
        if (!doomed.isEmpty()) {
            SheetRowCompactor.compact(grid.sheet(), firstRow, doomed);
            grid.refreshMergedRegions();
        }
        log.info("Removed {} rows with empty or NA indicator from '{}'", doomed.size(), grid.sheetName());
        return doomed.size();
    }

    /**
     * Groups marker rows by their comparison key and keeps the first row of each duplicate group.
     * The kept row loses its auxiliary columns and gets the group's most frequent summary value.
     */
    public DedupOutcome dedupe(CellGridReader grid, int firstRow) {
        Map<RowGroupKey, List<Integer>> groups = new LinkedHashMap<>();
        int blankKeys = 0;
        int lastRow = grid.lastRow();
        for (int r = firstRow; r <= lastRow; r++) {
            if (!grid.read(r, indicatorColumn).trim().equalsIgnoreCase(markerValue)) {
                continue;
            }
            RowGroupKey key = keyOf(grid, r);
            if (key.isBlank()) {
                blankKeys++;
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }

        List<Integer> doomed = new ArrayList<>();
        int collapsed = 0;
        for (Map.Entry<RowGroupKey, List<Integer>> group : groups.entrySet()) {
            List<Integer> rows = group.getValue();
            if (rows.size() < 2) {
                continue;
            }
            int kept = rows.get(0);
            String summary = mostFrequent(grid, rows);
            for (Integer column : clearColumns) {
                CellWriter.clear(grid.sheet(), kept, column);
            }
            CellWriter.write(grid.sheet(), kept, summaryColumn, summary);
            doomed.addAll(rows.subList(1, rows.size()));
            collapsed++;
            log.debug("Collapsed {} rows into row {} for key {}", rows.size(), kept, group.getKey().values());
        }

        if (!doomed.isEmpty()) {
            SheetRowCompactor.compact(grid.sheet(), firstRow, doomed);
            grid.refreshMergedRegions();
        }
        log.info("Collapsed {} duplicate groups in '{}', removed {} rows ({} rows with blank key kept)",
                collapsed, grid.sheetName(), doomed.size(), blankKeys);
        return new DedupOutcome(collapsed, doomed.size(), blankKeys);
    }

    public RowGroupKey keyOf(CellGridReader grid, int row) {
        List<String> values = new ArrayList<>();
        for (Integer column : comparisonColumns) {
            values.add(grid.read(row, column));
        }
        return new RowGroupKey(values);
    }

    // Ties go to the value seen first.
    private String mostFrequent(CellGridReader grid, List<Integer> rows) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Integer row : rows) {
            String value = grid.read(row, summaryColumn);
            if (!value.isEmpty()) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best == null ? defaultSummary : best;
    }
}
