package com.example.tssconverter.service.extract;

import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellPosition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads a column downward from a header cell and splits each cell into individual items.
 * <p>
 * A cell may hold several items separated by newline, semicolon or comma. The delimiters are
 * tried in that order and the first one that yields more than one non-empty part wins.
 * Each item is trimmed, loses trailing {@code ;} and {@code ,}, and loses a leading list
 * number such as {@code "2. "}.
 */
@Slf4j
public class VerticalListExtractor {

    public static final int DEFAULT_MAX_ROWS = 1000;

    private static final List<String> DELIMITERS = List.of("\n", ";", ",");
    // "1." is list numbering, "1.5" is a value
    private static final Pattern LIST_NUMBERING = Pattern.compile("^\\s*\\d+\\.(?!\\d)\\s*");
    private static final int SHEET_OVERRUN = 100;

    private final int maxRows;

    public VerticalListExtractor() {
        this(DEFAULT_MAX_ROWS);
    }

    public VerticalListExtractor(int maxRows) {
        this.maxRows = maxRows;
    }

    /**
     * Items below {@code (headerRow, headerColumn)}, in order. Stops at the first empty visible
     * cell. Formula errors count as empty. Hidden rows are skipped.
     */
    public List<String> extract(CellGridReader grid, int headerRow, int headerColumn) {
        List<String> items = new ArrayList<>();
        int limit = Math.min(headerRow + maxRows, grid.lastRow() + SHEET_OVERRUN);
        int hiddenSkipped = 0;
        for (int r = headerRow + 1; r <= limit; r++) {
            if (grid.isRowHidden(r)) {
                hiddenSkipped++;
                continue;
            }
            String value = grid.read(r, headerColumn);
            if (value.isEmpty()) {
                break;
            }
            items.addAll(splitMultiValue(value));
        }
        log.debug("Extracted {} items below {}!{} ({} hidden rows skipped)",
                items.size(), grid.sheetName(), new CellPosition(headerRow, headerColumn), hiddenSkipped);
        return items;
    }

    public List<String> extract(CellGridReader grid, CellPosition header) {
        return extract(grid, header.row(), header.column());
    }

    /**
     * Reads the column to the right of each name header.
     */
    public List<String> extractByPosition(CellGridReader grid, List<CellPosition> namePositions) {
        List<String> values = new ArrayList<>();
        for (CellPosition position : namePositions) {
            values.addAll(extract(grid, position.right()));
        }
        return values;
    }

    /**
     * Article numbers paired by position with the name headers. When that yields nothing, the
     * columns under the explicit number headers are used instead.
     */
    public List<String> extractNumbers(CellGridReader grid, List<CellPosition> namePositions,
                                       List<CellPosition> numberHeaderPositions) {
        List<String> numbers = extractByPosition(grid, namePositions);
        if (!numbers.isEmpty()) {
            return numbers;
        }
        for (CellPosition position : numberHeaderPositions) {
            numbers.addAll(extract(grid, position));
        }
        if (!numbers.isEmpty()) {
            log.info("Article numbers in {} taken from number headers", grid.sheetName());
        }
        return numbers;
    }

    public static List<String> splitMultiValue(String text) {
        List<String> items = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return items;
        }
        for (String delimiter : DELIMITERS) {
            if (!text.contains(delimiter)) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (String part : text.split(Pattern.quote(delimiter))) {
                String cleaned = cleanItem(part);
                if (!cleaned.isEmpty()) {
                    parts.add(cleaned);
                }
            }
            if (parts.size() > 1) {
                return parts;
            }
        }
        String cleaned = cleanItem(text);
        if (!cleaned.isEmpty()) {
            items.add(cleaned);
        }
        return items;
    }

    /**
     * Trims and removes trailing {@code ;} and {@code ,}.
     */
    public static String cleanValue(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.trim();
        while (!cleaned.isEmpty() && (cleaned.endsWith(";") || cleaned.endsWith(","))) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        }
        return cleaned;
    }

    static String cleanItem(String value) {
        String cleaned = cleanValue(value);
        return LIST_NUMBERING.matcher(cleaned).replaceFirst("").trim();
    }

    /**
     * Unique (name, number) pairs in first-seen order. The shorter list is padded with empty strings.
     */
    public static List<ArticlePair> dedupePairs(List<String> names, List<String> numbers) {
        int size = Math.max(names.size(), numbers.size());
        Set<ArticlePair> unique = new LinkedHashSet<>();
        for (int i = 0; i < size; i++) {
            String name = i < names.size() ? names.get(i) : "";
            String number = i < numbers.size() ? numbers.get(i) : "";
            if (name.isEmpty() && number.isEmpty()) {
                continue;
            }
            unique.add(new ArticlePair(name, number));
        }
        return new ArrayList<>(unique);
    }
}
