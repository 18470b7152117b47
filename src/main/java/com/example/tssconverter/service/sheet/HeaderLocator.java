package com.example.tssconverter.service.sheet;

import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellPosition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds landmark cells by case-insensitive substring match inside a bounded window.
 * Hidden cells are never matched. Not finding anything is a normal outcome.
 */
@Slf4j
public class HeaderLocator {

    public Optional<CellPosition> find(CellGridReader grid, String marker,
                                       SearchWindow window, SearchDirection direction) {
        return find(grid, List.of(marker), window, direction);
    }

    public Optional<CellPosition> find(CellGridReader grid, List<String> markers,
                                       SearchWindow window, SearchDirection direction) {
        List<CellPosition> matches = scan(grid, markers, window, direction, true);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /**
     * Every matching cell in scan order: row by row in the search direction, left to right.
     */
    public List<CellPosition> findAll(CellGridReader grid, List<String> markers,
                                      SearchWindow window, SearchDirection direction) {
        return scan(grid, markers, window, direction, false);
    }

    private List<CellPosition> scan(CellGridReader grid, List<String> markers, SearchWindow window,
                                    SearchDirection direction, boolean firstOnly) {
        List<CellPosition> matches = new ArrayList<>();
        List<String> needles = normalizeAll(markers);
        if (needles.isEmpty()) {
            return matches;
        }
        int lastRow = grid.lastRow();
        int maxColumn = Math.min(window.maxColumns(), grid.lastColumn());
        if (lastRow == 0 || maxColumn == 0) {
            return matches;
        }

        int firstRow;
        int endRow;
        int step;
        if (direction == SearchDirection.DOWN) {
            firstRow = window.startRow();
            endRow = Math.min(lastRow, window.startRow() + window.maxRows() - 1);
            step = 1;
        } else {
            firstRow = Math.min(window.startRow(), lastRow);
            endRow = Math.max(1, window.startRow() - window.maxRows() + 1);
            step = -1;
        }

        for (int r = firstRow; step > 0 ? r <= endRow : r >= endRow; r += step) {
            for (int c = 1; c <= maxColumn; c++) {
                if (grid.isHidden(r, c) || grid.isCoveredByMerge(r, c)) {
                    continue;
                }
                String value = normalize(grid.read(r, c));
                if (value.isEmpty()) {
                    continue;
                }
                for (String needle : needles) {
                    if (value.contains(needle)) {
                        CellPosition position = new CellPosition(r, c);
                        log.debug("Found '{}' at {}!{}", needle, grid.sheetName(), position);
                        matches.add(position);
                        if (firstOnly) {
                            return matches;
                        }
                        break;
                    }
                }
            }
        }
        return matches;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static List<String> normalizeAll(List<String> markers) {
        List<String> normalized = new ArrayList<>();
        if (markers == null) {
            return normalized;
        }
        for (String marker : markers) {
            String value = normalize(marker);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return normalized;
    }
}
