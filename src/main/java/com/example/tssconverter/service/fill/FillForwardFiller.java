package com.example.tssconverter.service.fill;

import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Copies the last non-empty value of a column down into the empty cells below it.
 * <p>
 * Each column is handled on its own. Cells inside merged regions are never written.
 * Running it twice gives the same grid as running it once.
 */
@Slf4j
public class FillForwardFiller {

    /**
     * @return number of cells filled
     */
    public int fill(CellGridReader grid, List<Integer> columns, int startRow, int endRow) {
        int filled = 0;
        for (Integer column : columns) {
            filled += fillColumn(grid, column, startRow, endRow);
        }
        log.debug("Filled {} cells in {} (rows {}..{}, columns {})",
                filled, grid.sheetName(), startRow, endRow, columns);
        return filled;
    }

    /**
     * Last row holding any non-empty cell, scanning backward; {@code floorRow - 1} when none.
     */
    public int findEndRow(CellGridReader grid, int floorRow) {
        return grid.findLastDataRow(floorRow);
    }

    private int fillColumn(CellGridReader grid, int column, int startRow, int endRow) {
        String lastValue = null;
        int filled = 0;
        for (int r = startRow; r <= endRow; r++) {
            String value = grid.read(r, column);
            if (!value.isEmpty()) {
                lastValue = value;
                continue;
            }
            if (lastValue == null || grid.isMerged(r, column)) {
                continue;
            }
            CellWriter.write(grid.sheet(), r, column, lastValue);
            filled++;
        }
        return filled;
    }
}
