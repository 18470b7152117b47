package com.example.tssconverter.service.grid;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deletes rows by rebuilding the tail of a sheet instead of shifting it row by row.
 * <p>
 * Every row from {@code firstRow} to the last row is snapshotted, the surviving snapshots are
 * written back contiguously from {@code firstRow}, and the returned map says where each
 * surviving row went. Row indexes seen by the caller stay valid until the rebuild is done.
 */
public final class SheetRowCompactor {

    private SheetRowCompactor() {
    }

    /**
     * @param firstRow      first 1-based row of the region being rebuilt
     * @param rowsToDelete  1-based rows to drop; rows outside the region are ignored
     * @return old row to new row, for every surviving row of the region
     */
    public static Map<Integer, Integer> compact(Sheet sheet, int firstRow, Collection<Integer> rowsToDelete) {
        Map<Integer, Integer> remap = new LinkedHashMap<>();
        int lastRow = sheet.getPhysicalNumberOfRows() == 0 ? 0 : sheet.getLastRowNum() + 1;
        if (lastRow < firstRow) {
            return remap;
        }
        Set<Integer> deleted = new HashSet<>(rowsToDelete);

        List<RowSnapshot> kept = new ArrayList<>();
        int next = firstRow;
        for (int r = firstRow; r <= lastRow; r++) {
            if (deleted.contains(r)) {
                continue;
            }
            remap.put(r, next++);
            kept.add(RowSnapshot.of(sheet.getRow(r - 1)));
        }
        if (remap.size() == lastRow - firstRow + 1) {
            return remap;
        }

        List<CellRangeAddress> relocated = relocateMergedRegions(sheet, firstRow, lastRow, deleted);

        for (int r = lastRow; r >= firstRow; r--) {
            Row row = sheet.getRow(r - 1);
            if (row != null) {
                sheet.removeRow(row);
            }
        }
        for (int i = 0; i < kept.size(); i++) {
            kept.get(i).restore(sheet, firstRow + i - 1);
        }
        for (CellRangeAddress region : relocated) {
            sheet.addMergedRegion(region);
        }
        return remap;
    }

    // A region keeps its surviving rows: it moves up by the deleted rows above it and shrinks by
    // the deleted rows inside it. Regions reduced to a single cell or to nothing are dropped.
    private static List<CellRangeAddress> relocateMergedRegions(Sheet sheet, int firstRow, int lastRow,
                                                                Set<Integer> deleted) {
        List<CellRangeAddress> relocated = new ArrayList<>();
        for (int i = sheet.getNumMergedRegions() - 1; i >= 0; i--) {
            CellRangeAddress region = sheet.getMergedRegion(i);
            int top = region.getFirstRow() + 1;
            int bottom = region.getLastRow() + 1;
            int deletedAbove = countDeleted(deleted, firstRow, Math.min(top - 1, lastRow));
            int deletedInside = countDeleted(deleted, Math.max(top, firstRow), Math.min(bottom, lastRow));
            if (deletedAbove == 0 && deletedInside == 0) {
                continue;
            }
            sheet.removeMergedRegion(i);
            int newTop = top - deletedAbove;
            int newBottom = bottom - deletedAbove - deletedInside;
            boolean singleCell = newTop == newBottom && region.getFirstColumn() == region.getLastColumn();
            if (newBottom >= newTop && !singleCell) {
                relocated.add(new CellRangeAddress(newTop - 1, newBottom - 1,
                        region.getFirstColumn(), region.getLastColumn()));
            }
        }
        return relocated;
    }

    private static int countDeleted(Set<Integer> deleted, int from, int to) {
        int count = 0;
        for (int r = from; r <= to; r++) {
            if (deleted.contains(r)) {
                count++;
            }
        }
        return count;
    }

    private record RowSnapshot(short height, boolean zeroHeight, List<CellSnapshot> cells) {

        static RowSnapshot of(Row row) {
            if (row == null) {
                return new RowSnapshot((short) -1, false, List.of());
            }
            List<CellSnapshot> cells = new ArrayList<>();
            for (Cell cell : row) {
                cells.add(CellSnapshot.of(cell));
            }
            return new RowSnapshot(row.getHeight(), row.getZeroHeight(), cells);
        }

        void restore(Sheet sheet, int rowIndex) {
            if (height < 0 && cells.isEmpty()) {
                return;
            }
            Row row = sheet.createRow(rowIndex);
            if (height >= 0) {
                row.setHeight(height);
            }
            row.setZeroHeight(zeroHeight);
            for (CellSnapshot cell : cells) {
                cell.restore(row);
            }
        }
    }

    private record CellSnapshot(int column, CellType type, Object value, CellStyle style) {

        static CellSnapshot of(Cell cell) {
            CellType type = cell.getCellType();
            Object value = switch (type) {
                case STRING -> cell.getStringCellValue();
                case NUMERIC -> cell.getNumericCellValue();
                case BOOLEAN -> cell.getBooleanCellValue();
                case FORMULA -> cell.getCellFormula();
                case ERROR -> cell.getErrorCellValue();
                default -> null;
            };
            return new CellSnapshot(cell.getColumnIndex(), type, value, cell.getCellStyle());
        }

        void restore(Row row) {
            Cell cell = row.createCell(column);
            cell.setCellStyle(style);
            switch (type) {
                case STRING -> cell.setCellValue((String) value);
                case NUMERIC -> cell.setCellValue((Double) value);
                case BOOLEAN -> cell.setCellValue((Boolean) value);
                case FORMULA -> cell.setCellFormula((String) value);
                case ERROR -> cell.setCellErrorValue((Byte) value);
                default -> cell.setBlank();
            }
        }
    }
}
