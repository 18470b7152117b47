package com.example.tssconverter.service.grid;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

public final class CellWriter {

    private CellWriter() {
    }

    public static Cell write(Sheet sheet, int row, int column, String value) {
        Cell cell = cellAt(sheet, row, column);
        if (value == null || value.isEmpty()) {
            cell.setBlank();
        } else {
            cell.setCellValue(value);
        }
        return cell;
    }

    public static void clear(Sheet sheet, int row, int column) {
        Row physicalRow = sheet.getRow(row - 1);
        if (physicalRow == null) {
            return;
        }
        Cell cell = physicalRow.getCell(column - 1);
        if (cell != null) {
            cell.setBlank();
        }
    }

    public static Cell cellAt(Sheet sheet, int row, int column) {
        Row physicalRow = sheet.getRow(row - 1);
        if (physicalRow == null) {
            physicalRow = sheet.createRow(row - 1);
        }
        Cell cell = physicalRow.getCell(column - 1);
        if (cell == null) {
            cell = physicalRow.createCell(column - 1);
        }
        return cell;
    }
}
