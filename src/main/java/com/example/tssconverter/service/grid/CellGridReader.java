package com.example.tssconverter.service.grid;

import com.example.tssconverter.service.quality.QualityReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merged-range aware, 1-based read access to a worksheet.
 * <p>
 * A cell inside a merged region always reads as the region's top-left cell. Formula errors,
 * out-of-range coordinates and unreadable cells never throw: {@link #tryRead(int, int)} says
 * what went wrong and {@link #read(int, int)} turns every failure into {@code ""}. Each formula
 * error is reported once per cell to the quality report.
 * <p>
 * Merged regions are captured when the reader is created; call {@link #refreshMergedRegions()}
 * after changing the sheet's structure.
 */
@Slf4j
public class CellGridReader {

    static final List<String> ERROR_TOKENS = List.of(
            "#N/A", "#REF!", "#VALUE!", "#DIV/0!", "#NAME?", "#NULL!", "#NUM!", "#ERROR!"
    );
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int MAX_ROWS = SpreadsheetVersion.EXCEL2007.getMaxRows();
    private static final int MAX_COLUMNS = SpreadsheetVersion.EXCEL2007.getMaxColumns();

    private final Sheet sheet;
    private final QualityReport report;
    private final String step;
    private List<CellRangeAddress> mergedRegions;
    private final Set<String> reportedErrors = new HashSet<>();

    public CellGridReader(Sheet sheet, QualityReport report, String step) {
        this.sheet = sheet;
        this.report = report == null ? new QualityReport() : report;
        this.step = step;
        this.mergedRegions = List.copyOf(sheet.getMergedRegions());
    }

    public static CellGridReader of(Sheet sheet) {
        return new CellGridReader(sheet, new QualityReport(), "read");
    }

    public Sheet sheet() {
        return sheet;
    }

    public String sheetName() {
        return sheet.getSheetName();
    }

    public QualityReport report() {
        return report;
    }

    public String step() {
        return step;
    }

    public String read(int row, int column) {
        return tryRead(row, column).textOrEmpty();
    }

    public String read(int row, String columnLetters) {
        return read(row, ColumnLetters.toIndex(columnLetters));
    }

    public String read(CellPosition position) {
        return read(position.row(), position.column());
    }

    public CellReadResult tryRead(int row, int column) {
        if (row < 1 || column < 1 || row > MAX_ROWS || column > MAX_COLUMNS) {
            return CellReadResult.failed(ReadErrorKind.OUT_OF_BOUNDS);
        }
        int sourceRow = row;
        int sourceColumn = column;
        Optional<CellRangeAddress> region = mergedRegionAt(row, column);
        if (region.isPresent()) {
            sourceRow = region.get().getFirstRow() + 1;
            sourceColumn = region.get().getFirstColumn() + 1;
        }

        Row physicalRow = sheet.getRow(sourceRow - 1);
        if (physicalRow == null) {
            return CellReadResult.ok("");
        }
        Cell cell = physicalRow.getCell(sourceColumn - 1);
        if (cell == null) {
            return CellReadResult.ok("");
        }

        try {
            CellReadResult result = readCell(cell);
            if (result.error() == ReadErrorKind.FORMULA_ERROR) {
                reportFormulaError(sourceRow, sourceColumn);
            }
            return result;
        } catch (RuntimeException e) {
            log.debug("Unreadable cell {}!{}: {}", sheet.getSheetName(),
                    new CellPosition(sourceRow, sourceColumn), e.getMessage());
            return CellReadResult.failed(ReadErrorKind.UNREADABLE);
        }
    }

    public void refreshMergedRegions() {
        this.mergedRegions = List.copyOf(sheet.getMergedRegions());
    }

    public boolean isMerged(int row, int column) {
        return mergedRegionAt(row, column).isPresent();
    }

    public Optional<CellRangeAddress> mergedRegionAt(int row, int column) {
        for (CellRangeAddress region : mergedRegions) {
            if (region.isInRange(row - 1, column - 1)) {
                return Optional.of(region);
            }
        }
        return Optional.empty();
    }

    /**
     * True for cells inside a merged region other than its top-left cell.
     */
    public boolean isCoveredByMerge(int row, int column) {
        return mergedRegionAt(row, column)
                .map(region -> region.getFirstRow() != row - 1 || region.getFirstColumn() != column - 1)
                .orElse(false);
    }

    public boolean isRowHidden(int row) {
        Row physicalRow = sheet.getRow(row - 1);
        return physicalRow != null && physicalRow.getZeroHeight();
    }

    public boolean isHidden(int row, int column) {
        return isRowHidden(row) || sheet.isColumnHidden(column - 1);
    }

    /**
     * Last physically present row, 1-based; 0 for an empty sheet.
     */
    public int lastRow() {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return 0;
        }
        return sheet.getLastRowNum() + 1;
    }

    /**
     * Widest used column over all rows and merged regions, 1-based; 0 for an empty sheet.
     */
    public int lastColumn() {
        int last = 0;
        for (Row row : sheet) {
            last = Math.max(last, row.getLastCellNum());
        }
        for (CellRangeAddress region : mergedRegions) {
            last = Math.max(last, region.getLastColumn() + 1);
        }
        return last;
    }

    public boolean rowHasData(int row) {
        return rowHasData(row, lastColumn());
    }

    public boolean rowHasData(int row, int maxColumn) {
        for (int c = 1; c <= maxColumn; c++) {
            if (!read(row, c).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Scans backward from the last row and returns the first row holding any non-empty cell,
     * or {@code floorRow - 1} when every row from {@code floorRow} down is empty.
     */
    public int findLastDataRow(int floorRow) {
        int maxColumn = lastColumn();
        for (int r = lastRow(); r >= floorRow; r--) {
            if (rowHasData(r, maxColumn)) {
                return r;
            }
        }
        return floorRow - 1;
    }

    private CellReadResult readCell(Cell cell) {
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();

        if (type == CellType.ERROR) {
            return CellReadResult.failed(ReadErrorKind.FORMULA_ERROR);
        }
        if (type == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                LocalDateTime value = cell.getLocalDateTimeCellValue();
                return CellReadResult.ok(value == null ? "" : value.format(DATE_FORMAT));
            }
            return CellReadResult.ok(formatNumber(cell.getNumericCellValue()));
        }
        if (type == CellType.BOOLEAN) {
            return CellReadResult.ok(cell.getBooleanCellValue() ? "TRUE" : "FALSE");
        }
        if (type == CellType.STRING) {
            String text = cell.getStringCellValue();
            if (text == null) {
                return CellReadResult.ok("");
            }
            if (containsErrorToken(text)) {
                return CellReadResult.failed(ReadErrorKind.FORMULA_ERROR);
            }
            return CellReadResult.ok(text.trim());
        }
        return CellReadResult.ok("");
    }

    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static boolean containsErrorToken(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        for (String token : ERROR_TOKENS) {
            if (upper.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private void reportFormulaError(int row, int column) {
        CellPosition position = new CellPosition(row, column);
        if (!reportedErrors.add(position.toString())) {
            return;
        }
        report.warn(step, QualityReport.FORMULA_ERRORS,
                "Formula error in " + sheet.getSheetName() + "!" + position + " treated as empty",
                Map.of("sheet", sheet.getSheetName(), "cell", position.toString()));
    }
}
