package com.example.tssconverter.service.grid;

import com.example.tssconverter.service.SheetFixtures;
import com.example.tssconverter.service.quality.IssueLevel;
import com.example.tssconverter.service.quality.QualityReport;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class CellGridReaderTest {

    private XSSFWorkbook workbook;
    private Sheet sheet;
    private QualityReport report;

    @BeforeEach
    void setUp() {
        workbook = new XSSFWorkbook();
        sheet = workbook.createSheet("M-Textile");
        report = new QualityReport();
    }

    @AfterEach
    void tearDown() throws Exception {
        workbook.close();
    }

    @Test
    void everyCellOfMergedRegionReadsTopLeftValue() {
        SheetFixtures.set(sheet, "B2", "Merged value");
        SheetFixtures.set(sheet, "C3", "hidden below merge");
        sheet.addMergedRegion(new CellRangeAddress(1, 3, 1, 2));
        CellGridReader grid = new CellGridReader(sheet, report, "test");

        for (int row = 2; row <= 4; row++) {
            for (int column = 2; column <= 3; column++) {
                assertThat(grid.read(row, column)).isEqualTo("Merged value");
                assertThat(grid.isMerged(row, column)).isTrue();
            }
        }
        assertThat(grid.isCoveredByMerge(2, 2)).isFalse();
        assertThat(grid.isCoveredByMerge(3, 3)).isTrue();
        assertThat(grid.read(5, 2)).isEmpty();
    }

    @Test
    void numbersDatesAndBooleansHaveCanonicalText() {
        SheetFixtures.set(sheet, "A1", 5);
        SheetFixtures.set(sheet, "A2", 2.5);
        SheetFixtures.set(sheet, "A3", true);
        SheetFixtures.set(sheet, "A4", "  padded  ");
        CellStyle dateStyle = workbook.createCellStyle();
        dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
        SheetFixtures.set(sheet, "A5", "").setCellValue(LocalDateTime.of(2024, 3, 1, 8, 30));
        sheet.getRow(4).getCell(0).setCellStyle(dateStyle);
        CellGridReader grid = CellGridReader.of(sheet);

        assertThat(grid.read(1, 1)).isEqualTo("5");
        assertThat(grid.read(2, 1)).isEqualTo("2.5");
        assertThat(grid.read(3, 1)).isEqualTo("TRUE");
        assertThat(grid.read(4, 1)).isEqualTo("padded");
        assertThat(grid.read(5, 1)).isEqualTo("2024-03-01 08:30:00");
    }

    @Test
    void formulaErrorsReadAsEmptyAndAreReportedOncePerCell() {
        SheetFixtures.set(sheet, "A1", "#N/A");
        SheetFixtures.set(sheet, "A2", "").setCellErrorValue(FormulaError.REF.getCode());
        SheetFixtures.set(sheet, "A3", "value #DIV/0! inside");
        CellGridReader grid = new CellGridReader(sheet, report, "step2");

        assertThat(grid.tryRead(1, 1).error()).isEqualTo(ReadErrorKind.FORMULA_ERROR);
        assertThat(grid.read(1, 1)).isEmpty();
        assertThat(grid.read(1, 1)).isEmpty();
        assertThat(grid.tryRead(2, 1).error()).isEqualTo(ReadErrorKind.FORMULA_ERROR);
        assertThat(grid.read(3, 1)).isEmpty();

        assertThat(report.count(IssueLevel.WARNING, QualityReport.FORMULA_ERRORS)).isEqualTo(3);
        assertThat(report.issues()).allSatisfy(issue -> assertThat(issue.step()).isEqualTo("step2"));
    }

    @Test
    void outOfBoundsReadsNeverThrow() {
        CellGridReader grid = CellGridReader.of(sheet);

        assertThat(grid.tryRead(0, 1).error()).isEqualTo(ReadErrorKind.OUT_OF_BOUNDS);
        assertThat(grid.tryRead(1, -3).error()).isEqualTo(ReadErrorKind.OUT_OF_BOUNDS);
        assertThat(grid.read(2_000_000, 1)).isEmpty();
        assertThat(grid.tryRead(500, 500).isOk()).isTrue();
        assertThat(grid.read(500, 500)).isEmpty();
    }

    @Test
    void lastDataRowIgnoresTrailingEmptyRows() {
        SheetFixtures.set(sheet, "A1", "header");
        SheetFixtures.set(sheet, "C4", "data");
        SheetFixtures.set(sheet, "B9", "");
        sheet.createRow(11);
        CellGridReader grid = CellGridReader.of(sheet);

        assertThat(grid.lastRow()).isEqualTo(12);
        assertThat(grid.findLastDataRow(2)).isEqualTo(4);
        assertThat(grid.findLastDataRow(5)).isEqualTo(4);
        assertThat(grid.rowHasData(4)).isTrue();
        assertThat(grid.rowHasData(9)).isFalse();
    }

    @Test
    void hiddenRowsAndColumnsAreDetected() {
        SheetFixtures.set(sheet, "A2", "x").getRow().setZeroHeight(true);
        sheet.setColumnHidden(3, true);
        CellGridReader grid = CellGridReader.of(sheet);

        assertThat(grid.isRowHidden(2)).isTrue();
        assertThat(grid.isHidden(2, 1)).isTrue();
        assertThat(grid.isHidden(1, 4)).isTrue();
        assertThat(grid.isHidden(1, 1)).isFalse();
    }
}
