package com.example.tssconverter.service.grid;

import com.example.tssconverter.service.SheetFixtures;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SheetRowCompactorTest {

    @Test
    void survivingRowsMoveUpInOrder() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = SheetFixtures.sheet(workbook, "Output", new String[][]{
                    {"title"},
                    {"r2", "a"},
                    {"r3", "b"},
                    {"r4", "c"},
                    {"r5", "d"},
                    {"r6", "e"}
            });
            SheetFixtures.set(sheet, "C6", 42);

            Map<Integer, Integer> remap = SheetRowCompactor.compact(sheet, 2, List.of(3, 5));

            assertThat(remap).containsExactly(Map.entry(2, 2), Map.entry(4, 3), Map.entry(6, 4));
            CellGridReader grid = CellGridReader.of(sheet);
            assertThat(grid.read(1, 1)).isEqualTo("title");
            assertThat(grid.read(2, 2)).isEqualTo("a");
            assertThat(grid.read(3, 2)).isEqualTo("c");
            assertThat(grid.read(4, 2)).isEqualTo("e");
            assertThat(grid.read(4, 3)).isEqualTo("42");
            assertThat(grid.lastRow()).isEqualTo(4);
        }
    }

    @Test
    void mergedRegionsAboveTheRegionAreUntouched() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = SheetFixtures.sheet(workbook, "Output", new String[][]{
                    {"band"}, {""}, {"x"}, {"y"}, {"z"}
            });
            sheet.addMergedRegion(new CellRangeAddress(0, 1, 0, 0));

            SheetRowCompactor.compact(sheet, 3, List.of(4));

            assertThat(sheet.getMergedRegions()).containsExactly(new CellRangeAddress(0, 1, 0, 0));
            CellGridReader grid = CellGridReader.of(sheet);
            assertThat(grid.read(3, 1)).isEqualTo("x");
            assertThat(grid.read(4, 1)).isEqualTo("z");
            assertThat(grid.read(5, 1)).isEmpty();
        }
    }

    @Test
    void nothingToDeleteLeavesSheetAlone() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = SheetFixtures.sheet(workbook, "Output", new String[][]{{"a"}, {"b"}});

            Map<Integer, Integer> remap = SheetRowCompactor.compact(sheet, 1, List.of());

            assertThat(remap).containsEntry(1, 1).containsEntry(2, 2);
            assertThat(CellGridReader.of(sheet).read(2, 1)).isEqualTo("b");
        }
    }

    @Test
    void regionCrossingTheBoundaryKeepsItsShapeWhenOnlyLaterRowsGo() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = numberedRows(workbook, 16);
            sheet.addMergedRegion(new CellRangeAddress(8, 11, 0, 0));

            SheetRowCompactor.compact(sheet, 11, List.of(15));

            assertThat(sheet.getMergedRegions()).containsExactly(new CellRangeAddress(8, 11, 0, 0));
            assertThat(CellGridReader.of(sheet).read(15, 2)).isEqualTo("b16");
        }
    }

    @Test
    void regionCrossingTheBoundaryShrinksByItsDeletedRows() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = numberedRows(workbook, 16);
            sheet.addMergedRegion(new CellRangeAddress(8, 12, 0, 0));

            SheetRowCompactor.compact(sheet, 11, List.of(12));

            assertThat(sheet.getMergedRegions()).containsExactly(new CellRangeAddress(8, 11, 0, 0));
        }
    }

    @Test
    void regionsInsideTheRebuiltAreaShrinkOrMoveUp() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = numberedRows(workbook, 18);
            sheet.addMergedRegion(new CellRangeAddress(11, 13, 2, 2));
            sheet.addMergedRegion(new CellRangeAddress(15, 16, 3, 4));

            SheetRowCompactor.compact(sheet, 11, List.of(13));

            assertThat(sheet.getMergedRegions()).containsExactlyInAnyOrder(
                    new CellRangeAddress(11, 12, 2, 2),
                    new CellRangeAddress(14, 15, 3, 4));
            CellGridReader grid = CellGridReader.of(sheet);
            assertThat(grid.read(13, 2)).isEqualTo("b14");
            assertThat(grid.read(13, 3)).isEqualTo("c12");
        }
    }

    @Test
    void regionReducedToOneCellIsDropped() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = numberedRows(workbook, 14);
            sheet.addMergedRegion(new CellRangeAddress(11, 12, 0, 0));

            SheetRowCompactor.compact(sheet, 11, List.of(13));

            assertThat(sheet.getMergedRegions()).isEmpty();
        }
    }

    private static Sheet numberedRows(XSSFWorkbook workbook, int rows) {
        Sheet sheet = workbook.createSheet("Output");
        for (int r = 1; r <= rows; r++) {
            SheetFixtures.set(sheet, "B" + r, "b" + r);
        }
        SheetFixtures.set(sheet, "C12", "c12");
        return sheet;
    }
}
