package com.example.tssconverter.service.extract;

import com.example.tssconverter.service.SheetFixtures;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellPosition;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VerticalListExtractorTest {

    private final VerticalListExtractor extractor = new VerticalListExtractor();
    private XSSFWorkbook workbook;

    @BeforeEach
    void setUp() {
        workbook = new XSSFWorkbook();
    }

    @AfterEach
    void tearDown() throws Exception {
        workbook.close();
    }

    @Test
    void numberedMultiLineCellSplitsIntoCleanItems() {
        Sheet sheet = SheetFixtures.sheet(workbook, "M-Textile", new String[][]{
                {"Article name"},
                {"1.Item A;\n2. Item B;"}
        });

        assertThat(extractor.extract(CellGridReader.of(sheet), 1, 1)).containsExactly("Item A", "Item B");
    }

    @Test
    void stopsAtFirstEmptyCellAndTreatsFormulaErrorsAsEmpty() {
        Sheet sheet = SheetFixtures.sheet(workbook, "M-Textile", new String[][]{
                {"Article name"},
                {"Shirt"},
                {"Jacket"},
                {"#REF!"},
                {"Never read"}
        });

        assertThat(extractor.extract(CellGridReader.of(sheet), new CellPosition(1, 1)))
                .containsExactly("Shirt", "Jacket");
    }

    @Test
    void hiddenRowsAreSkippedNotTerminating() {
        Sheet sheet = SheetFixtures.sheet(workbook, "M-Textile", new String[][]{
                {"Article name"},
                {"Shirt"},
                {"Hidden"},
                {"Jacket"}
        });
        sheet.getRow(2).setZeroHeight(true);

        assertThat(extractor.extract(CellGridReader.of(sheet), 1, 1)).containsExactly("Shirt", "Jacket");
    }

    @Test
    void safetyBoundLimitsRowsRead() {
        String[][] rows = new String[30][1];
        rows[0][0] = "Article name";
        for (int i = 1; i < rows.length; i++) {
            rows[i][0] = "Item " + i;
        }
        Sheet sheet = SheetFixtures.sheet(workbook, "M-Textile", rows);

        assertThat(new VerticalListExtractor(5).extract(CellGridReader.of(sheet), 1, 1)).hasSize(5);
    }

    @Test
    void delimitersAreTriedInPriorityOrder() {
        assertThat(VerticalListExtractor.splitMultiValue("a, b\nc, d")).containsExactly("a, b", "c, d");
        assertThat(VerticalListExtractor.splitMultiValue("a;b,c")).containsExactly("a", "b,c");
        assertThat(VerticalListExtractor.splitMultiValue("a,b")).containsExactly("a", "b");
        assertThat(VerticalListExtractor.splitMultiValue("only one;")).containsExactly("only one");
        assertThat(VerticalListExtractor.splitMultiValue("   ")).isEmpty();
    }

    @Test
    void decimalsAreNotMistakenForListNumbers() {
        assertThat(VerticalListExtractor.splitMultiValue("1.5 mm thread")).containsExactly("1.5 mm thread");
        assertThat(VerticalListExtractor.splitMultiValue("12. Zipper")).containsExactly("Zipper");
        assertThat(VerticalListExtractor.cleanValue(" value;, ")).isEqualTo("value");
    }

    @Test
    void numbersArePairedByPositionWithHeaderFallback() {
        Sheet sheet = SheetFixtures.sheet(workbook, "M-Textile", new String[][]{
                {"Article name", "Article number", "", "Article number"},
                {"Shirt", "100", "", "900"},
                {"Jacket", "200", "", "901"}
        });
        CellGridReader grid = CellGridReader.of(sheet);
        List<CellPosition> names = List.of(new CellPosition(1, 1));
        List<CellPosition> numberHeaders = List.of(new CellPosition(1, 4));

        assertThat(extractor.extractNumbers(grid, names, numberHeaders)).containsExactly("100", "200");

        sheet.getRow(1).getCell(1).setBlank();
        assertThat(extractor.extractNumbers(grid, names, numberHeaders)).containsExactly("900", "901");
    }

    @Test
    void pairsAreDedupedInFirstSeenOrderWithPadding() {
        List<ArticlePair> pairs = VerticalListExtractor.dedupePairs(
                List.of("Shirt", "Jacket", "Shirt", "Shirt", "Cap"),
                List.of("100", "200", "100", "101"));

        assertThat(pairs).containsExactly(
                new ArticlePair("Shirt", "100"),
                new ArticlePair("Jacket", "200"),
                new ArticlePair("Shirt", "101"),
                new ArticlePair("Cap", ""));
    }
}
