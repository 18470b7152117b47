package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.config.TssConverterSettings;
import com.example.tssconverter.config.TssMappingConfig;
import com.example.tssconverter.service.SheetFixtures;
import com.example.tssconverter.service.fill.FillForwardFiller;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.mapping.ColumnRemapper;
import com.example.tssconverter.service.quality.QualityReport;
import com.example.tssconverter.service.sheet.HeaderLocator;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DataMappingStageTest {

    @TempDir
    Path tempDir;

    private final TssMappingConfig mapping = SheetFixtures.mapping();

    @Test
    void postFillCopiesMappedValuesDownTheConfiguredColumns() throws Exception {
        TssConverterSettings settings = TssConverterSettings.defaults()
                .withOutputDir(tempDir)
                .withPostFillColumns(List.of("D"));
        Path source = writeMaterialSheet(tempDir.resolve("materials.xlsx"));
        QualityReport report = new QualityReport();
        Path template = new TemplateCreationStage(settings, mapping).process(source, report);

        Path mapped = stage(settings).process(source, template, report);

        assertThat(report.statistics())
                .containsEntry("rows_mapped", 4)
                .containsEntry("cells_postfilled", 2);
        try (Workbook workbook = SheetFixtures.open(mapped)) {
            CellGridReader grid = CellGridReader.of(workbook.getSheet("Output Template"));
            assertThat(List.of(grid.read(11, "D"), grid.read(12, "D"), grid.read(13, "D"), grid.read(14, "D")))
                    .containsExactly("Cotton", "Cotton", "Wool", "Wool");
            assertThat(grid.read(12, "B")).isEqualTo("c2");
            assertThat(grid.read(15, "D")).isEmpty();
        }
    }

    @Test
    void withoutPostFillColumnsGapsStayEmpty() throws Exception {
        TssConverterSettings settings = TssConverterSettings.defaults().withOutputDir(tempDir);
        Path source = writeMaterialSheet(tempDir.resolve("materials.xlsx"));
        QualityReport report = new QualityReport();
        Path template = new TemplateCreationStage(settings, mapping).process(source, report);

        Path mapped = stage(settings).process(source, template, report);

        assertThat(report.statistics()).doesNotContainKey("cells_postfilled");
        try (Workbook workbook = SheetFixtures.open(mapped)) {
            CellGridReader grid = CellGridReader.of(workbook.getSheet("Output Template"));
            assertThat(grid.read(12, "D")).isEmpty();
        }
    }

    private DataMappingStage stage(TssConverterSettings settings) {
        return new DataMappingStage(settings, mapping, new HeaderLocator(), new ColumnRemapper(mapping),
                new FillForwardFiller());
    }

    // Material column J lands in output column D; only rows 1 and 3 of the block carry it.
    private static Path writeMaterialSheet(Path file) throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("M-Materials");
            SheetFixtures.set(sheet, "A1", "Product combination");
            SheetFixtures.set(sheet, "C2", "Component");
            for (int i = 1; i <= 4; i++) {
                SheetFixtures.set(sheet, "C" + (i + 2), "c" + i);
                SheetFixtures.set(sheet, "X" + (i + 2), "SD");
            }
            SheetFixtures.set(sheet, "J3", "Cotton");
            SheetFixtures.set(sheet, "J5", "Wool");
            return SheetFixtures.save(workbook, file);
        }
    }
}
