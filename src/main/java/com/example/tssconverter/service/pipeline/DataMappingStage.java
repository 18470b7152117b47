package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.config.SheetTypeMapping;
import com.example.tssconverter.config.TemplateLayout;
import com.example.tssconverter.config.TssConverterSettings;
import com.example.tssconverter.config.TssMappingConfig;
import com.example.tssconverter.service.error.TssValidationException;
import com.example.tssconverter.service.fill.FillForwardFiller;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellPosition;
import com.example.tssconverter.service.grid.ColumnLetters;
import com.example.tssconverter.service.grid.WorkbookFiles;
import com.example.tssconverter.service.mapping.ColumnRemapper;
import com.example.tssconverter.service.mapping.SheetMappingResult;
import com.example.tssconverter.service.quality.QualityReport;
import com.example.tssconverter.service.sheet.HeaderLocator;
import com.example.tssconverter.service.sheet.SearchDirection;
import com.example.tssconverter.service.sheet.SearchWindow;
import com.example.tssconverter.service.sheet.SheetClassifier;
import com.example.tssconverter.service.sheet.SheetType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Step 4: maps the data rows of every classified source sheet into the template's data area.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataMappingStage {

    static final String STEP = "step4";

    private final TssConverterSettings settings;
    private final TssMappingConfig mappingConfig;
    private final HeaderLocator headerLocator;
    private final ColumnRemapper remapper;
    private final FillForwardFiller filler;

    public Path process(Path prefilledInput, Path templateFile, QualityReport report) {
        return process(prefilledInput, templateFile, null, report);
    }

    public Path process(Path prefilledInput, Path templateFile, Path output, QualityReport report) {
        Path target = StageOutputs.resolve(prefilledInput, output, settings.outputDir(), 4);
        log.info("Step 4: mapping {} into {}", prefilledInput, templateFile);
        TemplateLayout layout = mappingConfig.template();

        try (Workbook source = WorkbookFiles.open(prefilledInput);
             Workbook template = WorkbookFiles.open(templateFile)) {
            Sheet outputSheet = TemplateSheets.outputSheet(template, layout);
            TemplateSheets.checkTemplate(outputSheet, layout, settings.fallbackEnabled(), report, STEP);
            int nextRow = ColumnRemapper.firstFreeRow(new CellGridReader(outputSheet, report, STEP), layout.dataStartRow());
            int firstRow = nextRow;

            int mapped = 0;
            int classified = 0;
            for (Sheet sheet : source) {
                SheetType type = SheetClassifier.classify(sheet.getSheetName());
                switch (type) {
                    case F, M, C, P -> {
                        classified++;
                        SheetMappingResult result = mapSheet(new CellGridReader(sheet, report, STEP), type, outputSheet, nextRow);
                        nextRow = result.nextRow();
                        mapped += result.rowsMapped();
                    }
                    case UNCLASSIFIED -> log.debug("Skipping unclassified sheet '{}'", sheet.getSheetName());
                }
            }

            if (mapped == 0) {
                handleNothingMapped(report, classified);
            } else if (!settings.postFillColumns().isEmpty()) {
                int filled = filler.fill(new CellGridReader(outputSheet, report, STEP),
                        ColumnLetters.toIndexes(settings.postFillColumns()), firstRow, nextRow - 1);
                report.recordStatistic("cells_postfilled", filled);
            }
            report.recordStatistic("sheets_classified", classified);
            report.recordStatistic("rows_mapped", mapped);
            WorkbookFiles.save(template, target);
            log.info("Step 4 completed: {} ({} rows from {} sheets)", target, mapped, classified);
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Workbook could not be closed: " + e.getMessage(), e);
        }
    }

    private SheetMappingResult mapSheet(CellGridReader grid, SheetType type, Sheet output, int nextRow) {
        Optional<SheetTypeMapping> mapping = mappingConfig.mappingFor(type);
        if (mapping.isEmpty()) {
            log.debug("No mapping configured for {} sheet '{}'", type, grid.sheetName());
            return new SheetMappingResult(0, nextRow);
        }
        SearchWindow window = SearchWindow.of(settings.mappingHeaderSearchRows(), settings.headerSearchMaxColumns());
        Optional<CellPosition> anchor = headerLocator.find(grid, mapping.get().anchorMarker(), window, SearchDirection.DOWN);
        if (anchor.isEmpty()) {
            grid.report().warn(STEP, QualityReport.MISSING_HEADERS,
                    "No '" + mapping.get().anchorMarker() + "' header in '" + grid.sheetName() + "', sheet skipped",
                    Map.of("sheet", grid.sheetName(), "type", type.name()));
            return new SheetMappingResult(0, nextRow);
        }
        int dataStart = anchor.get().row() + mapping.get().dataOffset();
        return remapper.mapSheet(grid, type, dataStart, output, nextRow);
    }

    private void handleNothingMapped(QualityReport report, int classified) {
        String message = classified == 0
                ? "No F/M/C/P sheet found in the input"
                : "No data rows found in " + classified + " classified sheets";
        if (!settings.fallbackEnabled()) {
            throw new TssValidationException("EMPTY_EXTRACTION", message);
        }
        report.warn(STEP, QualityReport.EMPTY_EXTRACTION, message);
        report.info(STEP, QualityReport.FALLBACK_APPLIED, "Output keeps the template header without data rows");
    }
}
