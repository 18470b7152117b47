package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.config.SheetTypeMapping;
import com.example.tssconverter.config.TssConverterSettings;
import com.example.tssconverter.config.TssMappingConfig;
import com.example.tssconverter.service.fill.FillForwardFiller;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellPosition;
import com.example.tssconverter.service.grid.WorkbookFiles;
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
 * Step 3: a copy of the raw workbook with the grouping columns of M, C and P sheets filled forward.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreMappingFillStage {

    static final String STEP = "step3";

    private final TssConverterSettings settings;
    private final TssMappingConfig mappingConfig;
    private final HeaderLocator headerLocator;
    private final FillForwardFiller filler;

    public Path process(Path rawInput, QualityReport report) {
        return process(rawInput, null, report);
    }

    public Path process(Path rawInput, Path output, QualityReport report) {
        Path target = StageOutputs.resolve(rawInput, output, settings.outputDir(), 3);
        log.info("Step 3: pre-mapping fill of {}", rawInput);
        int filled = 0;
        try (Workbook workbook = WorkbookFiles.open(rawInput)) {
            for (Sheet sheet : workbook) {
                SheetType type = SheetClassifier.classify(sheet.getSheetName());
                filled += switch (type) {
                    case M, C, P -> fillSheet(new CellGridReader(sheet, report, STEP), type);
                    case F, UNCLASSIFIED -> 0;
                };
            }
            report.recordStatistic("cells_prefilled", filled);
            WorkbookFiles.save(workbook, target);
        } catch (IOException e) {
            throw new IllegalStateException("Workbook could not be closed: " + e.getMessage(), e);
        }
        log.info("Step 3 completed: {} ({} cells filled)", target, filled);
        return target;
    }

    private int fillSheet(CellGridReader grid, SheetType type) {
        Optional<SheetTypeMapping> mapping = mappingConfig.mappingFor(type);
        if (mapping.isEmpty() || mapping.get().fillColumns().isEmpty()) {
            return 0;
        }
        SearchWindow window = SearchWindow.of(settings.mappingHeaderSearchRows(), settings.headerSearchMaxColumns());
        Optional<CellPosition> anchor = headerLocator.find(grid, mapping.get().anchorMarker(), window, SearchDirection.DOWN);
        if (anchor.isEmpty()) {
            grid.report().warn(STEP, QualityReport.MISSING_HEADERS,
                    "No '" + mapping.get().anchorMarker() + "' header in '" + grid.sheetName() + "', sheet not filled",
                    Map.of("sheet", grid.sheetName()));
            return 0;
        }
        int startRow = anchor.get().row() + mapping.get().dataOffset();
        int endRow = filler.findEndRow(grid, startRow);
        if (endRow < startRow) {
            return 0;
        }
        int filled = filler.fill(grid, mapping.get().fillColumnIndexes(), startRow, endRow);
        log.info("Sheet '{}' ({}): filled {} cells in {} rows {}..{}", grid.sheetName(), type, filled,
                mapping.get().fillColumns(), startRow, endRow);
        return filled;
    }
}
