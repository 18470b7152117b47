package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.config.TemplateLayout;
import com.example.tssconverter.config.TssConverterSettings;
import com.example.tssconverter.config.TssMappingConfig;
import com.example.tssconverter.service.dedup.DedupOutcome;
import com.example.tssconverter.service.dedup.DuplicateGrouper;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.WorkbookFiles;
import com.example.tssconverter.service.quality.QualityReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Step 5: drops rows without a document type and collapses duplicate SD rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FilterDeduplicateStage {

    static final String STEP = "step5";

    private final TssConverterSettings settings;
    private final TssMappingConfig mappingConfig;
    private final DuplicateGrouper grouper;

    public Path process(Path input, QualityReport report) {
        return process(input, null, report);
    }

    public Path process(Path input, Path output, QualityReport report) {
        Path target = StageOutputs.resolve(input, output, settings.outputDir(), 5);
        log.info("Step 5: filtering and deduplicating {}", input);
        TemplateLayout layout = mappingConfig.template();

        try (Workbook workbook = WorkbookFiles.open(input)) {
            Sheet sheet = TemplateSheets.outputSheet(workbook, layout);
            CellGridReader grid = new CellGridReader(sheet, report, STEP);
            int firstRow = layout.dataStartRow();

            int removed = grouper.removeRows(grid, firstRow);
            DedupOutcome outcome = grouper.dedupe(grid, firstRow);
            int remaining = countDataRows(grid, firstRow);

            report.recordStatistic("rows_removed", removed);
            report.recordStatistic("duplicate_groups", outcome.groupsCollapsed());
            report.recordStatistic("duplicates_removed", outcome.rowsRemoved());
            report.recordStatistic("final_data_rows", remaining);
            WorkbookFiles.save(workbook, target);
            log.info("Step 5 completed: {} ({} filtered, {} duplicates removed, {} rows left)",
                    target, removed, outcome.rowsRemoved(), remaining);
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Workbook could not be closed: " + e.getMessage(), e);
        }
    }

    static int countDataRows(CellGridReader grid, int firstRow) {
        int maxColumn = grid.lastColumn();
        int count = 0;
        for (int r = firstRow; r <= grid.lastRow(); r++) {
            if (grid.rowHasData(r, maxColumn)) {
                count++;
            }
        }
        return count;
    }
}
