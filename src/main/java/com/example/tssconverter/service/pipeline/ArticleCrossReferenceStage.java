package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.config.CrossReferenceRules;
import com.example.tssconverter.config.TemplateLayout;
import com.example.tssconverter.config.TssConverterSettings;
import com.example.tssconverter.config.TssMappingConfig;
import com.example.tssconverter.service.crossref.CrossReferenceResult;
import com.example.tssconverter.service.crossref.CrossReferencer;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.ColumnLetters;
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
 * Step 6: marks article columns from the per-row article lists and produces the final file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleCrossReferenceStage {

    static final String STEP = "step6";

    private final TssConverterSettings settings;
    private final TssMappingConfig mappingConfig;
    private final CrossReferencer crossReferencer;

    public Path process(Path input, QualityReport report) {
        return process(input, null, report);
    }

    public Path process(Path input, Path output, QualityReport report) {
        Path target = output != null ? output : StageOutputs.finalOutput(input, settings.outputDir());
        log.info("Step 6: cross-referencing articles in {}", input);
        TemplateLayout layout = mappingConfig.template();
        CrossReferenceRules rules = mappingConfig.crossReference();

        try (Workbook workbook = WorkbookFiles.open(input)) {
            Sheet sheet = TemplateSheets.outputSheet(workbook, layout);
            CellGridReader grid = new CellGridReader(sheet, report, STEP);
            CrossReferenceResult result = crossReferencer.crossReference(grid,
                    ColumnLetters.toIndex(rules.listColumn()),
                    rules.headerRow(),
                    ColumnLetters.toIndex(rules.headerColumnStart()),
                    layout.dataStartRow());

            if (result.headersIndexed() == 0) {
                report.warn(STEP, QualityReport.MISSING_HEADERS,
                        "No article headers in row " + rules.headerRow() + " from column " + rules.headerColumnStart());
            }
            if (result.unmatchedArticles() > 0) {
                report.info(STEP, "unmatched_articles",
                        result.unmatchedArticles() + " listed articles matched no article header");
            }
            report.recordStatistic("rows_cross_referenced", result.rowsProcessed());
            report.recordStatistic("marks_written", result.marksWritten());
            WorkbookFiles.save(workbook, target);
            log.info("Step 6 completed: {} ({} marks in {} rows)", target, result.marksWritten(), result.rowsProcessed());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Workbook could not be closed: " + e.getMessage(), e);
        }
    }
}
