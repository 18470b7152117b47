package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.service.error.TssValidationException;
import com.example.tssconverter.service.grid.WorkbookFiles;
import com.example.tssconverter.service.quality.QualityReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runs the six stages for one document, each consuming the previous stage's file.
 * <p>
 * A validation failure ends the run with a failed result; I/O failures on output propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TssPipeline {

    private final TemplateCreationStage templateCreationStage;
    private final ArticleExtractionStage articleExtractionStage;
    private final PreMappingFillStage preMappingFillStage;
    private final DataMappingStage dataMappingStage;
    private final FilterDeduplicateStage filterDeduplicateStage;
    private final ArticleCrossReferenceStage articleCrossReferenceStage;

    public PipelineResult run(Path rawInput, Path workDir) {
        return run(rawInput, workDir, new QualityReport());
    }

    public PipelineResult run(Path rawInput, Path workDir, QualityReport report) {
        log.info("Converting {} in {}", rawInput, workDir);
        int completed = 0;
        try {
            Path template = templateCreationStage.process(rawInput, WorkbookFiles.stepOutput(rawInput, workDir, 1), report);
            completed++;
            Path withArticles = articleExtractionStage.process(template, rawInput,
                    WorkbookFiles.stepOutput(rawInput, workDir, 2), report);
            completed++;
            Path prefilled = preMappingFillStage.process(rawInput, WorkbookFiles.stepOutput(rawInput, workDir, 3), report);
            completed++;
            Path mapped = dataMappingStage.process(prefilled, withArticles,
                    WorkbookFiles.stepOutput(rawInput, workDir, 4), report);
            completed++;
            Path filtered = filterDeduplicateStage.process(mapped, WorkbookFiles.stepOutput(rawInput, workDir, 5), report);
            completed++;
            Path output = articleCrossReferenceStage.process(filtered, StageOutputs.finalOutput(rawInput, workDir), report);
            completed++;

            report.recordStatistic("steps_completed", completed);
            log.info("Conversion of {} finished: {} (quality score {})", rawInput.getFileName(), output,
                    report.qualityScore());
            return PipelineResult.succeeded(output, completed, report);
        } catch (TssValidationException e) {
            report.recordStatistic("steps_completed", completed);
            report.error("step" + (completed + 1), QualityReport.PROCESSING_FAILED, e.getMessage(),
                    Map.of("errorCode", e.getErrorCode()));
            log.warn("Conversion of {} stopped at step {}: {}", rawInput.getFileName(), completed + 1, e.toString());
            return PipelineResult.failed(e.getErrorCode(), e.getMessage(), completed, report);
        }
    }
}
