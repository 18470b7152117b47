package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.config.ExtractionRules;
import com.example.tssconverter.config.TemplateLayout;
import com.example.tssconverter.config.TssConverterSettings;
import com.example.tssconverter.config.TssMappingConfig;
import com.example.tssconverter.service.error.TssValidationException;
import com.example.tssconverter.service.extract.ArticlePair;
import com.example.tssconverter.service.extract.VerticalListExtractor;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellPosition;
import com.example.tssconverter.service.grid.CellWriter;
import com.example.tssconverter.service.grid.ColumnLetters;
import com.example.tssconverter.service.grid.WorkbookFiles;
import com.example.tssconverter.service.quality.QualityReport;
import com.example.tssconverter.service.sheet.HeaderLocator;
import com.example.tssconverter.service.sheet.SearchDirection;
import com.example.tssconverter.service.sheet.SearchWindow;
import com.example.tssconverter.service.sheet.SheetClassifier;
import com.example.tssconverter.service.sheet.SheetType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Step 2: collects article names and numbers from the textile material sheets and writes them
 * into the article band of the template.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleExtractionStage {

    static final String STEP = "step2";

    private final TssConverterSettings settings;
    private final TssMappingConfig mappingConfig;
    private final HeaderLocator headerLocator;
    private final VerticalListExtractor extractor;

    public Path process(Path templateFile, Path rawInput, QualityReport report) {
        return process(templateFile, rawInput, null, report);
    }

    public Path process(Path templateFile, Path rawInput, Path output, QualityReport report) {
        Path target = StageOutputs.resolve(rawInput, output, settings.outputDir(), 2);
        log.info("Step 2: extracting articles from {} into {}", rawInput, templateFile);
        TemplateLayout layout = mappingConfig.template();

        try (Workbook template = WorkbookFiles.open(templateFile);
             Workbook raw = WorkbookFiles.open(rawInput)) {
            Sheet outputSheet = TemplateSheets.outputSheet(template, layout);
            TemplateSheets.checkTemplate(outputSheet, layout, settings.fallbackEnabled(), report, STEP);

            List<String> names = new ArrayList<>();
            List<String> numbers = new ArrayList<>();
            List<Sheet> sources = textileSheets(raw);
            if (sources.isEmpty()) {
                report.warn(STEP, QualityReport.MISSING_HEADERS,
                        "No material sheet with '" + mappingConfig.extraction().sheetKeyword() + "' in its name");
            }
            for (Sheet sheet : sources) {
                extractFrom(new CellGridReader(sheet, report, STEP), names, numbers);
            }

            List<ArticlePair> pairs = VerticalListExtractor.dedupePairs(names, numbers);
            if (pairs.isEmpty()) {
                handleEmptyExtraction(report);
            } else {
                populate(template, outputSheet, layout, pairs);
            }
            report.recordStatistic("articles_extracted", pairs.size());
            WorkbookFiles.save(template, target);
            log.info("Step 2 completed: {} ({} unique articles)", target, pairs.size());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Workbook could not be closed: " + e.getMessage(), e);
        }
    }

    List<Sheet> textileSheets(Workbook workbook) {
        String keyword = mappingConfig.extraction().sheetKeyword().toLowerCase(Locale.ROOT);
        List<Sheet> sheets = new ArrayList<>();
        for (Sheet sheet : workbook) {
            SheetType type = SheetClassifier.classify(sheet.getSheetName());
            boolean matches = switch (type) {
                case M -> sheet.getSheetName().toLowerCase(Locale.ROOT).contains(keyword);
                case F, C, P, UNCLASSIFIED -> false;
            };
            if (matches) {
                log.info("Extraction source sheet: {}", sheet.getSheetName());
                sheets.add(sheet);
            }
        }
        return sheets;
    }

    private void extractFrom(CellGridReader grid, List<String> names, List<String> numbers) {
        ExtractionRules rules = mappingConfig.extraction();
        SearchWindow window = SearchWindow.of(settings.headerSearchMaxRows(), settings.headerSearchMaxColumns());
        Optional<CellPosition> anchor = headerLocator.find(grid, rules.anchorMarkers(), window, SearchDirection.DOWN);
        if (anchor.isEmpty()) {
            grid.report().warn(STEP, QualityReport.MISSING_HEADERS,
                    "No product combination/information header in '" + grid.sheetName() + "'",
                    Map.of("sheet", grid.sheetName()));
            return;
        }

        SearchWindow above = SearchWindow.above(anchor.get().row(), settings.headerSearchMaxColumns());
        List<CellPosition> nameHeaders = headerLocator.findAll(grid, rules.nameHeaders(), above, SearchDirection.UP);
        if (nameHeaders.isEmpty()) {
            grid.report().warn(STEP, QualityReport.MISSING_HEADERS,
                    "No article name header above " + anchor.get() + " in '" + grid.sheetName() + "'",
                    Map.of("sheet", grid.sheetName(), "anchor", anchor.get().toString()));
            return;
        }
        List<CellPosition> numberHeaders = headerLocator.findAll(grid, rules.numberHeaders(), above, SearchDirection.UP);

        List<String> sheetNames = new ArrayList<>();
        for (CellPosition header : nameHeaders) {
            sheetNames.addAll(extractor.extract(grid, header));
        }
        List<String> sheetNumbers = extractor.extractNumbers(grid, nameHeaders, numberHeaders);
        log.info("Sheet '{}': {} article names, {} article numbers", grid.sheetName(),
                sheetNames.size(), sheetNumbers.size());
        names.addAll(sheetNames);
        numbers.addAll(sheetNumbers);
    }

    private void handleEmptyExtraction(QualityReport report) {
        if (!settings.fallbackEnabled()) {
            throw new TssValidationException("EMPTY_EXTRACTION", "No article names or numbers could be extracted");
        }
        report.warn(STEP, QualityReport.EMPTY_EXTRACTION, "No articles extracted; article band left empty");
        report.info(STEP, QualityReport.FALLBACK_APPLIED, "Continuing with an empty article band");
    }

    private void populate(Workbook workbook, Sheet sheet, TemplateLayout layout, List<ArticlePair> pairs) {
        CellStyle nameStyle = articleStyle(workbook, layout, true);
        CellStyle numberStyle = articleStyle(workbook, layout, false);
        int column = layout.articleStartColumnIndex();
        for (ArticlePair pair : pairs) {
            if (!pair.name().isEmpty()) {
                if (layout.articleNameLastRow() > layout.articleNameFirstRow()) {
                    sheet.addMergedRegion(new CellRangeAddress(layout.articleNameFirstRow() - 1,
                            layout.articleNameLastRow() - 1, column - 1, column - 1));
                }
                Cell cell = CellWriter.write(sheet, layout.articleNameFirstRow(), column, pair.name());
                cell.setCellStyle(nameStyle);
            }
            if (!pair.number().isEmpty()) {
                Cell cell = CellWriter.write(sheet, layout.articleNumberRow(), column, pair.number());
                cell.setCellStyle(numberStyle);
            }
            log.debug("Article {} -> {}", pair, ColumnLetters.toLetters(column));
            column++;
        }
    }

    private CellStyle articleStyle(Workbook workbook, TemplateLayout layout, boolean rotated) {
        XSSFCellStyle style = (XSSFCellStyle) workbook.createCellStyle();
        style.setFillForegroundColor(TemplateCreationStage.color(layout.articleNameFill()));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        if (rotated) {
            style.setRotation((short) 90);
            style.setWrapText(true);
        }
        return style;
    }
}
