package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.config.TemplateHeader;
import com.example.tssconverter.config.TemplateLabel;
import com.example.tssconverter.config.TemplateLayout;
import com.example.tssconverter.config.TssConverterSettings;
import com.example.tssconverter.config.TssMappingConfig;
import com.example.tssconverter.service.error.TssValidationException;
import com.example.tssconverter.service.error.WorksheetStructureException;
import com.example.tssconverter.service.grid.CellWriter;
import com.example.tssconverter.service.grid.WorkbookFiles;
import com.example.tssconverter.service.quality.QualityReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Step 1: checks the raw upload and writes the empty, styled output template.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateCreationStage {

    static final String STEP = "step1";

    private final TssConverterSettings settings;
    private final TssMappingConfig mappingConfig;

    public Path process(Path rawInput, QualityReport report) {
        return process(rawInput, null, report);
    }

    public Path process(Path rawInput, Path output, QualityReport report) {
        Path target = StageOutputs.resolve(rawInput, output, settings.outputDir(), 1);
        log.info("Step 1: creating output template for {}", rawInput);
        validateInput(rawInput, report);

        TemplateLayout layout = mappingConfig.template();
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(layout.sheetName());
            writeLabels(workbook, sheet, layout);
            writeHeaders(workbook, sheet, layout);
            TemplateSheets.checkTemplate(sheet, layout, settings.fallbackEnabled(), report, STEP);
            WorkbookFiles.save(workbook, target);
        } catch (IOException e) {
            throw new IllegalStateException("Template workbook could not be closed: " + e.getMessage(), e);
        }
        log.info("Step 1 completed: {} ({} headers)", target, layout.headers().size());
        return target;
    }

    private void validateInput(Path rawInput, QualityReport report) {
        try (Workbook raw = WorkbookFiles.open(rawInput)) {
            if (raw.getNumberOfSheets() == 0) {
                throw new WorksheetStructureException("Workbook '" + rawInput.getFileName() + "' has no worksheets");
            }
            report.recordStatistic("input_sheets", raw.getNumberOfSheets());
        } catch (TssValidationException e) {
            report.error(STEP, QualityReport.FILE_VALIDATION_FAILED, e.getMessage());
            throw e;
        } catch (IOException e) {
            throw new IllegalStateException("Input workbook could not be closed: " + e.getMessage(), e);
        }
    }

    private void writeLabels(XSSFWorkbook workbook, Sheet sheet, TemplateLayout layout) {
        XSSFCellStyle style = workbook.createCellStyle();
        XSSFFont font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setFillForegroundColor(color(layout.labelFill()));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);

        for (TemplateLabel label : layout.labels()) {
            CellReference reference = new CellReference(label.cell().toUpperCase(Locale.ROOT));
            Cell cell = CellWriter.write(sheet, reference.getRow() + 1, reference.getCol() + 1, label.text());
            cell.setCellStyle(style);
        }
    }

    private void writeHeaders(XSSFWorkbook workbook, Sheet sheet, TemplateLayout layout) {
        int column = 1;
        for (TemplateHeader header : layout.headers()) {
            XSSFCellStyle style = workbook.createCellStyle();
            XSSFFont font = workbook.createFont();
            font.setBold(true);
            font.setColor(color(header.font()));
            style.setFont(font);
            style.setFillForegroundColor(color(header.background()));
            style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            style.setAlignment(HorizontalAlignment.CENTER);
            style.setVerticalAlignment(VerticalAlignment.CENTER);
            style.setWrapText(true);

            Cell cell = CellWriter.write(sheet, layout.headerRow(), column, header.name());
            cell.setCellStyle(style);
            sheet.setColumnWidth(column - 1, header.width() * 256);
            column++;
        }
    }

    static XSSFColor color(String argb) {
        return new XSSFColor(HexFormat.of().parseHex(argb), null);
    }
}
