package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.config.TemplateLayout;
import com.example.tssconverter.service.error.WorksheetStructureException;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.quality.QualityReport;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

import java.util.Locale;
import java.util.Map;

final class TemplateSheets {

    private TemplateSheets() {
    }

    static Sheet outputSheet(Workbook workbook, TemplateLayout layout) {
        Sheet sheet = workbook.getSheet(layout.sheetName());
        if (sheet != null) {
            return sheet;
        }
        if (workbook.getNumberOfSheets() == 0) {
            throw new WorksheetStructureException("Workbook contains no worksheet");
        }
        return workbook.getSheetAt(0);
    }

    static boolean hasHeaderRow(Sheet sheet, TemplateLayout layout) {
        String expected = layout.headers().get(0).name().toLowerCase(Locale.ROOT);
        String actual = CellGridReader.of(sheet).read(layout.headerRow(), 1).toLowerCase(Locale.ROOT);
        return actual.contains(expected);
    }

    static void checkTemplate(Sheet sheet, TemplateLayout layout, boolean fallbackEnabled,
                              QualityReport report, String step) {
        if (hasHeaderRow(sheet, layout)) {
            return;
        }
        String message = "Template header row " + layout.headerRow() + " of '" + sheet.getSheetName()
                + "' does not start with '" + layout.headers().get(0).name() + "'";
        if (!fallbackEnabled) {
            throw new WorksheetStructureException(message);
        }
        report.warn(step, QualityReport.VALIDATION_WARNING, message,
                Map.of("sheet", sheet.getSheetName(), "headerRow", layout.headerRow()));
    }
}
