package com.example.tssconverter.config;

import com.example.tssconverter.service.grid.ColumnLetters;

import java.util.List;

public record TemplateLayout(
        String sheetName,
        int headerRow,
        int dataStartRow,
        int articleNameFirstRow,
        int articleNameLastRow,
        int articleNumberRow,
        String articleStartColumn,
        String articleNameFill,
        String labelFill,
        List<TemplateLabel> labels,
        List<TemplateHeader> headers
) {
    public TemplateLayout {
        labels = labels == null ? List.of() : List.copyOf(labels);
        headers = headers == null ? List.of() : List.copyOf(headers);
    }

    public int articleStartColumnIndex() {
        return ColumnLetters.toIndex(articleStartColumn);
    }
}
