package com.example.tssconverter.config;

import java.nio.file.Path;
import java.util.List;

public record TssConverterSettings(
        Path outputDir,
        boolean fallbackEnabled,
        int headerSearchMaxRows,
        int headerSearchMaxColumns,
        int mappingHeaderSearchRows,
        int extractionMaxRows,
        List<String> postFillColumns
) {
    public TssConverterSettings {
        postFillColumns = postFillColumns == null ? List.of() : List.copyOf(postFillColumns);
    }

    public static TssConverterSettings defaults() {
        return new TssConverterSettings(Path.of("output"), true, 100, 50, 50, 1000, List.of());
    }

    public TssConverterSettings withFallback(boolean enabled) {
        return new TssConverterSettings(outputDir, enabled, headerSearchMaxRows, headerSearchMaxColumns,
                mappingHeaderSearchRows, extractionMaxRows, postFillColumns);
    }

    public TssConverterSettings withOutputDir(Path directory) {
        return new TssConverterSettings(directory, fallbackEnabled, headerSearchMaxRows, headerSearchMaxColumns,
                mappingHeaderSearchRows, extractionMaxRows, postFillColumns);
    }

    public TssConverterSettings withPostFillColumns(List<String> columns) {
        return new TssConverterSettings(outputDir, fallbackEnabled, headerSearchMaxRows, headerSearchMaxColumns,
                mappingHeaderSearchRows, extractionMaxRows, columns);
    }
}
