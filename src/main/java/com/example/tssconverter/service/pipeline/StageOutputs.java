package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.service.grid.WorkbookFiles;

import java.nio.file.Path;

final class StageOutputs {

    static final String FINAL_PREFIX = "Standard Internal TSS - ";

    private StageOutputs() {
    }

    static Path resolve(Path input, Path output, Path outputDir, int step) {
        return output != null ? output : WorkbookFiles.stepOutput(input, outputDir, step);
    }

    static Path finalOutput(Path input, Path outputDir) {
        return outputDir.resolve(FINAL_PREFIX + WorkbookFiles.baseName(input) + WorkbookFiles.XLSX);
    }
}
