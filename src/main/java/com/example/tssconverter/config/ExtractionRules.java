package com.example.tssconverter.config;

import java.util.List;

public record ExtractionRules(
        String sheetKeyword,
        List<String> anchorMarkers,
        List<String> nameHeaders,
        List<String> numberHeaders
) {
    public ExtractionRules {
        anchorMarkers = anchorMarkers == null ? List.of() : List.copyOf(anchorMarkers);
        nameHeaders = nameHeaders == null ? List.of() : List.copyOf(nameHeaders);
        numberHeaders = numberHeaders == null ? List.of() : List.copyOf(numberHeaders);
    }
}
