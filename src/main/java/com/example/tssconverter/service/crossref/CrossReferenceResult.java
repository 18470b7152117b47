package com.example.tssconverter.service.crossref;

public record CrossReferenceResult(
        int headersIndexed,
        int rowsProcessed,
        int marksWritten,
        int unmatchedArticles,
        int listCellsCleared
) {
}
