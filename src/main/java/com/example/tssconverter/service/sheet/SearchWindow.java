package com.example.tssconverter.service.sheet;

public record SearchWindow(int startRow, int maxRows, int maxColumns) {

    public SearchWindow {
        if (startRow < 1 || maxRows < 1 || maxColumns < 1) {
            throw new IllegalArgumentException("Search window must cover at least one cell");
        }
    }

    public static SearchWindow of(int maxRows, int maxColumns) {
        return new SearchWindow(1, maxRows, maxColumns);
    }

    public static SearchWindow above(int startRow, int maxColumns) {
        return new SearchWindow(startRow, startRow, maxColumns);
    }
}
