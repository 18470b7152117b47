package com.example.tssconverter.service.grid;

public record CellPosition(int row, int column) {

    public CellPosition {
        if (row < 1 || column < 1) {
            throw new IllegalArgumentException("Cell coordinates are 1-based: " + row + "," + column);
        }
    }

    public CellPosition right() {
        return new CellPosition(row, column + 1);
    }

    @Override
    public String toString() {
        return ColumnLetters.toLetters(column) + row;
    }
}
