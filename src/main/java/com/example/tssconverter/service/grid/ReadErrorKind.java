package com.example.tssconverter.service.grid;

public enum ReadErrorKind {
    FORMULA_ERROR,
    OUT_OF_BOUNDS,
    UNREADABLE
}
