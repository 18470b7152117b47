package com.example.tssconverter.service.sheet;

public enum SheetType {
    F,
    M,
    C,
    P,
    UNCLASSIFIED;

    public boolean isClassified() {
        return this != UNCLASSIFIED;
    }
}
