package com.example.tssconverter.config;

public record CrossReferenceRules(
        String listColumn,
        int headerRow,
        String headerColumnStart,
        String marker,
        int emptyHeaderStop
) {
}
