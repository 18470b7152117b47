package com.example.tssconverter.service.mapping;

public record SheetMappingResult(int rowsMapped, int nextRow) {
}
