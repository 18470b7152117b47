package com.example.tssconverter.config;

import com.example.tssconverter.service.grid.ColumnLetters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SheetTypeMapping(
        String anchorMarker,
        int dataOffset,
        Map<String, String> literals,
        Map<String, String> columns,
        List<String> fillColumns
) {
    public SheetTypeMapping {
        literals = literals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(literals));
        columns = columns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        fillColumns = fillColumns == null ? List.of() : List.copyOf(fillColumns);
    }

    public List<ColumnMapping> columnMappings() {
        List<ColumnMapping> mappings = new ArrayList<>();
        columns.forEach((source, destination) -> mappings.add(ColumnMapping.parse(source, destination)));
        return mappings;
    }

    public Map<Integer, String> literalColumns() {
        Map<Integer, String> resolved = new LinkedHashMap<>();
        literals.forEach((column, value) -> resolved.put(ColumnLetters.toIndex(column), value));
        return resolved;
    }

    public List<Integer> fillColumnIndexes() {
        return ColumnLetters.toIndexes(fillColumns);
    }
}
