package com.example.tssconverter.service.dedup;

import java.util.List;

public record RowGroupKey(List<String> values) {

    public RowGroupKey {
        values = values.stream().map(value -> value == null ? "" : value.trim()).toList();
    }

    public boolean isBlank() {
        return values.stream().allMatch(String::isEmpty);
    }
}
