package com.example.tssconverter.service.crossref;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalized article header text to the columns carrying it, in column order.
 */
public class ArticleHeaderIndex {

    private final Map<String, List<Integer>> columnsByName = new LinkedHashMap<>();

    void add(String normalizedName, int column) {
        columnsByName.computeIfAbsent(normalizedName, name -> new ArrayList<>()).add(column);
    }

    public boolean isEmpty() {
        return columnsByName.isEmpty();
    }

    public int size() {
        return columnsByName.values().stream().mapToInt(List::size).sum();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(columnsByName.keySet());
    }

    /**
     * Exact match first. Otherwise every header that contains the name or is contained in it.
     */
    public List<Integer> match(String normalizedName) {
        if (normalizedName == null || normalizedName.isEmpty()) {
            return List.of();
        }
        List<Integer> exact = columnsByName.get(normalizedName);
        if (exact != null) {
            return List.copyOf(exact);
        }
        Set<Integer> partial = new LinkedHashSet<>();
        for (Map.Entry<String, List<Integer>> entry : columnsByName.entrySet()) {
            String header = entry.getKey();
            if (header.contains(normalizedName) || normalizedName.contains(header)) {
                partial.addAll(entry.getValue());
            }
        }
        return new ArrayList<>(partial);
    }
}
