package com.example.tssconverter.service.grid;

import org.apache.poi.ss.util.CellReference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class ColumnLetters {

    private static final Pattern LETTERS = Pattern.compile("^[A-Za-z]{1,3}$");

    private ColumnLetters() {
    }

    public static int toIndex(String letters) {
        if (letters == null || !LETTERS.matcher(letters.trim()).matches()) {
            throw new IllegalArgumentException("Not a column reference: '" + letters + "'");
        }
        return CellReference.convertColStringToIndex(letters.trim().toUpperCase(Locale.ROOT)) + 1;
    }

    public static List<Integer> toIndexes(Collection<String> letters) {
        List<Integer> indexes = new ArrayList<>();
        if (letters == null) {
            return indexes;
        }
        for (String letter : letters) {
            indexes.add(toIndex(letter));
        }
        return indexes;
    }

    public static String toLetters(int column) {
        if (column < 1) {
            throw new IllegalArgumentException("Column index is 1-based: " + column);
        }
        return CellReference.convertNumToColString(column - 1);
    }

    public static boolean isValid(String letters) {
        return letters != null && LETTERS.matcher(letters.trim()).matches();
    }
}
