package com.example.tssconverter.service.sheet;

import java.util.Locale;

/**
 * Derives a {@link SheetType} from a worksheet name. Prefixes are checked in the order
 * {@code F-}, {@code M-}, {@code C-}, {@code P}, ignoring case.
 */
public final class SheetClassifier {

    private SheetClassifier() {
    }

    public static SheetType classify(String sheetName) {
        if (sheetName == null) {
            return SheetType.UNCLASSIFIED;
        }
        String name = sheetName.trim().toUpperCase(Locale.ROOT);
        if (name.startsWith("F-")) {
            return SheetType.F;
        }
        if (name.startsWith("M-")) {
            return SheetType.M;
        }
        if (name.startsWith("C-")) {
            return SheetType.C;
        }
        if (name.startsWith("P")) {
            return SheetType.P;
        }
        return SheetType.UNCLASSIFIED;
    }
}
