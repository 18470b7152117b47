package com.example.tssconverter.service.grid;

public record CellReadResult(String text, ReadErrorKind error) {

    private static final CellReadResult EMPTY = new CellReadResult("", null);

    public static CellReadResult ok(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        return new CellReadResult(text, null);
    }

    public static CellReadResult failed(ReadErrorKind error) {
        return new CellReadResult("", error);
    }

    public boolean isOk() {
        return error == null;
    }

    public String textOrEmpty() {
        return isOk() ? text : "";
    }
}
