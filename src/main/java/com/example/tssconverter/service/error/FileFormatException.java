package com.example.tssconverter.service.error;

import java.nio.file.Path;

public class FileFormatException extends TssValidationException {

    public static final String CODE = "FILE_FORMAT_ERROR";

    public FileFormatException(Path file, String expected, String actual) {
        super(CODE, describe(file, expected, actual));
    }

    public FileFormatException(Path file, String expected, String actual, Throwable cause) {
        super(CODE, describe(file, expected, actual), cause);
    }

    private static String describe(Path file, String expected, String actual) {
        String message = "Invalid file format for '" + file + "'. Expected: " + expected;
        if (actual != null && !actual.isBlank()) {
            message += ", got: " + actual;
        }
        return message;
    }
}
