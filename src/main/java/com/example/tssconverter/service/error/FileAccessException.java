package com.example.tssconverter.service.error;

import java.nio.file.Path;

/**
 * Reading or writing a file failed at the I/O level. Always fatal for the run.
 */
public class FileAccessException extends TssConverterException {

    public static final String CODE = "FILE_ACCESS_ERROR";

    public FileAccessException(Path file, String operation, Throwable cause) {
        super(CODE, "Cannot " + operation + " file '" + file + "': " + reasonOf(cause), cause);
    }

    private static String reasonOf(Throwable cause) {
        if (cause == null || cause.getMessage() == null) {
            return "unknown reason";
        }
        return cause.getMessage();
    }
}
