package com.example.tssconverter.service.error;

/**
 * Base type for every failure raised by the conversion stages.
 */
public class TssConverterException extends RuntimeException {

    private final String errorCode;

    public TssConverterException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TssConverterException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return "[" + errorCode + "] " + getMessage();
    }
}
