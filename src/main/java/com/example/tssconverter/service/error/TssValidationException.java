package com.example.tssconverter.service.error;

public class TssValidationException extends TssConverterException {

    public TssValidationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public TssValidationException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
