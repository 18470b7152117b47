package com.example.tssconverter.service.error;

public class WorksheetStructureException extends TssValidationException {

    public static final String CODE = "WORKSHEET_STRUCTURE_ERROR";

    public WorksheetStructureException(String message) {
        super(CODE, message);
    }
}
