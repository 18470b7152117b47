package com.example.tssconverter.service.error;

public class ConfigurationException extends TssConverterException {

    public static final String CODE = "CONFIGURATION_ERROR";

    public ConfigurationException(String key, String issue) {
        super(CODE, "Configuration error for '" + key + "': " + issue);
    }

    public ConfigurationException(String key, String issue, Throwable cause) {
        super(CODE, "Configuration error for '" + key + "': " + issue, cause);
    }
}
