package com.example.tssconverter.config;

public record TemplateLabel(
        String cell,
        String text
) {
}
