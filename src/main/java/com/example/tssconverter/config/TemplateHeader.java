package com.example.tssconverter.config;

public record TemplateHeader(
        String name,
        String background,
        String font,
        int width
) {
}
