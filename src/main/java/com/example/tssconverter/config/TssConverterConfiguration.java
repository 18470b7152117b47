package com.example.tssconverter.config;

import com.example.tssconverter.service.crossref.CrossReferencer;
import com.example.tssconverter.service.dedup.DuplicateGrouper;
import com.example.tssconverter.service.error.ConfigurationException;
import com.example.tssconverter.service.extract.VerticalListExtractor;
import com.example.tssconverter.service.fill.FillForwardFiller;
import com.example.tssconverter.service.grid.ColumnLetters;
import com.example.tssconverter.service.mapping.ColumnRemapper;
import com.example.tssconverter.service.sheet.HeaderLocator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

@Configuration
public class TssConverterConfiguration {

    @Bean
    public TssConverterSettings tssConverterSettings(
            @Value("${tss.output-dir:output}") String outputDir,
            @Value("${tss.fallback-enabled:true}") boolean fallbackEnabled,
            @Value("${tss.header-search.max-rows:100}") int headerSearchMaxRows,
            @Value("${tss.header-search.max-columns:50}") int headerSearchMaxColumns,
            @Value("${tss.mapping.header-search-rows:50}") int mappingHeaderSearchRows,
            @Value("${tss.extraction.max-rows:1000}") int extractionMaxRows,
            @Value("${tss.mapping.post-fill-columns:}") String postFillColumns) {
        if (headerSearchMaxRows < 1 || headerSearchMaxColumns < 1 || mappingHeaderSearchRows < 1) {
            throw new ConfigurationException("tss.header-search", "search windows must be at least one cell");
        }
        if (extractionMaxRows < 1) {
            throw new ConfigurationException("tss.extraction.max-rows", "must be positive");
        }
        return new TssConverterSettings(
                Path.of(outputDir),
                fallbackEnabled,
                headerSearchMaxRows,
                headerSearchMaxColumns,
                mappingHeaderSearchRows,
                extractionMaxRows,
                parseColumns(postFillColumns)
        );
    }

    @Bean
    public TssMappingConfig tssMappingConfig(@Value("${tss.mapping-resource:tss-mapping.json}") String resource) {
        return TssMappingLoader.load(resource);
    }

    @Bean
    public HeaderLocator headerLocator() {
        return new HeaderLocator();
    }

    @Bean
    public VerticalListExtractor verticalListExtractor(TssConverterSettings settings) {
        return new VerticalListExtractor(settings.extractionMaxRows());
    }

    @Bean
    public ColumnRemapper columnRemapper(TssMappingConfig mappingConfig) {
        return new ColumnRemapper(mappingConfig);
    }

    @Bean
    public FillForwardFiller fillForwardFiller() {
        return new FillForwardFiller();
    }

    @Bean
    public DuplicateGrouper duplicateGrouper(TssMappingConfig mappingConfig) {
        return new DuplicateGrouper(mappingConfig.dedup());
    }

    @Bean
    public CrossReferencer crossReferencer(TssMappingConfig mappingConfig) {
        return new CrossReferencer(mappingConfig.crossReference().marker(),
                mappingConfig.crossReference().emptyHeaderStop());
    }

    static List<String> parseColumns(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> columns = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(column -> !column.isEmpty())
                .toList();
        for (String column : columns) {
            if (!ColumnLetters.isValid(column)) {
                throw new ConfigurationException("tss.mapping.post-fill-columns", "invalid column letters '" + column + "'");
            }
        }
        return columns;
    }
}
