package com.example.tssconverter.config;

import com.example.tssconverter.service.error.ConfigurationException;
import com.example.tssconverter.service.grid.ColumnLetters;
import com.example.tssconverter.service.sheet.SheetType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Reads the domain mapping from the classpath and checks every column reference in it.
 */
@Slf4j
public final class TssMappingLoader {

    private TssMappingLoader() {
    }

    public static TssMappingConfig load(String resourceName) {
        ClassPathResource resource = new ClassPathResource(resourceName);
        if (!resource.exists()) {
            throw new ConfigurationException(resourceName, "mapping resource not found on classpath");
        }
        ObjectMapper mapper = new ObjectMapper();
        TssMappingConfig config;
        try (InputStream input = resource.getInputStream()) {
            config = mapper.readValue(input, TssMappingConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException(resourceName, "unreadable mapping: " + e.getMessage(), e);
        }
        validate(resourceName, config);
        log.info("Loaded TSS mapping from {} ({} sheet types)", resourceName, config.sheetTypes().size());
        return config;
    }

    static void validate(String resourceName, TssMappingConfig config) {
        if (config == null || config.template() == null || config.extraction() == null
                || config.dedup() == null || config.crossReference() == null) {
            throw new ConfigurationException(resourceName, "template, extraction, dedup and crossReference sections are required");
        }
        TemplateLayout template = config.template();
        if (template.headers().isEmpty()) {
            throw new ConfigurationException("template.headers", "at least one header is required");
        }
        if (template.dataStartRow() <= template.headerRow()) {
            throw new ConfigurationException("template.dataStartRow", "must be below the header row");
        }
        checkColumn("template.articleStartColumn", template.articleStartColumn());
        for (TemplateLabel label : template.labels()) {
            checkCell("template.labels", label.cell());
        }

        for (Map.Entry<SheetType, SheetTypeMapping> entry : config.sheetTypes().entrySet()) {
            String key = "sheetTypes." + entry.getKey();
            if (!entry.getKey().isClassified()) {
                throw new ConfigurationException(key, "no mapping may be declared for unclassified sheets");
            }
            SheetTypeMapping mapping = entry.getValue();
            try {
                mapping.columnMappings();
                mapping.literalColumns();
                mapping.fillColumnIndexes();
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(key, e.getMessage(), e);
            }
            if (mapping.dataOffset() < 1) {
                throw new ConfigurationException(key + ".dataOffset", "must be at least 1");
            }
        }

        DedupRules dedup = config.dedup();
        checkColumn("dedup.indicatorColumn", dedup.indicatorColumn());
        checkColumn("dedup.summaryColumn", dedup.summaryColumn());
        checkColumns("dedup.comparisonColumns", dedup.comparisonColumns());
        checkColumns("dedup.clearColumns", dedup.clearColumns());

        CrossReferenceRules crossReference = config.crossReference();
        checkColumn("crossReference.listColumn", crossReference.listColumn());
        checkColumn("crossReference.headerColumnStart", crossReference.headerColumnStart());
        if (crossReference.emptyHeaderStop() < 1) {
            throw new ConfigurationException("crossReference.emptyHeaderStop", "must be at least 1");
        }
    }

    private static void checkColumns(String key, List<String> columns) {
        for (String column : columns) {
            checkColumn(key, column);
        }
    }

    private static void checkColumn(String key, String column) {
        if (!ColumnLetters.isValid(column)) {
            throw new ConfigurationException(key, "invalid column letters '" + column + "'");
        }
    }

    private static void checkCell(String key, String cell) {
        if (cell == null || !cell.matches("^[A-Za-z]{1,3}[1-9]\\d*$")) {
            throw new ConfigurationException(key, "invalid cell reference '" + cell + "'");
        }
    }
}
