package com.example.tssconverter.config;

import com.example.tssconverter.service.sheet.SheetType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public record TssMappingConfig(
        String combineDelimiter,
        TemplateLayout template,
        ExtractionRules extraction,
        Map<SheetType, SheetTypeMapping> sheetTypes,
        DedupRules dedup,
        CrossReferenceRules crossReference
) {
    public TssMappingConfig {
        combineDelimiter = combineDelimiter == null ? "-" : combineDelimiter;
        EnumMap<SheetType, SheetTypeMapping> copy = new EnumMap<>(SheetType.class);
        if (sheetTypes != null) {
            copy.putAll(sheetTypes);
        }
        sheetTypes = Collections.unmodifiableMap(copy);
    }

    public Optional<SheetTypeMapping> mappingFor(SheetType type) {
        return Optional.ofNullable(sheetTypes.get(type));
    }
}
