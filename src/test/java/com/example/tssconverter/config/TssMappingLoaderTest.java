package com.example.tssconverter.config;

import com.example.tssconverter.service.error.ConfigurationException;
import com.example.tssconverter.service.sheet.SheetType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TssMappingLoaderTest {

    @Test
    void loadsBundledMapping() {
        TssMappingConfig config = TssMappingLoader.load("tss-mapping.json");

        assertThat(config.combineDelimiter()).isEqualTo("-");
        assertThat(config.template().headers()).hasSize(17);
        assertThat(config.template().headers().get(0).name()).isEqualTo("Combination");
        assertThat(config.template().articleStartColumnIndex()).isEqualTo(18);
        assertThat(config.sheetTypes()).containsOnlyKeys(SheetType.F, SheetType.M, SheetType.C, SheetType.P);
        assertThat(config.mappingFor(SheetType.UNCLASSIFIED)).isEmpty();
        assertThat(config.dedup().normalizedNaValues()).contains("", "NA", "-");
    }

    @Test
    void keepsColumnDeclarationOrder() {
        SheetTypeMapping material = TssMappingLoader.load("tss-mapping.json").mappingFor(SheetType.M).orElseThrow();

        assertThat(material.columnMappings())
                .extracting(ColumnMapping::sourceKey)
                .startsWith("B", "C", "D", "J", "L", "K", "X", "O+P");
        assertThat(material.fillColumnIndexes()).containsExactly(10, 11, 12);
    }

    @Test
    void literalColumnsResolveToIndexes() {
        SheetTypeMapping fabric = TssMappingLoader.load("tss-mapping.json").mappingFor(SheetType.F).orElseThrow();

        assertThat(fabric.literalColumns()).containsExactly(Map.entry(1, "Art"));
        assertThat(fabric.fillColumnIndexes()).isEmpty();
    }

    @Test
    void combinationKeysSplitOnPlus() {
        ColumnMapping mapping = ColumnMapping.parse("O+P", "I");

        assertThat(mapping.isCombination()).isTrue();
        assertThat(mapping.sourceColumns()).containsExactly(15, 16);
        assertThat(mapping.destinationColumn()).isEqualTo(9);
        assertThat(ColumnMapping.parse("AA", "P").sourceColumns()).isEqualTo(List.of(27));
    }

    @Test
    void invalidColumnLettersAreRejected() {
        assertThatThrownBy(() -> TssMappingLoader.load("tss-mapping-invalid.json"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("dedup.indicatorColumn")
                .hasMessageContaining("H1");
    }

    @Test
    void missingResourceIsAConfigurationError() {
        ConfigurationException e = catchThrowableOfType(
                () -> TssMappingLoader.load("no-such-mapping.json"), ConfigurationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getErrorCode()).isEqualTo(ConfigurationException.CODE);
    }

    @Test
    void malformedJsonIsAConfigurationError() {
        assertThatThrownBy(() -> TssMappingLoader.load("tss-mapping-truncated.json"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unreadable mapping");
    }
}
