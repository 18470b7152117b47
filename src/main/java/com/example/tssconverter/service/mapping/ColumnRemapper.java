package com.example.tssconverter.service.mapping;

import com.example.tssconverter.config.ColumnMapping;
import com.example.tssconverter.config.SheetTypeMapping;
import com.example.tssconverter.config.TssMappingConfig;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellWriter;
import com.example.tssconverter.service.sheet.SheetType;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Sheet;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves source rows into the unified output layout using the per-sheet-type column table.
 * <p>
 * Single-column entries are copied when non-empty. Combination entries ({@code "K+L"}) join
 * the non-empty source values with the configured delimiter and are skipped when all sources
 * are empty. Literal columns are written on every mapped row.
 */
@Slf4j
public class ColumnRemapper {

    private final String delimiter;
    private final Map<SheetType, List<ColumnMapping>> columnMappings = new EnumMap<>(SheetType.class);
    private final Map<SheetType, Map<Integer, String>> literals = new EnumMap<>(SheetType.class);

    public ColumnRemapper(TssMappingConfig config) {
        this.delimiter = config.combineDelimiter();
        for (Map.Entry<SheetType, SheetTypeMapping> entry : config.sheetTypes().entrySet()) {
            columnMappings.put(entry.getKey(), entry.getValue().columnMappings());
            literals.put(entry.getKey(), entry.getValue().literalColumns());
        }
    }

    /**
     * Destination column (1-based) to value for one source row, in mapping order.
     * Unclassified sheets map to nothing.
     */
    public Map<Integer, String> map(CellGridReader source, int row, SheetType type) {
        return switch (type) {
            case F, M, C, P -> mapClassified(source, row, type);
            case UNCLASSIFIED -> Map.of();
        };
    }

    /**
     * Maps source rows from {@code dataStartRow} until the first row without any non-empty cell,
     * writing them to {@code target} from {@code targetRow} on.
     */
    public SheetMappingResult mapSheet(CellGridReader source, SheetType type, int dataStartRow,
                                       Sheet target, int targetRow) {
        if (!type.isClassified() || !columnMappings.containsKey(type)) {
            return new SheetMappingResult(0, targetRow);
        }
        int maxColumn = source.lastColumn();
        int lastRow = source.lastRow();
        int next = targetRow;
        int mapped = 0;
        for (int r = dataStartRow; r <= lastRow; r++) {
            if (!isDataRow(source, r, maxColumn)) {
                break;
            }
            Map<Integer, String> values = map(source, r, type);
            for (Map.Entry<Integer, String> value : values.entrySet()) {
                CellWriter.write(target, next, value.getKey(), value.getValue());
            }
            next++;
            mapped++;
        }
        log.info("Mapped {} rows from {} sheet '{}'", mapped, type, source.sheetName());
        return new SheetMappingResult(mapped, next);
    }

    public boolean isDataRow(CellGridReader source, int row, int maxColumn) {
        return source.rowHasData(row, maxColumn);
    }

    /**
     * First row at or after {@code fromRow} whose column B is empty.
     */
    public static int firstFreeRow(CellGridReader target, int fromRow) {
        int row = fromRow;
        while (!target.read(row, 2).isEmpty()) {
            row++;
        }
        return row;
    }

    private Map<Integer, String> mapClassified(CellGridReader source, int row, SheetType type) {
        Map<Integer, String> values = new LinkedHashMap<>(literals.getOrDefault(type, Map.of()));
        for (ColumnMapping mapping : columnMappings.getOrDefault(type, List.of())) {
            String value = mapping.isCombination()
                    ? combine(source, row, mapping.sourceColumns())
                    : source.read(row, mapping.sourceColumns().get(0));
            if (!value.isEmpty()) {
                values.put(mapping.destinationColumn(), value);
            }
        }
        return values;
    }

    private String combine(CellGridReader source, int row, List<Integer> columns) {
        List<String> parts = new ArrayList<>();
        for (Integer column : columns) {
            String value = source.read(row, column);
            if (!value.isEmpty()) {
                parts.add(value);
            }
        }
        return String.join(delimiter, parts);
    }
}
