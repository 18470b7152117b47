package com.example.tssconverter.service.crossref;

import com.example.tssconverter.service.extract.VerticalListExtractor;
import com.example.tssconverter.service.grid.CellGridReader;
import com.example.tssconverter.service.grid.CellWriter;
import com.example.tssconverter.service.grid.ColumnLetters;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Marks, for every data row, the article header columns named in the row's article list,
 * then clears the list column.
 */
@Slf4j
public class CrossReferencer {

    private static final Pattern LINE_SPLIT = Pattern.compile("[\\n;]");
    private static final Pattern LIST_NUMBERING = Pattern.compile("^\\s*\\d+\\.(?!\\d)\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int HEADER_OVERRUN = 10;

    private final String marker;
    private final int emptyHeaderStop;

    public CrossReferencer(String marker, int emptyHeaderStop) {
        this.marker = marker;
        this.emptyHeaderStop = emptyHeaderStop;
    }

    /**
     * Scans {@code headerRow} from {@code headerColumnStart} until {@code emptyHeaderStop}
     * consecutive empty cells, or just past the used columns.
     */
    public ArticleHeaderIndex buildIndex(CellGridReader grid, int headerRow, int headerColumnStart) {
        ArticleHeaderIndex index = new ArticleHeaderIndex();
        int limit = grid.lastColumn() + HEADER_OVERRUN;
        int empty = 0;
        for (int c = headerColumnStart; empty < emptyHeaderStop && c <= limit; c++) {
            String name = normalize(grid.read(headerRow, c));
            if (name.isEmpty()) {
                empty++;
                continue;
            }
            empty = 0;
            index.add(name, c);
            log.debug("Article header '{}' at {}{}", name, ColumnLetters.toLetters(c), headerRow);
        }
        log.info("Indexed {} article headers in row {} of '{}'", index.size(), headerRow, grid.sheetName());
        return index;
    }

    public CrossReferenceResult crossReference(CellGridReader grid, int listColumn, int headerRow,
                                               int headerColumnStart, int startRow) {
        ArticleHeaderIndex index = buildIndex(grid, headerRow, headerColumnStart);
        int lastRow = grid.lastRow();
        int processed = 0;
        int marks = 0;
        int unmatched = 0;

        for (int r = startRow; r <= lastRow; r++) {
            String list = grid.read(r, listColumn);
            if (list.isEmpty()) {
                continue;
            }
            processed++;
            Set<Integer> columns = new LinkedHashSet<>();
            for (String article : parseArticleList(list)) {
                List<Integer> matches = index.match(normalize(article));
                if (matches.isEmpty()) {
                    unmatched++;
                    log.debug("No article header matches '{}' (row {})", article, r);
                }
                columns.addAll(matches);
            }
            for (Integer column : columns) {
                CellWriter.write(grid.sheet(), r, column, marker);
                marks++;
            }
        }

        int cleared = clearListColumn(grid, listColumn, startRow, lastRow);
        log.info("Cross-referenced {} rows in '{}': {} marks, {} unmatched articles, {} list cells cleared",
                processed, grid.sheetName(), marks, unmatched, cleared);
        return new CrossReferenceResult(index.size(), processed, marks, unmatched, cleared);
    }

    /**
     * Splits on newline and semicolon, drops list numbering and trailing {@code ;} / {@code ,}.
     */
    public static List<String> parseArticleList(String text) {
        List<String> articles = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return articles;
        }
        for (String line : LINE_SPLIT.split(text)) {
            String article = LIST_NUMBERING.matcher(line.trim()).replaceFirst("");
            article = VerticalListExtractor.cleanValue(article);
            if (!article.isEmpty()) {
                articles.add(article);
            }
        }
        return articles;
    }

    /**
     * Lower-cased, trimmed, inner whitespace collapsed to one space.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    private int clearListColumn(CellGridReader grid, int listColumn, int startRow, int lastRow) {
        int cleared = 0;
        for (int r = startRow; r <= lastRow; r++) {
            if (!grid.tryRead(r, listColumn).isOk() || !grid.read(r, listColumn).isEmpty()) {
                CellWriter.clear(grid.sheet(), r, listColumn);
                cleared++;
            }
        }
        return cleared;
    }
}
