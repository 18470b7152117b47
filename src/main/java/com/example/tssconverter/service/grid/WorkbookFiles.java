package com.example.tssconverter.service.grid;

import com.example.tssconverter.service.error.FileAccessException;
import com.example.tssconverter.service.error.FileFormatException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Opening and persisting workbooks for the file-to-file stages.
 */
@Slf4j
public final class WorkbookFiles {

    public static final String XLSX = ".xlsx";
    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".xlsx", ".xlsm");
    private static final Pattern STEP_SUFFIX = Pattern.compile("\\s*-\\s*Step\\d+$", Pattern.CASE_INSENSITIVE);

    private WorkbookFiles() {
    }

    /**
     * Opens an Excel workbook. The caller owns the returned workbook and must close it.
     *
     * @throws FileFormatException when the file is missing, has the wrong extension or cannot be parsed
     */
    public static Workbook open(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new FileFormatException(file, "an existing Excel file (.xlsx)", "file not found");
        }
        String extension = extensionOf(file);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new FileFormatException(file, "Excel file (.xlsx, .xlsm)",
                    extension.isEmpty() ? "no extension" : extension);
        }
        try (InputStream input = Files.newInputStream(file)) {
            return WorkbookFactory.create(input);
        } catch (IOException | RuntimeException e) {
            throw new FileFormatException(file, "a readable Excel workbook", e.getMessage(), e);
        }
    }

    /**
     * Writes to a temp file next to {@code target} and moves it into place, so a failed write
     * never leaves a partial file at {@code target}.
     *
     * @throws FileAccessException when the output cannot be written
     */
    public static Path save(Workbook workbook, Path target) {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".tss-", ".tmp");
            try (OutputStream output = Files.newOutputStream(temp)) {
                workbook.write(output);
            }
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved workbook to {}", absolute);
            return absolute;
        } catch (IOException | RuntimeException e) {
            FileAccessException failure = new FileAccessException(absolute, "write", e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    /**
     * {@code <basename> - Step<N>.xlsx} inside {@code outputDir}.
     */
    public static Path stepOutput(Path input, Path outputDir, int step) {
        return outputDir.resolve(baseName(input) + " - Step" + step + XLSX);
    }

    /**
     * File name without extension and without a trailing {@code " - Step<N>"}.
     */
    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return STEP_SUFFIX.matcher(name).replaceFirst("").trim();
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
