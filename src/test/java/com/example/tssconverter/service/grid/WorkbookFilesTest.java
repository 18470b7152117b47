package com.example.tssconverter.service.grid;

import com.example.tssconverter.service.SheetFixtures;
import com.example.tssconverter.service.error.FileAccessException;
import com.example.tssconverter.service.error.FileFormatException;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkbookFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void derivedNamesDropExtensionAndStepSuffix() {
        assertThat(WorkbookFiles.baseName(Path.of("Supplier TSS.xlsx"))).isEqualTo("Supplier TSS");
        assertThat(WorkbookFiles.baseName(Path.of("Supplier TSS - Step4.xlsx"))).isEqualTo("Supplier TSS");
        assertThat(WorkbookFiles.stepOutput(Path.of("in/Supplier TSS - Step2.xlsx"), tempDir, 3))
                .isEqualTo(tempDir.resolve("Supplier TSS - Step3.xlsx"));
    }

    @Test
    void rejectsMissingFilesAndWrongExtensions() throws Exception {
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "hello");
        Path fake = Files.writeString(tempDir.resolve("fake.xlsx"), "not a zip");

        assertThatThrownBy(() -> WorkbookFiles.open(tempDir.resolve("missing.xlsx")))
                .isInstanceOf(FileFormatException.class);
        assertThatThrownBy(() -> WorkbookFiles.open(text))
                .isInstanceOf(FileFormatException.class)
                .hasMessageContaining(".txt");
        assertThatThrownBy(() -> WorkbookFiles.open(fake))
                .isInstanceOf(FileFormatException.class)
                .extracting(e -> ((FileFormatException) e).getErrorCode())
                .isEqualTo(FileFormatException.CODE);
    }

    @Test
    void saveLeavesOnlyTheTargetBehind() throws Exception {
        Path target = tempDir.resolve("nested/out.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            SheetFixtures.set(workbook.createSheet("Output Template"), "A1", "saved");
            WorkbookFiles.save(workbook, target);
        }

        try (Workbook reopened = WorkbookFiles.open(target);
             Stream<Path> files = Files.list(target.getParent())) {
            assertThat(CellGridReader.of(reopened.getSheetAt(0)).read(1, 1)).isEqualTo("saved");
            assertThat(files).containsExactly(target.toAbsolutePath());
        }
    }

    @Test
    void unwritableTargetIsAFileAccessError() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            workbook.createSheet("Output Template");
            assertThatThrownBy(() -> WorkbookFiles.save(workbook, blocker.resolve("out.xlsx")))
                    .isInstanceOf(FileAccessException.class);
        }
    }
}
