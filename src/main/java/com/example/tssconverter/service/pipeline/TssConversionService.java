package com.example.tssconverter.service.pipeline;

import com.example.tssconverter.service.error.FileAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs the pipeline on uploaded bytes inside a private temp directory that is removed afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TssConversionService {

    private static final String DEFAULT_NAME = "upload.xlsx";

    private final TssPipeline pipeline;

    public ConversionOutcome convert(byte[] content, String originalFilename) {
        String fileName = safeFileName(originalFilename);
        Path workDir;
        try {
            workDir = Files.createTempDirectory("tss-");
        } catch (IOException e) {
            throw new FileAccessException(Path.of(System.getProperty("java.io.tmpdir")), "create temp directory in", e);
        }

        try {
            Path input = workDir.resolve(fileName);
            write(input, content);
            PipelineResult result = pipeline.run(input, workDir.resolve("out"));
            if (!result.success()) {
                return new ConversionOutcome(null, new byte[0], result);
            }
            return new ConversionOutcome(result.output().getFileName().toString(), read(result.output()), result);
        } finally {
            deleteRecursively(workDir);
        }
    }

    static String safeFileName(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return DEFAULT_NAME;
        }
        String name = originalFilename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.replaceAll("[^\\w .()\\-]", "_").trim();
        if (name.isEmpty() || name.startsWith(".")) {
            return DEFAULT_NAME;
        }
        return name;
    }

    private static void write(Path file, byte[] content) {
        try {
            Files.write(file, content);
        } catch (IOException e) {
            throw new FileAccessException(file, "write", e);
        }
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new FileAccessException(file, "read", e);
        }
    }

    private static void deleteRecursively(Path directory) {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException e) {
            log.warn("Could not list temp directory {} for cleanup: {}", directory, e.getMessage());
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Could not delete temp file {}: {}", path, e.getMessage());
            }
        }
    }
}
