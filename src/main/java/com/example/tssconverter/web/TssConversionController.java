package com.example.tssconverter.web;

import com.example.tssconverter.service.error.TssValidationException;
import com.example.tssconverter.service.pipeline.ConversionOutcome;
import com.example.tssconverter.service.pipeline.PipelineResult;
import com.example.tssconverter.service.pipeline.TssConversionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tss")
@RequiredArgsConstructor
public class TssConversionController {

    static final String QUALITY_SCORE_HEADER = "X-TSS-Quality-Score";
    static final String WARNING_COUNT_HEADER = "X-TSS-Warning-Count";

    private final TssConversionService conversionService;

    @PostMapping("/convert")
    public ResponseEntity<byte[]> convert(@RequestParam("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Upload file must not be empty.");
        }
        ConversionOutcome outcome = conversionService.convert(file.getBytes(), file.getOriginalFilename());
        PipelineResult result = outcome.result();
        if (!outcome.success()) {
            throw new TssValidationException(result.errorCode(), result.failureReason());
        }

        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(outcome.fileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(
                        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .header(QUALITY_SCORE_HEADER, String.valueOf(outcome.qualityScore()))
                .header(WARNING_COUNT_HEADER, String.valueOf(result.quality().warningCount()))
                .body(outcome.content());
    }

    @ExceptionHandler(TssValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(TssValidationException e) {
        log.info("Conversion rejected: {}", e.toString());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errorCode", e.getErrorCode());
        body.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errorCode", "BAD_REQUEST");
        body.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(body);
    }
}
