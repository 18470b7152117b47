package com.example.tssconverter.web;

import com.example.tssconverter.service.pipeline.ConversionOutcome;
import com.example.tssconverter.service.pipeline.PipelineResult;
import com.example.tssconverter.service.pipeline.TssConversionService;
import com.example.tssconverter.service.quality.QualitySummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TssConversionController.class)
class TssConversionControllerTest {

    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TssConversionService conversionService;

    @Test
    void returnsConvertedWorkbookWithQualityHeaders() throws Exception {
        byte[] converted = {1, 2, 3, 4};
        String fileName = "Standard Internal TSS - vendor.xlsx";
        PipelineResult result = new PipelineResult(true, Path.of(fileName), null, null, 6,
                summary(85, 1), Map.of("final_data_rows", 18));
        when(conversionService.convert(any(), eq("vendor.xlsx")))
                .thenReturn(new ConversionOutcome(fileName, converted, result));

        mockMvc.perform(multipart("/api/tss/convert")
                        .file(new MockMultipartFile("file", "vendor.xlsx", XLSX, new byte[]{9, 9})))
                .andExpect(status().isOk())
                .andExpect(content().contentType(XLSX))
                .andExpect(header().string("Content-Disposition", containsString("attachment")))
                .andExpect(header().string("Content-Disposition", containsString("Standard")))
                .andExpect(header().string(TssConversionController.QUALITY_SCORE_HEADER, "85"))
                .andExpect(header().string(TssConversionController.WARNING_COUNT_HEADER, "1"))
                .andExpect(content().bytes(converted));
    }

    @Test
    void failedConversionIsUnprocessable() throws Exception {
        PipelineResult result = new PipelineResult(false, null, "FILE_FORMAT_ERROR",
                "Expected .xlsx or .xlsm", 0, summary(40, 0), Map.of());
        when(conversionService.convert(any(), any()))
                .thenReturn(new ConversionOutcome(null, new byte[0], result));

        mockMvc.perform(multipart("/api/tss/convert")
                        .file(new MockMultipartFile("file", "vendor.csv", "text/csv", "a;b".getBytes())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("FILE_FORMAT_ERROR"))
                .andExpect(jsonPath("$.message").value("Expected .xlsx or .xlsm"));
    }

    @Test
    void emptyUploadIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/tss/convert")
                        .file(new MockMultipartFile("file", "empty.xlsx", XLSX, new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        verify(conversionService, never()).convert(any(), any());
    }

    private static QualitySummary summary(int score, int warnings) {
        return new QualitySummary(score, 0, warnings, 0, Map.of(), List.of(), List.of(), Map.of(), List.of());
    }
}
