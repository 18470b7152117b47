package com.example.tssconverter.service.pipeline;

public record ConversionOutcome(
        String fileName,
        byte[] content,
        PipelineResult result
) {
    public boolean success() {
        return result.success();
    }

    public int qualityScore() {
        return result.quality().qualityScore();
    }
}
