package com.receipt.extraction.model;

import lombok.Data;

import java.util.List;

@Data
public class OcrResponse {

    private String fileName;
    private OcrDocument document;
    private PreprocessingOptions preprocessing;
    private List<String> appliedSteps;
    private int confidenceThreshold;
    private long processingTimeMillis;
}
