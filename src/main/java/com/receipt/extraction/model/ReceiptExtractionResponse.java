package com.receipt.extraction.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ReceiptExtractionResponse {

    private String status = "SUCCESS";               // SUCCESS, EMPTY, ERROR
    private String fileName;
    private ExtractionResult extraction;
    private int wordCount;
    private double avgOcrConfidence;
    private PreprocessingOptions preprocessing;
    private List<String> appliedSteps = new ArrayList<>();
    private int confidenceThreshold;
    private long processingTimeMillis;
    private List<String> warnings = new ArrayList<>();

    public static ReceiptExtractionResponse error(String fileName, String reason) {
        ReceiptExtractionResponse r = new ReceiptExtractionResponse();
        r.status = "ERROR";
        r.fileName = fileName;
        r.warnings.add(reason);
        return r;
    }
}
