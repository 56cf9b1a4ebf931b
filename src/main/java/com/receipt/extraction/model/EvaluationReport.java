package com.receipt.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class EvaluationReport {

    Map<String, Double> fieldScores;     // vendor, date, subtotal, tax, total
    double overallAccuracy;
    int wordCount;
    double avgOcrConfidence;
    boolean meetsWordThreshold;
    String confidenceGrade;              // High, Medium, Low
    ExtractionResult extraction;
}
