package com.receipt.extraction.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.receipt.extraction.model.EvaluationReport;
import com.receipt.extraction.model.ExtractionResult;
import com.receipt.extraction.model.FieldCandidate;
import com.receipt.extraction.model.GroundTruth;
import com.receipt.extraction.model.OcrDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Scores an extraction against known-correct values.
 *
 * Vendor: 1.0 exact, 0.7 when one contains the other. Date: exact only.
 * Amounts: 1.0 within max(0.02, 1%) of the expected value, 0.5 within twice that.
 */
@Service
@Slf4j
public class ExtractionEvaluator {

    static final double PARTIAL_VENDOR_SCORE = 0.7;
    static final double NEAR_AMOUNT_SCORE = 0.5;

    private final ObjectMapper objectMapper;

    public ExtractionEvaluator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EvaluationReport evaluate(ExtractionResult result, OcrDocument document, GroundTruth expected) {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("vendor", scoreVendor(result.getVendor().getValue(), expected.getVendor()));
        scores.put("date", scoreDate(result.getDate(), expected.getDate()));
        scores.put("subtotal", scoreAmount(result.getSubtotal().getValue(), expected.getSubtotal()));
        scores.put("tax", scoreAmount(result.getTax().getValue(), expected.getTax()));
        scores.put("total", scoreAmount(result.getTotal().getValue(), expected.getTotal()));

        double accuracy = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        log.info("Evaluation: field scores {}, overall accuracy {}", scores, String.format("%.2f", accuracy));

        return EvaluationReport.builder()
                .fieldScores(scores)
                .overallAccuracy(accuracy)
                .wordCount(document.getWordCount())
                .avgOcrConfidence(document.getAvgConfidence())
                .meetsWordThreshold(document.getWordCount() >= expected.getExpectedWordsMin())
                .confidenceGrade(grade(document.getAvgConfidence()))
                .extraction(result)
                .build();
    }

    GroundTruth readGroundTruth(InputStream json) throws IOException {
        return objectMapper.readValue(json, GroundTruth.class);
    }

    // ─── SCORING ───────────────────────────────────────────────────────

    static double scoreVendor(String extracted, String expected) {
        if (extracted == null || expected == null) return 0.0;
        String e = extracted.trim().toUpperCase(Locale.ROOT);
        String x = expected.trim().toUpperCase(Locale.ROOT);

        if (e.equals(x)) return 1.0;
        if (e.contains(x) || x.contains(e)) return PARTIAL_VENDOR_SCORE;
        return 0.0;
    }

    static double scoreDate(FieldCandidate<?> extracted, String expected) {
        if (!extracted.isPresent() || expected == null) return 0.0;
        return extracted.getValue().toString().equals(expected.trim()) ? 1.0 : 0.0;
    }

    static double scoreAmount(Double extracted, Double expected) {
        if (extracted == null || expected == null) return 0.0;
        double tolerance = Math.max(0.02, expected * 0.01);
        double error = Math.abs(extracted - expected);

        if (error <= tolerance) return 1.0;
        if (error <= tolerance * 2) return NEAR_AMOUNT_SCORE;
        return 0.0;
    }

    static String grade(double avgConfidence) {
        if (avgConfidence >= 80) return "High";
        if (avgConfidence >= 60) return "Medium";
        return "Low";
    }
}
