package com.receipt.extraction.model;

import lombok.Builder;
import lombok.Value;

/**
 * One extracted field value together with the evidence behind it.
 * Confidence is clamped into [0, 1] on construction.
 *
 * @param <T> payload type: String for the vendor, LocalDate for the date, Double for amounts
 */
@Value
public class FieldCandidate<T> {

    T value;
    double confidence;
    BoundingBox sourceBox;
    String rawText;

    @Builder(toBuilder = true)
    public FieldCandidate(T value, double confidence, BoundingBox sourceBox, String rawText) {
        this.value = value;
        this.confidence = clamp(confidence);
        this.sourceBox = sourceBox;
        this.rawText = rawText == null ? "" : rawText;
    }

    /** No evidence for the field. */
    public static <T> FieldCandidate<T> empty() {
        return new FieldCandidate<>(null, 0.0, null, "");
    }

    public boolean isPresent() {
        return value != null;
    }

    public FieldCandidate<T> withConfidence(double newConfidence) {
        return toBuilder().confidence(newConfidence).build();
    }

    public static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
