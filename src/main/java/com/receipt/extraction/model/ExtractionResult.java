package com.receipt.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.stream.DoubleStream;

/**
 * Final structured fields for one receipt. Missing fields are present as
 * empty candidates rather than nulls, so callers never have to null-check
 * the candidate itself.
 */
@Value
@Builder
public class ExtractionResult {

    @Builder.Default
    FieldCandidate<String> vendor = FieldCandidate.empty();

    @Builder.Default
    FieldCandidate<LocalDate> date = FieldCandidate.empty();

    @Builder.Default
    FieldCandidate<Double> subtotal = FieldCandidate.empty();

    @Builder.Default
    FieldCandidate<Double> tax = FieldCandidate.empty();

    @Builder.Default
    FieldCandidate<Double> total = FieldCandidate.empty();

    double overallConfidence;

    public DoubleStream confidences() {
        return DoubleStream.of(
                vendor.getConfidence(),
                date.getConfidence(),
                subtotal.getConfidence(),
                tax.getConfidence(),
                total.getConfidence());
    }

    public static ExtractionResult empty() {
        return ExtractionResult.builder().overallConfidence(0.0).build();
    }
}
