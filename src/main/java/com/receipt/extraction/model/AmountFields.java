package com.receipt.extraction.model;

import lombok.Value;
import lombok.With;

/**
 * Subtotal, tax and total as extracted together from one document.
 */
@Value
@With
public class AmountFields {

    FieldCandidate<Double> subtotal;
    FieldCandidate<Double> tax;
    FieldCandidate<Double> total;

    public static AmountFields empty() {
        return new AmountFields(FieldCandidate.empty(), FieldCandidate.empty(), FieldCandidate.empty());
    }

    public FieldCandidate<Double> get(AmountKind kind) {
        return switch (kind) {
            case SUBTOTAL -> subtotal;
            case TAX -> tax;
            case TOTAL -> total;
        };
    }

    public AmountFields with(AmountKind kind, FieldCandidate<Double> candidate) {
        return switch (kind) {
            case SUBTOTAL -> withSubtotal(candidate);
            case TAX -> withTax(candidate);
            case TOTAL -> withTotal(candidate);
        };
    }
}
