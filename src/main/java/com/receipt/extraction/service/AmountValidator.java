package com.receipt.extraction.service;

import com.receipt.extraction.config.ExtractionRules;
import com.receipt.extraction.model.AmountFields;
import com.receipt.extraction.model.FieldCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cross-checks subtotal + tax against total and shifts all three confidences
 * together. Nothing changes unless all three amounts were found.
 */
@Service
@Slf4j
public class AmountValidator {

    private final ExtractionRules rules;

    public AmountValidator(ExtractionRules rules) {
        this.rules = rules;
    }

    public AmountFields validate(AmountFields amounts) {
        FieldCandidate<Double> subtotal = amounts.getSubtotal();
        FieldCandidate<Double> tax = amounts.getTax();
        FieldCandidate<Double> total = amounts.getTotal();

        if (!subtotal.isPresent() || !tax.isPresent() || !total.isPresent()) {
            return amounts;
        }

        double expected = subtotal.getValue() + tax.getValue();
        double tolerance = Math.max(rules.getMinTolerance(), total.getValue() * rules.getRelativeTolerance());
        boolean consistent = Math.abs(total.getValue() - expected) <= tolerance;

        double delta = consistent ? rules.getConsistencyBoost() : -rules.getInconsistencyPenalty();
        log.debug("Amounts {} (subtotal {} + tax {} vs total {}, tolerance {})",
                consistent ? "consistent" : "inconsistent",
                subtotal.getValue(), tax.getValue(), total.getValue(), tolerance);

        return new AmountFields(
                adjust(subtotal, delta),
                adjust(tax, delta),
                adjust(total, delta));
    }

    private static FieldCandidate<Double> adjust(FieldCandidate<Double> candidate, double delta) {
        return candidate.withConfidence(candidate.getConfidence() + delta);
    }
}
