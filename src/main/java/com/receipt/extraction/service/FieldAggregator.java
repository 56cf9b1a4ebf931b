package com.receipt.extraction.service;

import com.receipt.extraction.model.AmountFields;
import com.receipt.extraction.model.ExtractionResult;
import com.receipt.extraction.model.FieldCandidate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.stream.DoubleStream;

@Component
public class FieldAggregator {

    /**
     * Overall confidence is the plain mean of the five field confidences,
     * soft-misses included at 0.
     */
    public ExtractionResult aggregate(FieldCandidate<String> vendor,
                                      FieldCandidate<LocalDate> date,
                                      AmountFields amounts) {
        double overall = DoubleStream.of(
                        vendor.getConfidence(),
                        date.getConfidence(),
                        amounts.getSubtotal().getConfidence(),
                        amounts.getTax().getConfidence(),
                        amounts.getTotal().getConfidence())
                .average()
                .orElse(0.0);

        return ExtractionResult.builder()
                .vendor(vendor)
                .date(date)
                .subtotal(amounts.getSubtotal())
                .tax(amounts.getTax())
                .total(amounts.getTotal())
                .overallConfidence(overall)
                .build();
    }
}
