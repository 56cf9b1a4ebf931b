package com.receipt.extraction.service;

import com.receipt.extraction.model.AmountFields;
import com.receipt.extraction.model.ExtractionResult;
import com.receipt.extraction.model.FieldCandidate;
import com.receipt.extraction.model.OcrDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Turns one OCR document into structured fields.
 *
 * The three extractors only read the document, so this class holds no state
 * between calls and the same document always produces the same result.
 */
@Service
@Slf4j
public class ReceiptFieldExtractor {

    private final DateExtractor dateExtractor;
    private final AmountExtractor amountExtractor;
    private final VendorExtractor vendorExtractor;
    private final AmountValidator amountValidator;
    private final FieldAggregator aggregator;

    public ReceiptFieldExtractor(DateExtractor dateExtractor,
                                 AmountExtractor amountExtractor,
                                 VendorExtractor vendorExtractor,
                                 AmountValidator amountValidator,
                                 FieldAggregator aggregator) {
        this.dateExtractor = dateExtractor;
        this.amountExtractor = amountExtractor;
        this.vendorExtractor = vendorExtractor;
        this.amountValidator = amountValidator;
        this.aggregator = aggregator;
    }

    public ExtractionResult extract(OcrDocument document) {
        if (document == null) {
            return ExtractionResult.empty();
        }

        FieldCandidate<LocalDate> date = dateExtractor.extract(document);
        AmountFields amounts = amountValidator.validate(amountExtractor.extract(document));
        FieldCandidate<String> vendor = vendorExtractor.extract(document);

        ExtractionResult result = aggregator.aggregate(vendor, date, amounts);
        log.info("Extracted vendor={}, date={}, subtotal={}, tax={}, total={} (overall confidence {})",
                vendor.getValue(), date.getValue(),
                amounts.getSubtotal().getValue(), amounts.getTax().getValue(), amounts.getTotal().getValue(),
                String.format("%.3f", result.getOverallConfidence()));
        return result;
    }
}
