package com.receipt.extraction.config;

import com.receipt.extraction.model.AmountKind;
import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read-only rule data shared by the field extractors.
 *
 * Pattern lists are evaluated top to bottom and the first hit wins, so their
 * order is observable behaviour. The confidence constants below were tuned by
 * hand; treat them as knobs rather than derived values.
 */
@Value
@Builder
public class ExtractionRules {

    List<Pattern> datePatterns;
    List<Pattern> currencyPatterns;
    Map<AmountKind, List<String>> amountKeywords;
    Set<String> vendorStopWords;

    int minYear;
    int maxYearsAhead;

    double consistencyBoost;
    double inconsistencyPenalty;
    double minTolerance;
    double relativeTolerance;

    int vendorSearchLines;
    int vendorMinLength;
    int vendorMaxLength;
    double vendorPositionWeight;
    double vendorLengthWeight;
    double vendorOcrWeight;
    double vendorLengthNorm;

    double defaultFieldConfidence;

    private static final String MONTH = "(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?";

    public static ExtractionRules defaults() {
        Map<AmountKind, List<String>> keywords = new EnumMap<>(AmountKind.class);
        keywords.put(AmountKind.SUBTOTAL,
                List.of("subtotal", "sub total", "sub-total", "amount before tax", "net amount"));
        keywords.put(AmountKind.TAX,
                List.of("tax", "sales tax", "vat", "gst", "hst", "tax amount"));
        keywords.put(AmountKind.TOTAL,
                List.of("total", "amount due", "total amount", "grand total", "balance due", "total due"));

        return ExtractionRules.builder()
                .datePatterns(List.of(
                        Pattern.compile("\\b\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b"),
                        Pattern.compile("\\b\\d{4}[/-]\\d{1,2}[/-]\\d{1,2}\\b"),
                        Pattern.compile("\\b" + MONTH + "\\s+\\d{1,2},?\\s+\\d{4}\\b", Pattern.CASE_INSENSITIVE),
                        Pattern.compile("\\b\\d{1,2}\\s+" + MONTH + "\\s+\\d{4}\\b", Pattern.CASE_INSENSITIVE)))
                .currencyPatterns(List.of(
                        Pattern.compile("\\$\\s*\\d{1,3}(?:,\\d{3})*(?:\\.\\d{2})?"),
                        Pattern.compile("\\d{1,3}(?:,\\d{3})*(?:\\.\\d{2})?\\s*\\$"),
                        Pattern.compile("\\$\\d+(?:\\.\\d{2})?"),
                        Pattern.compile("\\d+(?:\\.\\d{2})?")))
                .amountKeywords(Map.copyOf(keywords))
                .vendorStopWords(Set.of(
                        "receipt", "invoice", "bill", "statement", "order", "purchase", "sale",
                        "date", "time", "total", "tax", "subtotal", "amount", "due", "paid",
                        "cash", "credit", "card", "visa", "mastercard", "amex", "discover"))
                .minYear(2000)
                .maxYearsAhead(1)
                .consistencyBoost(0.2)
                .inconsistencyPenalty(0.3)
                .minTolerance(0.02)
                .relativeTolerance(0.01)
                .vendorSearchLines(10)
                .vendorMinLength(3)
                .vendorMaxLength(100)
                .vendorPositionWeight(0.4)
                .vendorLengthWeight(0.2)
                .vendorOcrWeight(0.4)
                .vendorLengthNorm(50.0)
                .defaultFieldConfidence(0.5)
                .build();
    }

    public List<String> keywordsFor(AmountKind kind) {
        return amountKeywords.getOrDefault(kind, List.of());
    }
}
