package com.receipt.extraction.service;

import com.receipt.extraction.config.ExtractionRules;
import com.receipt.extraction.model.AmountFields;
import com.receipt.extraction.model.AmountKind;
import com.receipt.extraction.model.FieldCandidate;
import com.receipt.extraction.model.OcrDocument;
import com.receipt.extraction.model.OcrToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds subtotal, tax and total by keyword line search.
 *
 * Each kind is scanned independently, so one line can feed more than one kind:
 * "subtotal: $147.96" contains both "subtotal" and "total". The total line
 * then has to out-score it on OCR confidence to take over.
 */
@Service
@Slf4j
public class AmountExtractor {

    private final ExtractionRules rules;
    private final ConfidenceFuser fuser;

    public AmountExtractor(ExtractionRules rules, ConfidenceFuser fuser) {
        this.rules = rules;
        this.fuser = fuser;
    }

    public AmountFields extract(OcrDocument document) {
        String[] lines = document.getRawText().split("\n");
        AmountFields amounts = AmountFields.empty();

        for (AmountKind kind : AmountKind.values()) {
            amounts = amounts.with(kind, extractKind(kind, lines, document.getTokens()));
        }
        return amounts;
    }

    // ─── PER KIND ──────────────────────────────────────────────────────

    private FieldCandidate<Double> extractKind(AmountKind kind, String[] lines, List<OcrToken> tokens) {
        List<String> keywords = rules.keywordsFor(kind);
        FieldCandidate<Double> best = FieldCandidate.empty();

        for (String rawLine : lines) {
            String line = rawLine.trim().toLowerCase(Locale.ROOT);
            if (line.isEmpty() || keywords.stream().noneMatch(line::contains)) continue;

            FieldCandidate<Double> match = extractCurrency(line, tokens);
            if (match != null && match.getConfidence() > best.getConfidence()) {
                best = match;
            }
        }

        if (best.isPresent()) {
            log.debug("{}: {} from '{}' (confidence {})", kind, best.getValue(), best.getRawText(), best.getConfidence());
        }
        return best;
    }

    /**
     * Tries each currency pattern in order; within a pattern, matches left to right.
     * Returns the first strictly positive amount, or null.
     */
    private FieldCandidate<Double> extractCurrency(String line, List<OcrToken> tokens) {
        for (Pattern pattern : rules.getCurrencyPatterns()) {
            Matcher m = pattern.matcher(line);
            while (m.find()) {
                String raw = m.group();
                Double amount = parseAmount(raw);
                if (amount == null || amount <= 0) continue;

                return FieldCandidate.<Double>builder()
                        .value(amount)
                        .rawText(raw)
                        .confidence(fuser.fieldConfidence(raw, tokens))
                        .sourceBox(fuser.findBox(raw, tokens))
                        .build();
            }
        }
        return null;
    }

    // ─── TYPE PARSING ──────────────────────────────────────────────────

    static Double parseAmount(String raw) {
        try {
            return Double.parseDouble(raw.replaceAll("[^0-9.]", ""));
        } catch (NumberFormatException e) {
            log.debug("Failed to parse '{}' as an amount", raw);
            return null;
        }
    }
}
