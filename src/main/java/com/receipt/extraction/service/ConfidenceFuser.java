package com.receipt.extraction.service;

import com.receipt.extraction.config.ExtractionRules;
import com.receipt.extraction.model.BoundingBox;
import com.receipt.extraction.model.FieldCandidate;
import com.receipt.extraction.model.OcrToken;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Ties a piece of extracted text back to the OCR tokens it came from.
 *
 * Matching is a loose substring test in either direction, not span alignment:
 * "$160.91" matches a token "$160.91" and also a token "160", so the box is a
 * best-effort pointer and the confidence a blend of everything that overlaps.
 */
@Component
public class ConfidenceFuser {

    private final ExtractionRules rules;

    public ConfidenceFuser(ExtractionRules rules) {
        this.rules = rules;
    }

    /**
     * Box of the first token related to {@code text}, or null.
     */
    public BoundingBox findBox(String text, List<OcrToken> tokens) {
        if (text == null || tokens == null) return null;
        String target = text.trim().toLowerCase(Locale.ROOT);

        for (OcrToken token : tokens) {
            String word = token.getText().toLowerCase(Locale.ROOT);
            if (target.contains(word) || word.contains(target)) {
                return token.getBox();
            }
        }
        return null;
    }

    /**
     * Mean OCR confidence (normalized to [0, 1]) of every token that overlaps
     * any word of {@code text}. Falls back to the rules' default when nothing overlaps.
     */
    public double fieldConfidence(String text, List<OcrToken> tokens) {
        if (text == null || tokens == null) return rules.getDefaultFieldConfidence();

        long sum = 0;
        int matches = 0;

        for (String word : text.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (word.isEmpty()) continue;
            for (OcrToken token : tokens) {
                String ocrWord = token.getText().toLowerCase(Locale.ROOT);
                if (ocrWord.contains(word) || word.contains(ocrWord)) {
                    sum += token.getConfidence();
                    matches++;
                }
            }
        }

        if (matches == 0) {
            return rules.getDefaultFieldConfidence();
        }
        return FieldCandidate.clamp((double) sum / matches / 100.0);
    }
}
