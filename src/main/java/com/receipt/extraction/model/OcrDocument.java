package com.receipt.extraction.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Output of one OCR pass over one image. Built through {@link #of} so the
 * word count and average confidence always agree with the token list.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OcrDocument {

    String rawText;
    List<OcrToken> tokens;
    int wordCount;
    double avgConfidence;

    public static OcrDocument of(String rawText, List<OcrToken> tokens) {
        List<OcrToken> copy = tokens == null ? List.of() : List.copyOf(tokens);
        double avg = copy.stream()
                .mapToInt(OcrToken::getConfidence)
                .average()
                .orElse(0.0);
        return new OcrDocument(rawText == null ? "" : rawText, copy, copy.size(), avg);
    }

    public static OcrDocument empty() {
        return of("", List.of());
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * Maps every token box by {@code factor}, e.g. 0.5 to undo a 2x upscale.
     */
    public OcrDocument rescale(double factor) {
        if (factor == 1.0) {
            return this;
        }
        return of(rawText, tokens.stream().map(t -> t.rescale(factor)).toList());
    }
}
