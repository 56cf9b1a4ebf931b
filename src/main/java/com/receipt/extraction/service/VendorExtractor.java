package com.receipt.extraction.service;

import com.receipt.extraction.config.ExtractionRules;
import com.receipt.extraction.model.FieldCandidate;
import com.receipt.extraction.model.OcrDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@Slf4j
public class VendorExtractor {

    private final ExtractionRules rules;
    private final ConfidenceFuser fuser;

    public VendorExtractor(ExtractionRules rules, ConfidenceFuser fuser) {
        this.rules = rules;
        this.fuser = fuser;
    }

    /**
     * Scores the top lines of the document and returns the best one, title-cased.
     * Lines nearer the top, longer lines, and lines OCR was sure about all score higher.
     */
    public FieldCandidate<String> extract(OcrDocument document) {
        String[] lines = document.getRawText().split("\n");
        int searchLines = Math.min(rules.getVendorSearchLines(), lines.length);

        FieldCandidate<String> best = null;

        for (int i = 0; i < searchLines; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || !isVendorCandidate(line)) continue;

            double score = scoreLine(line, i, document);
            log.debug("Vendor candidate '{}' at line {} scored {}", line, i, score);

            if (best == null || score > best.getConfidence()) {
                best = FieldCandidate.<String>builder()
                        .value(titleCase(line))
                        .rawText(line)
                        .confidence(score)
                        .sourceBox(fuser.findBox(line, document.getTokens()))
                        .build();
            }
        }

        return best == null ? FieldCandidate.empty() : best;
    }

    private double scoreLine(String line, int index, OcrDocument document) {
        double position = (double) (rules.getVendorSearchLines() - index) / rules.getVendorSearchLines();
        double length = Math.min(line.length() / rules.getVendorLengthNorm(), 1.0);
        double ocr = fuser.fieldConfidence(line, document.getTokens());

        return position * rules.getVendorPositionWeight()
                + length * rules.getVendorLengthWeight()
                + ocr * rules.getVendorOcrWeight();
    }

    boolean isVendorCandidate(String line) {
        String lower = line.toLowerCase(Locale.ROOT);

        for (String stopWord : rules.getVendorStopWords()) {
            if (lower.contains(stopWord)) {
                return false;
            }
        }

        long digits = line.chars().filter(Character::isDigit).count();
        if (digits > line.length() * 0.5) {
            return false;
        }

        int length = line.trim().length();
        return length >= rules.getVendorMinLength() && length <= rules.getVendorMaxLength();
    }

    /**
     * Upper-cases the first letter of every run of letters and lower-cases the rest,
     * so "TECH MART" becomes "Tech Mart" and "o'neil" becomes "O'Neil".
     */
    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean previousLetter = false;

        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }
}
