package com.receipt.extraction.service;

import com.receipt.extraction.config.ExtractionRules;
import com.receipt.extraction.model.FieldCandidate;
import com.receipt.extraction.model.OcrDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@Slf4j
public class DateExtractor {

    private final ExtractionRules rules;
    private final ConfidenceFuser fuser;
    private final Clock clock;
    private final LenientDateParser parser;

    public DateExtractor(ExtractionRules rules, ConfidenceFuser fuser, Clock clock) {
        this.rules = rules;
        this.fuser = fuser;
        this.clock = clock;
        this.parser = new LenientDateParser(clock);
    }

    /**
     * Runs every date pattern over the raw text and returns the match with the
     * highest field confidence. Earlier patterns, then earlier positions, win ties.
     */
    public FieldCandidate<LocalDate> extract(OcrDocument document) {
        String text = document.getRawText();
        int maxYear = LocalDate.now(clock).getYear() + rules.getMaxYearsAhead();

        FieldCandidate<LocalDate> best = null;

        for (Pattern pattern : rules.getDatePatterns()) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String raw = m.group();
                LocalDate parsed;
                try {
                    parsed = parser.parse(raw);
                } catch (DateTimeException | NumberFormatException e) {
                    log.debug("Discarding date candidate '{}': {}", raw, e.getMessage());
                    continue;
                }

                if (parsed.getYear() < rules.getMinYear() || parsed.getYear() > maxYear) {
                    log.debug("Discarding date candidate '{}': year {} out of range", raw, parsed.getYear());
                    continue;
                }

                FieldCandidate<LocalDate> candidate = FieldCandidate.<LocalDate>builder()
                        .value(parsed)
                        .rawText(raw)
                        .confidence(fuser.fieldConfidence(raw, document.getTokens()))
                        .sourceBox(fuser.findBox(raw, document.getTokens()))
                        .build();

                if (best == null || candidate.getConfidence() > best.getConfidence()) {
                    best = candidate;
                }
            }
        }

        if (best == null) {
            return FieldCandidate.empty();
        }
        log.debug("Selected date {} from '{}' (confidence {})", best.getValue(), best.getRawText(), best.getConfidence());
        return best;
    }
}
