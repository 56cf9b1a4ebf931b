package com.receipt.extraction.service;

import com.receipt.extraction.model.BoundingBox;
import com.receipt.extraction.model.FieldCandidate;
import com.receipt.extraction.model.OcrDocument;
import com.receipt.extraction.model.OcrToken;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.receipt.extraction.service.ReceiptFixtures.tokens;
import static org.assertj.core.api.Assertions.assertThat;

class DateExtractorTest {

    // Fixed clock sits in 2026, so 2027 is the last accepted year
    private final DateExtractor extractor =
            new DateExtractor(ReceiptFixtures.RULES, ReceiptFixtures.fuser(), ReceiptFixtures.FIXED_CLOCK);

    private FieldCandidate<LocalDate> extract(String rawText) {
        return extractor.extract(OcrDocument.of(rawText, List.of()));
    }

    @Test
    void rejectsYearsBefore2000() {
        assertThat(extract("Date: 01/15/1999").isPresent()).isFalse();
    }

    @Test
    void acceptsYear2000() {
        assertThat(extract("Date: 01/15/2000").getValue()).isEqualTo(LocalDate.of(2000, 1, 15));
    }

    @Test
    void acceptsNextYearButNotTheOneAfter() {
        assertThat(extract("Date: 01/15/2027").getValue()).isEqualTo(LocalDate.of(2027, 1, 15));
        assertThat(extract("Date: 01/15/2028").isPresent()).isFalse();
    }

    @Test
    void picksTheMostConfidentCandidate() {
        OcrDocument doc = OcrDocument.of(
                "Order 01/05/2024\nShipped 02/06/2024",
                tokens("01/05/2024", 40, "02/06/2024", 90));

        FieldCandidate<LocalDate> date = extractor.extract(doc);

        assertThat(date.getValue()).isEqualTo(LocalDate.of(2024, 2, 6));
        assertThat(date.getConfidence()).isEqualTo(0.9);
        assertThat(date.getRawText()).isEqualTo("02/06/2024");
        assertThat(date.getSourceBox()).isEqualTo(doc.getTokens().get(1).getBox());
    }

    @Test
    void tiesGoToTheEarlierPatternThenEarlierPosition() {
        // no tokens, so every candidate scores the 0.5 default
        assertThat(extract("Issued 2024-01-10 due 02/20/2024").getValue()).isEqualTo(LocalDate.of(2024, 2, 20));
        assertThat(extract("03/01/2024 then 04/01/2024").getValue()).isEqualTo(LocalDate.of(2024, 3, 1));
    }

    @Test
    void readsMonthNameDates() {
        OcrDocument doc = OcrDocument.of("Visit on March 15, 2024", List.of(
                new OcrToken("March", new BoundingBox(0, 0, 50, 10), 88),
                new OcrToken("15,", new BoundingBox(55, 0, 70, 10), 90),
                new OcrToken("2024", new BoundingBox(75, 0, 110, 10), 92)));

        FieldCandidate<LocalDate> date = extractor.extract(doc);

        assertThat(date.getValue()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(date.getRawText()).isEqualTo("March 15, 2024");
        assertThat(date.getConfidence()).isEqualTo(0.9);
    }

    @Test
    void discardsUnparseableMatchesAndKeepsScanning() {
        assertThat(extract("Ref 13/13/2024 Date 12/01/2024").getValue()).isEqualTo(LocalDate.of(2024, 12, 1));
    }

    @Test
    void noDateIsASoftMiss() {
        FieldCandidate<LocalDate> date = extract("THANK YOU FOR SHOPPING");

        assertThat(date.getValue()).isNull();
        assertThat(date.getConfidence()).isZero();
        assertThat(extractor.extract(OcrDocument.empty()).isPresent()).isFalse();
    }
}
