package com.receipt.extraction.service;

import com.receipt.extraction.model.FieldCandidate;
import com.receipt.extraction.model.OcrDocument;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.receipt.extraction.service.ReceiptFixtures.tokens;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VendorExtractorTest {

    private final VendorExtractor extractor = new VendorExtractor(ReceiptFixtures.RULES, ReceiptFixtures.fuser());

    @Test
    void picksTheHeaderLineAndTitleCasesIt() {
        OcrDocument doc = ReceiptFixtures.techMartReceipt();

        FieldCandidate<String> vendor = extractor.extract(doc);

        assertThat(vendor.getValue()).isEqualTo("Tech Mart Electronics");
        assertThat(vendor.getRawText()).isEqualTo("TECH MART ELECTRONICS");
        // 0.4 * position 1.0 + 0.2 * length 21/50 + 0.4 * ocr 0.91
        assertThat(vendor.getConfidence()).isCloseTo(0.848, within(1e-9));
        assertThat(vendor.getSourceBox()).isEqualTo(doc.getTokens().get(0).getBox());
    }

    @Test
    void documentKeywordLinesAreNeverTheVendor() {
        OcrDocument doc = OcrDocument.of("INVOICE #4471\nBLUE BOTTLE COFFEE",
                tokens("INVOICE", 99, "#4471", 99, "BLUE", 60, "BOTTLE", 60, "COFFEE", 60));

        assertThat(extractor.extract(doc).getValue()).isEqualTo("Blue Bottle Coffee");
    }

    @Test
    void blankLinesStillCountTowardPosition() {
        OcrDocument doc = OcrDocument.of("\nFIRST SHOP\nOTHER SHOP", List.of());

        FieldCandidate<String> vendor = extractor.extract(doc);

        assertThat(vendor.getValue()).isEqualTo("First Shop");
        assertThat(vendor.getConfidence()).isCloseTo(0.4 * 0.9 + 0.2 * 10 / 50.0 + 0.4 * 0.5, within(1e-9));
    }

    @Test
    void onlyTheFirstTenLinesAreSearched() {
        String header = String.join("\n", Collections.nCopies(10, "TOTAL 1.00"));
        OcrDocument doc = OcrDocument.of(header + "\nLATE VENDOR NAME", List.of());

        assertThat(extractor.extract(doc).isPresent()).isFalse();
    }

    @Test
    void noCandidateIsASoftMiss() {
        FieldCandidate<String> vendor = extractor.extract(OcrDocument.empty());

        assertThat(vendor.getValue()).isNull();
        assertThat(vendor.getConfidence()).isZero();
        assertThat(vendor.getSourceBox()).isNull();
    }

    @Test
    void rejectsStopWordsDigitHeavyAndBadLengthLines() {
        assertThat(extractor.isVendorCandidate("Cash Register 2")).isFalse();
        assertThat(extractor.isVendorCandidate("555-1234 x9")).isFalse();
        assertThat(extractor.isVendorCandidate("AB")).isFalse();
        assertThat(extractor.isVendorCandidate("X".repeat(101))).isFalse();

        assertThat(extractor.isVendorCandidate("ABC")).isTrue();
        assertThat(extractor.isVendorCandidate("7 ELEVEN")).isTrue();
        assertThat(extractor.isVendorCandidate("X".repeat(100))).isTrue();
    }

    @Test
    void titleCasesEveryLetterRun() {
        assertThat(VendorExtractor.titleCase("TECH MART")).isEqualTo("Tech Mart");
        assertThat(VendorExtractor.titleCase("o'neil hardware")).isEqualTo("O'Neil Hardware");
        assertThat(VendorExtractor.titleCase("7-ELEVEN")).isEqualTo("7-Eleven");
    }
}
