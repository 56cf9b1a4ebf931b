package com.receipt.extraction.ocr;

import com.receipt.extraction.config.ExtractionProperties;
import com.receipt.extraction.model.BoundingBox;
import com.receipt.extraction.model.OcrDocument;
import com.receipt.extraction.model.OcrToken;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI.TessPageIteratorLevel;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.springframework.stereotype.Component;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

@Component
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    private final ExtractionProperties.Tesseract settings;

    public TesseractOcrEngine(ExtractionProperties properties) {
        this.settings = properties.getTesseract();
    }

    @Override
    public OcrDocument recognize(BufferedImage image, int confidenceThreshold) {
        try {
            ITesseract tesseract = newTesseract();

            List<Word> words = tesseract.getWords(image, TessPageIteratorLevel.RIL_WORD);
            String text = tesseract.doOCR(image);

            OcrDocument document = OcrDocument.of(text, toTokens(words, confidenceThreshold));
            log.info("OCR found {} tokens (avg confidence {}) above threshold {}",
                    document.getWordCount(), String.format("%.1f", document.getAvgConfidence()), confidenceThreshold);
            return document;
        } catch (Exception | LinkageError e) {
            log.error("OCR extraction failed: {}", e.getMessage(), e);
            return OcrDocument.empty();
        }
    }

    static List<OcrToken> toTokens(List<Word> words, int confidenceThreshold) {
        List<OcrToken> tokens = new ArrayList<>();
        for (Word word : words) {
            String text = word.getText() == null ? "" : word.getText().trim();
            int confidence = Math.round(word.getConfidence());
            if (text.isEmpty() || confidence < confidenceThreshold) continue;

            Rectangle r = word.getBoundingBox();
            tokens.add(new OcrToken(text, BoundingBox.ofRectangle(r.x, r.y, r.width, r.height), confidence));
        }
        return tokens;
    }

    // Tesseract instances hold native handles and are not safe to share between threads
    private ITesseract newTesseract() {
        Tesseract tesseract = new Tesseract();
        if (settings.getDatapath() != null && !settings.getDatapath().isBlank()) {
            tesseract.setDatapath(settings.getDatapath());
        }
        tesseract.setLanguage(settings.getLanguage());
        tesseract.setOcrEngineMode(settings.getOcrEngineMode());
        tesseract.setPageSegMode(settings.getPageSegMode());
        return tesseract;
    }
}
