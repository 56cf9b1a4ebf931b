package com.receipt.extraction.service;

import com.receipt.extraction.config.ExtractionProperties;
import com.receipt.extraction.image.DocumentLoader;
import com.receipt.extraction.image.ImagePreprocessor;
import com.receipt.extraction.model.EvaluationReport;
import com.receipt.extraction.model.ExtractionResult;
import com.receipt.extraction.model.GroundTruth;
import com.receipt.extraction.model.OcrDocument;
import com.receipt.extraction.model.OcrResponse;
import com.receipt.extraction.model.PreprocessedImage;
import com.receipt.extraction.model.PreprocessingOptions;
import com.receipt.extraction.model.ReceiptExtractionResponse;
import com.receipt.extraction.ocr.OcrEngine;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Top-level orchestrator:
 *
 *   bytes → image → preprocess → OCR → map boxes back → extract fields
 *
 * OCR runs on the preprocessed image, which may be upscaled. Boxes are scaled
 * back to the caller's image before the extractors see them, so every box in a
 * response is in original pixel coordinates.
 */
@Service
@Slf4j
public class ReceiptExtractionService {

    private final DocumentLoader documentLoader;
    private final ImagePreprocessor preprocessor;
    private final OcrEngine ocrEngine;
    private final ReceiptFieldExtractor fieldExtractor;
    private final ExtractionEvaluator evaluator;
    private final ExtractionProperties properties;

    public ReceiptExtractionService(DocumentLoader documentLoader,
                                    ImagePreprocessor preprocessor,
                                    OcrEngine ocrEngine,
                                    ReceiptFieldExtractor fieldExtractor,
                                    ExtractionEvaluator evaluator,
                                    ExtractionProperties properties) {
        this.documentLoader = documentLoader;
        this.preprocessor = preprocessor;
        this.ocrEngine = ocrEngine;
        this.fieldExtractor = fieldExtractor;
        this.evaluator = evaluator;
        this.properties = properties;
    }

    public ReceiptExtractionResponse extract(byte[] bytes, String fileName,
                                             PreprocessingOptions options, Integer confidenceThreshold) {
        long start = System.currentTimeMillis();
        PreprocessingOptions opts = options == null ? PreprocessingOptions.defaults() : options;
        int threshold = resolveThreshold(confidenceThreshold);

        // 1. OCR the document
        Recognition recognition = recognizeInternal(bytes, fileName, opts, threshold);
        OcrDocument document = recognition.getDocument();

        // 2. Extract fields
        ExtractionResult result = fieldExtractor.extract(document);

        ReceiptExtractionResponse response = new ReceiptExtractionResponse();
        response.setFileName(fileName);
        response.setExtraction(result);
        response.setWordCount(document.getWordCount());
        response.setAvgOcrConfidence(document.getAvgConfidence());
        response.setPreprocessing(opts);
        response.setAppliedSteps(recognition.getAppliedSteps());
        response.setConfidenceThreshold(threshold);
        if (document.isEmpty()) {
            response.setStatus("EMPTY");
            response.getWarnings().add("OCR produced no tokens at or above confidence " + threshold);
        }
        response.setProcessingTimeMillis(System.currentTimeMillis() - start);

        log.info("Extraction completed in {}ms for {} (status {})",
                response.getProcessingTimeMillis(), fileName, response.getStatus());
        return response;
    }

    public OcrResponse recognize(byte[] bytes, String fileName,
                                 PreprocessingOptions options, Integer confidenceThreshold) {
        long start = System.currentTimeMillis();
        PreprocessingOptions opts = options == null ? PreprocessingOptions.defaults() : options;
        int threshold = resolveThreshold(confidenceThreshold);

        Recognition recognition = recognizeInternal(bytes, fileName, opts, threshold);

        OcrResponse response = new OcrResponse();
        response.setFileName(fileName);
        response.setDocument(recognition.getDocument());
        response.setPreprocessing(opts);
        response.setAppliedSteps(recognition.getAppliedSteps());
        response.setConfidenceThreshold(threshold);
        response.setProcessingTimeMillis(System.currentTimeMillis() - start);
        return response;
    }

    /**
     * Runs the full pipeline with default preprocessing and scores the result
     * against {@code expected}.
     */
    public EvaluationReport evaluate(byte[] bytes, String fileName, GroundTruth expected) {
        PreprocessingOptions opts = PreprocessingOptions.defaults();
        Recognition recognition = recognizeInternal(bytes, fileName, opts, properties.getConfidenceThreshold());
        ExtractionResult result = fieldExtractor.extract(recognition.getDocument());
        return evaluator.evaluate(result, recognition.getDocument(), expected);
    }

    private Recognition recognizeInternal(byte[] bytes, String fileName, PreprocessingOptions options, int threshold) {
        BufferedImage image = documentLoader.load(bytes, fileName);
        PreprocessedImage processed = preprocessor.preprocess(image, options);

        OcrDocument document = ocrEngine
                .recognize(processed.getImage(), threshold)
                .rescale(1.0 / processed.getScaleFactor());

        return new Recognition(document, processed.getAppliedSteps());
    }

    private int resolveThreshold(Integer requested) {
        int threshold = requested == null ? properties.getConfidenceThreshold() : requested;
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("Confidence threshold must be between 0 and 100, got " + threshold);
        }
        return threshold;
    }

    @Value
    private static class Recognition {
        OcrDocument document;
        List<String> appliedSteps;
    }
}
