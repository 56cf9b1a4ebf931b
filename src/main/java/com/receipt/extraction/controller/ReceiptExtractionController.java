package com.receipt.extraction.controller;

import com.receipt.extraction.exception.DocumentProcessingException;
import com.receipt.extraction.exception.UnsupportedDocumentException;
import com.receipt.extraction.model.GroundTruth;
import com.receipt.extraction.model.OcrResponse;
import com.receipt.extraction.model.PreprocessingOptions;
import com.receipt.extraction.model.ReceiptExtractionResponse;
import com.receipt.extraction.service.ReceiptExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/receipts")
@Slf4j
public class ReceiptExtractionController {

    private final ReceiptExtractionService extractionService;

    public ReceiptExtractionController(ReceiptExtractionService extractionService) {
        this.extractionService = extractionService;
    }

    /**
     * Full pipeline: preprocessing, OCR and field extraction.
     * Every preprocessing switch defaults to on; the threshold defaults to the configured value.
     */
    @PostMapping("/extract")
    public ResponseEntity<ReceiptExtractionResponse> extract(
            @RequestParam("file") MultipartFile file,
            @RequestParam(defaultValue = "true") boolean grayscale,
            @RequestParam(defaultValue = "true") boolean denoise,
            @RequestParam(defaultValue = "true") boolean deskew,
            @RequestParam(defaultValue = "true") boolean upscale,
            @RequestParam(defaultValue = "true") boolean binarize,
            @RequestParam(required = false) Integer confidenceThreshold) {

        PreprocessingOptions options = new PreprocessingOptions(grayscale, denoise, deskew, upscale, binarize);
        try {
            log.info("Processing extraction for file: {}", file.getOriginalFilename());
            return ResponseEntity.ok(extractionService.extract(
                    file.getBytes(), file.getOriginalFilename(), options, confidenceThreshold));
        } catch (Exception e) {
            return failure(file, e);
        }
    }

    /**
     * OCR only: raw text, tokens, boxes and confidences.
     */
    @PostMapping("/ocr")
    public ResponseEntity<?> ocr(
            @RequestParam("file") MultipartFile file,
            @RequestParam(defaultValue = "true") boolean grayscale,
            @RequestParam(defaultValue = "true") boolean denoise,
            @RequestParam(defaultValue = "true") boolean deskew,
            @RequestParam(defaultValue = "true") boolean upscale,
            @RequestParam(defaultValue = "true") boolean binarize,
            @RequestParam(required = false) Integer confidenceThreshold) {

        PreprocessingOptions options = new PreprocessingOptions(grayscale, denoise, deskew, upscale, binarize);
        try {
            log.info("Processing OCR for file: {}", file.getOriginalFilename());
            OcrResponse response = extractionService.recognize(
                    file.getBytes(), file.getOriginalFilename(), options, confidenceThreshold);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return failure(file, e);
        }
    }

    /**
     * Runs the pipeline and scores it against the supplied expected values.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String vendor,
            @RequestParam(required = false) String date,
            @RequestParam(required = false) Double subtotal,
            @RequestParam(required = false) Double tax,
            @RequestParam(required = false) Double total,
            @RequestParam(defaultValue = "20") int expectedWordsMin) {

        GroundTruth expected = new GroundTruth(vendor, date, subtotal, tax, total, expectedWordsMin);
        try {
            return ResponseEntity.ok(extractionService.evaluate(file.getBytes(), file.getOriginalFilename(), expected));
        } catch (Exception e) {
            return failure(file, e);
        }
    }

    private ResponseEntity<ReceiptExtractionResponse> failure(MultipartFile file, Exception e) {
        ReceiptExtractionResponse error = ReceiptExtractionResponse.error(file.getOriginalFilename(), e.getMessage());

        if (e instanceof UnsupportedDocumentException || e instanceof IllegalArgumentException) {
            log.warn("Rejected {}: {}", file.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().body(error);
        }
        if (e instanceof DocumentProcessingException) {
            log.warn("Could not process {}: {}", file.getOriginalFilename(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
        }

        log.error("Extraction failed", e);
        return ResponseEntity.internalServerError().body(error);
    }
}
