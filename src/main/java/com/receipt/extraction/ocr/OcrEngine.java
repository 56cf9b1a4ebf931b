package com.receipt.extraction.ocr;

import com.receipt.extraction.model.OcrDocument;

import java.awt.image.BufferedImage;

/**
 * Converts an image into words, boxes and confidences.
 *
 * Implementations must not throw: a failed recognition is reported as
 * {@link OcrDocument#empty()} so extraction degrades to soft misses.
 */
public interface OcrEngine {

    /**
     * @param image               image to recognize, already preprocessed
     * @param confidenceThreshold tokens with confidence (0-100) below this are dropped
     * @return recognized text and tokens, box coordinates in {@code image}'s pixel space
     */
    OcrDocument recognize(BufferedImage image, int confidenceThreshold);
}
