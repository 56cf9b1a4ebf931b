package com.receipt.extraction.model;

import lombok.Value;

/**
 * A single recognized word. Confidence is on Tesseract's 0-100 scale.
 */
@Value
public class OcrToken {

    String text;
    BoundingBox box;
    int confidence;

    public OcrToken rescale(double factor) {
        return new OcrToken(text, box == null ? null : box.scale(factor), confidence);
    }
}
