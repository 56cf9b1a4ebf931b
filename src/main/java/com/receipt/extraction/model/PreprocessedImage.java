package com.receipt.extraction.model;

import lombok.Value;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * An image ready for OCR. {@code scaleFactor} is how much larger this image is
 * than the one the caller supplied; OCR boxes are divided by it.
 */
@Value
public class PreprocessedImage {

    BufferedImage image;
    double scaleFactor;
    List<String> appliedSteps;
}
