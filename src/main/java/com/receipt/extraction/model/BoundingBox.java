package com.receipt.extraction.model;

import lombok.Value;

/**
 * Axis-aligned pixel box, (x1, y1) top-left and (x2, y2) bottom-right.
 */
@Value
public class BoundingBox {

    int x1;
    int y1;
    int x2;
    int y2;

    public static BoundingBox ofRectangle(int left, int top, int width, int height) {
        return new BoundingBox(left, top, left + width, top + height);
    }

    public BoundingBox scale(double factor) {
        return new BoundingBox(
                (int) Math.round(x1 * factor),
                (int) Math.round(y1 * factor),
                (int) Math.round(x2 * factor),
                (int) Math.round(y2 * factor));
    }
}
