package com.receipt.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreprocessingOptions {

    @Builder.Default
    private boolean grayscale = true;

    @Builder.Default
    private boolean denoise = true;

    @Builder.Default
    private boolean deskew = true;

    @Builder.Default
    private boolean upscale = true;

    @Builder.Default
    private boolean binarize = true;

    public static PreprocessingOptions defaults() {
        return PreprocessingOptions.builder().build();
    }

    public static PreprocessingOptions none() {
        return new PreprocessingOptions(false, false, false, false, false);
    }
}
