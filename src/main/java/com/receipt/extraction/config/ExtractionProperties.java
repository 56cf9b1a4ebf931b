package com.receipt.extraction.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "receipt.extraction")
public class ExtractionProperties {

    /**
     * Tokens whose OCR confidence (0-100) is below this are dropped.
     */
    private int confidenceThreshold = 30;

    /**
     * Resolution used when rasterizing the first page of a PDF.
     */
    private float pdfDpi = 300f;

    private Tesseract tesseract = new Tesseract();

    @Data
    public static class Tesseract {

        /**
         * Directory holding the *.traineddata files. Null lets Tess4J use TESSDATA_PREFIX.
         */
        private String datapath;

        private String language = "eng";

        /** 3 = default engine (legacy + LSTM as available). */
        private int ocrEngineMode = 3;

        /** 6 = assume a single uniform block of text. */
        private int pageSegMode = 6;
    }
}
