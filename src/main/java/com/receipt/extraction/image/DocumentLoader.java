package com.receipt.extraction.image;

import com.receipt.extraction.config.ExtractionProperties;
import com.receipt.extraction.exception.DocumentProcessingException;
import com.receipt.extraction.exception.UnsupportedDocumentException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * Turns uploaded bytes into a single raster image. Only the first page of a
 * PDF is rendered.
 */
@Component
@Slf4j
public class DocumentLoader {

    public static final Set<String> SUPPORTED_TYPES = Set.of("png", "jpg", "jpeg", "pdf");

    private final ExtractionProperties properties;

    public DocumentLoader(ExtractionProperties properties) {
        this.properties = properties;
    }

    public BufferedImage load(byte[] bytes, String fileName) {
        String type = fileType(fileName);
        if (bytes == null || bytes.length == 0) {
            throw new DocumentProcessingException("Document '" + fileName + "' is empty");
        }

        try {
            BufferedImage image = "pdf".equals(type) ? renderFirstPage(bytes) : ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw new DocumentProcessingException("Could not decode '" + fileName + "' as " + type);
            }
            log.info("Loaded {} ({} bytes) as {}x{} image", fileName, bytes.length, image.getWidth(), image.getHeight());
            return image;
        } catch (IOException e) {
            throw new DocumentProcessingException("Could not read '" + fileName + "': " + e.getMessage(), e);
        }
    }

    /**
     * Lower-case extension of {@code fileName}, validated against {@link #SUPPORTED_TYPES}.
     */
    public static String fileType(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new UnsupportedDocumentException("No filename provided");
        }
        int dot = fileName.lastIndexOf('.');
        String extension = dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_TYPES.contains(extension)) {
            throw new UnsupportedDocumentException(
                    "Unsupported file type '" + extension + "'. Please upload PNG, JPG, or PDF files.");
        }
        return extension;
    }

    private BufferedImage renderFirstPage(byte[] bytes) throws IOException {
        try (PDDocument doc = Loader.loadPDF(bytes)) {
            if (doc.getNumberOfPages() == 0) {
                throw new DocumentProcessingException("PDF has no pages");
            }
            return new PDFRenderer(doc).renderImageWithDPI(0, properties.getPdfDpi(), ImageType.RGB);
        }
    }
}
