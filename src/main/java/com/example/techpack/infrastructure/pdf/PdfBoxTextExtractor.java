package com.example.techpack.infrastructure.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure adapter that turns PDF bytes into the ordered text lines the parsers consume.
 * Text is stripped page by page in reading order. An unreadable document yields no lines, so the
 * caller still receives an empty result instead of an error.
 */
@Service
public class PdfBoxTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);

    /**
     * @param pdfBytes raw PDF content
     * @return lines of every page in order, or an empty list when PDFBox cannot read the bytes
     */
    public List<String> extractLines(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            return List.of();
        }
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            return extractLines(document);
        } catch (IOException e) {
            log.error("Unable to extract text from PDF ({} bytes): {}", pdfBytes.length, e.getMessage());
            return List.of();
        }
    }

    /**
     * @param pdfPath PDF on disk
     * @return lines of every page in order, or an empty list when the file is missing or unreadable
     */
    public List<String> extractLines(Path pdfPath) {
        if (!Files.isRegularFile(pdfPath)) {
            log.error("Tech pack not found: {}", pdfPath.toAbsolutePath());
            return List.of();
        }
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            return extractLines(document);
        } catch (IOException e) {
            log.error("Unable to extract text from {}: {}", pdfPath, e.getMessage());
            return List.of();
        }
    }

    private List<String> extractLines(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");
        stripper.setSortByPosition(true);
        List<String> lines = new ArrayList<>();
        for (int page = 1; page <= document.getNumberOfPages(); page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            String text = stripper.getText(document);
            if (text != null) {
                text.lines().forEach(lines::add);
            }
        }
        log.debug("Extracted {} lines from {} pages", lines.size(), document.getNumberOfPages());
        return lines;
    }
}
