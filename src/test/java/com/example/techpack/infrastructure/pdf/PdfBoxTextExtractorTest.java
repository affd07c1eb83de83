package com.example.techpack.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the PDFBox line extractor.
 */
class PdfBoxTextExtractorTest {

    private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor();

    @Test
    void extractsLinesPageByPage() throws Exception {
        byte[] pdf = createPdf(List.of("COLLAR", "Collar stand height 2.5cm"), List.of("SNLS stitch SPI 12"));

        List<String> lines = extractor.extractLines(pdf).stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();

        assertThat(lines).containsExactly("COLLAR", "Collar stand height 2.5cm", "SNLS stitch SPI 12");
    }

    @Test
    void readsFromDisk(@TempDir Path tempDir) throws Exception {
        Path pdf = tempDir.resolve("pack.pdf");
        Files.write(pdf, createPdf(List.of("Hem XS-5cm S-7cm")));

        assertThat(extractor.extractLines(pdf)).anyMatch(line -> line.contains("Hem XS-5cm S-7cm"));
    }

    /**
     * Unreadable content is logged and yields no lines instead of an exception.
     */
    @Test
    void corruptOrMissingDocumentsYieldNoLines(@TempDir Path tempDir) {
        assertThat(extractor.extractLines("not a pdf".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(extractor.extractLines(new byte[0])).isEmpty();
        assertThat(extractor.extractLines(tempDir.resolve("missing.pdf"))).isEmpty();
    }

    @SafeVarargs
    static byte[] createPdf(List<String>... pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            for (List<String> lines : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    contentStream.setLeading(18);
                    contentStream.newLineAtOffset(72, 700);
                    for (String line : lines) {
                        contentStream.showText(line);
                        contentStream.newLine();
                    }
                    contentStream.endText();
                }
            }

            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }
}
