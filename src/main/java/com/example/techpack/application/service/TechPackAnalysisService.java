package com.example.techpack.application.service;

import com.example.techpack.application.parser.BaseInformationExtractor;
import com.example.techpack.application.parser.ItemClassifier;
import com.example.techpack.application.parser.TechPackResultAssembler;
import com.example.techpack.application.parser.TechnicalTableBuilder;
import com.example.techpack.domain.exception.TechPackFileRequiredException;
import com.example.techpack.domain.exception.TechPackPathRequiredException;
import com.example.techpack.domain.exception.UnsupportedDocumentFormatException;
import com.example.techpack.domain.model.AnalysisFeature;
import com.example.techpack.domain.model.BaseInformation;
import com.example.techpack.domain.model.ComponentTables;
import com.example.techpack.domain.model.GarmentComponent;
import com.example.techpack.domain.model.Section;
import com.example.techpack.domain.model.TechPackAnalysis;
import com.example.techpack.domain.model.TechPackItem;
import com.example.techpack.infrastructure.exception.DocumentReadException;
import com.example.techpack.infrastructure.pdf.PdfBoxTextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Application-layer service that orchestrates tech pack analysis.
 * It validates inputs, delegates text extraction to PDFBox and runs the requested engines over
 * the extracted lines.
 */
@Service
public class TechPackAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TechPackAnalysisService.class);

    private final PdfBoxTextExtractor textExtractor;
    private final ItemClassifier itemClassifier;
    private final TechnicalTableBuilder technicalTableBuilder;
    private final BaseInformationExtractor baseInformationExtractor;
    private final TechPackResultAssembler resultAssembler;

    /**
     * Creates the service with its extraction and classification collaborators.
     *
     * @param textExtractor            PDF to line adapter
     * @param itemClassifier           item-mode engine
     * @param technicalTableBuilder    table-mode engine
     * @param baseInformationExtractor header fact extractor
     * @param resultAssembler          final merge step
     */
    public TechPackAnalysisService(PdfBoxTextExtractor textExtractor,
                                   ItemClassifier itemClassifier,
                                   TechnicalTableBuilder technicalTableBuilder,
                                   BaseInformationExtractor baseInformationExtractor,
                                   TechPackResultAssembler resultAssembler) {
        this.textExtractor = textExtractor;
        this.itemClassifier = itemClassifier;
        this.technicalTableBuilder = technicalTableBuilder;
        this.baseInformationExtractor = baseInformationExtractor;
        this.resultAssembler = resultAssembler;
    }

    public TechPackAnalysis analyze(MultipartFile file) {
        return analyze(file, AnalysisFeature.everything());
    }

    /**
     * Analyzes an uploaded tech pack.
     *
     * @param file     uploaded PDF
     * @param features parts of the analysis to compute; empty means all
     * @return analysis envelope, empty when the PDF holds no readable text
     * @throws TechPackFileRequiredException       when the file is missing or empty
     * @throws UnsupportedDocumentFormatException when the upload does not look like a PDF
     * @throws DocumentReadException              when the upload stream cannot be read
     */
    public TechPackAnalysis analyze(MultipartFile file, Set<AnalysisFeature> features) {
        if (file == null || file.isEmpty()) {
            throw new TechPackFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedDocumentFormatException(file.getOriginalFilename());
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new DocumentReadException("Unable to read the uploaded tech pack.", e);
        }
        log.info("Analyzing upload {} ({} bytes)", resolveFileName(file), bytes.length);
        return analyzeLines(textExtractor.extractLines(bytes), features);
    }

    public TechPackAnalysis analyze(Path pdfPath) {
        return analyze(pdfPath, AnalysisFeature.everything());
    }

    /**
     * Analyzes a tech pack on disk. A missing or unreadable file produces the empty envelope.
     *
     * @param pdfPath  path to the PDF
     * @param features parts of the analysis to compute; empty means all
     * @return analysis envelope
     * @throws TechPackPathRequiredException when {@code pdfPath} is null
     */
    public TechPackAnalysis analyze(Path pdfPath, Set<AnalysisFeature> features) {
        if (pdfPath == null) {
            throw new TechPackPathRequiredException();
        }
        log.info("Analyzing {}", pdfPath);
        return analyzeLines(textExtractor.extractLines(pdfPath), features);
    }

    /**
     * Runs the requested engines over lines that were already extracted.
     *
     * @param lines    document lines in reading order
     * @param features parts of the analysis to compute; empty means all
     * @return analysis envelope
     */
    public TechPackAnalysis analyzeLines(List<String> lines, Set<AnalysisFeature> features) {
        EnumSet<AnalysisFeature> requested = normalizeFeatures(features);
        List<String> safeLines = lines == null ? List.of() : lines;

        Map<Section, List<TechPackItem>> items = requested.contains(AnalysisFeature.SECTION_ITEMS)
                ? itemClassifier.classify(safeLines)
                : Map.of();
        Map<GarmentComponent, ComponentTables> tables = requested.contains(AnalysisFeature.TECHNICAL_TABLE)
                ? technicalTableBuilder.collect(safeLines)
                : Map.of();
        BaseInformation baseInformation = requested.contains(AnalysisFeature.BASE_INFORMATION)
                ? baseInformationExtractor.extract(safeLines)
                : BaseInformation.empty();

        TechPackAnalysis analysis = resultAssembler.assemble(items, tables, baseInformation);
        log.info("Analyzed {} lines: {} items, {} components",
                safeLines.size(),
                analysis.getSections().values().stream().mapToInt(List::size).sum(),
                analysis.getTechnicalTable().components().size());
        return analysis;
    }

    /**
     * @param features caller-supplied feature list
     * @return copy to avoid mutating inputs, or {@link AnalysisFeature#everything()} when empty
     */
    private EnumSet<AnalysisFeature> normalizeFeatures(Set<AnalysisFeature> features) {
        if (features == null || features.isEmpty()) {
            return AnalysisFeature.everything();
        }
        return EnumSet.copyOf(features);
    }

    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
