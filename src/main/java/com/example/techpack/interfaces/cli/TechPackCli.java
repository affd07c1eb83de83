package com.example.techpack.interfaces.cli;

import com.example.techpack.application.parser.BaseInformationExtractor;
import com.example.techpack.application.parser.ItemClassifier;
import com.example.techpack.application.parser.NameResolver;
import com.example.techpack.application.parser.TechPackPatterns;
import com.example.techpack.application.parser.TechPackResultAssembler;
import com.example.techpack.application.parser.TechnicalLineClassifier;
import com.example.techpack.application.parser.TechnicalTableBuilder;
import com.example.techpack.application.parser.UnitNormalizer;
import com.example.techpack.application.service.TechPackAnalysisService;
import com.example.techpack.domain.exception.DomainException;
import com.example.techpack.domain.model.TechPackAnalysis;
import com.example.techpack.domain.model.TechPackVocabulary;
import com.example.techpack.infrastructure.pdf.PdfBoxTextExtractor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line entry point: analyzes one tech pack and prints the envelope as indented JSON.
 * Runs without the Spring context; logs go to stderr so stdout only carries JSON.
 */
public final class TechPackCli {

    static final String USAGE = "Usage: techpack-cli <pdf_path>";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final TechPackAnalysisService analysisService;

    TechPackCli(TechPackAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    public static void main(String[] args) {
        System.exit(new TechPackCli(defaultService()).run(args, System.out, System.err));
    }

    /**
     * @param args command-line arguments, the first one being the PDF path
     * @param out  receives the JSON document
     * @param err  receives usage and validation messages
     * @return process exit code
     */
    int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length < 1 || args[0].isBlank()) {
            err.println(USAGE);
            return 1;
        }
        try {
            TechPackAnalysis analysis = analysisService.analyze(Path.of(args[0]));
            out.println(MAPPER.writeValueAsString(analysis));
            return 0;
        } catch (DomainException ex) {
            err.println(ex.getMessage());
            return 1;
        } catch (JsonProcessingException ex) {
            err.println("Unable to write the analysis: " + ex.getOriginalMessage());
            return 1;
        }
    }

    static TechPackAnalysisService defaultService() {
        TechPackVocabulary vocabulary = TechPackVocabulary.defaults();
        TechPackPatterns patterns = new TechPackPatterns();
        UnitNormalizer unitNormalizer = new UnitNormalizer();
        return new TechPackAnalysisService(
                new PdfBoxTextExtractor(),
                new ItemClassifier(patterns, new NameResolver(vocabulary), vocabulary),
                new TechnicalTableBuilder(patterns, unitNormalizer, new TechnicalLineClassifier(patterns), vocabulary),
                new BaseInformationExtractor(),
                new TechPackResultAssembler()
        );
    }
}
