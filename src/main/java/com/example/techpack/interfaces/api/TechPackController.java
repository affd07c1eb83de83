package com.example.techpack.interfaces.api;

import com.example.techpack.application.service.TechPackAnalysisService;
import com.example.techpack.domain.model.AnalysisFeature;
import com.example.techpack.domain.model.TechPackAnalysis;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.EnumSet;
import java.util.List;

/**
 * Interfaces-layer REST controller that accepts tech pack uploads and returns the analysis as JSON.
 */
@RestController
@RequestMapping("/api/techpack")
public class TechPackController {

    private final TechPackAnalysisService analysisService;

    public TechPackController(TechPackAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    /**
     * @param file          uploaded PDF
     * @param featureParams requested feature list (optional, repeated {@code features} parameter)
     * @return analysis envelope
     */
    @PostMapping(value = "/analyze", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TechPackAnalysis> analyze(@RequestParam("file") MultipartFile file,
                                                    @RequestParam(value = "features", required = false) List<String> featureParams) {
        EnumSet<AnalysisFeature> features = AnalysisFeature.parseRequested(featureParams);
        return ResponseEntity.ok(analysisService.analyze(file, features));
    }
}
