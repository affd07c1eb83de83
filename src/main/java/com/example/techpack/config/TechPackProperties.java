package com.example.techpack.config;

import com.example.techpack.domain.model.Relevance;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the tech pack parser. Every vocabulary list is optional; an
 * unset list keeps the built-in default.
 *
 * @param apiVersion                version reported by the health endpoint
 * @param noiseWords                bare component words rejected as item names or values
 * @param stopWords                 words stripped from item names
 * @param measurementKeywords       words that make a measurement label relevant
 * @param relevanceTerms            ordered term to relevance table, first hit wins; keys holding
 *                                  {@code _} must be bracketed ({@code relevance-terms.[clean_finish]})
 *                                  or relaxed binding drops the underscore
 * @param ignoreLineTerms           boilerplate patterns skipped by the item classifier
 * @param technicalIgnoreTerms      boilerplate patterns skipped by the technical table builder
 * @param measurementRowRejectTerms tokens that disqualify a base measurement label
 */
@ConfigurationProperties(prefix = "techpack")
public record TechPackProperties(
        String apiVersion,
        List<String> noiseWords,
        List<String> stopWords,
        List<String> measurementKeywords,
        Map<String, Relevance> relevanceTerms,
        List<String> ignoreLineTerms,
        List<String> technicalIgnoreTerms,
        List<String> measurementRowRejectTerms
) {

    public TechPackProperties {
        if (apiVersion == null || apiVersion.isBlank()) {
            apiVersion = "1.0.0";
        }
    }
}
