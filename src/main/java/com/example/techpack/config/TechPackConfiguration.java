package com.example.techpack.config;

import com.example.techpack.domain.model.TechPackVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;
import java.util.Map;

/**
 * Wires the {@code techpack.*} properties into the {@link TechPackVocabulary} shared by the item
 * classifier, the name resolver and the technical table builder.
 */
@Configuration
@EnableConfigurationProperties(TechPackProperties.class)
public class TechPackConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TechPackConfiguration.class);

    /**
     * Builds the shared vocabulary, letting configured lists replace the defaults one by one.
     *
     * @param properties bound {@code techpack.*} properties
     * @return immutable vocabulary injected into the parsers
     */
    @Bean
    public TechPackVocabulary techPackVocabulary(TechPackProperties properties) {
        TechPackVocabulary vocabulary = new TechPackVocabulary(
                orDefault(properties.noiseWords(), TechPackVocabulary.defaultNoiseWords()),
                orDefault(properties.stopWords(), TechPackVocabulary.defaultStopWords()),
                orDefault(properties.measurementKeywords(), TechPackVocabulary.defaultMeasurementKeywords()),
                orDefault(properties.relevanceTerms(), TechPackVocabulary.defaultRelevanceTerms()),
                orDefault(properties.ignoreLineTerms(), TechPackVocabulary.defaultIgnoreLineTerms()),
                orDefault(properties.technicalIgnoreTerms(), TechPackVocabulary.defaultTechnicalIgnoreTerms()),
                orDefault(properties.measurementRowRejectTerms(), TechPackVocabulary.defaultMeasurementRowRejectTerms())
        );
        log.info("Tech pack vocabulary ready ({} relevance terms)", vocabulary.relevanceTerms().size());
        return vocabulary;
    }

    private static <T extends Collection<?>> T orDefault(T configured, T fallback) {
        return configured == null || configured.isEmpty() ? fallback : configured;
    }

    private static <K, V> Map<K, V> orDefault(Map<K, V> configured, Map<K, V> fallback) {
        return configured == null || configured.isEmpty() ? fallback : configured;
    }
}
