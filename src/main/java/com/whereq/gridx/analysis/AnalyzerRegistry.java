package com.whereq.gridx.analysis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Selects the analyzer front-end for a submission language
 */
@Slf4j
@Service
public class AnalyzerRegistry {

    public static final String DEFAULT_LANGUAGE = "python";

    private final Map<String, CodeAnalyzer> analyzers;

    public AnalyzerRegistry(List<CodeAnalyzer> analyzers) {
        this.analyzers = analyzers.stream()
            .collect(Collectors.toMap(a -> a.language().toLowerCase(Locale.ROOT), Function.identity()));
        log.info("Registered code analyzers: {}", this.analyzers.keySet());
    }

    /**
     * Get analyzer by language, blank means {@value #DEFAULT_LANGUAGE}
     *
     * @throws IllegalArgumentException if no analyzer handles the language
     */
    public CodeAnalyzer forLanguage(String language) {
        String key = language == null || language.isBlank()
            ? DEFAULT_LANGUAGE
            : language.toLowerCase(Locale.ROOT);
        CodeAnalyzer analyzer = analyzers.get(key);
        if (analyzer == null) {
            throw new IllegalArgumentException("Unsupported language: " + language);
        }
        return analyzer;
    }

    public AnalysisReport analyze(String language, String code) {
        return forLanguage(language).analyze(code);
    }

    public Set<String> languages() {
        return analyzers.keySet();
    }
}
