package com.whereq.gridx.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerRegistryTest {

    private static CodeAnalyzer analyzer(String language) {
        return new CodeAnalyzer() {
            @Override
            public String language() {
                return language;
            }

            @Override
            public AnalysisReport analyze(String code) {
                return AnalysisReport.of(language, List.of(), List.of());
            }
        };
    }

    private final AnalyzerRegistry registry = new AnalyzerRegistry(List.of(analyzer("Python"), analyzer("lua")));

    @Test
    void blankLanguageMeansPython() {
        assertThat(registry.analyze(null, "x = 1").getLanguage()).isEqualTo("Python");
        assertThat(registry.analyze(" ", "x = 1").getLanguage()).isEqualTo("Python");
    }

    @Test
    void lookupIgnoresCase() {
        assertThat(registry.forLanguage("LUA").language()).isEqualTo("lua");
        assertThat(registry.languages()).containsExactlyInAnyOrder("python", "lua");
    }

    @Test
    void unknownLanguageIsRejected() {
        assertThatThrownBy(() -> registry.analyze("cobol", "DISPLAY 'HI'."))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unsupported language: cobol");
    }
}
