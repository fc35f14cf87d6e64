package de.mirkosertic.mcp.docnav.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilePatternMatcher Tests")
class FilePatternMatcherTest {

    private final FilePatternMatcher matcher = new FilePatternMatcher(
            List.of(".md", ".txt", ".rst", ".py", ".js", ".ts", ".json"),
            List.of("node_modules", ".git", "__pycache__", "archive"),
            List.of(".md", ".txt", ".rst"));

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"README.md", "docs/guide.rst", "src/app.py", "web/index.ts", "package.json", "NOTES.TXT"})
    @DisplayName("Should include")
    void shouldInclude(final String path) {
        assertThat(matcher.shouldInclude(path)).isTrue();
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"logo.png", "build/app.class", "node_modules/lib/readme.md", ".git/HEAD.txt",
            "src/__pycache__/mod.py", "docs/archive/2019.md", "docs/archived-notes.md", "Makefile"})
    @DisplayName("Should exclude")
    void shouldExclude(final String path) {
        assertThat(matcher.shouldInclude(path)).isFalse();
    }

    @Test
    @DisplayName("Should match exclusions as path substrings")
    void shouldMatchSubstrings() {
        assertThat(matcher.isExcluded("tools/.github/workflow.md")).isTrue();
        assertThat(matcher.isExcluded("docs/guide.md")).isFalse();
    }

    @Test
    @DisplayName("Should distinguish structured text from code")
    void shouldDetectStructuredFiles() {
        assertThat(matcher.isStructured("docs/guide.md")).isTrue();
        assertThat(matcher.isStructured("CHANGES.RST")).isTrue();
        assertThat(matcher.isStructured("src/app.py")).isFalse();
        assertThat(matcher.isStructured("config.json")).isFalse();
    }

    @Test
    @DisplayName("Should accept extensions without leading dot")
    void shouldNormalizeExtensions() {
        final FilePatternMatcher bare = new FilePatternMatcher(List.of("MD"), List.of(), List.of("md"));

        assertThat(bare.shouldInclude("guide.md")).isTrue();
        assertThat(bare.isStructured("guide.md")).isTrue();
        assertThat(bare.shouldInclude("guide.txt")).isFalse();
    }
}
