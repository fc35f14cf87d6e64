package de.mirkosertic.mcp.docnav.mcp.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SearchRequest Tests")
class SearchRequestTest {

    @Test
    @DisplayName("Should split the comma-separated file filter")
    void shouldSplitFiles() {
        final SearchRequest request = SearchRequest.fromMap(Map.of("query", "q", "files", " a.md, docs/b.md ,,a.md "));

        assertThat(request.fileFilter()).containsExactly("a.md", "docs/b.md");
    }

    @Test
    @DisplayName("Should accept the file filter as a list")
    void shouldAcceptFileList() {
        final SearchRequest request = SearchRequest.fromMap(Map.of("query", "q", "files", List.of("a.md", "b.md")));

        assertThat(request.fileFilter()).containsExactly("a.md", "b.md");
    }

    @Test
    @DisplayName("Should not filter without files")
    void shouldNotFilterByDefault() {
        assertThat(SearchRequest.fromMap(Map.of("query", "q")).fileFilter()).isNull();
        assertThat(SearchRequest.fromMap(Map.of("query", "q", "files", " , ")).fileFilter()).isNull();
    }

    @Test
    @DisplayName("Should apply limit defaults and bounds")
    void shouldApplyLimits() {
        assertThat(SearchRequest.fromMap(Map.of("query", "q")).effectiveLimit(5, 50)).isEqualTo(5);
        assertThat(SearchRequest.fromMap(Map.of("query", "q", "limit", 0)).effectiveLimit(5, 50)).isEqualTo(5);
        assertThat(SearchRequest.fromMap(Map.of("query", "q", "limit", 12)).effectiveLimit(5, 50)).isEqualTo(12);
        assertThat(SearchRequest.fromMap(Map.of("query", "q", "limit", 500)).effectiveLimit(5, 50)).isEqualTo(50);
    }

    @Test
    @DisplayName("Should include previews unless disabled")
    void shouldDefaultPreviews() {
        assertThat(SearchRequest.fromMap(Map.of("query", "q")).effectiveIncludePreview()).isTrue();
        assertThat(SearchRequest.fromMap(Map.of("query", "q", "includePreview", false)).effectiveIncludePreview()).isFalse();
    }
}
