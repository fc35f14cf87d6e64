package de.mirkosertic.mcp.docnav.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DocumentSplitter Tests")
class DocumentSplitterTest {

    @Test
    @DisplayName("Should split at headings with full labels")
    void shouldSplitAtHeadings() {
        final String text = "# Guide\nIntro to the guide\n## Install\nRun the installer\n";

        final List<DocumentSplitter.Chunk> chunks = DocumentSplitter.byHeadings(text, "guide.md");

        assertThat(chunks).extracting(DocumentSplitter.Chunk::label).containsExactly("Guide", "Guide > Install");
        assertThat(chunks).extracting(DocumentSplitter.Chunk::index).containsExactly(0, 1);
        assertThat(chunks.get(1).lineStart()).isEqualTo(2);
        assertThat(chunks.get(1).lineEnd()).isEqualTo(4);
        assertThat(chunks.get(1).chars()).isEqualTo("Run the installer".length());
        assertThat(chunks.get(1).tokens()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should split into fixed line windows")
    void shouldSplitIntoLineWindows() {
        final String text = "one\ntwo\nthree\nfour\nfive\n";

        final List<DocumentSplitter.Chunk> chunks = DocumentSplitter.byLines(text, 2);

        assertThat(chunks).extracting(DocumentSplitter.Chunk::label)
                .containsExactly("lines 1-2", "lines 3-4", "lines 5-5");
        assertThat(chunks).extracting(DocumentSplitter.Chunk::lineStart).containsExactly(0, 2, 4);
        assertThat(chunks).extracting(DocumentSplitter.Chunk::lineEnd).containsExactly(2, 4, 5);
        assertThat(chunks.get(0).chars()).isEqualTo("one\ntwo".length());
        assertThat(chunks.get(0).tokens()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should produce no line windows for empty text")
    void shouldHandleEmptyText() {
        assertThat(DocumentSplitter.byLines("", 10)).isEmpty();
    }

    @Test
    @DisplayName("Should reject non-positive window sizes")
    void shouldRejectInvalidChunkSize() {
        assertThatThrownBy(() -> DocumentSplitter.byLines("text", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should dispatch on the split mode")
    void shouldDispatchOnMode() {
        final String text = "# A\nalpha\n# B\nbeta\n";

        assertThat(DocumentSplitter.split(text, "ab.md", SplitMode.HEADINGS, 1)).hasSize(2);
        assertThat(DocumentSplitter.split(text, "ab.md", SplitMode.LINES, 1)).hasSize(4);
    }

    @Test
    @DisplayName("Should parse split modes case-insensitively")
    void shouldParseModes() {
        assertThat(SplitMode.parse("Lines")).isEqualTo(SplitMode.LINES);
        assertThat(SplitMode.parse(" headings ")).isEqualTo(SplitMode.HEADINGS);
        assertThatThrownBy(() -> SplitMode.parse("pages")).isInstanceOf(IllegalArgumentException.class);
    }
}
