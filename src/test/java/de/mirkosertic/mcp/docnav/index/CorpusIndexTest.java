package de.mirkosertic.mcp.docnav.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CorpusIndex Tests")
class CorpusIndexTest {

    @Test
    @DisplayName("Should order distinctive terms by IDF, then alphabetically")
    void shouldOrderDistinctiveTerms() {
        final Map<String, Double> idf = new LinkedHashMap<>();
        idf.put("common", 0.3);
        idf.put("zebra", 1.5);
        idf.put("apple", 1.5);
        idf.put("middle", 0.9);
        final CorpusIndex index = new CorpusIndex("t", "/r", List.of(), List.of(), idf, 0, 0, List.of());

        assertThat(index.mostDistinctiveTerms(3)).extracting(TermWeight::term)
                .containsExactly("apple", "zebra", "middle");
        assertThat(index.mostDistinctiveTerms(0)).isEmpty();
    }

    @Test
    @DisplayName("Should drop section bodies when compacted")
    void shouldCompact() {
        final Section section = new Section("a.md", "A", List.of("Root"), "body text", List.of("body", "text"), 0, 3);
        final CorpusIndex index = new CorpusIndex("t", "/r", List.of(new FileRecord("a.md", 9, 3, 2)),
                List.of(section), Map.of(), 2, 9, List.of());

        final CorpusIndex compacted = index.compacted();

        assertThat(compacted.sections()).allSatisfy(s -> assertThat(s.content()).isNull());
        assertThat(compacted.sections().get(0)).isEqualTo(section.withoutContent());
        assertThat(compacted.files()).isEqualTo(index.files());
    }

    @Test
    @DisplayName("Should default missing collections")
    void shouldDefaultNulls() {
        final CorpusIndex index = new CorpusIndex("t", "/r", null, null, null, 0, 0, null);

        assertThat(index.files()).isEmpty();
        assertThat(index.sections()).isEmpty();
        assertThat(index.idf()).isEmpty();
        assertThat(index.skippedFiles()).isEmpty();
    }
}
