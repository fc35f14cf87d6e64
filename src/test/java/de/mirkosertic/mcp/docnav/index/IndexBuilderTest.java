package de.mirkosertic.mcp.docnav.index;

import de.mirkosertic.mcp.docnav.config.ApplicationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("IndexBuilder Tests")
class IndexBuilderTest {

    @TempDir
    Path tempDir;

    private IndexBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new IndexBuilder(ApplicationConfig.defaults(tempDir));
    }

    private void write(final String relativePath, final String content) throws IOException {
        final Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Two-file corpus")
    class TwoFileCorpus {

        private CorpusIndex index;

        @BeforeEach
        void build() throws IOException {
            write("a.md", "# Setup\nInstall the tool. Configure the tool.\n");
            write("b.md", "Run the tool.\n");
            index = builder.build(tempDir);
        }

        @Test
        @DisplayName("Should produce one section per file")
        void shouldProduceSections() {
            assertThat(index.sections()).hasSize(2);
            assertThat(index.sections()).extracting(Section::file).containsExactly("a.md", "b.md");
            assertThat(index.sections()).extracting(Section::header).containsExactly("Setup", "b.md");
        }

        @Test
        @DisplayName("Should record files with size, lines and tokens")
        void shouldRecordFiles() {
            assertThat(index.files()).extracting(FileRecord::path).containsExactly("a.md", "b.md");
            final FileRecord a = index.files().get(0);
            assertThat(a.lines()).isEqualTo(2);
            assertThat(a.tokens()).isEqualTo(5);
            assertThat(a.size()).isEqualTo("# Setup\nInstall the tool. Configure the tool.\n".length());
            assertThat(index.totalTokens()).isEqualTo(7);
            assertThat(index.totalChars()).isEqualTo(
                    "# Setup\nInstall the tool. Configure the tool.\n".length() + "Run the tool.\n".length());
        }

        @Test
        @DisplayName("Should leave out terms present in every section")
        void shouldComputeIdf() {
            assertThat(index.idf()).doesNotContainKey("tool");
            assertThat(index.idf().get("configure")).isCloseTo(Math.log(2), within(1e-12));
            assertThat(index.idf().get("run")).isCloseTo(Math.log(2), within(1e-12));
            assertThat(index.idf().values()).allSatisfy(value -> assertThat(value).isGreaterThanOrEqualTo(0.0));
        }

        @Test
        @DisplayName("Should keep section bodies and record the root")
        void shouldKeepContent() {
            assertThat(index.sections()).allSatisfy(s -> assertThat(s.content()).isNotNull());
            assertThat(index.sections().get(0).content()).isEqualTo("Install the tool. Configure the tool.");
            assertThat(index.root()).isEqualTo(tempDir.toAbsolutePath().normalize().toString());
            assertThat(index.createdAt()).isNotBlank();
            assertThat(index.skippedFiles()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Candidate selection")
    class CandidateSelection {

        @Test
        @DisplayName("Should skip excluded directories and unknown extensions")
        void shouldApplyFilters() throws IOException {
            write("docs/guide.md", "# Guide\ntext\n");
            write("node_modules/pkg/readme.md", "# Pkg\ntext\n");
            write(".git/notes.txt", "text\n");
            write("docs/archive/old.md", "# Old\ntext\n");
            write("src/__pycache__/mod.py", "x = 1\n");
            write("image.png", "not really an image");
            write("src/app.py", "def main():\n    pass\n");

            final CorpusIndex index = builder.build(tempDir);

            assertThat(index.files()).extracting(FileRecord::path)
                    .containsExactly("docs/guide.md", "src/app.py");
        }

        @Test
        @DisplayName("Should never index its own snapshot")
        void shouldIgnoreSnapshot() throws IOException {
            write("guide.md", "# Guide\ntext\n");
            write(".docnav/index.json", "{\"sections\":[]}");
            write(".docnav/progress.json", "{\"step\":\"indexing\"}");

            final CorpusIndex index = builder.build(tempDir);

            assertThat(index.files()).extracting(FileRecord::path)
                    .containsExactly(".docnav/progress.json", "guide.md");
        }

        @Test
        @DisplayName("Should index code files as one whole-document section")
        void shouldIndexCodeWhole() throws IOException {
            write("app.js", "function start() {}\n// heading-like\n# not a heading\n");

            final CorpusIndex index = builder.build(tempDir);

            assertThat(index.sections()).hasSize(1);
            assertThat(index.sections().get(0).header()).isEqualTo("app.js");
            assertThat(index.sections().get(0).lineEnd()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should collect the default project layout")
        void shouldBuildDefault() throws IOException {
            write("docs/guide.md", "# Guide\ntext\n");
            write(".docnav/notes.md", "# Notes\ntext\n");
            write("README.md", "# Readme\ntext\n");
            write("src/app.py", "def main():\n    pass\n");

            final CorpusIndex index = builder.buildDefault();

            assertThat(index.files()).extracting(FileRecord::path)
                    .containsExactly("docs/guide.md", ".docnav/notes.md", "README.md");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should skip files that are not valid UTF-8")
        void shouldSkipMalformedFiles() throws IOException {
            write("good.md", "# Good\nreadable text\n");
            Files.write(tempDir.resolve("bad.md"), new byte[]{'#', ' ', (byte) 0xC3, (byte) 0x28, '\n'});

            final CorpusIndex index = builder.build(tempDir);

            assertThat(index.files()).extracting(FileRecord::path).containsExactly("good.md");
            assertThat(index.skippedFiles()).containsExactly("bad.md");
        }

        @Test
        @DisplayName("Should fail for a missing root")
        void shouldFailForMissingRoot() {
            assertThatThrownBy(() -> builder.build(tempDir.resolve("missing")))
                    .isInstanceOf(NoSuchFileException.class);
        }

        @Test
        @DisplayName("Should fail for a root that is a file")
        void shouldFailForFileRoot() throws IOException {
            write("file.md", "text");

            assertThatThrownBy(() -> builder.build(tempDir.resolve("file.md")))
                    .isInstanceOf(NotDirectoryException.class);
        }

        @Test
        @DisplayName("Should build an empty index for an empty root")
        void shouldBuildEmptyIndex() throws IOException {
            final CorpusIndex index = builder.build(tempDir);

            assertThat(index.files()).isEmpty();
            assertThat(index.sections()).isEmpty();
            assertThat(index.idf()).isEmpty();
        }
    }

    @Nested
    @DisplayName("IDF computation")
    class IdfComputation {

        @Test
        @DisplayName("Should keep an empty table for a single section")
        void shouldBeEmptyForSingleSection() {
            final Section only = new Section("a.md", "A", List.of(), null, List.of("alpha", "beta", "alpha"), 0, 1);

            assertThat(IndexBuilder.computeIdf(List.of(only))).isEmpty();
        }

        @Test
        @DisplayName("Should count a term once per section")
        void shouldCountDocumentFrequency() {
            final List<Section> sections = List.of(
                    new Section("a.md", "A", List.of(), null, List.of("alpha", "alpha", "alpha"), 0, 1),
                    new Section("a.md", "B", List.of(), null, List.of("beta"), 1, 2),
                    new Section("b.md", "C", List.of(), null, List.of("alpha", "gamma"), 0, 1),
                    new Section("b.md", "D", List.of(), null, List.of(), 1, 2));

            final Map<String, Double> idf = IndexBuilder.computeIdf(sections);

            assertThat(idf.get("alpha")).isCloseTo(Math.log(4.0 / 2), within(1e-12));
            assertThat(idf.get("beta")).isCloseTo(Math.log(4.0), within(1e-12));
            assertThat(idf.get("gamma")).isCloseTo(Math.log(4.0), within(1e-12));
            assertThat(idf).containsOnlyKeys("alpha", "beta", "gamma");
        }

        @Test
        @DisplayName("Should be empty without sections")
        void shouldBeEmptyWithoutSections() {
            assertThat(IndexBuilder.computeIdf(List.of())).isEmpty();
        }
    }
}
