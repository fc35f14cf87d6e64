package de.mirkosertic.mcp.docnav;

import de.mirkosertic.mcp.docnav.config.ApplicationConfig;
import de.mirkosertic.mcp.docnav.crawler.FileContentReader;
import de.mirkosertic.mcp.docnav.index.CorpusIndex;
import de.mirkosertic.mcp.docnav.index.DocumentSplitter;
import de.mirkosertic.mcp.docnav.index.FileRecord;
import de.mirkosertic.mcp.docnav.index.IndexBuilder;
import de.mirkosertic.mcp.docnav.index.IndexStore;
import de.mirkosertic.mcp.docnav.index.SplitMode;
import de.mirkosertic.mcp.docnav.search.SearchEngine;
import de.mirkosertic.mcp.docnav.search.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DocumentIndexService Tests")
class DocumentIndexServiceTest {

    @TempDir
    Path tempDir;

    private void write(final String relativePath, final String content) throws IOException {
        final Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Nested
    @DisplayName("With real components")
    class Integration {

        private DocumentIndexService service;

        @BeforeEach
        void setUp() throws IOException {
            write("docs/setup.md", """
                    # Setup
                    Install the tool.
                    ## Configuration
                    Configure the tool with config.yaml.
                    """);
            write("docs/usage.md", "# Usage\nRun the tool from the command line.\n");
            write("README.md", "# Readme\nStart with docs/setup.md to install.\n");
            service = new DocumentIndexService(ApplicationConfig.defaults(tempDir));
        }

        @Test
        @DisplayName("Should build, save and reload the default collection")
        void shouldRebuildAndReload() throws IOException {
            final CorpusIndex built = service.rebuild(null);

            assertThat(built.files()).hasSize(3);
            assertThat(Files.exists(tempDir.resolve(".docnav/index.json"))).isTrue();
            assertThat(service.obtainIndex(false)).isEqualTo(built.compacted());
        }

        @Test
        @DisplayName("Should build and save a snapshot on first use")
        void shouldBuildLazily() throws IOException {
            assertThat(Files.exists(service.getSnapshotPath())).isFalse();

            final CorpusIndex index = service.obtainIndex(false);

            assertThat(index.sections()).isNotEmpty();
            assertThat(Files.exists(service.getSnapshotPath())).isTrue();
        }

        @Test
        @DisplayName("Should include previews only when requested")
        void shouldSearchWithAndWithoutPreviews() throws IOException {
            final List<SearchResult> withPreview = service.search("configure", 5, null, true);
            final List<SearchResult> withoutPreview = service.search("configure", 5, null, false);

            assertThat(withPreview).hasSize(1);
            assertThat(withPreview.get(0).file()).isEqualTo("docs/setup.md");
            assertThat(withPreview.get(0).header()).isEqualTo("Configuration");
            assertThat(withPreview.get(0).hierarchy()).containsExactly("Setup");
            assertThat(withPreview.get(0).preview()).contains("config.yaml");
            assertThat(withoutPreview.get(0).preview()).isNull();
            assertThat(withoutPreview.get(0).score()).isEqualTo(withPreview.get(0).score());
        }

        @Test
        @DisplayName("Should normalize file filters")
        void shouldNormalizeFilter() throws IOException {
            final List<SearchResult> results = service.search("install", 5, Set.of("./README.md"), true);

            assertThat(results).extracting(SearchResult::file).containsOnly("README.md");
        }

        @Test
        @DisplayName("Should search every requested file on its own")
        void shouldSearchPerFile() throws IOException {
            final Map<String, List<SearchResult>> results =
                    service.searchPerFile("tool", 1, List.of("docs/usage.md", "docs/setup.md", "README.md"));

            assertThat(results).containsOnlyKeys("docs/usage.md", "docs/setup.md", "README.md");
            assertThat(results.get("docs/usage.md")).hasSize(1);
            assertThat(results.get("docs/setup.md")).hasSize(1);
            assertThat(results.get("README.md")).isEmpty();
        }

        @Test
        @DisplayName("Should keep the previous root when an explicit rebuild fails")
        void shouldKeepRootAfterFailedRebuild() throws IOException {
            assertThat(service.search("configure", 5, null, true)).hasSize(1);

            assertThatThrownBy(() -> service.rebuild(tempDir.resolve("missing").toString()))
                    .isInstanceOf(NoSuchFileException.class);

            assertThat(service.getRootPath()).isEqualTo(tempDir.toAbsolutePath().normalize());
            assertThat(service.search("configure", 5, null, true)).hasSize(1);
            assertThat(service.search("configure", 5, null, false)).hasSize(1);
        }

        @Test
        @DisplayName("Should switch the root only after a successful rebuild")
        void shouldSwitchRootAfterRebuild() throws IOException {
            final Path docs = tempDir.resolve("docs").toAbsolutePath().normalize();

            service.rebuild(docs.toString());
            assertThatThrownBy(() -> service.rebuild(docs.resolve("missing").toString()))
                    .isInstanceOf(NoSuchFileException.class);

            assertThat(service.getRootPath()).isEqualTo(docs);
            assertThat(service.previewFile("usage.md", 1).lines()).containsExactly("# Usage");
        }

        @Test
        @DisplayName("Should list distinct headers per file")
        void shouldListHeaders() throws IOException {
            final Map<String, List<String>> headers = service.listHeaders();

            assertThat(headers).containsEntry("docs/setup.md", List.of("Setup", "Configuration"));
            assertThat(headers).containsEntry("docs/usage.md", List.of("Usage"));
            assertThat(headers.keySet()).containsExactly("docs/setup.md", "docs/usage.md", "README.md");
        }

        @Test
        @DisplayName("Should preview the leading lines of a file")
        void shouldPreviewFile() throws IOException {
            final FilePreview preview = service.previewFile("docs/setup.md", 2);

            assertThat(preview.path()).isEqualTo("docs/setup.md");
            assertThat(preview.totalLines()).isEqualTo(4);
            assertThat(preview.lines()).containsExactly("# Setup", "Install the tool.");
            assertThat(preview.truncated()).isTrue();
        }

        @Test
        @DisplayName("Should split a file at its headings")
        void shouldSplitFile() throws IOException {
            final List<DocumentSplitter.Chunk> chunks = service.splitFile("docs/setup.md", SplitMode.HEADINGS, 10);

            assertThat(chunks).extracting(DocumentSplitter.Chunk::label).containsExactly("Setup", "Setup > Configuration");
        }

        @Test
        @DisplayName("Should refuse paths outside the project root")
        void shouldRefuseEscapingPaths() {
            assertThatThrownBy(() -> service.previewFile("../outside.md", 5))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.splitFile("/etc/hosts", SplitMode.LINES, 10))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.previewFile("docs/missing.md", 5))
                    .isInstanceOf(NoSuchFileException.class);
        }

        @Test
        @DisplayName("Should switch to an explicit root and back")
        void shouldUseExplicitRoot() throws IOException {
            write("other/notes.md", "# Notes\nAnything about deployment.\n");

            final CorpusIndex explicit = service.rebuild(tempDir.resolve("other").toString());
            assertThat(explicit.files()).extracting(FileRecord::path).containsExactly("notes.md");
            assertThat(service.previewFile("notes.md", 1).lines()).containsExactly("# Notes");

            final CorpusIndex fallback = service.rebuild(null);
            assertThat(fallback.files()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("Snapshot handling")
    class SnapshotHandling {

        private final CorpusIndex index = new CorpusIndex("2026-01-15T10:15:30Z", "/r",
                List.of(), List.of(), Map.of(), 0, 0, List.of());

        private IndexBuilder builder;
        private IndexStore store;
        private DocumentIndexService service;

        @BeforeEach
        void setUp() {
            builder = mock(IndexBuilder.class);
            store = mock(IndexStore.class);
            service = new DocumentIndexService(ApplicationConfig.defaults(tempDir), builder, store,
                    new SearchEngine(100), new FileContentReader());
        }

        @Test
        @DisplayName("Should answer from the snapshot without building")
        void shouldUseSnapshot() throws IOException {
            when(store.load()).thenReturn(index);

            assertThat(service.obtainIndex(false)).isSameAs(index);

            verify(builder, never()).buildDefault();
            verify(store, never()).save(any());
        }

        @Test
        @DisplayName("Should build and save when the snapshot is unusable")
        void shouldBuildWhenSnapshotMissing() throws IOException {
            when(store.load()).thenReturn(null);
            when(builder.buildDefault()).thenReturn(index);

            assertThat(service.obtainIndex(false)).isSameAs(index);

            verify(store).save(index);
        }

        @Test
        @DisplayName("Should always build when section bodies are needed")
        void shouldBuildForContent() throws IOException {
            when(builder.buildDefault()).thenReturn(index);

            assertThat(service.obtainIndex(true)).isSameAs(index);

            verify(store, never()).load();
            verify(store, never()).save(any());
        }

        @Test
        @DisplayName("Should not touch the snapshot when the build fails")
        void shouldPropagateBuildFailure() throws IOException {
            when(builder.buildDefault()).thenThrow(new NoSuchFileException("/r"));

            assertThatThrownBy(() -> service.rebuild(null)).isInstanceOf(NoSuchFileException.class);

            verify(store, never()).save(any());
        }
    }
}
