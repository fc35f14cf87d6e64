package de.mirkosertic.mcp.docnav;

import de.mirkosertic.mcp.docnav.config.ApplicationConfig;
import de.mirkosertic.mcp.docnav.crawler.FileContentReader;
import de.mirkosertic.mcp.docnav.index.CorpusIndex;
import de.mirkosertic.mcp.docnav.index.DocumentSplitter;
import de.mirkosertic.mcp.docnav.index.IndexBuilder;
import de.mirkosertic.mcp.docnav.index.IndexStore;
import de.mirkosertic.mcp.docnav.index.JsonIndexStore;
import de.mirkosertic.mcp.docnav.index.Section;
import de.mirkosertic.mcp.docnav.index.SectionExtractor;
import de.mirkosertic.mcp.docnav.index.SplitMode;
import de.mirkosertic.mcp.docnav.search.SearchEngine;
import de.mirkosertic.mcp.docnav.search.SearchResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Coordinates building, persisting and querying the corpus index.
 * <p>
 * The snapshot is used whenever section bodies are not needed. Operations that need them
 * (search previews) rebuild in memory, because the snapshot never carries bodies.
 * Builds and snapshot writes are serialized on this instance.
 */
public class DocumentIndexService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentIndexService.class);

    private final ApplicationConfig config;
    private final IndexBuilder builder;
    private final IndexStore store;
    private final SearchEngine searchEngine;
    private final FileContentReader reader;

    // Root of the last explicit build, null means the configured default collection
    private @Nullable Path activeRoot;

    public DocumentIndexService(final ApplicationConfig config) {
        this(config,
                new IndexBuilder(config),
                new JsonIndexStore(config.getSnapshotPath()),
                new SearchEngine(config.getResultPreviewChars()),
                new FileContentReader());
    }

    public DocumentIndexService(final ApplicationConfig config, final IndexBuilder builder, final IndexStore store,
                                final SearchEngine searchEngine, final FileContentReader reader) {
        this.config = config;
        this.builder = builder;
        this.store = store;
        this.searchEngine = searchEngine;
        this.reader = reader;
    }

    /**
     * Build a fresh index and replace the snapshot with it.
     *
     * @param root directory to index; null indexes the default collection of the project
     * @return the full index, section bodies included
     * @throws IOException if the root cannot be enumerated or the snapshot cannot be written
     */
    public synchronized CorpusIndex rebuild(final @Nullable String root) throws IOException {
        final Path requestedRoot = root == null || root.isBlank() ? null : Paths.get(root).toAbsolutePath().normalize();
        final CorpusIndex index = build(requestedRoot);
        store.save(index);
        logger.info("Snapshot written to {}", store.getLocation());
        // Only a successful build switches the root
        activeRoot = requestedRoot;
        return index;
    }

    /**
     * The index to answer a request from.
     *
     * @param needsContent true if section bodies are required, which always means a fresh build
     */
    public synchronized CorpusIndex obtainIndex(final boolean needsContent) throws IOException {
        if (needsContent) {
            return buildCurrent();
        }
        final CorpusIndex loaded = store.load();
        if (loaded != null) {
            return loaded;
        }
        logger.info("No usable snapshot at {}, building one", store.getLocation());
        final CorpusIndex built = buildCurrent();
        store.save(built);
        return built;
    }

    private CorpusIndex buildCurrent() throws IOException {
        return build(activeRoot);
    }

    private CorpusIndex build(final @Nullable Path root) throws IOException {
        return root != null ? builder.build(root) : builder.buildDefault();
    }

    /**
     * Ranked search over all sections or the sections of the given files.
     *
     * @param files          relative file paths to restrict the search to, null for all files
     * @param includePreview whether results carry section excerpts, which costs a rebuild
     */
    public List<SearchResult> search(final String query, final int limit, final @Nullable Set<String> files,
                                     final boolean includePreview) throws IOException {
        final CorpusIndex index = obtainIndex(includePreview);
        return searchEngine.search(index, query, limit, files == null ? null : normalizeFilter(files));
    }

    /**
     * Search every file on its own against one index.
     *
     * @param limit maximum number of sections per file
     * @return results per requested file, in request order
     */
    public Map<String, List<SearchResult>> searchPerFile(final String query, final int limit,
                                                         final List<String> files) throws IOException {
        final CorpusIndex index = obtainIndex(true);
        final Map<String, List<SearchResult>> results = new LinkedHashMap<>();
        for (final String file : files) {
            results.put(file, searchEngine.search(index, query, limit, normalizeFilter(Set.of(file))));
        }
        return results;
    }

    private static Set<String> normalizeFilter(final Set<String> files) {
        final Set<String> normalized = new LinkedHashSet<>();
        for (final String file : files) {
            String path = file.trim().replace('\\', '/');
            while (path.startsWith("./")) {
                path = path.substring(2);
            }
            normalized.add(path);
        }
        return normalized;
    }

    /**
     * The first {@code maxLines} lines of a file below the current root.
     */
    public FilePreview previewFile(final String path, final int maxLines) throws IOException {
        final Path file = resolveInsideRoot(path);
        final List<String> lines = SectionExtractor.splitLines(reader.read(file).content());
        final int shown = Math.max(0, Math.min(maxLines, lines.size()));
        return new FilePreview(relativeToRoot(file), lines.size(), lines.subList(0, shown));
    }

    /**
     * Cut a file below the current root into chunks.
     *
     * @throws IllegalArgumentException for line mode with a non-positive chunk size
     */
    public List<DocumentSplitter.Chunk> splitFile(final String path, final SplitMode mode, final int chunkLines)
            throws IOException {
        final Path file = resolveInsideRoot(path);
        final String relative = relativeToRoot(file);
        return DocumentSplitter.split(reader.read(file).content(), relative, mode, chunkLines);
    }

    /**
     * Distinct section headers per file, in index order.
     */
    public Map<String, List<String>> listHeaders() throws IOException {
        final Map<String, Set<String>> grouped = new LinkedHashMap<>();
        for (final Section section : obtainIndex(false).sections()) {
            grouped.computeIfAbsent(section.file(), key -> new LinkedHashSet<>()).add(section.header());
        }
        final Map<String, List<String>> headers = new LinkedHashMap<>();
        grouped.forEach((file, names) -> headers.put(file, new ArrayList<>(names)));
        return headers;
    }

    public Path getSnapshotPath() {
        return store.getLocation();
    }

    public synchronized Path getRootPath() {
        return activeRoot != null ? activeRoot : config.getProjectRootPath();
    }

    /**
     * Resolve a user-supplied path against the current root.
     *
     * @throws IllegalArgumentException if the path escapes the root
     * @throws NoSuchFileException      if it does not name a regular file
     */
    Path resolveInsideRoot(final String path) throws IOException {
        final Path root = getRootPath();
        final Path resolved = root.resolve(path).toAbsolutePath().normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path is outside of " + root + ": " + path);
        }
        if (!Files.isRegularFile(resolved)) {
            throw new NoSuchFileException(resolved.toString());
        }
        return resolved;
    }

    private String relativeToRoot(final Path file) {
        return getRootPath().relativize(file).toString().replace(File.separatorChar, '/');
    }
}
