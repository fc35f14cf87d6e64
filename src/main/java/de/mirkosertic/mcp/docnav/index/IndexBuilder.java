package de.mirkosertic.mcp.docnav.index;

import de.mirkosertic.mcp.docnav.TermTokenizer;
import de.mirkosertic.mcp.docnav.config.ApplicationConfig;
import de.mirkosertic.mcp.docnav.crawler.CandidateFile;
import de.mirkosertic.mcp.docnav.crawler.DocumentCollector;
import de.mirkosertic.mcp.docnav.crawler.ExtractedDocument;
import de.mirkosertic.mcp.docnav.crawler.FileContentReader;
import de.mirkosertic.mcp.docnav.crawler.FilePatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link CorpusIndex} from scratch.
 * <p>
 * Each candidate file is read, split into sections (heading-structured documents) or kept
 * whole (code), and accounted in the running totals. A file that cannot be read is logged,
 * recorded as skipped and left out; only an unlistable root fails the build.
 * Every build is independent, no state is shared between calls.
 */
public class IndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final ApplicationConfig config;
    private final DocumentCollector collector;
    private final FileContentReader reader;

    public IndexBuilder(final ApplicationConfig config) {
        this(config,
                new DocumentCollector(new FilePatternMatcher(
                        config.getIncludeExtensions(),
                        config.getExcludePathFragments(),
                        config.getStructuredExtensions())),
                new FileContentReader());
    }

    public IndexBuilder(final ApplicationConfig config, final DocumentCollector collector,
                        final FileContentReader reader) {
        this.config = config;
        this.collector = collector;
        this.reader = reader;
    }

    /**
     * Index every candidate file below {@code root}.
     *
     * @throws IOException if the root cannot be enumerated
     */
    public CorpusIndex build(final Path root) throws IOException {
        final Path base = root.toAbsolutePath().normalize();
        return buildFrom(base, collector.collect(base, ignoredPaths()));
    }

    /**
     * Index the default collection of the configured project: documentation directory,
     * working-state directory and the top-level project files.
     *
     * @throws IOException if the project root cannot be enumerated
     */
    public CorpusIndex buildDefault() throws IOException {
        final Path base = config.getProjectRootPath();
        return buildFrom(base, collector.collectDefault(base,
                config.getDocsDirectoryPath(), config.getStateDirectoryPath(), ignoredPaths()));
    }

    private Set<Path> ignoredPaths() {
        // The snapshot is JSON and would otherwise index itself
        return Set.of(config.getSnapshotPath().toAbsolutePath().normalize());
    }

    CorpusIndex buildFrom(final Path root, final List<CandidateFile> candidates) {
        final long startTime = System.nanoTime();

        final List<FileRecord> files = new ArrayList<>();
        final List<Section> sections = new ArrayList<>();
        final List<String> skipped = new ArrayList<>();
        long totalTokens = 0;
        long totalChars = 0;

        for (final CandidateFile candidate : candidates) {
            final ExtractedDocument document;
            try {
                document = reader.read(candidate.path());
            } catch (final IOException e) {
                logger.warn("Skipping unreadable file {}: {}", candidate.relativePath(), e.toString());
                skipped.add(candidate.relativePath());
                continue;
            }

            final String text = document.content();
            final List<String> fileTokens = TermTokenizer.tokenize(text);
            files.add(new FileRecord(candidate.relativePath(), document.fileSize(),
                    SectionExtractor.splitLines(text).size(), fileTokens.size()));

            final List<Section> extracted;
            if (collector.getMatcher().isStructured(candidate.relativePath())) {
                extracted = SectionExtractor.extractSections(text, candidate.relativePath());
            } else {
                extracted = List.of(SectionExtractor.extractWholeDocument(
                        text, candidate.relativePath(), config.getCodePreviewChars()));
            }
            for (final Section section : extracted) {
                sections.add(section.withFile(candidate.relativePath()));
            }

            totalTokens += fileTokens.size();
            totalChars += text.length();
        }

        final Map<String, Double> idf = computeIdf(sections);
        final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

        logger.info("Index built in {}ms: {} files, {} sections, {} weighted terms, {} skipped",
                durationMs, files.size(), sections.size(), idf.size(), skipped.size());

        return new CorpusIndex(Instant.now().toString(), root.toString(), files, sections, idf,
                totalTokens, totalChars, skipped);
    }

    /**
     * Inverse document frequency over the section population: {@code ln(n / df)}.
     * Terms present in every section carry no weight and are left out; an empty
     * section list yields an empty table.
     */
    static Map<String, Double> computeIdf(final List<Section> sections) {
        final Map<String, Integer> documentFrequency = new LinkedHashMap<>();
        for (final Section section : sections) {
            for (final String term : new LinkedHashSet<>(section.tokens())) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        final int sectionCount = sections.size();
        final Map<String, Double> idf = new LinkedHashMap<>();
        documentFrequency.forEach((term, df) -> {
            if (df < sectionCount) {
                idf.put(term, Math.log((double) sectionCount / df));
            }
        });
        return idf;
    }
}
