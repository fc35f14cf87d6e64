package de.mirkosertic.mcp.docnav.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Resolves the set of files an index build scans.
 * <p>
 * Only the collection root has to be readable. Unreadable subdirectories are logged and
 * skipped. Results are sorted by relative path so that builds are reproducible.
 */
public class DocumentCollector {

    private static final Logger logger = LoggerFactory.getLogger(DocumentCollector.class);

    private final FilePatternMatcher matcher;

    public DocumentCollector(final FilePatternMatcher matcher) {
        this.matcher = matcher;
    }

    public FilePatternMatcher getMatcher() {
        return matcher;
    }

    /**
     * Collect all candidates below {@code root}, recursively.
     *
     * @param root    collection root, relative paths are computed against it
     * @param ignored absolute paths never to collect, e.g. the index snapshot
     * @throws IOException if the root does not exist, is not a directory or cannot be listed
     */
    public List<CandidateFile> collect(final Path root, final Set<Path> ignored) throws IOException {
        final Path base = root.toAbsolutePath().normalize();
        ensureListable(base);

        final List<CandidateFile> candidates = new ArrayList<>();
        walk(base, base, ignored, candidates);
        candidates.sort(Comparator.comparing(CandidateFile::relativePath));

        logger.info("Collected {} candidate files below {}", candidates.size(), base);
        return candidates;
    }

    /**
     * Collect the default set of a project: its documentation directory and working-state
     * directory recursively, plus the files directly inside the project root. Missing
     * documentation or state directories are skipped.
     *
     * @throws IOException if the project root cannot be listed
     */
    public List<CandidateFile> collectDefault(final Path projectRoot, final Path docsDirectory,
                                              final Path stateDirectory, final Set<Path> ignored) throws IOException {
        final Path base = projectRoot.toAbsolutePath().normalize();
        ensureListable(base);

        // Keyed by relative path: the directories may overlap
        final Map<String, CandidateFile> collected = new LinkedHashMap<>();
        for (final Path directory : List.of(docsDirectory, stateDirectory)) {
            final Path dir = directory.toAbsolutePath().normalize();
            if (!Files.isDirectory(dir)) {
                logger.debug("Skipping missing directory: {}", dir);
                continue;
            }
            final List<CandidateFile> found = new ArrayList<>();
            walk(base, dir, ignored, found);
            found.sort(Comparator.comparing(CandidateFile::relativePath));
            found.forEach(candidate -> collected.putIfAbsent(candidate.relativePath(), candidate));
        }

        final List<CandidateFile> topLevel = new ArrayList<>();
        try (final Stream<Path> entries = Files.list(base)) {
            entries.filter(Files::isRegularFile)
                    .map(file -> toCandidate(base, file))
                    .filter(candidate -> !isIgnored(candidate.path(), ignored))
                    .filter(candidate -> matcher.shouldInclude(candidate.relativePath()))
                    .forEach(topLevel::add);
        }
        topLevel.sort(Comparator.comparing(CandidateFile::relativePath));
        topLevel.forEach(candidate -> collected.putIfAbsent(candidate.relativePath(), candidate));

        logger.info("Collected {} candidate files for project {}", collected.size(), base);
        return new ArrayList<>(collected.values());
    }

    private void walk(final Path base, final Path start, final Set<Path> ignored,
                      final List<CandidateFile> sink) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                if (!dir.equals(start) && matcher.isExcluded(relativize(base, dir))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !isIgnored(file, ignored)) {
                    final CandidateFile candidate = toCandidate(base, file);
                    if (matcher.shouldInclude(candidate.relativePath())) {
                        sink.add(candidate);
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException e) {
                logger.warn("Cannot access {}, skipping: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static void ensureListable(final Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            if (Files.exists(root)) {
                throw new NotDirectoryException(root.toString());
            }
            throw new NoSuchFileException(root.toString());
        }
        // Fails with AccessDeniedException for unreadable roots
        try (final DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            logger.trace("Root {} is listable", root);
        }
    }

    private static boolean isIgnored(final Path file, final Set<Path> ignored) {
        return ignored.contains(file.toAbsolutePath().normalize());
    }

    private static CandidateFile toCandidate(final Path base, final Path file) {
        final Path absolute = file.toAbsolutePath().normalize();
        return new CandidateFile(absolute, relativize(base, absolute));
    }

    static String relativize(final Path base, final Path file) {
        return base.relativize(file.toAbsolutePath().normalize()).toString().replace(File.separatorChar, '/');
    }
}
