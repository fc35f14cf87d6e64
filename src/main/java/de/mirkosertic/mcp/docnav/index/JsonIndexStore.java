package de.mirkosertic.mcp.docnav.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Keeps the index snapshot as a single JSON file, by default {@code .docnav/index.json}
 * below the project root.
 * <p>
 * Unknown properties are ignored on load, so snapshots written by newer versions stay
 * readable. A missing, empty or corrupt snapshot loads as null.
 */
public class JsonIndexStore implements IndexStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonIndexStore.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path snapshotPath;

    public JsonIndexStore(final Path snapshotPath) {
        this.snapshotPath = snapshotPath;
    }

    @Override
    public synchronized void save(final CorpusIndex index) throws IOException {
        final Path parent = snapshotPath.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            logger.debug("Created state directory: {}", parent);
        }

        try (final Writer writer = Files.newBufferedWriter(snapshotPath, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            OBJECT_MAPPER.writeValue(writer, index.compacted());
        }
        logger.info("Saved index snapshot with {} files and {} sections to {}",
                index.files().size(), index.sections().size(), snapshotPath);
    }

    @Override
    public synchronized @Nullable CorpusIndex load() {
        if (!Files.exists(snapshotPath)) {
            logger.debug("Index snapshot does not exist: {}", snapshotPath);
            return null;
        }

        try (final Reader reader = Files.newBufferedReader(snapshotPath, StandardCharsets.UTF_8)) {
            final CorpusIndex index = OBJECT_MAPPER.readValue(reader, CorpusIndex.class);
            if (index == null) {
                logger.debug("Index snapshot is empty: {}", snapshotPath);
                return null;
            }
            logger.debug("Loaded index snapshot from {}: {} sections", snapshotPath, index.sections().size());
            return index;
        } catch (final IOException e) {
            logger.warn("Ignoring unreadable index snapshot {}: {}", snapshotPath, e.getMessage());
            return null;
        } catch (final RuntimeException e) {
            logger.warn("Ignoring invalid index snapshot {}", snapshotPath, e);
            return null;
        }
    }

    @Override
    public Path getLocation() {
        return snapshotPath;
    }
}
