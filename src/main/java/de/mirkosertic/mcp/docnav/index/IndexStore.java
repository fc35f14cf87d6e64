package de.mirkosertic.mcp.docnav.index;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Durable storage for the compacted form of a {@link CorpusIndex}.
 */
public interface IndexStore {

    /**
     * Persist the index without section bodies. The last write wins.
     */
    void save(CorpusIndex index) throws IOException;

    /**
     * @return the compacted index, or null if no snapshot exists or it cannot be read
     */
    @Nullable CorpusIndex load();

    Path getLocation();
}
