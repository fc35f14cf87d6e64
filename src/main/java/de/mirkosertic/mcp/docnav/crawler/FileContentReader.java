package de.mirkosertic.mcp.docnav.crawler;

import de.mirkosertic.mcp.docnav.util.TextCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads candidate files as strict UTF-8 text.
 * <p>
 * Malformed input is not replaced: it surfaces as a {@link java.nio.charset.MalformedInputException}
 * so that the index builder can skip the file instead of indexing garbage.
 */
public class FileContentReader {

    private static final Logger logger = LoggerFactory.getLogger(FileContentReader.class);

    public ExtractedDocument read(final Path file) throws IOException {
        final long fileSize = Files.size(file);
        final String raw = Files.readString(file, StandardCharsets.UTF_8);
        final String content = TextCleaner.stripInvalid(raw);

        logger.debug("Read {} characters ({} bytes) from file: {}", content.length(), fileSize, file);

        return new ExtractedDocument(content, fileSize);
    }
}
