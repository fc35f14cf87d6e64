package de.mirkosertic.mcp.docnav;

import com.google.common.base.Strings;
import de.mirkosertic.mcp.docnav.config.ApplicationConfig;
import de.mirkosertic.mcp.docnav.config.BuildInfo;
import de.mirkosertic.mcp.docnav.index.CorpusIndex;
import de.mirkosertic.mcp.docnav.index.DocumentSplitter;
import de.mirkosertic.mcp.docnav.mcp.SchemaGenerator;
import de.mirkosertic.mcp.docnav.mcp.ToolResultHelper;
import de.mirkosertic.mcp.docnav.mcp.dto.BuildIndexRequest;
import de.mirkosertic.mcp.docnav.mcp.dto.BuildIndexResponse;
import de.mirkosertic.mcp.docnav.mcp.dto.IndexStatsResponse;
import de.mirkosertic.mcp.docnav.mcp.dto.ListHeadersResponse;
import de.mirkosertic.mcp.docnav.mcp.dto.PreviewFileRequest;
import de.mirkosertic.mcp.docnav.mcp.dto.PreviewFileResponse;
import de.mirkosertic.mcp.docnav.mcp.dto.SearchFilesRequest;
import de.mirkosertic.mcp.docnav.mcp.dto.SearchFilesResponse;
import de.mirkosertic.mcp.docnav.mcp.dto.SearchHit;
import de.mirkosertic.mcp.docnav.mcp.dto.SearchRequest;
import de.mirkosertic.mcp.docnav.mcp.dto.SearchResponse;
import de.mirkosertic.mcp.docnav.mcp.dto.SplitFileRequest;
import de.mirkosertic.mcp.docnav.mcp.dto.SplitFileResponse;
import de.mirkosertic.mcp.docnav.search.SearchResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * MCP tools for navigating a documentation tree: index builds, ranked section search,
 * file previews and splits, and index statistics.
 */
public class DocumentationTools {

    private static final Logger logger = LoggerFactory.getLogger(DocumentationTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search the documentation index and return the best matching SECTIONS (not whole files), ranked by TF-IDF. \
            The query is free text: words are lower-cased, English stopwords and words shorter than three characters \
            are dropped. There is no stemming, no synonym expansion and no query syntax, so include the word forms \
            you expect in the documents ('configure configuration config'). \
            Every hit carries file, heading, enclosing headings and a 0-based line range [lineStart, lineEnd) \
            that can be used to read exactly that part of the file. \
            Restrict the search with 'files' (comma-separated relative paths). \
            Previews need a fresh in-memory build; set includePreview=false to answer from the saved snapshot.""";

    private final DocumentIndexService indexService;
    private final ApplicationConfig config;

    public DocumentationTools(final DocumentIndexService indexService, final ApplicationConfig config) {
        this.indexService = indexService;
        this.config = config;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("buildIndex")
                        .description("Rebuild the documentation index from scratch and save it as snapshot. " +
                                "Call this after documents were added or changed. Reports file, section and term counts " +
                                "and the files that could not be read.")
                        .inputSchema(SchemaGenerator.generateSchema(BuildIndexRequest.class))
                        .build())
                .callHandler((exchange, request) -> buildIndex(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("search")
                        .description(SEARCH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(SearchRequest.class))
                        .build())
                .callHandler((exchange, request) -> search(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("searchFiles")
                        .description("Run one query against each of the given files separately and return the best " +
                                "sections per file. Useful to locate a topic inside a known set of documents.")
                        .inputSchema(SchemaGenerator.generateSchema(SearchFilesRequest.class))
                        .build())
                .callHandler((exchange, request) -> searchFiles(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("previewFile")
                        .description("Return the first lines of a file below the project root, together with its total line count.")
                        .inputSchema(SchemaGenerator.generateSchema(PreviewFileRequest.class))
                        .build())
                .callHandler((exchange, request) -> previewFile(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("splitFile")
                        .description("Split a file into chunks, either at its Markdown headings or into fixed-size line windows. " +
                                "Returns label, 0-based line range, character and term count of every chunk, " +
                                "so a large file can be read piece by piece.")
                        .inputSchema(SchemaGenerator.generateSchema(SplitFileRequest.class))
                        .build())
                .callHandler((exchange, request) -> splitFile(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("listHeaders")
                        .description("List the distinct section headings of every indexed file. Gives a table of contents of the documentation.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> listHeaders())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getIndexStats")
                        .description("Get statistics about the documentation index: files, sections, weighted terms, totals, " +
                                "creation time, snapshot location and the most distinctive terms.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getIndexStats())
                .build());

        return tools;
    }

    // Tool implementation methods
    McpSchema.CallToolResult buildIndex(final Map<String, Object> args) {
        final BuildIndexRequest request = BuildIndexRequest.fromMap(args);

        logger.info("Build index request: root='{}'", request.root());

        try {
            final long startTime = System.nanoTime();
            final CorpusIndex index = indexService.rebuild(request.root());
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

            return ToolResultHelper.createResult(
                    BuildIndexResponse.success(index, indexService.getSnapshotPath().toString(), durationMs));

        } catch (final IOException e) {
            logger.error("Error building index", e);
            return ToolResultHelper.createResult(BuildIndexResponse.error("Error building index: " + e));
        } catch (final RuntimeException e) {
            logger.error("Unexpected error building index", e);
            return ToolResultHelper.createResult(BuildIndexResponse.error("Error building index: " + e));
        }
    }

    McpSchema.CallToolResult search(final Map<String, Object> args) {
        final SearchRequest request = SearchRequest.fromMap(args);
        final int limit = request.effectiveLimit(config.getDefaultResultLimit(), config.getMaxResultLimit());

        logger.info("Search request: query='{}', limit={}, files='{}', includePreview={}",
                request.query(), limit, request.files(), request.effectiveIncludePreview());

        try {
            final long startTime = System.nanoTime();
            final List<SearchResult> results = indexService.search(Strings.nullToEmpty(request.query()), limit,
                    request.fileFilter(), request.effectiveIncludePreview());
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

            logger.info("Search completed in {}ms: {} hits", durationMs, results.size());

            return ToolResultHelper.createResult(SearchResponse.success(request.query(), toHits(results),
                    request.effectiveIncludePreview(), durationMs));

        } catch (final IOException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchResponse.error("Search error: " + e));
        } catch (final RuntimeException e) {
            logger.error("Unexpected search error", e);
            return ToolResultHelper.createResult(SearchResponse.error("Search error: " + e));
        }
    }

    McpSchema.CallToolResult searchFiles(final Map<String, Object> args) {
        final SearchFilesRequest request = SearchFilesRequest.fromMap(args);
        final int limit = request.effectiveLimit(config.getDefaultResultLimit(), config.getMaxResultLimit());

        logger.info("Search files request: query='{}', files={}, limit={}", request.query(), request.files(), limit);

        if (request.files().isEmpty()) {
            return ToolResultHelper.createResult(SearchFilesResponse.error("At least one file is required"));
        }

        try {
            final long startTime = System.nanoTime();
            final Map<String, List<SearchResult>> perFile =
                    indexService.searchPerFile(Strings.nullToEmpty(request.query()), limit, request.files());
            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;

            final Map<String, List<SearchHit>> hits = new LinkedHashMap<>();
            perFile.forEach((file, results) -> hits.put(file, toHits(results)));

            logger.info("Search files completed in {}ms over {} files", durationMs, hits.size());

            return ToolResultHelper.createResult(SearchFilesResponse.success(request.query(), hits, durationMs));

        } catch (final IOException e) {
            logger.error("Search files error", e);
            return ToolResultHelper.createResult(SearchFilesResponse.error("Search error: " + e));
        } catch (final RuntimeException e) {
            logger.error("Unexpected search files error", e);
            return ToolResultHelper.createResult(SearchFilesResponse.error("Search error: " + e));
        }
    }

    McpSchema.CallToolResult previewFile(final Map<String, Object> args) {
        final PreviewFileRequest request = PreviewFileRequest.fromMap(args);

        logger.info("Preview file request: path='{}', lines={}", request.path(), request.lines());

        if (request.path() == null || request.path().isBlank()) {
            return ToolResultHelper.createResult(PreviewFileResponse.error("Path is required"));
        }

        try {
            final FilePreview preview = indexService.previewFile(request.path(),
                    request.effectiveLines(config.getFilePreviewLines()));
            return ToolResultHelper.createResult(PreviewFileResponse.success(preview));

        } catch (final IllegalArgumentException e) {
            logger.warn("Rejected preview of {}: {}", request.path(), e.getMessage());
            return ToolResultHelper.createResult(PreviewFileResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error previewing file {}", request.path(), e);
            return ToolResultHelper.createResult(PreviewFileResponse.error("Error reading file: " + e));
        } catch (final RuntimeException e) {
            logger.error("Unexpected error previewing file {}", request.path(), e);
            return ToolResultHelper.createResult(PreviewFileResponse.error("Error reading file: " + e));
        }
    }

    McpSchema.CallToolResult splitFile(final Map<String, Object> args) {
        final SplitFileRequest request;
        try {
            request = SplitFileRequest.fromMap(args);
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid split request: {}", e.getMessage());
            return ToolResultHelper.createResult(SplitFileResponse.error("Invalid mode, use 'headings' or 'lines'"));
        }

        logger.info("Split file request: path='{}', mode={}, chunkLines={}",
                request.path(), request.effectiveMode(), request.chunkLines());

        if (request.path() == null || request.path().isBlank()) {
            return ToolResultHelper.createResult(SplitFileResponse.error("Path is required"));
        }

        try {
            final List<DocumentSplitter.Chunk> chunks = indexService.splitFile(request.path(),
                    request.effectiveMode(), request.effectiveChunkLines(config.getChunkLines()));

            logger.info("Split {} into {} chunks", request.path(), chunks.size());

            return ToolResultHelper.createResult(SplitFileResponse.success(request.path(),
                    request.effectiveMode().name().toLowerCase(Locale.ROOT), chunks));

        } catch (final IllegalArgumentException e) {
            logger.warn("Rejected split of {}: {}", request.path(), e.getMessage());
            return ToolResultHelper.createResult(SplitFileResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error splitting file {}", request.path(), e);
            return ToolResultHelper.createResult(SplitFileResponse.error("Error reading file: " + e));
        } catch (final RuntimeException e) {
            logger.error("Unexpected error splitting file {}", request.path(), e);
            return ToolResultHelper.createResult(SplitFileResponse.error("Error reading file: " + e));
        }
    }

    McpSchema.CallToolResult listHeaders() {
        logger.info("List headers request");

        try {
            final Map<String, List<String>> headers = indexService.listHeaders();

            logger.info("Listed headers of {} files", headers.size());

            return ToolResultHelper.createResult(ListHeadersResponse.success(headers));

        } catch (final IOException e) {
            logger.error("Error listing headers", e);
            return ToolResultHelper.createResult(ListHeadersResponse.error("Error listing headers: " + e));
        } catch (final RuntimeException e) {
            logger.error("Unexpected error listing headers", e);
            return ToolResultHelper.createResult(ListHeadersResponse.error("Error listing headers: " + e));
        }
    }

    McpSchema.CallToolResult getIndexStats() {
        logger.info("Index stats request");

        try {
            final CorpusIndex index = indexService.obtainIndex(false);

            logger.info("Index stats: {} files, {} sections", index.files().size(), index.sections().size());

            return ToolResultHelper.createResult(IndexStatsResponse.success(index,
                    indexService.getSnapshotPath().toString(), BuildInfo.getVersion(),
                    BuildInfo.getBuildTimestamp(), config.getTopTerms()));

        } catch (final IOException e) {
            logger.error("Error getting index stats", e);
            return ToolResultHelper.createResult(IndexStatsResponse.error("Error getting index stats: " + e));
        } catch (final RuntimeException e) {
            logger.error("Unexpected error getting index stats", e);
            return ToolResultHelper.createResult(IndexStatsResponse.error("Error getting index stats: " + e));
        }
    }

    private static List<SearchHit> toHits(final List<SearchResult> results) {
        return results.stream().map(SearchHit::from).toList();
    }
}
