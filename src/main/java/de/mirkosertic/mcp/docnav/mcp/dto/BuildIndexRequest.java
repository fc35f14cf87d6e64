package de.mirkosertic.mcp.docnav.mcp.dto;

import de.mirkosertic.mcp.docnav.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the buildIndex tool.
 */
public record BuildIndexRequest(
        @Nullable
        @Description("Directory to index recursively. Omit to index the project's docs directory, its state directory and the top-level project files.")
        String root
) {
    public static BuildIndexRequest fromMap(final Map<String, Object> args) {
        return new BuildIndexRequest((String) args.get("root"));
    }
}
