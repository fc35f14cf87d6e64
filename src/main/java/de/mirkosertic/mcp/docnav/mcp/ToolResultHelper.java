package de.mirkosertic.mcp.docnav.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;

/**
 * Wraps response DTOs into MCP tool results.
 * <p>
 * The DTO is serialized to JSON and returned as a single text content. Records with a
 * {@code success} component set to false are flagged as error results.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(isErrorResponse(response))
                .build();
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            logger.error("Cannot serialize tool response of type {}", obj.getClass().getName(), e);
            return "{\"success\":false,\"error\":\"JSON serialization error\"}";
        }
    }

    private static boolean isErrorResponse(final Object response) {
        if (!(response instanceof Record record)) {
            return false;
        }
        for (final RecordComponent component : record.getClass().getRecordComponents()) {
            if (!"success".equals(component.getName())) {
                continue;
            }
            try {
                if (component.getAccessor().invoke(record) instanceof Boolean success) {
                    return !success;
                }
            } catch (final IllegalAccessException | InvocationTargetException e) {
                logger.debug("Cannot read success flag of {}", record.getClass().getName(), e);
            }
        }
        return false;
    }
}
