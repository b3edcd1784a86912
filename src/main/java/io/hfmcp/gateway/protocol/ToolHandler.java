package io.hfmcp.gateway.protocol;

import java.util.Map;

/**
 * Executes one tool call with already validated arguments.
 */
@FunctionalInterface
public interface ToolHandler {

    /**
     * @param arguments validated arguments, defaults applied
     * @param context call context
     * @return a {@code tools/call} result: {@code content} plus optional {@code isError}
     * @throws Exception any failure; the server reports it to the caller as an error result
     */
    Map<String, Object> handle(Map<String, Object> arguments, ToolCallContext context) throws Exception;
}
