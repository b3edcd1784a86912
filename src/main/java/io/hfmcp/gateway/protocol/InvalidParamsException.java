package io.hfmcp.gateway.protocol;

/**
 * Tool or method arguments failed validation.
 */
public class InvalidParamsException extends McpProtocolException {

    public InvalidParamsException(String message) {
        super(JsonRpcErrors.INVALID_PARAMS, message);
    }
}
