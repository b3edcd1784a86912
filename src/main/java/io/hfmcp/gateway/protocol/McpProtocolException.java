package io.hfmcp.gateway.protocol;

/**
 * A protocol-level failure that maps onto a JSON-RPC error code.
 */
public class McpProtocolException extends RuntimeException {

    private final int code;

    public McpProtocolException(int code, String message) {
        super(message);
        this.code = code;
    }

    public McpProtocolException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
