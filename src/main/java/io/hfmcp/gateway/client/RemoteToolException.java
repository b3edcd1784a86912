package io.hfmcp.gateway.client;

/**
 * A remote endpoint failed to answer or answered with an error.
 */
public class RemoteToolException extends RuntimeException {

    public RemoteToolException(String message) {
        super(message);
    }

    public RemoteToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
