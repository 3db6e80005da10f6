package com.graphmend.core.codec;

/**
 * Raised when a payload cannot be read as a decision graph: wrong JSON types,
 * missing id or kind, unknown kind, duplicate node id.
 */
public class GraphPayloadException extends Exception {

    public GraphPayloadException(String message)                  { super(message); }
    public GraphPayloadException(String message, Throwable cause) { super(message, cause); }
}
