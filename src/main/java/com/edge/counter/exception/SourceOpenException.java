package com.edge.counter.exception;

/**
 * 视频源无法打开
 */
public class SourceOpenException extends RuntimeException {

    public SourceOpenException(String uri) {
        super("Failed to open video source: " + uri);
    }

    public SourceOpenException(String uri, Throwable cause) {
        super("Failed to open video source: " + uri + " (" + cause.getMessage() + ")", cause);
    }
}
