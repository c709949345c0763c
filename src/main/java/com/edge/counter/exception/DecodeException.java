package com.edge.counter.exception;

/**
 * 读取或解码帧时出错
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
