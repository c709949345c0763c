package com.edge.counter.exception;

/**
 * 摄像头会话相关异常的基类
 */
public class CameraException extends RuntimeException {
    private final int channel;

    public CameraException(int channel, String message) {
        super(message);
        this.channel = channel;
    }

    public int getChannel() {
        return channel;
    }
}
