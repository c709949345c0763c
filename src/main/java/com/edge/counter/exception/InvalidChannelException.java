package com.edge.counter.exception;

/**
 * 通道号不合法（超出配置范围）
 */
public class InvalidChannelException extends CameraException {

    public InvalidChannelException(int channel, int min, int max) {
        super(channel, "Invalid channel " + channel + " (must be " + min + "-" + max + ")");
    }
}
