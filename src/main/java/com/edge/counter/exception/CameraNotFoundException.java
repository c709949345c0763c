package com.edge.counter.exception;

public class CameraNotFoundException extends CameraException {

    public CameraNotFoundException(int channel) {
        super(channel, "Camera " + channel + " not found");
    }
}
