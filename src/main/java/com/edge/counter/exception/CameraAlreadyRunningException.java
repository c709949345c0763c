package com.edge.counter.exception;

public class CameraAlreadyRunningException extends CameraException {

    public CameraAlreadyRunningException(int channel) {
        super(channel, "Camera " + channel + " already running");
    }
}
