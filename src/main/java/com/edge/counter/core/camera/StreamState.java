package com.edge.counter.core.camera;

/**
 * 解码线程状态: IDLE → OPENING → STREAMING → {STOPPED | FAILED}
 */
public enum StreamState {
    IDLE,
    OPENING,
    STREAMING,
    STOPPED,
    FAILED;

    public boolean isActive() {
        return this == OPENING || this == STREAMING;
    }

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
