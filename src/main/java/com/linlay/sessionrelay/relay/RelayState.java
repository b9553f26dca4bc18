package com.linlay.sessionrelay.relay;

public enum RelayState {
    STARTING,
    STREAMING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
