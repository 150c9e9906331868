package com.pgwire.client.model;

public enum StartupState {
    CONNECTING,
    STARTUP_SENT,
    AUTHENTICATING,
    BACKEND_PARAMS_WAIT,
    READY_FOR_QUERY,
    FAILED
}
