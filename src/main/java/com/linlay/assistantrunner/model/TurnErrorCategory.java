package com.linlay.assistantrunner.model;

public enum TurnErrorCategory {
    TIMEOUT,
    REMOTE_FATAL,
    TOOL_FAILURE,
    BUSY
}
