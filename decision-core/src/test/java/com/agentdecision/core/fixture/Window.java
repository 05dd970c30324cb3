package com.agentdecision.core.fixture;

public enum Window {
    OPEN,
    CLOSE
}
