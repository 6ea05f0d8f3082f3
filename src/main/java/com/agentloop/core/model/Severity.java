package com.agentloop.core.model;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
