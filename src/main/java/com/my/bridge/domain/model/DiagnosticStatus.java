package com.my.bridge.domain.model;

public enum DiagnosticStatus {
    OK,
    WARNING,
    FAILED
}
