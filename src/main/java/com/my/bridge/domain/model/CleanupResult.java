package com.my.bridge.domain.model;

public record CleanupResult(int days, ConfirmationState state, int deletedRows) {
}
