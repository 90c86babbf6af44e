package com.my.bridge.domain.model;

public record RemovalResult(Connection connection, ConfirmationState state, boolean removed) {
}
