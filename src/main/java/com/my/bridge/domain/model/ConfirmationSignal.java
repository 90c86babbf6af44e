package com.my.bridge.domain.model;

public record ConfirmationSignal(long userId, boolean approved) {
}
