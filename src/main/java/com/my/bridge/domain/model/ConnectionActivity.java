package com.my.bridge.domain.model;

public record ConnectionActivity(Connection connection, long messages) {
}
