package com.my.bridge.domain.model;

public record ConnectionDetails(Connection connection, MessageStats lastWeek) {
}
