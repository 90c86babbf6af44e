package com.my.bridge.domain.model;

public record SpamCheckResult(int count, boolean blocked) {
}
