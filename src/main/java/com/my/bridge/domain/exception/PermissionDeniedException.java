package com.my.bridge.domain.exception;

import com.my.bridge.domain.model.ChannelCapability;

import java.util.Set;

/**
 * 왜: 플랫폼 권한이 부족하거나 실행자가 권한이 없을 때, 부족한 항목을 함께 전달하기 위함.
 */
public class PermissionDeniedException extends RuntimeException {

    private final Set<ChannelCapability> missing;

    public PermissionDeniedException(String message) {
        this(message, Set.of());
    }

    public PermissionDeniedException(String message, Set<ChannelCapability> missing) {
        super(message);
        this.missing = Set.copyOf(missing);
    }

    public Set<ChannelCapability> missing() {
        return missing;
    }
}
