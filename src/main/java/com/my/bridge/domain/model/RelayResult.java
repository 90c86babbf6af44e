package com.my.bridge.domain.model;

public record RelayResult(RelayDecision decision, int forwardedCount) {

    public static RelayResult stopped(RelayDecision decision) {
        return new RelayResult(decision, 0);
    }
}
