package com.my.bridge.domain.model;

public enum ReasonCode {
    PROFANITY,
    BLOCKED_LINK,
    SPAM_PATTERN,
    MASS_MENTION,
    TOKEN_LEAK
}
