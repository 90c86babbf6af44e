package com.my.bridge.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 왜: 콘텐츠 필터가 참조하는 목록과 임계값을 시작 시 한 번 만들어 주입하기 위함.
 */
public record FilterRules(Set<String> blockedDomains, List<String> profanityWords, int massMentionThreshold) {

    public FilterRules {
        blockedDomains = blockedDomains.stream()
                .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                .filter(domain -> !domain.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        profanityWords = profanityWords.stream()
                .map(word -> word.trim().toLowerCase(Locale.ROOT))
                .filter(word -> !word.isEmpty())
                .toList();
        if (massMentionThreshold < 1) {
            throw new IllegalArgumentException("massMentionThreshold는 1 이상이어야 합니다.");
        }
    }
}
