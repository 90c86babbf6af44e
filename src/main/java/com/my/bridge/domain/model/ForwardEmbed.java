package com.my.bridge.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 전달 메시지의 카드 표현(작성자, 출처 서버, 원본 시각, 연결 정보)을 플랫폼 포맷과 분리해 두기 위함.
 */
public record ForwardEmbed(String description,
                           String authorName,
                           String authorIconUrl,
                           Instant timestamp,
                           String footer,
                           int color) {

    public static final int DEFAULT_COLOR = 0x7289da;

    public ForwardEmbed {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(authorName, "authorName");
    }
}
