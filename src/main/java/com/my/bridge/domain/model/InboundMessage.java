package com.my.bridge.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 왜: 게이트웨이에서 수신한 메시지 생성 이벤트의 최소 계약을 고정해 중계 파이프라인이 일관된 입력을 받도록 하기 위함.
 */
public record InboundMessage(long id,
                             long authorId,
                             boolean authorBot,
                             String authorName,
                             String authorAvatarUrl,
                             String content,
                             List<InboundAttachment> attachments,
                             long channelId,
                             long guildId,
                             String guildName,
                             Instant createdAt,
                             MessageKind kind) {

    public InboundMessage {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(kind, "kind");
        content = content == null ? "" : content;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        authorName = authorName == null || authorName.isBlank() ? String.valueOf(authorId) : authorName;
    }

    public boolean hasText() {
        return !content.isBlank();
    }
}
