package com.my.bridge.domain.model;

import java.util.List;

/**
 * 왜: 게이트웨이 전송 요청의 형태(텍스트, 카드, 첨부)를 고정해 어댑터 간 포맷 불일치를 방지하기 위함.
 */
public record OutgoingMessage(String text, ForwardEmbed embed, List<OutgoingFile> files) {

    public OutgoingMessage {
        files = files == null ? List.of() : List.copyOf(files);
        if ((text == null || text.isBlank()) && embed == null && files.isEmpty()) {
            throw new IllegalArgumentException("보낼 내용이 없습니다.");
        }
    }

    public static OutgoingMessage text(String text) {
        return new OutgoingMessage(text, null, List.of());
    }
}
