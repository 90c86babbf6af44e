package com.my.bridge.domain.model;

/**
 * 왜: 호출자가 필요한 검사만 켜도록 검사 스위치를 하나의 값으로 전달하기 위함.
 */
public record FilterOptions(boolean profanity,
                            boolean links,
                            boolean spam,
                            boolean massMentions,
                            boolean tokens) {

    public static FilterOptions all() {
        return new FilterOptions(true, true, true, true, true);
    }

    /**
     * 중계 경로: 링크 검사는 항상, 욕설 검사는 서버 설정에 따라.
     */
    public static FilterOptions forRelay(boolean profanityFilter) {
        return new FilterOptions(profanityFilter, true, false, false, false);
    }
}
