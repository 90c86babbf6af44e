package com.my.bridge.domain.model;

/**
 * 왜: 봇 전체 현황(DB 집계, 최근 메시지, 프로세스 지표)을 한 번에 돌려주기 위함.
 */
public record BotStats(DatabaseStats database, MessageStats lastWeek, ProcessMetrics process) {
}
