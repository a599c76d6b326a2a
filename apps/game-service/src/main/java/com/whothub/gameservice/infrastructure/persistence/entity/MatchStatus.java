package com.whothub.gameservice.infrastructure.persistence.entity;

/**
 * 玩家最近一场对局的状态。
 * PAID_RETRY：已付费重试，解锁再来一局。
 */
public enum MatchStatus {
    WON,
    LOST,
    PAID_RETRY
}
