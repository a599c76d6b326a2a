package com.whothub.gameservice.platform.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * 推送消息外壳（所有出站事件复用）
 * - event：事件名，决定 payload 的结构
 * - topic：所属对局码 / 赛事 ID，点对点消息可为空
 * - payload：事件内容
 * - ts：服务器时间戳（ms）
 *
 * 用法示例：
 *   ServerEvent.of(OutboundEvent.MATCH_OVER, "AB12", new MatchOver("0xabc"));
 */
public record ServerEvent<T>(OutboundEvent event, String topic, T payload, long ts) {

    public ServerEvent {
        Objects.requireNonNull(event, "event");
    }

    public static <T> ServerEvent<T> of(OutboundEvent event, String topic, T payload) {
        return new ServerEvent<>(event, topic, payload, Instant.now().toEpochMilli());
    }

    /** 点对点消息，不归属任何对局/赛事 */
    public static <T> ServerEvent<T> direct(OutboundEvent event, T payload) {
        return of(event, null, payload);
    }
}
