package com.whothub.gameservice.games.whot.domain.model;

import com.whothub.gameservice.games.whot.domain.enums.ChatStatus;
import lombok.Getter;

import java.time.Instant;

/**
 * 对局内聊天记录（直接作为 receive_message / chat_history 的载荷下发）。
 */
@Getter
public class ChatMessage {

    private final String id;
    private final String senderId;
    private final String text;
    private final Instant timestamp;
    private ChatStatus status;

    public ChatMessage(String id, String senderId, String text, Instant timestamp) {
        this.id = id;
        this.senderId = senderId;
        this.text = text;
        this.timestamp = timestamp;
        this.status = ChatStatus.SENT;
    }

    /**
     * 标记已读。
     * @return 状态是否发生了变化
     */
    public boolean markRead() {
        if (status == ChatStatus.READ) {
            return false;
        }
        status = ChatStatus.READ;
        return true;
    }
}
