package com.whothub.gameservice.games.whot.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whothub.gameservice.games.whot.domain.enums.Seat;
import com.whothub.gameservice.games.whot.domain.model.ChatMessage;
import com.whothub.gameservice.games.whot.domain.model.GameSession;
import com.whothub.gameservice.games.whot.domain.model.TournamentLink;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 会话注册表：活跃双人对局的入座、局面转发、聊天、重连与断线通知。
 * 所有方法都必须在主循环线程上调用。
 */
public interface SessionRegistry {

    /**
     * 加入（或创建）对局。
     * @param tournamentLink 客户端声明的赛事关联，可为空；仅在创建对局且校验通过时挂载
     * @return 该玩家的座位
     */
    Seat joinSession(String sessionCode, String storedId, String connectionId, TournamentLink tournamentLink);

    /**
     * 提交新局面：转成 ONE 号位视角保存，并推给除提交者以外的参与者。
     * 提交者座位以连接绑定为准，未绑定的连接直接丢弃。
     */
    void applyStateUpdate(String sessionCode, String connectionId, ObjectNode newState);

    /**
     * @return 记录下的消息；连接未绑定本对局时为空
     */
    Optional<ChatMessage> recordChatMessage(String sessionCode, String connectionId, String text);

    /**
     * 把对手发来的消息标为已读，读者取连接绑定的参与者。
     * @return 是否有消息被标为已读（有变化才广播）
     */
    boolean markRead(String sessionCode, String connectionId);

    /** 告诉 storedId 的对手：我在线 */
    void confirmOnline(String sessionCode, String storedId);

    /** 连接断开：通知所有相关对局中的对手，但不移除参与者 */
    void notifyDisconnect(String connectionId);

    /** 延迟销毁对局（宽限期后复查实例未被替换再删除） */
    void terminateSession(String sessionCode);

    Optional<GameSession> findSession(String sessionCode);

    /**
     * 清扫最后活动时间早于 cutoff 的对局。
     * @param retain 返回 true 的对局即使空闲也保留
     * @return 清除的数量
     */
    int sweepIdleSessions(Instant cutoff, Predicate<GameSession> retain);
}
