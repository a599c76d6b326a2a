package com.whothub.gameservice.platform.ws;

import com.whothub.gameservice.platform.transport.ClientNotifier;
import com.whothub.gameservice.platform.transport.OutboundEvent;
import com.whothub.gameservice.platform.transport.ServerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 基于 SimpMessagingTemplate 的出站推送实现。
 * 投递失败只记日志：推送是尽力而为，不能反过来打断对局状态变更。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompClientNotifier implements ClientNotifier {

    /** 点对点队列：客户端订阅 /user/queue/events */
    static final String CONNECTION_QUEUE = "/queue/events";
    /** 赛事大厅频道 */
    static final String LOBBY_TOPIC = "/topic/tournaments";

    private final SimpMessagingTemplate messaging;

    @Override
    public void toConnection(String connectionId, OutboundEvent event, Object payload) {
        if (connectionId == null) {
            return;
        }
        try {
            messaging.convertAndSendToUser(connectionId, CONNECTION_QUEUE,
                    ServerEvent.direct(event, payload), connectionHeaders(connectionId));
        } catch (Exception e) {
            log.warn("点对点推送失败: connectionId={}, event={}", connectionId, event, e);
        }
    }

    @Override
    public void toSession(String sessionCode, OutboundEvent event, Object payload) {
        try {
            messaging.convertAndSend(sessionTopic(sessionCode), ServerEvent.of(event, sessionCode, payload));
        } catch (Exception e) {
            log.warn("对局广播失败: sessionCode={}, event={}", sessionCode, event, e);
        }
    }

    @Override
    public void toLobby(OutboundEvent event, Object payload) {
        try {
            messaging.convertAndSend(LOBBY_TOPIC, ServerEvent.of(event, null, payload));
        } catch (Exception e) {
            log.warn("大厅广播失败: event={}", event, e);
        }
    }

    /** 拼接对局广播路径（示例：/topic/session.AB12） */
    static String sessionTopic(String sessionCode) {
        return "/topic/session." + sessionCode;
    }

    /**
     * 附带 sessionId 头：即使用户注册表里还查不到该 Principal，也能按连接路由。
     */
    private static MessageHeaders connectionHeaders(String connectionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(connectionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
