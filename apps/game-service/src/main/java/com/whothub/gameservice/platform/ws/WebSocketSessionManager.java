package com.whothub.gameservice.platform.ws;

import com.whothub.gameservice.games.whot.service.SessionRegistry;
import com.whothub.gameservice.platform.loop.GameLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * WebSocket 连接生命周期监听。
 * 断开时通知各对局中的对手（参与者本身保留，等待重连）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    private final GameLoop gameLoop;
    private final SessionRegistry sessionRegistry;

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        log.info("WebSocket 连接建立: connectionId={}", accessor.getSessionId());
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String connectionId = event.getSessionId();
        log.info("WebSocket 连接断开: connectionId={}, status={}", connectionId, event.getCloseStatus());
        gameLoop.submit("disconnect", () -> sessionRegistry.notifyDisconnect(connectionId));
    }
}
