package com.whothub.gameservice.platform.ws;

import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.security.Principal;

/**
 * STOMP 连接身份拦截器
 *
 * 玩家身份（storedId）由客户端在各事件里声明，服务端不做登录认证；
 * 这里只在 CONNECT 阶段把“连接本身”登记为 Principal，名字就是 STOMP sessionId。
 * 这样 convertAndSendToUser(connectionId, ...) 就能精确投递到某一条连接，
 * 仲裁时也始终以这条连接绑定的参与者为准。
 */
@Component
public class ConnectionPrincipalInterceptor implements ChannelInterceptor {

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            accessor = StompHeaderAccessor.wrap(message);
        }
        // 仅处理 CONNECT 命令
        if (StompCommand.CONNECT.equals(accessor.getCommand()) && accessor.getUser() == null) {
            String sessionId = accessor.getSessionId();
            if (sessionId != null) {
                accessor.setUser(new ConnectionPrincipal(sessionId));
            }
        }
        return message;
    }

    /** 以连接 ID 命名的 Principal */
    public record ConnectionPrincipal(String connectionId) implements Principal {
        @Override
        public String getName() {
            return connectionId;
        }
    }
}
