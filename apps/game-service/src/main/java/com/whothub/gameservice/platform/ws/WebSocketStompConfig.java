package com.whothub.gameservice.platform.ws;

import com.whothub.gameservice.platform.config.WhotProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket + STOMP 配置类
 * ----------------------------------------
 * 客户端通过 /ws 端点连接，用 /app 前缀发送入站事件，
 * 订阅 /topic/... 接收对局/大厅广播，订阅 /user/queue/events 接收点对点消息。
 *
 * 用途：
 *   - /app/join_session 等 : 客户端发送
 *   - /topic/session.{code} : 对局内广播
 *   - /topic/tournaments    : 赛事大厅广播
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final ConnectionPrincipalInterceptor principalInterceptor;
    private final WhotProperties properties;

    public WebSocketStompConfig(ConnectionPrincipalInterceptor principalInterceptor, WhotProperties properties) {
        this.principalInterceptor = principalInterceptor;
        this.properties = properties;
    }

    /**
     * WebSocket 心跳用的 TaskScheduler。
     * 使用不同的 bean 名称避免与 Spring 自动配置冲突。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] origins = properties.getWs().getAllowedOrigins();
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(origins);
        // SockJS 回退（浏览器不支持原生 WebSocket 时）
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(origins)
                .withSockJS();
    }

    /**
     * 心跳 [客户端发送间隔, 服务端发送间隔] 均为 10 秒；
     * 断线检测依赖心跳超时后框架发出的 SessionDisconnectEvent。
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[]{10000, 10000})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(principalInterceptor);
    }
}
