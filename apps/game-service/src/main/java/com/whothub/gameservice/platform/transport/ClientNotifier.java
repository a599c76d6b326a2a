package com.whothub.gameservice.platform.transport;

/**
 * 出站推送端口。
 * 注册表与赛事引擎只依赖这个接口，不关心底层是 STOMP 还是别的传输。
 */
public interface ClientNotifier {

    /** 点对点：只发给某一条连接 */
    void toConnection(String connectionId, OutboundEvent event, Object payload);

    /** 发给订阅了该对局主题的所有连接（按调用顺序送达） */
    void toSession(String sessionCode, OutboundEvent event, Object payload);

    /** 大厅广播：所有订阅赛事频道的连接 */
    void toLobby(OutboundEvent event, Object payload);

    /** 拒绝提示只回给发起方 */
    default void sendError(String connectionId, String message) {
        toConnection(connectionId, OutboundEvent.SESSION_ERROR, message);
    }
}
