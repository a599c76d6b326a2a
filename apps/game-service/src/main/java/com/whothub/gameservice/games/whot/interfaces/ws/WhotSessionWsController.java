package com.whothub.gameservice.games.whot.interfaces.ws;

import com.whothub.gameservice.common.CoordinationException;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.SessionCommands.ApplyStateUpdate;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.SessionCommands.ConfirmOnline;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.SessionCommands.JoinSession;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.SessionCommands.MarkRead;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.SessionCommands.SendMessage;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.SessionCommands.SessionCommand;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.SessionCommands.SessionOver;
import com.whothub.gameservice.games.whot.service.ResultArbiter;
import com.whothub.gameservice.games.whot.service.SessionRegistry;
import com.whothub.gameservice.platform.config.WhotProperties;
import com.whothub.gameservice.platform.ws.CommandDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * Whot 对局 WebSocket 控制器
 * ----------------------------------------
 * 只做两件事：校验入站命令、把命令投递到主循环。
 * 连接 ID 取 STOMP sessionId，仲裁、局面提交、聊天与已读都以它绑定的参与者为准。
 *
 *   /app/join_session          入座 / 重连
 *   /app/apply_state_update    提交新局面
 *   /app/send_message          聊天
 *   /app/mark_read             已读回执
 *   /app/confirm_online_state  告知对手在线
 *   /app/session_over          结束上报（可带胜负声明）
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class WhotSessionWsController {

    private final SessionRegistry sessionRegistry;
    private final ResultArbiter resultArbiter;
    private final CommandDispatcher dispatcher;
    private final WhotProperties properties;

    @MessageMapping("/join_session")
    public void join(@Payload JoinSession cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "join_session")) {
            return;
        }
        dispatcher.dispatch(connectionId, "join_session",
                () -> sessionRegistry.joinSession(cmd.sessionCode(), cmd.storedId(), connectionId, cmd.tournamentLink()));
    }

    @MessageMapping("/apply_state_update")
    public void applyStateUpdate(@Payload ApplyStateUpdate cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "apply_state_update")) {
            return;
        }
        dispatcher.dispatch(connectionId, "apply_state_update",
                () -> sessionRegistry.applyStateUpdate(cmd.sessionCode(), connectionId, cmd.stateObject()));
    }

    @MessageMapping("/send_message")
    public void sendMessage(@Payload SendMessage cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "send_message")) {
            return;
        }
        try {
            cmd.requireWithin(properties.getSession().getMaxMessageLength());
        } catch (CoordinationException e) {
            dispatcher.reject(connectionId, "send_message", e);
            return;
        }
        dispatcher.dispatch(connectionId, "send_message",
                () -> sessionRegistry.recordChatMessage(cmd.sessionCode(), connectionId, cmd.text()));
    }

    @MessageMapping("/mark_read")
    public void markRead(@Payload MarkRead cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "mark_read")) {
            return;
        }
        dispatcher.dispatch(connectionId, "mark_read",
                () -> sessionRegistry.markRead(cmd.sessionCode(), connectionId));
    }

    @MessageMapping("/confirm_online_state")
    public void confirmOnline(@Payload ConfirmOnline cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "confirm_online_state")) {
            return;
        }
        dispatcher.dispatch(connectionId, "confirm_online_state",
                () -> sessionRegistry.confirmOnline(cmd.sessionCode(), cmd.storedId()));
    }

    /**
     * 结束上报。上报者身份只看连接绑定，声明只表达“我赢 / 对手赢”。
     */
    @MessageMapping("/session_over")
    public void sessionOver(@Payload SessionOver cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "session_over")) {
            return;
        }
        dispatcher.dispatch(connectionId, "session_over",
                () -> resultArbiter.handleSessionOver(cmd.sessionCode(), connectionId, cmd.claim()));
    }

    private boolean accept(SessionCommand cmd, String connectionId, String label) {
        if (cmd == null) {
            log.warn("空命令: cmd={}, connectionId={}", label, connectionId);
            return false;
        }
        try {
            cmd.validate();
            return true;
        } catch (CoordinationException e) {
            dispatcher.reject(connectionId, label, e);
            return false;
        }
    }
}
