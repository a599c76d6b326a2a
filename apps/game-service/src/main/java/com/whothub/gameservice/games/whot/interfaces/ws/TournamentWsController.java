package com.whothub.gameservice.games.whot.interfaces.ws;

import com.whothub.gameservice.common.CoordinationException;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.TournamentCommands.CreateTournament;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.TournamentCommands.JoinTournament;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.TournamentCommands.ReconnectTournament;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.TournamentCommands.RequestMatchInfo;
import com.whothub.gameservice.games.whot.interfaces.ws.dto.TournamentCommands.TournamentCommand;
import com.whothub.gameservice.games.whot.service.TournamentEngine;
import com.whothub.gameservice.platform.transport.ClientNotifier;
import com.whothub.gameservice.platform.transport.OutboundEvent;
import com.whothub.gameservice.platform.ws.CommandDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * 赛事 WebSocket 控制器
 * ----------------------------------------
 *   /app/create_tournament     建赛（大厅广播新列表）
 *   /app/join_tournament       报名 / 重新进入
 *   /app/reconnect_tournament  断线后改绑连接
 *   /app/request_match_info    重新获取本场对局码
 *   /app/list_tournaments      拉取赛事列表（只回给请求者）
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class TournamentWsController {

    private final TournamentEngine tournamentEngine;
    private final CommandDispatcher dispatcher;
    private final ClientNotifier notifier;

    @MessageMapping("/create_tournament")
    public void create(@Payload CreateTournament cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "create_tournament")) {
            return;
        }
        dispatcher.dispatch(connectionId, "create_tournament",
                () -> tournamentEngine.createTournament(cmd.size(), cmd.name()));
    }

    @MessageMapping("/join_tournament")
    public void join(@Payload JoinTournament cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "join_tournament")) {
            return;
        }
        dispatcher.dispatch(connectionId, "join_tournament",
                () -> tournamentEngine.joinTournament(cmd.tournamentId(), cmd.storedId(), cmd.name(), connectionId));
    }

    @MessageMapping("/reconnect_tournament")
    public void reconnect(@Payload ReconnectTournament cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "reconnect_tournament")) {
            return;
        }
        dispatcher.dispatch(connectionId, "reconnect_tournament",
                () -> tournamentEngine.reconnectTournament(cmd.tournamentId(), cmd.storedId(), connectionId));
    }

    @MessageMapping("/request_match_info")
    public void requestMatchInfo(@Payload RequestMatchInfo cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        if (!accept(cmd, connectionId, "request_match_info")) {
            return;
        }
        dispatcher.dispatch(connectionId, "request_match_info",
                () -> tournamentEngine.requestMatchInfo(connectionId, cmd.tournamentId(), cmd.matchId()));
    }

    @MessageMapping("/list_tournaments")
    public void list(SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        dispatcher.dispatch(connectionId, "list_tournaments",
                () -> notifier.toConnection(connectionId, OutboundEvent.TOURNAMENTS_LIST, tournamentEngine.listTournaments()));
    }

    private boolean accept(TournamentCommand cmd, String connectionId, String label) {
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
