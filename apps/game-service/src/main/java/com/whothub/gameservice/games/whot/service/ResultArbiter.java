package com.whothub.gameservice.games.whot.service;

import com.whothub.gameservice.application.stats.MatchStatsRecorder;
import com.whothub.gameservice.games.whot.domain.dto.MatchOver;
import com.whothub.gameservice.games.whot.domain.enums.WinnerClaim;
import com.whothub.gameservice.games.whot.domain.model.GameSession;
import com.whothub.gameservice.games.whot.domain.model.Participant;
import com.whothub.gameservice.games.whot.domain.model.TournamentLink;
import com.whothub.gameservice.platform.transport.ClientNotifier;
import com.whothub.gameservice.platform.transport.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 胜负仲裁
 * ----------------------------------------
 * 客户端只上报相对声明（user / opponent），上报者身份一律以“这条连接绑定的参与者”为准，
 * 从不信任载荷里的 storedId。仲裁通过后依次：
 *   1) 赛事场次记胜者（如有关联）
 *   2) 向对局广播 match_over
 *   3) 延迟销毁对局
 * 最后异步结算经验值。每个对局只结算一次。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultArbiter {

    private final SessionRegistry sessionRegistry;
    private final TournamentEngine tournamentEngine;
    private final ClientNotifier notifier;
    private final MatchStatsRecorder statsRecorder;

    /**
     * 处理 session_over。
     * @param claim 可为空：为空表示只结束对局、不判胜负
     * @return 仲裁出的胜者 storedId；未判胜负或被丢弃时为空
     */
    public Optional<String> handleSessionOver(String sessionCode, String reportingConnectionId, WinnerClaim claim) {
        Optional<GameSession> found = sessionRegistry.findSession(sessionCode);
        if (found.isEmpty()) {
            log.warn("结束上报的对局不存在，已丢弃: code={}, connectionId={}", sessionCode, reportingConnectionId);
            return Optional.empty();
        }
        GameSession session = found.get();
        Optional<Participant> reporter = session.findByConnection(reportingConnectionId);
        if (reporter.isEmpty()) {
            log.warn("未绑定该对局的连接上报结果，已丢弃: code={}, connectionId={}, claim={}",
                    sessionCode, reportingConnectionId, claim);
            return Optional.empty();
        }
        if (!session.conclude()) {
            log.info("对局已结算，忽略重复上报: code={}, connectionId={}", sessionCode, reportingConnectionId);
            return Optional.empty();
        }

        Participant me = reporter.get();
        Optional<Participant> opponent = session.opponentOf(me);
        if (claim == null || opponent.isEmpty()) {
            log.info("对局结束（无胜负）: code={}, reporter={}", sessionCode, me.getStoredId());
            sessionRegistry.terminateSession(sessionCode);
            return Optional.empty();
        }

        Participant winner = claim == WinnerClaim.USER ? me : opponent.get();
        Participant loser = winner == me ? opponent.get() : me;
        log.info("仲裁结果: code={}, reporter={}, claim={}, winner={}",
                sessionCode, me.getStoredId(), claim, winner.getStoredId());

        // 1) 赛事晋级
        session.tournamentLink().ifPresent(link -> reportToTournament(link, winner.getStoredId()));
        // 2) 广播结果
        notifier.toSession(sessionCode, OutboundEvent.MATCH_OVER, new MatchOver(winner.getStoredId()));
        // 3) 宽限期后销毁
        sessionRegistry.terminateSession(sessionCode);
        // 经验值结算（异步）
        statsRecorder.recordResult(winner.getStoredId(), loser.getStoredId());
        return Optional.of(winner.getStoredId());
    }

    private void reportToTournament(TournamentLink link, String winnerStoredId) {
        tournamentEngine.reportMatchResult(link.tournamentId(), link.matchId(), winnerStoredId);
    }
}
