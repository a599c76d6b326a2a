package com.whothub.gameservice.games.whot.service.impl;

import com.whothub.gameservice.common.CoordinationException;
import com.whothub.gameservice.games.whot.domain.constants.GameMessages;
import com.whothub.gameservice.games.whot.domain.dto.MatchReady;
import com.whothub.gameservice.games.whot.domain.dto.TournamentJoined;
import com.whothub.gameservice.games.whot.domain.dto.TournamentView;
import com.whothub.gameservice.games.whot.domain.enums.TournamentStatus;
import com.whothub.gameservice.games.whot.domain.model.Match;
import com.whothub.gameservice.games.whot.domain.model.Tournament;
import com.whothub.gameservice.games.whot.domain.model.TournamentEntrant;
import com.whothub.gameservice.games.whot.domain.model.TournamentLink;
import com.whothub.gameservice.games.whot.domain.repository.SessionRepository;
import com.whothub.gameservice.games.whot.domain.repository.TournamentRepository;
import com.whothub.gameservice.games.whot.service.SessionCodeAllocator;
import com.whothub.gameservice.games.whot.service.TournamentEngine;
import com.whothub.gameservice.platform.config.WhotProperties;
import com.whothub.gameservice.platform.loop.GameLoop;
import com.whothub.gameservice.platform.transport.ClientNotifier;
import com.whothub.gameservice.platform.transport.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TournamentEngineImpl implements TournamentEngine {

    private static final int MIN_SIZE = 2;

    private final TournamentRepository tournamentRepo;
    private final SessionRepository sessionRepo;
    private final SessionCodeAllocator codeAllocator;
    private final ClientNotifier notifier;
    private final GameLoop gameLoop;
    private final WhotProperties properties;
    private final Clock clock;

    /**
     * 创建赛事
     */
    @Override
    public TournamentView createTournament(int size, String name) {
        // 1) 人数必须是 [2, maxSize] 内的 2 的幂
        int maxSize = properties.getTournament().getMaxSize();
        if (size < MIN_SIZE || size > maxSize || Integer.bitCount(size) != 1) {
            throw CoordinationException.invalidInput(GameMessages.formatInvalidSize(maxSize));
        }
        // 2) 生成 6 位赛事 ID，未命名时给默认名
        String id = codeAllocator.nextTournamentId(tournamentRepo::exists);
        String finalName = (name == null || name.isBlank()) ? "Tournament " + id : name.trim();
        Tournament t = new Tournament(id, finalName, size, clock.instant());
        tournamentRepo.save(t);
        log.info("创建赛事: id={}, name={}, size={}", id, finalName, size);

        // 3) 刷新大厅列表
        notifier.toLobby(OutboundEvent.TOURNAMENTS_LIST, listTournaments());
        return TournamentView.of(t);
    }

    /**
     * 报名
     */
    @Override
    public TournamentView joinTournament(String tournamentId, String storedId, String name, String connectionId) {
        Tournament t = requireTournament(tournamentId);

        // 1) 已在名单中：按重连处理，开赛后也允许
        if (t.findEntrant(storedId).isPresent()) {
            log.info("选手重新进入赛事: tournamentId={}, storedId={}", tournamentId, storedId);
            return rebind(t, storedId, name, connectionId);
        }
        // 2) 新选手：必须在报名阶段且未满
        if (t.getStatus() != TournamentStatus.WAITING) {
            throw CoordinationException.conflict(GameMessages.TOURNAMENT_ALREADY_STARTED);
        }
        if (t.isFull()) {
            throw CoordinationException.conflict(GameMessages.TOURNAMENT_FULL);
        }
        String displayName = (name == null || name.isBlank()) ? GameMessages.defaultDisplayName(storedId) : name.trim();
        t.addEntrant(new TournamentEntrant(storedId, displayName, connectionId));
        log.info("选手报名: tournamentId={}, storedId={}, name={}, {}/{}",
                tournamentId, storedId, displayName, t.getParticipants().size(), t.getSize());

        TournamentView view = TournamentView.of(t);
        notifier.toLobby(OutboundEvent.TOURNAMENT_UPDATE, view);
        notifier.toConnection(connectionId, OutboundEvent.TOURNAMENT_JOINED, new TournamentJoined(true, view));

        // 3) 人满自动开赛
        if (t.isFull()) {
            start(t);
            return TournamentView.of(t);
        }
        return view;
    }

    @Override
    public TournamentView reconnectTournament(String tournamentId, String storedId, String connectionId) {
        Tournament t = requireTournament(tournamentId);
        if (t.findEntrant(storedId).isEmpty()) {
            throw CoordinationException.notFound(GameMessages.NOT_A_PARTICIPANT);
        }
        return rebind(t, storedId, null, connectionId);
    }

    /**
     * 改绑连接。参赛名单与所有场次引用同一实例，这里仍逐场核对一遍。
     */
    private TournamentView rebind(Tournament t, String storedId, String name, String connectionId) {
        TournamentEntrant entrant = t.findEntrant(storedId).orElseThrow();
        entrant.rebind(connectionId, name);
        for (Match m : t.getMatches()) {
            m.playerByStoredId(storedId)
                    .filter(ref -> ref != entrant)
                    .ifPresent(ref -> ref.rebind(connectionId, name));
        }
        log.info("赛事连接改绑: tournamentId={}, storedId={}, connectionId={}", t.getId(), storedId, connectionId);
        TournamentView view = TournamentView.of(t);
        notifier.toLobby(OutboundEvent.TOURNAMENT_UPDATE, view);
        notifier.toConnection(connectionId, OutboundEvent.TOURNAMENT_JOINED, new TournamentJoined(true, view));
        return view;
    }

    private void start(Tournament t) {
        generateRound1Matches(t);
        log.info("赛事开赛: id={}, size={}, rounds={}", t.getId(), t.getSize(), t.totalRounds());
        notifier.toLobby(OutboundEvent.TOURNAMENT_UPDATE, TournamentView.of(t));
        notifyMatchReady(t);
    }

    /** 第一轮按报名顺序配对：(0,1), (2,3), ... */
    void generateRound1Matches(Tournament t) {
        t.startRound(1, t.getParticipants());
    }

    /**
     * 给本轮所有待赛场次分配对局码（只分配一次），并通知双方。
     */
    void notifyMatchReady(Tournament t) {
        for (Match m : t.matchesOfRound(t.getCurrentRound())) {
            if (!m.isReady()) {
                continue;
            }
            if (!m.hasSessionCode()) {
                m.assignSessionCode(codeAllocator.nextSessionCode(this::sessionCodeInUse));
                log.info("场次分配对局码: matchId={}, code={}", m.getMatchId(), m.getSessionCode());
            }
            sendMatchReady(t, m, m.getP1());
            sendMatchReady(t, m, m.getP2());
        }
    }

    private void sendMatchReady(Tournament t, Match m, TournamentEntrant to) {
        String opponentName = m.opponentOf(to).map(TournamentEntrant::getName).orElse(null);
        notifier.toConnection(to.getConnectionId(), OutboundEvent.TOURNAMENT_MATCH_READY,
                new MatchReady(m.getSessionCode(), m.getMatchId(), opponentName, t.getId()));
    }

    /** 对局码需同时避开活跃对局和所有已分配的场次码 */
    private boolean sessionCodeInUse(String code) {
        if (sessionRepo.exists(code)) {
            return true;
        }
        for (Tournament t : tournamentRepo.findAll()) {
            for (Match m : t.getMatches()) {
                if (code.equals(m.getSessionCode())) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public void requestMatchInfo(String connectionId, String tournamentId, String matchId) {
        Optional<Tournament> ot = tournamentRepo.find(tournamentId);
        Optional<Match> om = ot.flatMap(t -> t.findMatch(matchId));
        if (om.isEmpty()) {
            log.debug("请求场次信息，赛事或场次不存在: tournamentId={}, matchId={}", tournamentId, matchId);
            return;
        }
        Tournament t = ot.get();
        Match m = om.get();
        if (!m.hasSessionCode()) {
            notifyMatchReady(t);
            return;
        }
        TournamentEntrant requester = boundTo(m.getP1(), connectionId) ? m.getP1()
                : boundTo(m.getP2(), connectionId) ? m.getP2() : null;
        if (requester == null) {
            log.debug("非本场选手请求场次信息，忽略: matchId={}, connectionId={}", matchId, connectionId);
            return;
        }
        sendMatchReady(t, m, requester);
    }

    @Override
    public void reportMatchResult(String tournamentId, String matchId, String winnerStoredId) {
        Optional<Tournament> ot = tournamentRepo.find(tournamentId);
        Optional<Match> om = ot.flatMap(t -> t.findMatch(matchId));
        if (om.isEmpty()) {
            log.debug("上报结果，赛事或场次不存在: tournamentId={}, matchId={}", tournamentId, matchId);
            return;
        }
        Match m = om.get();
        if (m.isSettled()) {
            log.info("场次已有胜者，忽略重复上报: matchId={}", matchId);
            return;
        }
        Optional<TournamentEntrant> winner = m.playerByStoredId(winnerStoredId);
        if (winner.isEmpty()) {
            log.warn("胜者不在本场选手中，忽略: matchId={}, winner={}", matchId, winnerStoredId);
            return;
        }
        m.settle(winner.get());
        log.info("场次结束: matchId={}, winner={}", matchId, winnerStoredId);
        advanceRound(ot.get());
    }

    /**
     * 晋级判定：
     * - 本轮还有未完成场次：只刷新对阵
     * - 只剩一名胜者且已到最后一轮：赛事结束，定时清理
     * - 否则：胜者按顺序配对进入下一轮
     */
    void advanceRound(Tournament t) {
        List<Match> roundMatches = t.matchesOfRound(t.getCurrentRound());
        boolean allSettled = roundMatches.stream().allMatch(Match::isSettled);
        if (!allSettled) {
            notifier.toLobby(OutboundEvent.TOURNAMENT_UPDATE, TournamentView.of(t));
            return;
        }
        List<TournamentEntrant> winners = roundMatches.stream().map(Match::getWinner).toList();

        if (winners.size() == 1 && t.getCurrentRound() >= t.totalRounds()) {
            t.complete(winners.get(0));
            log.info("赛事结束: id={}, champion={}", t.getId(), winners.get(0).getStoredId());
            notifier.toLobby(OutboundEvent.TOURNAMENT_UPDATE, TournamentView.of(t));
            scheduleCleanup(t);
            return;
        }

        int next = t.getCurrentRound() + 1;
        t.startRound(next, winners);
        log.info("赛事晋级: id={}, round={}, matches={}", t.getId(), next, winners.size() / 2);
        notifier.toLobby(OutboundEvent.TOURNAMENT_UPDATE, TournamentView.of(t));
        notifyMatchReady(t);
    }

    private void scheduleCleanup(Tournament t) {
        gameLoop.schedule("tournament-cleanup-" + t.getId(), () -> {
            if (tournamentRepo.removeIfSame(t)) {
                log.info("已完成赛事已清理: id={}", t.getId());
                notifier.toLobby(OutboundEvent.TOURNAMENTS_LIST, listTournaments());
            }
        }, properties.getTournament().getCleanupDelay());
    }

    @Override
    public List<TournamentView> listTournaments() {
        return tournamentRepo.findAll().stream().map(TournamentView::of).toList();
    }

    @Override
    public boolean verifyLink(TournamentLink link, String sessionCode) {
        if (link == null || !link.isComplete() || sessionCode == null) {
            return false;
        }
        return tournamentRepo.find(link.tournamentId())
                .flatMap(t -> t.findMatch(link.matchId()))
                .map(m -> sessionCode.equals(m.getSessionCode()))
                .orElse(false);
    }

    @Override
    public boolean isMatchPlayer(TournamentLink link, String storedId) {
        if (link == null || !link.isComplete()) {
            return false;
        }
        return tournamentRepo.find(link.tournamentId())
                .flatMap(t -> t.findMatch(link.matchId()))
                .flatMap(m -> m.playerByStoredId(storedId))
                .isPresent();
    }

    @Override
    public Optional<Tournament> findTournament(String tournamentId) {
        return tournamentRepo.find(tournamentId);
    }

    private static boolean boundTo(TournamentEntrant e, String connectionId) {
        return e != null && connectionId != null && connectionId.equals(e.getConnectionId());
    }

    private Tournament requireTournament(String tournamentId) {
        return tournamentRepo.find(tournamentId)
                .orElseThrow(() -> CoordinationException.notFound(GameMessages.TOURNAMENT_NOT_FOUND));
    }
}
