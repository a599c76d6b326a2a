package com.whothub.gameservice.games.whot.service.impl;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whothub.gameservice.common.CoordinationException;
import com.whothub.gameservice.games.whot.domain.constants.GameMessages;
import com.whothub.gameservice.games.whot.domain.deck.InitialStateFactory;
import com.whothub.gameservice.games.whot.domain.dto.ReadReceipt;
import com.whothub.gameservice.games.whot.domain.dto.StateDispatch;
import com.whothub.gameservice.games.whot.domain.dto.StateUpdate;
import com.whothub.gameservice.games.whot.domain.enums.Seat;
import com.whothub.gameservice.games.whot.domain.model.ChatMessage;
import com.whothub.gameservice.games.whot.domain.model.GameSession;
import com.whothub.gameservice.games.whot.domain.model.Participant;
import com.whothub.gameservice.games.whot.domain.model.TournamentLink;
import com.whothub.gameservice.games.whot.domain.repository.SessionRepository;
import com.whothub.gameservice.games.whot.domain.state.StateOrientation;
import com.whothub.gameservice.games.whot.service.SessionRegistry;
import com.whothub.gameservice.games.whot.service.TournamentEngine;
import com.whothub.gameservice.platform.config.WhotProperties;
import com.whothub.gameservice.platform.loop.GameLoop;
import com.whothub.gameservice.platform.transport.ClientNotifier;
import com.whothub.gameservice.platform.transport.OutboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRegistryImpl implements SessionRegistry {

    private final SessionRepository sessionRepo;
    private final TournamentEngine tournamentEngine;
    private final InitialStateFactory initialStateFactory;
    private final ClientNotifier notifier;
    private final GameLoop gameLoop;
    private final WhotProperties properties;
    private final Clock clock;

    /**
     * 加入对局
     */
    @Override
    public Seat joinSession(String sessionCode, String storedId, String connectionId, TournamentLink tournamentLink) {
        // 1) 对局码必须恰好 4 位
        if (sessionCode == null || sessionCode.length() != 4) {
            throw CoordinationException.invalidInput(GameMessages.INVALID_SESSION_CODE);
        }
        if (storedId == null || storedId.isBlank()) {
            throw CoordinationException.invalidInput(GameMessages.formatMissingField("storedId"));
        }
        Instant now = clock.instant();

        // 2) 不存在则创建，创建者坐 ONE 号位
        Optional<GameSession> existing = sessionRepo.find(sessionCode);
        if (existing.isEmpty()) {
            return createSession(sessionCode, storedId, connectionId, tournamentLink, now);
        }

        GameSession session = existing.get();
        session.touch(now);
        Optional<Participant> known = session.findByStoredId(storedId);

        // 3) 老面孔：只改绑连接并重发本方视角的局面
        if (known.isPresent()) {
            Participant me = known.get();
            me.rebind(connectionId);
            log.info("玩家重连对局: code={}, storedId={}, seat={}, connectionId={}",
                    sessionCode, storedId, me.getSeat(), connectionId);
            sendInitialState(session, me);
            session.opponentOf(me).ifPresent(opp -> {
                notifier.toConnection(opp.getConnectionId(), OutboundEvent.OPPONENT_PRESENCE_CHANGED, true);
                notifier.toConnection(connectionId, OutboundEvent.CHAT_HISTORY, session.chatHistory());
                notifier.toConnection(connectionId, OutboundEvent.OPPONENT_PRESENCE_CHANGED, opp.isOnline());
            });
            return me.getSeat();
        }

        // 4) 新面孔：赛事对局只收本场两名选手，已满则拒绝
        Optional<TournamentLink> link = session.tournamentLink();
        if (link.isPresent() && !tournamentEngine.isMatchPlayer(link.get(), storedId)) {
            log.warn("非本场选手尝试加入赛事对局: code={}, storedId={}, matchId={}",
                    sessionCode, storedId, link.get().matchId());
            throw CoordinationException.conflict(GameMessages.NOT_MATCH_PLAYER);
        }
        if (session.isFull()) {
            log.info("对局已满，拒绝加入: code={}, storedId={}", sessionCode, storedId);
            throw CoordinationException.conflict(GameMessages.SESSION_FULL);
        }

        // 5) 坐 TWO 号位，收到翻转后的局面和聊天记录，房主收到上线通知
        Participant me = session.seat(storedId, connectionId, GameMessages.defaultDisplayName(storedId), now);
        log.info("玩家入座: code={}, storedId={}, seat={}, connectionId={}",
                sessionCode, storedId, me.getSeat(), connectionId);
        sendInitialState(session, me);
        Participant host = session.opponentOf(me).orElseThrow();
        notifier.toConnection(host.getConnectionId(), OutboundEvent.OPPONENT_PRESENCE_CHANGED, true);
        notifier.toConnection(connectionId, OutboundEvent.CHAT_HISTORY, session.chatHistory());
        notifier.toConnection(connectionId, OutboundEvent.OPPONENT_PRESENCE_CHANGED, host.isOnline());
        return me.getSeat();
    }

    private Seat createSession(String sessionCode, String storedId, String connectionId,
                               TournamentLink claimedLink, Instant now) {
        TournamentLink link = null;
        if (claimedLink != null && claimedLink.isComplete()) {
            if (tournamentEngine.verifyLink(claimedLink, sessionCode)) {
                if (!tournamentEngine.isMatchPlayer(claimedLink, storedId)) {
                    log.warn("非本场选手尝试创建赛事对局: code={}, storedId={}, matchId={}",
                            sessionCode, storedId, claimedLink.matchId());
                    throw CoordinationException.conflict(GameMessages.NOT_MATCH_PLAYER);
                }
                link = claimedLink;
            } else {
                log.warn("赛事关联校验失败，按普通对局创建: code={}, tournamentId={}, matchId={}",
                        sessionCode, claimedLink.tournamentId(), claimedLink.matchId());
            }
        }
        GameSession session = new GameSession(sessionCode, initialStateFactory.newGame(), link, now);
        Participant me = session.seat(storedId, connectionId, GameMessages.defaultDisplayName(storedId), now);
        sessionRepo.save(session);
        log.info("创建对局: code={}, storedId={}, tournamentLink={}", sessionCode, storedId, link);
        sendInitialState(session, me);
        return me.getSeat();
    }

    /** 按座位定向后下发完整局面 */
    private void sendInitialState(GameSession session, Participant target) {
        ObjectNode canonical = session.getCanonicalState();
        ObjectNode oriented = target.getSeat() == Seat.ONE ? canonical : StateOrientation.reverse(canonical);
        notifier.toConnection(target.getConnectionId(), OutboundEvent.STATE_DISPATCH, StateDispatch.initialize(oriented));
    }

    @Override
    public void applyStateUpdate(String sessionCode, String connectionId, ObjectNode newState) {
        GameSession session = requireSession(sessionCode);
        Optional<Participant> submitter = session.findByConnection(connectionId);
        if (submitter.isEmpty()) {
            log.warn("未绑定连接提交局面，已丢弃: code={}, connectionId={}", sessionCode, connectionId);
            return;
        }
        Participant me = submitter.get();
        if (StateOrientation.isPlayerTwoView(newState) != (me.getSeat() == Seat.TWO)) {
            log.debug("局面 player 字段与座位不一致，以连接绑定为准: code={}, seat={}", sessionCode, me.getSeat());
        }

        // 统一存成 ONE 号位视角
        ObjectNode canonical = me.getSeat() == Seat.ONE ? newState.deepCopy() : StateOrientation.reverse(newState);
        session.setCanonicalState(canonical);
        session.touch(clock.instant());

        StateUpdate update = new StateUpdate(canonical, StateOrientation.reverse(canonical));
        StateDispatch dispatch = StateDispatch.update(update);
        // 不回显给提交者
        for (Participant p : session.getParticipants()) {
            if (p != me) {
                notifier.toConnection(p.getConnectionId(), OutboundEvent.STATE_DISPATCH, dispatch);
            }
        }
        log.debug("局面已转发: code={}, from={}", sessionCode, me.getSeat());
    }

    /**
     * 发送者只认连接绑定的参与者，客户端自报的 senderId 不参与判断。
     */
    @Override
    public Optional<ChatMessage> recordChatMessage(String sessionCode, String connectionId, String text) {
        GameSession session = requireSession(sessionCode);
        Optional<Participant> sender = session.findByConnection(connectionId);
        if (sender.isEmpty()) {
            log.warn("未绑定连接发送聊天，已丢弃: code={}, connectionId={}", sessionCode, connectionId);
            return Optional.empty();
        }
        Instant now = clock.instant();
        String senderId = sender.get().getStoredId();
        ChatMessage msg = new ChatMessage(UUID.randomUUID().toString(), senderId, text, now);
        session.appendMessage(msg, properties.getSession().getChatHistoryLimit());
        session.touch(now);
        notifier.toSession(sessionCode, OutboundEvent.RECEIVE_MESSAGE, msg);
        log.debug("聊天消息: code={}, senderId={}", sessionCode, senderId);
        return Optional.of(msg);
    }

    @Override
    public boolean markRead(String sessionCode, String connectionId) {
        GameSession session = requireSession(sessionCode);
        Optional<Participant> reader = session.findByConnection(connectionId);
        if (reader.isEmpty()) {
            log.warn("未绑定连接标记已读，已丢弃: code={}, connectionId={}", sessionCode, connectionId);
            return false;
        }
        String readerId = reader.get().getStoredId();
        boolean changed = session.markReadBy(readerId);
        if (changed) {
            notifier.toSession(sessionCode, OutboundEvent.MESSAGES_READ,
                    new ReadReceipt(readerId));
        }
        return changed;
    }

    @Override
    public void confirmOnline(String sessionCode, String storedId) {
        sessionRepo.find(sessionCode)
                .flatMap(s -> s.findByStoredId(storedId).flatMap(s::opponentOf))
                .ifPresent(opp -> notifier.toConnection(opp.getConnectionId(),
                        OutboundEvent.OPPONENT_PRESENCE_CHANGED, true));
    }

    @Override
    public void notifyDisconnect(String connectionId) {
        if (connectionId == null) {
            return;
        }
        for (GameSession session : sessionRepo.findAll()) {
            session.findByConnection(connectionId).ifPresent(p -> {
                p.setOnline(false);
                log.info("玩家断线: code={}, storedId={}", session.getCode(), p.getStoredId());
                session.opponentOf(p).ifPresent(opp -> notifier.toConnection(opp.getConnectionId(),
                        OutboundEvent.OPPONENT_PRESENCE_CHANGED, false));
            });
        }
    }

    @Override
    public void terminateSession(String sessionCode) {
        Optional<GameSession> found = sessionRepo.find(sessionCode);
        if (found.isEmpty()) {
            return;
        }
        GameSession session = found.get();
        gameLoop.schedule("teardown-" + sessionCode, () -> {
            // 宽限期内对局码可能已被新对局复用，只删同一个实例
            if (sessionRepo.removeIfSame(session)) {
                log.info("对局已销毁: code={}", sessionCode);
            }
        }, properties.getSession().getTeardownDelay());
    }

    @Override
    public Optional<GameSession> findSession(String sessionCode) {
        return sessionRepo.find(sessionCode);
    }

    @Override
    public int sweepIdleSessions(Instant cutoff, Predicate<GameSession> retain) {
        List<GameSession> idle = new ArrayList<>();
        for (GameSession s : sessionRepo.findAll()) {
            if (s.getLastActivityAt().isBefore(cutoff) && !retain.test(s)) {
                idle.add(s);
            }
        }
        int removed = 0;
        for (GameSession s : idle) {
            if (sessionRepo.removeIfSame(s)) {
                removed++;
                log.info("清扫空闲对局: code={}, lastActivityAt={}", s.getCode(), s.getLastActivityAt());
            }
        }
        return removed;
    }

    private GameSession requireSession(String sessionCode) {
        return sessionRepo.find(sessionCode)
                .orElseThrow(() -> CoordinationException.notFound(GameMessages.SESSION_NOT_FOUND));
    }
}
