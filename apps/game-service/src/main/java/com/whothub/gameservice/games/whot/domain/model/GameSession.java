package com.whothub.gameservice.games.whot.domain.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whothub.gameservice.games.whot.domain.enums.Seat;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 双人对局
 * ----------------------------------------
 * - 最多两名参与者，座位 ONE 为创建者
 * - canonicalState：始终以 ONE 号位视角保存的局面
 * - 聊天记录为环形缓冲，只保留最近 N 条
 * <p>
 * 仅在主循环线程中读写，因此不做同步。
 */
@Getter
public class GameSession {

    public static final int MAX_PARTICIPANTS = 2;

    private final String code;
    private final Instant createdAt;
    private final List<Participant> participants = new ArrayList<>(MAX_PARTICIPANTS);
    @Getter(AccessLevel.NONE)
    private final Deque<ChatMessage> messages = new ArrayDeque<>();
    private final TournamentLink tournamentLink;

    @Setter
    private ObjectNode canonicalState;
    /** 第二名玩家入座时重置，保证计时公平 */
    private Instant startedAt;
    private Instant lastActivityAt;
    private boolean concluded;

    public GameSession(String code, ObjectNode canonicalState, TournamentLink tournamentLink, Instant now) {
        this.code = code;
        this.canonicalState = canonicalState;
        this.tournamentLink = tournamentLink;
        this.createdAt = now;
        this.startedAt = now;
        this.lastActivityAt = now;
    }

    public Optional<TournamentLink> tournamentLink() {
        return Optional.ofNullable(tournamentLink);
    }

    public boolean isFull() {
        return participants.size() >= MAX_PARTICIPANTS;
    }

    public Optional<Participant> findByStoredId(String storedId) {
        if (storedId == null) {
            return Optional.empty();
        }
        return participants.stream().filter(p -> storedId.equals(p.getStoredId())).findFirst();
    }

    public Optional<Participant> findByConnection(String connectionId) {
        return participants.stream().filter(p -> p.boundTo(connectionId)).findFirst();
    }

    public Optional<Participant> opponentOf(Participant participant) {
        return participants.stream().filter(p -> p != participant).findFirst();
    }

    /**
     * 入座。座位按入座顺序分配：第一位 ONE，第二位 TWO。
     */
    public Participant seat(String storedId, String connectionId, String displayName, Instant now) {
        if (isFull()) {
            throw new IllegalStateException("session " + code + " already has two participants");
        }
        Seat seat = participants.isEmpty() ? Seat.ONE : Seat.TWO;
        Participant p = new Participant(storedId, connectionId, displayName, seat);
        participants.add(p);
        if (seat == Seat.TWO) {
            startedAt = now;
        }
        touch(now);
        return p;
    }

    public List<Participant> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    /**
     * 追加一条聊天记录，超过上限时淘汰最早的一条。
     */
    public void appendMessage(ChatMessage message, int limit) {
        messages.addLast(message);
        while (messages.size() > limit) {
            messages.removeFirst();
        }
    }

    /**
     * 把除 readerId 以外的人发的消息标为已读。
     * @return 是否有消息状态发生变化
     */
    public boolean markReadBy(String readerId) {
        boolean changed = false;
        for (ChatMessage m : messages) {
            if (!m.getSenderId().equals(readerId) && m.markRead()) {
                changed = true;
            }
        }
        return changed;
    }

    /** 聊天记录快照（按时间顺序） */
    public List<ChatMessage> chatHistory() {
        return List.copyOf(messages);
    }

    public void touch(Instant now) {
        this.lastActivityAt = now;
    }

    /**
     * 标记对局已结束。
     * @return 首次结束返回 true，重复调用返回 false
     */
    public boolean conclude() {
        if (concluded) {
            return false;
        }
        concluded = true;
        return true;
    }
}
