package com.whothub.gameservice.games.whot.domain.model;

import com.whothub.gameservice.games.whot.domain.enums.TournamentStatus;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 单败淘汰赛
 * ----------------------------------------
 * 人数为 2 的幂；报满自动开赛，按报名顺序两两配对；
 * 每轮全部决出胜者后进入下一轮，直到第 log2(size) 轮决出冠军。
 */
@Getter
public class Tournament {

    private final String id;
    private final String name;
    private final int size;
    private final Instant createdAt;
    private final List<TournamentEntrant> participants = new ArrayList<>();
    private final List<Match> matches = new ArrayList<>();

    private TournamentStatus status = TournamentStatus.WAITING;
    private int currentRound = 1;
    private TournamentEntrant winner;

    public Tournament(String id, String name, int size, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.size = size;
        this.createdAt = createdAt;
    }

    /** 总轮数 = log2(size) */
    public int totalRounds() {
        return Integer.numberOfTrailingZeros(size);
    }

    public boolean isFull() {
        return participants.size() >= size;
    }

    public List<TournamentEntrant> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    public List<Match> getMatches() {
        return Collections.unmodifiableList(matches);
    }

    public Optional<TournamentEntrant> findEntrant(String storedId) {
        if (storedId == null) {
            return Optional.empty();
        }
        return participants.stream().filter(e -> storedId.equals(e.getStoredId())).findFirst();
    }

    public Optional<Match> findMatch(String matchId) {
        if (matchId == null) {
            return Optional.empty();
        }
        return matches.stream().filter(m -> matchId.equals(m.getMatchId())).findFirst();
    }

    public List<Match> matchesOfRound(int round) {
        return matches.stream().filter(m -> m.getRound() == round).toList();
    }

    public void addEntrant(TournamentEntrant entrant) {
        if (status != TournamentStatus.WAITING) {
            throw new IllegalStateException("tournament " + id + " already started");
        }
        if (isFull()) {
            throw new IllegalStateException("tournament " + id + " is full");
        }
        participants.add(entrant);
    }

    /**
     * 开始新一轮：按给定顺序两两配对并生成场次。
     */
    public List<Match> startRound(int round, List<TournamentEntrant> ordered) {
        List<Match> created = new ArrayList<>();
        for (int i = 0; i + 1 < ordered.size(); i += 2) {
            int index = i / 2;
            created.add(new Match(Match.idOf(id, round, index), round, ordered.get(i), ordered.get(i + 1)));
        }
        matches.addAll(created);
        currentRound = round;
        status = TournamentStatus.ACTIVE;
        return created;
    }

    public void complete(TournamentEntrant champion) {
        this.winner = champion;
        this.status = TournamentStatus.COMPLETED;
    }
}
