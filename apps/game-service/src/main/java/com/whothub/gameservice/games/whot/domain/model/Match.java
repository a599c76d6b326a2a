package com.whothub.gameservice.games.whot.domain.model;

import lombok.Getter;

import java.util.Optional;

/**
 * 赛事中的一场对决。
 * sessionCode 一经生成不再改变；winner 只能写入一次。
 */
@Getter
public class Match {

    private final String matchId;
    private final int round;
    private final TournamentEntrant p1;
    private final TournamentEntrant p2;
    private TournamentEntrant winner;
    private String sessionCode;

    public Match(String matchId, int round, TournamentEntrant p1, TournamentEntrant p2) {
        this.matchId = matchId;
        this.round = round;
        this.p1 = p1;
        this.p2 = p2;
    }

    public static String idOf(String tournamentId, int round, int index) {
        return tournamentId + "_r" + round + "_m" + index;
    }

    public boolean isReady() {
        return p1 != null && p2 != null && winner == null;
    }

    public boolean isSettled() {
        return winner != null;
    }

    public boolean hasSessionCode() {
        return sessionCode != null;
    }

    public void assignSessionCode(String code) {
        if (this.sessionCode != null) {
            throw new IllegalStateException("match " + matchId + " already has session code " + sessionCode);
        }
        this.sessionCode = code;
    }

    /** 只接受本场两名选手之一 */
    public Optional<TournamentEntrant> playerByStoredId(String storedId) {
        if (storedId == null) {
            return Optional.empty();
        }
        if (p1 != null && storedId.equals(p1.getStoredId())) {
            return Optional.of(p1);
        }
        if (p2 != null && storedId.equals(p2.getStoredId())) {
            return Optional.of(p2);
        }
        return Optional.empty();
    }

    public Optional<TournamentEntrant> opponentOf(TournamentEntrant entrant) {
        if (entrant == p1) {
            return Optional.ofNullable(p2);
        }
        if (entrant == p2) {
            return Optional.ofNullable(p1);
        }
        return Optional.empty();
    }

    /**
     * 记录胜者。
     * @return 首次写入成功返回 true
     */
    public boolean settle(TournamentEntrant winner) {
        if (this.winner != null) {
            return false;
        }
        this.winner = winner;
        return true;
    }
}
