package com.whothub.gameservice.games.whot.domain.dto;

import com.whothub.gameservice.games.whot.domain.model.Match;

/**
 * 对外公开的场次快照。
 * 不含对局码：对局码只通过 tournament_match_ready 发给本场两名选手。
 */
public record MatchView(String id, int round, PlayerView p1, PlayerView p2, PlayerView winner) {

    public static MatchView of(Match m) {
        return new MatchView(m.getMatchId(), m.getRound(),
                PlayerView.of(m.getP1()), PlayerView.of(m.getP2()), PlayerView.of(m.getWinner()));
    }
}
