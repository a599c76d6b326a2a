package com.whothub.gameservice.games.whot.domain.dto;

import com.whothub.gameservice.games.whot.domain.enums.TournamentStatus;
import com.whothub.gameservice.games.whot.domain.model.TournamentEntrant;
import com.whothub.gameservice.games.whot.domain.model.Tournament;

import java.time.Instant;
import java.util.List;

/**
 * 赛事公开快照（tournament_update / tournaments_list 的载荷）。
 * 不包含任何连接 ID。
 */
public record TournamentView(
        String id,
        String name,
        int size,
        TournamentStatus status,
        int currentRound,
        int playersCount,
        List<String> participants,
        List<MatchView> matches,
        PlayerView winner,
        Instant createdAt
) {

    public static TournamentView of(Tournament t) {
        List<String> ids = t.getParticipants().stream().map(TournamentEntrant::getStoredId).toList();
        List<MatchView> matches = t.getMatches().stream().map(MatchView::of).toList();
        return new TournamentView(t.getId(), t.getName(), t.getSize(), t.getStatus(), t.getCurrentRound(),
                ids.size(), ids, matches, PlayerView.of(t.getWinner()), t.getCreatedAt());
    }
}
