package com.whothub.gameservice.games.whot.domain.model;

/**
 * 对局与赛事场次的关联。只有校验通过（场次存在且对局码一致）后才会挂到对局上。
 */
public record TournamentLink(String tournamentId, String matchId) {

    public boolean isComplete() {
        return tournamentId != null && !tournamentId.isBlank()
                && matchId != null && !matchId.isBlank();
    }
}
