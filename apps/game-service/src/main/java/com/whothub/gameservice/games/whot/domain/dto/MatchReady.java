package com.whothub.gameservice.games.whot.domain.dto;

/**
 * tournament_match_ready 载荷：告诉选手去哪个对局码对战、对手是谁。
 */
public record MatchReady(String sessionCode, String matchId, String opponentName, String tournamentId) {
}
