package com.whothub.gameservice.games.whot.domain.dto;

/**
 * tournament_joined 载荷（回给报名/重连的连接）。
 */
public record TournamentJoined(boolean success, TournamentView tournament) {
}
