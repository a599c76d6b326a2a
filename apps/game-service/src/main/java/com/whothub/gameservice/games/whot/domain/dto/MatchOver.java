package com.whothub.gameservice.games.whot.domain.dto;

/** 仲裁结果：绝对的胜者 storedId */
public record MatchOver(String winnerStoredId) {
}
