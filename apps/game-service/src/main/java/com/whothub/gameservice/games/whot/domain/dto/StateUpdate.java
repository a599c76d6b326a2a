package com.whothub.gameservice.games.whot.domain.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** 同时携带两个视角的局面，客户端按自己的座位取用 */
public record StateUpdate(JsonNode playerOneState, JsonNode playerTwoState) {
}
