package com.whothub.gameservice.games.whot.domain.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * state_dispatch 载荷
 * - INITIALIZE_DECK：payload 为按接收方座位定向的完整局面
 * - UPDATE_STATE：payload 为 {@link StateUpdate}
 */
public record StateDispatch(String type, Object payload) {

    public static final String INITIALIZE_DECK = "INITIALIZE_DECK";
    public static final String UPDATE_STATE = "UPDATE_STATE";

    public static StateDispatch initialize(JsonNode orientedState) {
        return new StateDispatch(INITIALIZE_DECK, orientedState);
    }

    public static StateDispatch update(StateUpdate update) {
        return new StateDispatch(UPDATE_STATE, update);
    }
}
