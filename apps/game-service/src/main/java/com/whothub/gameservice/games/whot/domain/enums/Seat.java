package com.whothub.gameservice.games.whot.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对局座位。规范局面永远以 ONE 号位视角存储。
 */
public enum Seat {
    ONE("one"),
    TWO("two");

    private final String wireName;

    Seat(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
