package com.whothub.gameservice.games.whot.domain.deck;

import com.fasterxml.jackson.annotation.JsonValue;

/** Whot 牌的花色 */
public enum CardShape {
    CIRCLE(1, 2, 3, 4, 5, 7, 8, 10, 11, 12, 13, 14),
    TRIANGLE(1, 2, 3, 4, 5, 7, 8, 10, 11, 12, 13, 14),
    CROSS(1, 2, 3, 5, 7, 10, 11, 13, 14),
    SQUARE(1, 2, 3, 5, 7, 10, 11, 13, 14),
    STAR(1, 2, 3, 4, 5, 7, 8),
    WHOT(20, 20, 20, 20, 20);

    private final int[] numbers;

    CardShape(int... numbers) {
        this.numbers = numbers;
    }

    int[] numbers() {
        return numbers.clone();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
