package com.whothub.gameservice.games.whot.domain.deck;

public record Card(CardShape shape, int number) {

    public boolean isWhot() {
        return shape == CardShape.WHOT;
    }
}
