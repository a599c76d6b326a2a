package com.whothub.gameservice.games.whot.domain.deck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 标准 54 张 Whot 牌。
 */
public final class WhotDeck {

    public static final int SIZE = 54;

    private WhotDeck() {
    }

    /** 未洗的整副牌 */
    public static List<Card> standard() {
        List<Card> cards = new ArrayList<>(SIZE);
        for (CardShape shape : CardShape.values()) {
            for (int n : shape.numbers()) {
                cards.add(new Card(shape, n));
            }
        }
        return cards;
    }

    public static List<Card> shuffled(Random random) {
        List<Card> cards = standard();
        Collections.shuffle(cards, random);
        return cards;
    }
}
