package com.whothub.gameservice.games.whot.domain.deck;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.List;
import java.util.Random;

/**
 * 发牌：洗牌后双方各 5 张，剩余牌中第一张非 Whot 牌作为起始牌，其余为牌堆。
 * 出牌规则全部在客户端计算，服务端只负责给出一致的起始局面。
 */
@Component
public class WhotInitialStateFactory implements InitialStateFactory {

    static final int HAND_SIZE = 5;
    static final String OPENING_INFO = "It's your turn to make a move now";

    private final ObjectMapper objectMapper;
    private final Random random;

    @Autowired
    public WhotInitialStateFactory(ObjectMapper objectMapper) {
        this(objectMapper, new SecureRandom());
    }

    WhotInitialStateFactory(ObjectMapper objectMapper, Random random) {
        this.objectMapper = objectMapper;
        this.random = random;
    }

    @Override
    public ObjectNode newGame() {
        List<Card> cards = WhotDeck.shuffled(random);
        List<Card> user = cards.subList(0, HAND_SIZE);
        List<Card> opponent = cards.subList(HAND_SIZE, HAND_SIZE * 2);
        List<Card> rest = cards.subList(HAND_SIZE * 2, cards.size());

        int activeIdx = 0;
        while (rest.get(activeIdx).isWhot()) {
            activeIdx++;
        }
        Card active = rest.get(activeIdx);

        ArrayNode deck = objectMapper.createArrayNode();
        for (int i = 0; i < rest.size(); i++) {
            if (i != activeIdx) {
                deck.add(cardNode(rest.get(i)));
            }
        }

        ObjectNode state = objectMapper.createObjectNode();
        state.set("deck", deck);
        state.set("userCards", toArray(user));
        state.set("usedCards", objectMapper.createArrayNode().add(cardNode(active)));
        state.set("opponentCards", toArray(opponent));
        state.set("activeCard", cardNode(active));
        state.put("whoIsToPlay", "user");
        state.put("infoText", OPENING_INFO);
        state.put("infoShown", true);
        state.put("stateHasBeenInitialized", true);
        state.put("player", "one");
        return state;
    }

    private ArrayNode toArray(List<Card> cards) {
        ArrayNode arr = objectMapper.createArrayNode();
        cards.forEach(c -> arr.add(cardNode(c)));
        return arr;
    }

    private ObjectNode cardNode(Card card) {
        ObjectNode n = objectMapper.createObjectNode();
        n.put("shape", card.shape().wireName());
        n.put("number", card.number());
        return n;
    }
}
