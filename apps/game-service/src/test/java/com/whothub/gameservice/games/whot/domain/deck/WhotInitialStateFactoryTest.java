package com.whothub.gameservice.games.whot.domain.deck;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WhotInitialStateFactoryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void standardDeckHas54Cards() {
        assertEquals(WhotDeck.SIZE, WhotDeck.standard().size());
        assertEquals(5, WhotDeck.standard().stream().filter(Card::isWhot).count());
    }

    @RepeatedTest(20)
    void dealsFiveEachAndOpensOnNonWhotCard() {
        ObjectNode state = new WhotInitialStateFactory(mapper, new Random()).newGame();

        assertEquals(5, state.get("userCards").size());
        assertEquals(5, state.get("opponentCards").size());
        assertNotEquals("whot", state.get("activeCard").get("shape").asText());
        assertEquals(state.get("activeCard"), state.get("usedCards").get(0));
        assertEquals(WhotDeck.SIZE - 11, state.get("deck").size());
        assertEquals("user", state.get("whoIsToPlay").asText());
        assertEquals("one", state.get("player").asText());
        assertTrue(state.get("infoShown").asBoolean());
        assertTrue(state.get("stateHasBeenInitialized").asBoolean());
    }

    @Test
    void everyCardAppearsExactlyOnce() {
        ObjectNode state = new WhotInitialStateFactory(mapper, new Random(42)).newGame();

        Map<String, Integer> counts = new HashMap<>();
        for (String field : new String[]{"deck", "userCards", "opponentCards", "usedCards"}) {
            for (JsonNode c : state.get(field)) {
                counts.merge(c.get("shape").asText() + c.get("number").asInt(), 1, Integer::sum);
            }
        }
        Map<String, Integer> expected = new HashMap<>();
        for (Card c : WhotDeck.standard()) {
            expected.merge(c.shape().wireName() + c.number(), 1, Integer::sum);
        }
        assertEquals(expected, counts);
    }
}
