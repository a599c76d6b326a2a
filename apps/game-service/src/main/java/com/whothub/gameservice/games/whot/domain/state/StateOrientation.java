package com.whothub.gameservice.games.whot.domain.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * 局面视角翻转
 * ----------------------------------------
 * 规范局面永远以 ONE 号位视角保存；发给 TWO 号位前翻转一次，
 * 从 TWO 号位收到的局面翻转一次后再入库。翻转两次等于原局面。
 * <p>
 * 只改三处：userCards/opponentCards 互换，whoIsToPlay 的 user/opponent 互换，
 * player 的 one/two 互换；其它字段原样保留。
 */
public final class StateOrientation {

    static final String USER_CARDS = "userCards";
    static final String OPPONENT_CARDS = "opponentCards";
    static final String WHO_IS_TO_PLAY = "whoIsToPlay";
    static final String PLAYER = "player";

    private StateOrientation() {
    }

    /**
     * 返回翻转后的新局面，不修改入参。
     */
    public static ObjectNode reverse(ObjectNode state) {
        ObjectNode copy = state.deepCopy();
        JsonNode user = state.get(USER_CARDS);
        JsonNode opponent = state.get(OPPONENT_CARDS);
        // 只有一侧存在时也要搬到另一侧，保证翻转可逆
        copy.remove(USER_CARDS);
        copy.remove(OPPONENT_CARDS);
        if (opponent != null) {
            copy.set(USER_CARDS, opponent.deepCopy());
        }
        if (user != null) {
            copy.set(OPPONENT_CARDS, user.deepCopy());
        }
        swapText(copy, WHO_IS_TO_PLAY, "user", "opponent");
        swapText(copy, PLAYER, "one", "two");
        return copy;
    }

    /** 判断局面是否由 TWO 号位提交 */
    public static boolean isPlayerTwoView(JsonNode state) {
        JsonNode p = state.get(PLAYER);
        return p != null && p.isTextual() && "two".equals(p.asText());
    }

    private static void swapText(ObjectNode node, String field, String a, String b) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            return;
        }
        if (a.equals(v.asText())) {
            node.set(field, TextNode.valueOf(b));
        } else if (b.equals(v.asText())) {
            node.set(field, TextNode.valueOf(a));
        }
    }
}
