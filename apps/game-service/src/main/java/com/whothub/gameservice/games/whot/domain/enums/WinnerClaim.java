package com.whothub.gameservice.games.whot.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 客户端上报的“相对”胜负声明：user=我方胜，opponent=对手胜。
 * 只有结合上报连接绑定的参与者才能换算成绝对的 storedId。
 */
public enum WinnerClaim {
    USER("user"),
    OPPONENT("opponent");

    private final String wireName;

    WinnerClaim(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** 未知取值返回 null，交由校验层拒绝 */
    @JsonCreator
    public static WinnerClaim fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (WinnerClaim c : values()) {
            if (c.wireName.equalsIgnoreCase(value.trim())) {
                return c;
            }
        }
        return null;
    }
}
