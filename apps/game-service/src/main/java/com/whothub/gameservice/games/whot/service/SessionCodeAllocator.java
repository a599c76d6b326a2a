package com.whothub.gameservice.games.whot.service;

import org.apache.commons.lang3.RandomStringUtils;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;

/**
 * 对局码 / 赛事 ID 生成器（大写字母 + 数字）。
 * 唯一性由调用方通过 inUse 判定，冲突时重新生成。
 */
@Component
public class SessionCodeAllocator {

    public static final int SESSION_CODE_LENGTH = 4;
    public static final int TOURNAMENT_ID_LENGTH = 6;

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int MAX_ATTEMPTS = 1000;

    public String nextSessionCode(Predicate<String> inUse) {
        return next(SESSION_CODE_LENGTH, inUse);
    }

    public String nextTournamentId(Predicate<String> inUse) {
        return next(TOURNAMENT_ID_LENGTH, inUse);
    }

    protected String randomCode(int length) {
        return RandomStringUtils.random(length, ALPHABET);
    }

    private String next(int length, Predicate<String> inUse) {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            String code = randomCode(length);
            if (!inUse.test(code)) {
                return code;
            }
        }
        throw new IllegalStateException("无法生成唯一编码，长度=" + length);
    }
}
