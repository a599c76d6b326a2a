package com.whothub.gameservice.games.whot.domain.constants;

/**
 * 玩家可见的提示文案（session_error 原样下发）。
 * 统一管理，避免散落在各处硬编码。
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 对局 ==========

    public static final String INVALID_SESSION_CODE =
            "Sorry! Seems like this game link is invalid. Just go back and start your own game.";

    public static final String SESSION_FULL =
            "Sorry! There are already two players on this game, just go back and start your own game.";

    public static final String SESSION_NOT_FOUND = "This game session no longer exists.";

    public static final String NOT_MATCH_PLAYER =
            "Sorry! This is a tournament game for two other players, just go back and start your own game.";

    public static final String EMPTY_MESSAGE = "Message text must not be empty.";

    public static final String MESSAGE_TOO_LONG = "Message is too long (max %d characters).";

    public static String formatMessageTooLong(int max) {
        return String.format(MESSAGE_TOO_LONG, max);
    }

    // ========== 赛事 ==========

    public static final String TOURNAMENT_NOT_FOUND = "Tournament not found";

    public static final String TOURNAMENT_ALREADY_STARTED = "Tournament already started";

    public static final String TOURNAMENT_FULL = "Tournament full";

    public static final String NOT_A_PARTICIPANT = "Player not a participant";

    public static final String INVALID_TOURNAMENT_SIZE =
            "Tournament size must be a power of two between 2 and %d.";

    public static String formatInvalidSize(int maxSize) {
        return String.format(INVALID_TOURNAMENT_SIZE, maxSize);
    }

    // ========== 通用 ==========

    public static final String MISSING_FIELD = "Missing required field: %s";

    public static String formatMissingField(String field) {
        return String.format(MISSING_FIELD, field);
    }

    /** 未指定昵称时的默认显示名，取 storedId 前 4 位 */
    public static String defaultDisplayName(String storedId) {
        String prefix = storedId.length() > 4 ? storedId.substring(0, 4) : storedId;
        return "Player " + prefix;
    }
}
