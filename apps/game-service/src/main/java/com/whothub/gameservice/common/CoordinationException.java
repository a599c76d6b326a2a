package com.whothub.gameservice.common;

import lombok.Getter;

/**
 * 会话注册表 / 赛事引擎拒绝请求时抛出的业务异常。
 * message 是给玩家看的可读文案，会原样作为 session_error 推回发起方连接。
 */
@Getter
public class CoordinationException extends RuntimeException {

    private final ErrorKind kind;

    public CoordinationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static CoordinationException invalidInput(String message) {
        return new CoordinationException(ErrorKind.INVALID_INPUT, message);
    }

    public static CoordinationException notFound(String message) {
        return new CoordinationException(ErrorKind.NOT_FOUND, message);
    }

    public static CoordinationException conflict(String message) {
        return new CoordinationException(ErrorKind.CONFLICT, message);
    }
}
