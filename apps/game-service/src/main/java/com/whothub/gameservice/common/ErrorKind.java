package com.whothub.gameservice.common;

/**
 * 协调层错误分类。
 * 只描述“拒绝原因”的类别，具体提示文案由抛出方给出。
 */
public enum ErrorKind {
    /** 参数不合法：房间码格式错误、缺少必填字段等 */
    INVALID_INPUT(400),
    /** 目标不存在：未知的对局、赛事或场次 */
    NOT_FOUND(404),
    /** 状态冲突：房间已满、赛事已开始或已满员 */
    CONFLICT(409);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
