package com.whothub.gameservice.games.whot.domain.repository;

import com.whothub.gameservice.games.whot.domain.model.GameSession;

import java.util.Collection;
import java.util.Optional;

/**
 * 活跃对局表（仅进程内存，不跨重启）。
 */
public interface SessionRepository {

    Optional<GameSession> find(String code);

    boolean exists(String code);

    void save(GameSession session);

    /**
     * 仅当当前登记的就是这个实例时才移除，避免延迟任务误删同码新对局。
     */
    boolean removeIfSame(GameSession session);

    Collection<GameSession> findAll();
}
