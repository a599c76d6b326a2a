package com.whothub.gameservice.games.whot.domain.repository;

import com.whothub.gameservice.games.whot.domain.model.Tournament;

import java.util.Collection;
import java.util.Optional;

/**
 * 赛事表（仅进程内存）。
 */
public interface TournamentRepository {

    Optional<Tournament> find(String id);

    boolean exists(String id);

    void save(Tournament tournament);

    boolean removeIfSame(Tournament tournament);

    /** 按创建顺序返回 */
    Collection<Tournament> findAll();
}
