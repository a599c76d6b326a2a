package com.whothub.gameservice.games.whot.service;

import com.whothub.gameservice.games.whot.domain.dto.TournamentView;
import com.whothub.gameservice.games.whot.domain.model.Tournament;
import com.whothub.gameservice.games.whot.domain.model.TournamentLink;

import java.util.List;
import java.util.Optional;

/**
 * 赛事引擎：建赛、报名、配对、分配对局码、晋级与过期清理。
 * 所有方法都必须在主循环线程上调用。
 */
public interface TournamentEngine {

    TournamentView createTournament(int size, String name);

    /**
     * 报名。已在名单中的 storedId 走重连流程。人满自动开赛。
     */
    TournamentView joinTournament(String tournamentId, String storedId, String name, String connectionId);

    TournamentView reconnectTournament(String tournamentId, String storedId, String connectionId);

    /** 幂等：把场次信息重发给请求者；未知赛事/场次静默忽略 */
    void requestMatchInfo(String connectionId, String tournamentId, String matchId);

    /** 幂等：已决出胜者、未知场次、胜者不在本场时均不做任何事 */
    void reportMatchResult(String tournamentId, String matchId, String winnerStoredId);

    List<TournamentView> listTournaments();

    /** 关联校验：场次存在且其对局码就是 sessionCode */
    boolean verifyLink(TournamentLink link, String sessionCode);

    /** storedId 是否为该关联场次的两名选手之一；赛事或场次已不存在时返回 false */
    boolean isMatchPlayer(TournamentLink link, String storedId);

    Optional<Tournament> findTournament(String tournamentId);
}
