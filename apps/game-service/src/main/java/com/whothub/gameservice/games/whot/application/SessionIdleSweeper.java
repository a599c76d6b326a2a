package com.whothub.gameservice.games.whot.application;

import com.whothub.gameservice.games.whot.domain.model.GameSession;
import com.whothub.gameservice.games.whot.service.SessionRegistry;
import com.whothub.gameservice.games.whot.service.TournamentEngine;
import com.whothub.gameservice.platform.config.WhotProperties;
import com.whothub.gameservice.platform.loop.GameLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * 空闲对局清扫
 * ----------------------------------------
 * 从未上报结束的对局会一直留在内存里，这里定期清理超过 idle-ttl 无活动的对局。
 * 关联的赛事仍存在时保留，避免选手回来时对局码失效。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionIdleSweeper {

    private final GameLoop gameLoop;
    private final SessionRegistry sessionRegistry;
    private final TournamentEngine tournamentEngine;
    private final WhotProperties properties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("空闲对局清扫已启动: interval={}, idleTtl={}",
                properties.getSession().getSweepInterval(), properties.getSession().getIdleTtl());
        gameLoop.scheduleAtFixedRate("idle-sweep", this::sweep, properties.getSession().getSweepInterval());
    }

    /** 须在主循环线程执行 */
    public int sweep() {
        Instant cutoff = clock.instant().minus(properties.getSession().getIdleTtl());
        int removed = sessionRegistry.sweepIdleSessions(cutoff, this::tournamentStillExists);
        if (removed > 0) {
            log.info("空闲对局清扫完成: removed={}", removed);
        }
        return removed;
    }

    private boolean tournamentStillExists(GameSession session) {
        return session.tournamentLink()
                .map(link -> tournamentEngine.findTournament(link.tournamentId()).isPresent())
                .orElse(false);
    }
}
