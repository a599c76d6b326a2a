package com.whothub.gameservice.application.stats;

import com.whothub.gameservice.platform.config.WhotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 排行榜短时缓存：TTL 内直接返回上次结果，降低数据库压力。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaderboardCacheService {

    private final PlayerStatsService statsService;
    private final WhotProperties properties;
    private final Clock clock;

    private volatile Snapshot snapshot;

    public record Leaderboard(List<PlayerStatsView> entries, boolean cached) {
    }

    private record Snapshot(List<PlayerStatsView> entries, Instant loadedAt) {
    }

    public Leaderboard get() {
        Instant now = clock.instant();
        Snapshot s = snapshot;
        if (s != null && !s.entries().isEmpty()
                && now.isBefore(s.loadedAt().plus(properties.getStats().getLeaderboardCacheTtl()))) {
            return new Leaderboard(s.entries(), true);
        }
        List<PlayerStatsView> fresh = statsService.getLeaderboard(properties.getStats().getLeaderboardSize());
        snapshot = new Snapshot(fresh, now);
        log.debug("排行榜已刷新: size={}", fresh.size());
        return new Leaderboard(fresh, false);
    }

    /** 战绩变化后可主动失效 */
    public void evict() {
        snapshot = null;
    }
}
