package com.whothub.gameservice.application.stats;

import com.whothub.gameservice.platform.config.WhotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 对局结束后的经验值结算。
 * 在独立的 statsExecutor 上异步执行，失败只记日志、不重试，也不影响对局流程。
 */
@Slf4j
@Component
public class MatchStatsRecorder {

    private final PlayerStatsService statsService;
    private final Executor statsExecutor;
    private final WhotProperties properties;

    public MatchStatsRecorder(PlayerStatsService statsService,
                              @Qualifier("statsExecutor") Executor statsExecutor,
                              WhotProperties properties) {
        this.statsService = statsService;
        this.statsExecutor = statsExecutor;
        this.properties = properties;
    }

    /**
     * 胜者 +winXp，败者 +0。两笔写入互不影响。
     */
    public void recordResult(String winnerStoredId, String loserStoredId) {
        int winXp = properties.getStats().getWinXp();
        submit(winnerStoredId, winXp, true);
        if (loserStoredId != null) {
            submit(loserStoredId, 0, false);
        }
    }

    private void submit(String address, int xp, boolean win) {
        try {
            CompletableFuture.runAsync(() -> statsService.updateUserXP(address, xp, win), statsExecutor)
                    .exceptionally(ex -> {
                        log.warn("经验值写入失败: address={}, win={}", address, win, ex);
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("统计线程池已满，经验值写入被丢弃: address={}, xp={}, win={}", address, xp, win);
        }
    }
}
