package com.whothub.gameservice.platform.loop;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 对局主循环
 * ----------------------------------------
 * 会话注册表与赛事引擎的唯一执行线程：入站事件处理器、延迟销毁、赛事清理、空闲清扫
 * 都经由这里串行执行，因此内存中的房间表/赛事表无需加锁。
 * <p>
 * 单个任务抛出的异常只记录日志，不会影响其他对局或赛事。
 */
@Slf4j
@Component
public class GameLoop {

    private final ScheduledExecutorService executor;

    public GameLoop(@Qualifier("gameLoopExecutor") ScheduledExecutorService executor) {
        this.executor = executor;
    }

    /**
     * 立即排队执行（按提交顺序）。
     * @param label 任务名，仅用于日志
     */
    public void submit(String label, Runnable task) {
        executor.execute(() -> runSafely(label, task));
    }

    /**
     * 延迟执行。任务执行时目标可能已被移除，调用方必须自行复查。
     */
    public ScheduledFuture<?> schedule(String label, Runnable task, Duration delay) {
        return executor.schedule(() -> runSafely(label, task), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 固定频率执行（首次延迟一个周期）。
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String label, Runnable task, Duration period) {
        long ms = period.toMillis();
        return executor.scheduleAtFixedRate(() -> runSafely(label, task), ms, ms, TimeUnit.MILLISECONDS);
    }

    protected void runSafely(String label, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("主循环任务执行失败: task={}", label, e);
        }
    }
}
