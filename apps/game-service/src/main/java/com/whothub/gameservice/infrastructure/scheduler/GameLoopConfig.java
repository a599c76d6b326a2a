package com.whothub.gameservice.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程模型配置。
 * <ul>
 *   <li>gameLoopExecutor：单线程，所有对局/赛事状态变更与延迟销毁都在这里串行执行；</li>
 *   <li>statsExecutor：经验值/排行榜等持久化写入，失败只记日志，不阻塞对局流程。</li>
 * </ul>
 * 两者分开，避免数据库抖动拖慢实时对局。
 */
@Configuration
public class GameLoopConfig {

    @Bean(name = "gameLoopExecutor", destroyMethod = "shutdown")
    public ScheduledExecutorService gameLoopExecutor() {
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(1, daemonFactory("game-loop-"));
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }

    @Bean(name = "statsExecutor", destroyMethod = "shutdown")
    public ExecutorService statsExecutor() {
        int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        return new ThreadPoolExecutor(poolSize, poolSize, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000), daemonFactory("stats-"),
                // 队列满时直接拒绝，由提交方记录被丢弃的写入
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory daemonFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + idx.getAndIncrement());
                // 设置为守护线程
                t.setDaemon(true);
                return t;
            }
        };
    }
}
