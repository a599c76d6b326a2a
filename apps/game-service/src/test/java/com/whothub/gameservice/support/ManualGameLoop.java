package com.whothub.gameservice.support;

import com.whothub.gameservice.platform.loop.GameLoop;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 测试用主循环：submit 立即在当前线程执行，延迟任务先收集起来由测试手动触发。
 */
public class ManualGameLoop extends GameLoop {

    public record Pending(String label, Runnable task, Duration delay) {
    }

    private final List<Pending> scheduled = new ArrayList<>();
    private final List<Pending> periodic = new ArrayList<>();

    public ManualGameLoop() {
        super(null);
    }

    @Override
    public void submit(String label, Runnable task) {
        runSafely(label, task);
    }

    @Override
    public ScheduledFuture<?> schedule(String label, Runnable task, Duration delay) {
        scheduled.add(new Pending(label, task, delay));
        return null;
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(String label, Runnable task, Duration period) {
        periodic.add(new Pending(label, task, period));
        return null;
    }

    public List<Pending> scheduled() {
        return List.copyOf(scheduled);
    }

    public List<Pending> periodic() {
        return List.copyOf(periodic);
    }

    /** 执行并清空当前所有延迟任务 */
    public int runScheduled() {
        List<Pending> due = new ArrayList<>(scheduled);
        scheduled.clear();
        due.forEach(p -> runSafely(p.label(), p.task()));
        return due.size();
    }
}
