package com.tictactoe.gameservice.infrastructure.scheduler;

import com.tictactoe.gameservice.platform.config.TicTacToeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * 井字棋 AI 落子的延迟调度器。
 * 线程数取 tictactoe.ai.pool-size；新开一盘时被取消的延迟任务直接出队，容器关闭时丢弃未执行的任务。
 */
@Configuration
public class AiSchedulerConfig {

    /** AI 调度线程名前缀，便于在日志里区分 */
    static final String THREAD_PREFIX = "tictactoe-ai-";

    @Bean(name = "aiScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService aiScheduler(TicTacToeProperties props) {
        CustomizableThreadFactory threads = new CustomizableThreadFactory(THREAD_PREFIX);
        threads.setDaemon(true);

        ScheduledThreadPoolExecutor exec =
                new ScheduledThreadPoolExecutor(Math.max(1, props.getAi().getPoolSize()), threads);
        exec.setRemoveOnCancelPolicy(true);
        exec.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return exec;
    }
}
