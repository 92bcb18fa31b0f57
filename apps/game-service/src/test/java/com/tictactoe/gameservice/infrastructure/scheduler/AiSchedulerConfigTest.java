package com.tictactoe.gameservice.infrastructure.scheduler;

import com.tictactoe.gameservice.platform.config.TicTacToeProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AiSchedulerConfigTest {

    private ScheduledExecutorService scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) scheduler.shutdownNow();
    }

    @Test
    void poolSizeComesFromProperties() {
        TicTacToeProperties props = new TicTacToeProperties();
        props.getAi().setPoolSize(3);
        scheduler = new AiSchedulerConfig().aiScheduler(props);

        ScheduledThreadPoolExecutor exec = (ScheduledThreadPoolExecutor) scheduler;
        assertThat(exec.getCorePoolSize()).isEqualTo(3);
        assertThat(exec.getRemoveOnCancelPolicy()).isTrue();
        assertThat(exec.getExecuteExistingDelayedTasksAfterShutdownPolicy()).isFalse();
    }

    @Test
    void nonPositivePoolSizeFallsBackToOneThread() {
        TicTacToeProperties props = new TicTacToeProperties();
        props.getAi().setPoolSize(0);
        scheduler = new AiSchedulerConfig().aiScheduler(props);

        assertThat(((ScheduledThreadPoolExecutor) scheduler).getCorePoolSize()).isEqualTo(1);
    }

    @Test
    void tasksRunOnNamedDaemonThreads() throws Exception {
        scheduler = new AiSchedulerConfig().aiScheduler(new TicTacToeProperties());

        Callable<Thread> whoRuns = Thread::currentThread;
        Thread worker = scheduler.schedule(whoRuns, 0, TimeUnit.MILLISECONDS).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith(AiSchedulerConfig.THREAD_PREFIX);
        assertThat(worker.isDaemon()).isTrue();
    }

    @Test
    void cancelledDelayedTaskLeavesTheQueue() {
        scheduler = new AiSchedulerConfig().aiScheduler(new TicTacToeProperties());
        ScheduledThreadPoolExecutor exec = (ScheduledThreadPoolExecutor) scheduler;

        exec.schedule(() -> { }, 1, TimeUnit.HOURS).cancel(false);

        assertThat(exec.getQueue()).isEmpty();
    }
}
