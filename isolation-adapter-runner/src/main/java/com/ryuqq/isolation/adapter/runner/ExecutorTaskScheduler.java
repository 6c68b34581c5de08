package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.core.spi.ScheduledTask;
import com.ryuqq.isolation.core.spi.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link ScheduledExecutorService} 기반 {@link TaskScheduler}.
 *
 * <p>작업 예외는 로그로 남기고 삼킵니다. 주기 작업이 한 번의 예외로 중단되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);
    private final ScheduledExecutorService executor;

    /**
     * 지정 크기의 스레드 풀로 생성.
     *
     * @param poolSize 스레드 수 (1 이상)
     * @throws IllegalArgumentException poolSize가 1 미만인 경우
     */
    public ExecutorTaskScheduler(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be positive (current: " + poolSize + ")");
        }
        this.executor = Executors.newScheduledThreadPool(poolSize);
    }

    /**
     * 외부 executor로 생성.
     *
     * @param executor 스케줄 executor
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public ExecutorTaskScheduler(ScheduledExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
            guard(task), initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS
        );
        return new FutureHandle(future);
    }

    /**
     * Graceful shutdown.
     *
     * <p>실행 중인 작업을 최대 60초 기다린 뒤 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
    }

    private Runnable guard(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Scheduled task failed", e);
            }
        };
    }

    private static final class FutureHandle implements ScheduledTask {
        private final ScheduledFuture<?> future;

        private FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
