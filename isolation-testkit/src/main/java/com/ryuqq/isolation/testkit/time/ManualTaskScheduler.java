package com.ryuqq.isolation.testkit.time;

import com.ryuqq.isolation.core.spi.ScheduledTask;
import com.ryuqq.isolation.core.spi.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 가상 시간 {@link TaskScheduler}.
 *
 * <p>예약된 작업은 {@link #advance(Duration)}로 {@link MutableClock}을 진행시킬 때
 * 예정 시각 순서대로 호출 스레드에서 실행됩니다. 고정 주기 작업은 실행 후 다음 주기로 재예약됩니다.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ManualTaskScheduler scheduler = new ManualTaskScheduler(clock);
 * scheduler.schedule(task, Duration.ofSeconds(30));
 * scheduler.advance(Duration.ofSeconds(30)); // task 실행
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<Pending> pending = new ArrayList<>();
    private long sequence;
    private int executed;

    /**
     * 생성자.
     *
     * @param clock 진행시킬 시계
     */
    public ManualTaskScheduler(MutableClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, Duration delay) {
        return enqueue(task, clock.instant().plus(delay), null);
    }

    @Override
    public synchronized ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive (current: " + period + ")");
        }
        return enqueue(task, clock.instant().plus(initialDelay), period);
    }

    /**
     * 시간을 진행시키며 도래한 작업을 순서대로 실행.
     *
     * @param duration 진행할 시간
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Optional<Pending> next = nextDue(target);
            if (next.isEmpty()) {
                break;
            }
            Pending due = next.get();
            if (due.at.isAfter(clock.instant())) {
                clock.setInstant(due.at);
            }
            run(due);
        }
        clock.setInstant(target);
    }

    /**
     * 현재 시각까지 도래한 작업만 실행 (시간 진행 없음).
     */
    public void runDue() {
        advance(Duration.ZERO);
    }

    /**
     * 취소되지 않은 예약 작업 수.
     *
     * @return 대기 작업 수
     */
    public synchronized int pendingCount() {
        return (int) pending.stream().filter(p -> !p.handle.isCancelled()).count();
    }

    /**
     * 지금까지 실행한 작업 수.
     *
     * @return 실행 수
     */
    public synchronized int executedCount() {
        return executed;
    }

    private ScheduledTask enqueue(Runnable task, Instant at, Duration period) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        Handle handle = new Handle();
        pending.add(new Pending(task, at, period, sequence++, handle));
        return handle;
    }

    private synchronized Optional<Pending> nextDue(Instant target) {
        pending.removeIf(p -> p.handle.isCancelled());
        Optional<Pending> next = pending.stream()
            .filter(p -> !p.at.isAfter(target))
            .min(Comparator.comparing((Pending p) -> p.at).thenComparingLong(p -> p.sequence));
        next.ifPresent(pending::remove);
        return next;
    }

    private void run(Pending due) {
        due.task.run();
        synchronized (this) {
            executed++;
            if (due.period != null && !due.handle.isCancelled()) {
                pending.add(new Pending(due.task, due.at.plus(due.period), due.period, sequence++, due.handle));
            } else {
                due.handle.done = true;
            }
        }
    }

    private static final class Pending {
        private final Runnable task;
        private final Instant at;
        private final Duration period;
        private final long sequence;
        private final Handle handle;

        private Pending(Runnable task, Instant at, Duration period, long sequence, Handle handle) {
            this.task = task;
            this.at = at;
            this.period = period;
            this.sequence = sequence;
            this.handle = handle;
        }
    }

    private static final class Handle implements ScheduledTask {
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private volatile boolean done;

        @Override
        public boolean cancel() {
            return !done && cancelled.compareAndSet(false, true);
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
