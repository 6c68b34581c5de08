package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.application.coordination.CoordinationOrchestrator;
import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.coordination.AlreadyIsolated;
import com.ryuqq.isolation.core.coordination.ContinuityStep;
import com.ryuqq.isolation.core.coordination.CoordinatedResponse;
import com.ryuqq.isolation.core.coordination.CoordinationFailure;
import com.ryuqq.isolation.core.coordination.CoordinationStrategy;
import com.ryuqq.isolation.core.coordination.IsolateBreaker;
import com.ryuqq.isolation.core.event.CoordinationEvent;
import com.ryuqq.isolation.core.event.CoordinationRecoveryEvent;
import com.ryuqq.isolation.core.event.RecoveryCheck;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.model.SystemLayer;
import com.ryuqq.isolation.core.spi.BreakerNotFoundException;
import com.ryuqq.isolation.core.spi.BreakerStore;
import com.ryuqq.isolation.core.spi.BreakerView;
import com.ryuqq.isolation.core.spi.ScheduledTask;
import com.ryuqq.isolation.core.spi.TaskScheduler;
import com.ryuqq.isolation.core.statemachine.StateTransition;
import com.ryuqq.isolation.core.statemachine.TransitionSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 계층 간 격리 조정 기본 구현.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. trigger breaker 확인 (미등록 → BreakerNotFoundException)
 * 2. findByLayers(layers) → 대상 breaker
 * 3. 전략 결정: 대상 중 stagedTierThreshold 이상 등급이 있으면 STAGED, 아니면 PARALLEL
 * 4. breaker별 격리 (perBreakerTimeout 제한):
 *    - CLOSED / HALF_OPEN → COORDINATED_ISOLATION → OPEN
 *    - OPEN → 이미 격리됨 (전이 없음)
 *    - FORCE_OPEN / EMERGENCY, 타임아웃, 예외 → unaffected
 * 5. CoordinationEvent 발행, 복구 모니터 예약
 * 6. 복구 모니터: openDuration이 지난 OPEN breaker를 HALF_OPEN으로 전이한 뒤 복구 여부 보고
 * </pre>
 *
 * <p>타임아웃된 격리 작업은 취소되지 않으므로 응답 이후 늦게 적용될 수 있습니다.
 * 그 경우에도 상태 전이 이벤트는 정상 발행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultCoordinationOrchestrator implements CoordinationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultCoordinationOrchestrator.class);
    private final BreakerStore store;
    private final ChangeDispatcher dispatcher;
    private final TaskScheduler scheduler;
    private final ExecutorService executor;
    private final Clock clock;
    private final CoordinatorConfig config;
    private final Map<BreakerId, List<RecoveryMonitor>> recoveryMonitors = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param store breaker 저장소
     * @param dispatcher 이벤트/영속화 전파
     * @param scheduler 복구 모니터용 스케줄러
     * @param executor breaker별 격리 실행 executor
     * @param clock 시계
     * @param config 조정 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultCoordinationOrchestrator(
        BreakerStore store,
        ChangeDispatcher dispatcher,
        TaskScheduler scheduler,
        ExecutorService executor,
        Clock clock,
        CoordinatorConfig config
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.executor = executor;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public CoordinatedResponse coordinate(BreakerId triggerBreakerId, Set<SystemLayer> affectedLayers) {
        if (triggerBreakerId == null) {
            throw new IllegalArgumentException("triggerBreakerId cannot be null");
        }
        if (affectedLayers == null) {
            throw new IllegalArgumentException("affectedLayers cannot be null");
        }
        store.get(triggerBreakerId);

        Instant startedAt = clock.instant();
        String coordinationId = UUID.randomUUID().toString();
        List<BreakerView> targets = affectedLayers.isEmpty() ? List.of() : store.findByLayers(affectedLayers);
        CoordinationStrategy strategy = chooseStrategy(targets);
        log.info("Coordination {} started by {}: {} breakers across {} ({})",
            coordinationId, triggerBreakerId, targets.size(), affectedLayers, strategy);

        List<Attempt> attempts = strategy == CoordinationStrategy.STAGED
            ? isolateStaged(targets, coordinationId)
            : isolateAll(targets, coordinationId);

        List<BreakerId> affected = new ArrayList<>();
        List<CoordinationFailure> unaffected = new ArrayList<>();
        List<ContinuityStep> plan = new ArrayList<>();
        Duration longestOpen = Duration.ZERO;
        for (Attempt attempt : attempts) {
            if (attempt.failure() != null) {
                unaffected.add(attempt.failure());
                continue;
            }
            affected.add(attempt.breakerId());
            plan.add(attempt.step());
            Duration openDuration = attempt.config().timing().openDuration();
            if (openDuration.compareTo(longestOpen) > 0) {
                longestOpen = openDuration;
            }
        }

        CoordinatedResponse response = new CoordinatedResponse(
            coordinationId,
            triggerBreakerId,
            affected,
            unaffected,
            strategy,
            plan,
            config.fallbacksFor(affectedLayers),
            startedAt,
            startedAt.plus(longestOpen)
        );

        if (response.isPartial()) {
            log.warn("Coordination {} partially applied: {} isolated, {} unaffected {}",
                coordinationId, affected.size(), unaffected.size(), unaffected);
        } else {
            log.info("Coordination {} completed: {} isolated", coordinationId, affected.size());
        }
        dispatcher.publish(new CoordinationEvent(response));

        if (!affected.isEmpty()) {
            scheduleRecoveryMonitor(response, longestOpen);
        }
        return response;
    }

    @Override
    public int cancelRecoveryMonitors(BreakerId triggerBreakerId) {
        List<RecoveryMonitor> monitors = recoveryMonitors.remove(triggerBreakerId);
        if (monitors == null) {
            return 0;
        }
        int cancelled = 0;
        for (RecoveryMonitor monitor : monitors) {
            if (monitor.cancel()) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} recovery monitors started by {}", cancelled, triggerBreakerId);
        }
        return cancelled;
    }

    private CoordinationStrategy chooseStrategy(List<BreakerView> targets) {
        boolean critical = targets.stream()
            .anyMatch(view -> view.config().businessImpactTier().isAtLeast(config.stagedTierThreshold()));
        return critical ? CoordinationStrategy.STAGED : CoordinationStrategy.PARALLEL;
    }

    private List<Attempt> isolateAll(List<BreakerView> targets, String coordinationId) {
        List<CompletableFuture<Attempt>> futures = new ArrayList<>(targets.size());
        for (BreakerView target : targets) {
            futures.add(submit(target, coordinationId));
        }
        List<Attempt> attempts = new ArrayList<>(futures.size());
        for (CompletableFuture<Attempt> future : futures) {
            attempts.add(future.join());
        }
        return attempts;
    }

    private List<Attempt> isolateStaged(List<BreakerView> targets, String coordinationId) {
        Map<SystemLayer, List<BreakerView>> stages = new EnumMap<>(SystemLayer.class);
        for (BreakerView target : targets) {
            stages.computeIfAbsent(target.config().systemLayer(), layer -> new ArrayList<>()).add(target);
        }
        List<Attempt> attempts = new ArrayList<>(targets.size());
        for (Map.Entry<SystemLayer, List<BreakerView>> stage : stages.entrySet()) {
            log.debug("Coordination {} isolating stage {}", coordinationId, stage.getKey());
            attempts.addAll(isolateAll(stage.getValue(), coordinationId));
        }
        return attempts;
    }

    private CompletableFuture<Attempt> submit(BreakerView target, String coordinationId) {
        BreakerId breakerId = target.config().breakerId();
        try {
            return CompletableFuture.supplyAsync(() -> isolate(breakerId, coordinationId), executor)
                .orTimeout(config.perBreakerTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> Attempt.failed(breakerId, describe(breakerId, error)));
        } catch (RejectedExecutionException e) {
            log.warn("Isolation of {} rejected by executor", breakerId, e);
            return CompletableFuture.completedFuture(Attempt.failed(breakerId, "Isolation rejected by executor"));
        }
    }

    private Attempt isolate(BreakerId breakerId, String coordinationId) {
        Attempt attempt = store.update(breakerId, (breakerConfig, metrics) -> {
            BreakerState previous = metrics.state();
            Duration openDuration = breakerConfig.timing().openDuration();
            if (previous == BreakerState.OPEN) {
                return Attempt.isolated(breakerConfig, new AlreadyIsolated(breakerId, breakerConfig.name(),
                    breakerConfig.systemLayer(), metrics.stateEnteredAt().plus(openDuration)));
            }
            if (previous == BreakerState.CLOSED || previous == BreakerState.HALF_OPEN) {
                StateTransition applied = metrics.transition(TransitionSignal.COORDINATED_ISOLATION,
                    clock.instant(), "Coordinated isolation " + coordinationId);
                dispatcher.enqueue(breakerConfig, applied);
                return Attempt.isolated(breakerConfig, new IsolateBreaker(breakerId, breakerConfig.name(),
                    breakerConfig.systemLayer(), previous, applied.at().plus(openDuration)));
            }
            return Attempt.failed(breakerId, "Breaker is " + previous + " under operator control");
        });
        dispatcher.flush(breakerId);
        return attempt;
    }

    private String describe(BreakerId breakerId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            log.warn("Isolation of {} timed out after {}", breakerId, config.perBreakerTimeout());
            return "Isolation timed out after " + config.perBreakerTimeout();
        }
        if (cause instanceof BreakerNotFoundException) {
            return "Breaker deregistered during coordination";
        }
        log.warn("Isolation of {} failed", breakerId, cause);
        return "Isolation failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    // ============================================================
    // 복구 모니터
    // ============================================================

    private void scheduleRecoveryMonitor(CoordinatedResponse response, Duration delay) {
        BreakerId trigger = response.triggerBreakerId();
        RecoveryMonitor monitor = new RecoveryMonitor();
        recoveryMonitors.compute(trigger, (id, monitors) -> {
            List<RecoveryMonitor> registered = monitors == null ? new CopyOnWriteArrayList<>() : monitors;
            registered.add(monitor);
            return registered;
        });
        monitor.attach(scheduler.schedule(() -> {
            recoveryMonitors.computeIfPresent(trigger, (id, monitors) -> {
                monitors.remove(monitor);
                return monitors.isEmpty() ? null : monitors;
            });
            if (!monitor.isCancelled()) {
                checkRecovery(response);
            }
        }, delay));
    }

    private void checkRecovery(CoordinatedResponse response) {
        List<RecoveryCheck> checks = new ArrayList<>(response.affectedBreakers().size());
        for (BreakerId breakerId : response.affectedBreakers()) {
            checks.add(check(breakerId));
        }
        CoordinationRecoveryEvent event = new CoordinationRecoveryEvent(
            response.coordinationId(), response.triggerBreakerId(), checks, clock.instant()
        );
        log.info("Coordination {} recovery check: {} of {} recovered",
            response.coordinationId(), checks.stream().filter(RecoveryCheck::recovered).count(), checks.size());
        dispatcher.publish(event);
    }

    private RecoveryCheck check(BreakerId breakerId) {
        try {
            BreakerState state = store.update(breakerId, (breakerConfig, metrics) -> {
                Instant now = clock.instant();
                Instant reopensAt = metrics.stateEnteredAt().plus(breakerConfig.timing().openDuration());
                if (metrics.state() == BreakerState.OPEN && !now.isBefore(reopensAt)) {
                    dispatcher.enqueue(breakerConfig, metrics.transition(
                        TransitionSignal.OPEN_TIMEOUT_ELAPSED, now, "Open duration elapsed"));
                }
                return metrics.state();
            });
            dispatcher.flush(breakerId);
            boolean recovered = state == BreakerState.HALF_OPEN || state == BreakerState.CLOSED;
            return new RecoveryCheck(breakerId, Optional.of(state), recovered);
        } catch (BreakerNotFoundException e) {
            log.debug("Recovery check skipped, breaker {} is no longer registered", breakerId);
            return new RecoveryCheck(breakerId, Optional.empty(), false);
        }
    }

    /**
     * 복구 모니터 핸들. 예약 전에 등록되므로 예약 핸들이 붙기 전에 취소될 수 있습니다.
     */
    private static final class RecoveryMonitor {
        private volatile ScheduledTask task;
        private volatile boolean cancelled;

        void attach(ScheduledTask scheduled) {
            task = scheduled;
            if (cancelled) {
                scheduled.cancel();
            }
        }

        boolean cancel() {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            ScheduledTask scheduled = task;
            return scheduled == null || scheduled.cancel();
        }

        boolean isCancelled() {
            return cancelled;
        }
    }

    /**
     * breaker 하나의 격리 결과.
     */
    private record Attempt(
        BreakerId breakerId,
        BreakerConfig config,
        ContinuityStep step,
        CoordinationFailure failure
    ) {

        static Attempt isolated(BreakerConfig config, ContinuityStep step) {
            return new Attempt(config.breakerId(), config, step, null);
        }

        static Attempt failed(BreakerId breakerId, String reason) {
            return new Attempt(breakerId, null, null, new CoordinationFailure(breakerId, reason));
        }
    }
}
