package com.ryuqq.isolation.testkit.contract;

import com.ryuqq.isolation.core.config.InvalidBreakerConfigException;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.model.ErrorContext;
import com.ryuqq.isolation.core.model.SystemLayer;
import com.ryuqq.isolation.core.spi.BreakerNotFoundException;
import com.ryuqq.isolation.core.spi.BreakerStore;
import com.ryuqq.isolation.core.spi.BreakerView;
import com.ryuqq.isolation.core.statemachine.TransitionSignal;
import com.ryuqq.isolation.testkit.fixture.BreakerFixtures;
import com.ryuqq.isolation.testkit.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract contract test for {@link BreakerStore} implementations.
 *
 * <p>Adapter 모듈은 이 클래스를 상속하고 {@link #createStore(MutableClock)}만 구현하면
 * 같은 계약 검증을 받습니다.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>register → CLOSED, 카운터 0 / 중복 id는 InvalidConfig</li>
 *   <li>등록되지 않은 id는 항상 NotFound</li>
 *   <li>같은 breaker의 동시 update는 유실 없이 직렬화</li>
 *   <li>서로 다른 breaker의 update는 서로를 기다리지 않음</li>
 *   <li>replaceConfig는 지표를 보존</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractBreakerStoreContractTest {
 *     {@literal @}Override
 *     protected BreakerStore createStore(MutableClock clock) {
 *         return new MyStore(clock);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractBreakerStoreContractTest {

    protected MutableClock clock;
    protected BreakerStore store;

    /**
     * 테스트 대상 저장소 생성.
     *
     * @param clock 테스트 시계
     * @return 빈 저장소
     */
    protected abstract BreakerStore createStore(MutableClock clock);

    @BeforeEach
    void setUpStore() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        store = createStore(clock);
    }

    // ============================================================
    // 1. 등록과 조회
    // ============================================================

    @Test
    @DisplayName("register: CLOSED, 카운터 0으로 시작")
    void register_StartsClosedWithZeroCounters() {
        // given
        store.register(BreakerFixtures.standard("orders"));

        // when
        BreakerView view = store.get(BreakerId.of("orders"));

        // then
        assertThat(view.metrics().state()).isEqualTo(BreakerState.CLOSED);
        assertThat(view.metrics().failureCount()).isZero();
        assertThat(view.metrics().successCount()).isZero();
        assertThat(view.metrics().totalCount()).isZero();
        assertThat(view.metrics().history()).isEmpty();
        assertThat(view.metrics().stateEnteredAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("register: 중복 id는 InvalidBreakerConfigException")
    void register_DuplicateId_Throws() {
        // given
        store.register(BreakerFixtures.standard("orders"));

        // when & then
        assertThatThrownBy(() -> store.register(BreakerFixtures.standard("orders")))
            .isInstanceOf(InvalidBreakerConfigException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    @DisplayName("get/update/deregister/replaceConfig: 미등록 id는 BreakerNotFoundException")
    void unknownId_AlwaysNotFound() {
        BreakerId unknown = BreakerId.of("missing");

        assertThatThrownBy(() -> store.get(unknown)).isInstanceOf(BreakerNotFoundException.class);
        assertThatThrownBy(() -> store.update(unknown, (c, m) -> null)).isInstanceOf(BreakerNotFoundException.class);
        assertThatThrownBy(() -> store.deregister(unknown)).isInstanceOf(BreakerNotFoundException.class);
        assertThatThrownBy(() -> store.replaceConfig(BreakerFixtures.standard("missing")))
            .isInstanceOf(BreakerNotFoundException.class);
        assertThat(store.contains(unknown)).isFalse();
    }

    @Test
    @DisplayName("deregister 후에는 조회/변경 불가")
    void deregister_RemovesBreaker() {
        // given
        store.register(BreakerFixtures.standard("orders"));
        BreakerId id = BreakerId.of("orders");

        // when
        store.deregister(id);

        // then
        assertThat(store.contains(id)).isFalse();
        assertThatThrownBy(() -> store.get(id)).isInstanceOf(BreakerNotFoundException.class);
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    @DisplayName("findByLayers: 지정 계층의 breaker만 id 순으로 반환")
    void findByLayers_FiltersByLayer() {
        // given
        store.register(BreakerFixtures.atLayer("db-b", SystemLayer.DATA_ACCESS));
        store.register(BreakerFixtures.atLayer("db-a", SystemLayer.DATA_ACCESS));
        store.register(BreakerFixtures.atLayer("gateway", SystemLayer.API));
        store.register(BreakerFixtures.atLayer("cache", SystemLayer.INFRASTRUCTURE));

        // when
        List<BreakerView> views = store.findByLayers(Set.of(SystemLayer.DATA_ACCESS, SystemLayer.API));

        // then
        assertThat(views.stream().map(v -> v.config().breakerId().getValue()).collect(Collectors.toList()))
            .containsExactly("db-a", "db-b", "gateway");
    }

    @Test
    @DisplayName("replaceConfig: 지표와 상태는 유지")
    void replaceConfig_PreservesMetrics() {
        // given
        store.register(BreakerFixtures.standard("orders"));
        BreakerId id = BreakerId.of("orders");
        store.update(id, (c, m) -> {
            m.recordFailure(clock.instant(), ErrorContext.unclassified());
            m.transition(TransitionSignal.OPERATOR_FORCE_OPEN, clock.instant(), "maintenance");
            return null;
        });

        // when
        store.replaceConfig(BreakerFixtures.builder("orders", SystemLayer.API).name("renamed").build());

        // then
        BreakerView view = store.get(id);
        assertThat(view.config().name()).isEqualTo("renamed");
        assertThat(view.metrics().state()).isEqualTo(BreakerState.FORCE_OPEN);
        assertThat(view.metrics().failureCount()).isEqualTo(1);
    }

    // ============================================================
    // 2. 동시성
    // ============================================================

    @Test
    @DisplayName("같은 breaker에 대한 동시 update는 카운터를 잃지 않음")
    void concurrentUpdates_SameBreaker_NoLostIncrements() throws Exception {
        // given
        store.register(BreakerFixtures.standard("orders"));
        BreakerId id = BreakerId.of("orders");
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // when
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.update(id, (c, m) -> {
                        m.recordSuccess(clock.instant(), Duration.ofMillis(5));
                        return null;
                    });
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        assertThat(store.get(id).metrics().successCount()).isEqualTo((long) threads * perThread);
    }

    @Test
    @DisplayName("다른 breaker의 update는 서로를 기다리지 않음 (전역 락 없음)")
    void updates_DifferentBreakers_DoNotContend() throws Exception {
        // given
        store.register(BreakerFixtures.standard("slow"));
        store.register(BreakerFixtures.standard("fast"));
        CountDownLatch slowHoldsLock = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        Future<?> slow = pool.submit(() -> store.update(BreakerId.of("slow"), (c, m) -> {
            slowHoldsLock.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        assertThat(slowHoldsLock.await(5, TimeUnit.SECONDS)).isTrue();

        // when: 다른 breaker는 slow가 락을 쥔 동안에도 진행
        store.update(BreakerId.of("fast"), (c, m) -> {
            m.recordSuccess(clock.instant(), null);
            return null;
        });

        // then
        assertThat(store.get(BreakerId.of("fast")).metrics().successCount()).isEqualTo(1);
        release.countDown();
        slow.get(5, TimeUnit.SECONDS);
        pool.shutdown();
    }
}
