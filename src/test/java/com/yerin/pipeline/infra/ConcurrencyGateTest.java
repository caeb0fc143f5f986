package com.yerin.pipeline.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@DisplayName("동시성 게이트 테스트")
public class ConcurrencyGateTest {

    @Test
    @DisplayName("동시에 실행되는 수는 최대치를 넘지 않는다")
    void never_exceeds_max() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(3);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(10);

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(pool.submit(() -> {
                try (ConcurrencyGate.Permit permit = gate.acquire()) {
                    int now = running.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(30);
                    running.decrementAndGet();
                }
                return null;
            }));
        }
        for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(peak.get()).isLessThanOrEqualTo(3).isGreaterThan(0);
        assertThat(gate.inFlight()).isZero();
    }

    @Test
    @DisplayName("예외가 나도 permit 은 반환되고, 두 번 닫아도 한 번만 반환된다")
    void permit_released_once_on_every_path() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);

        assertThatThrownBy(() -> {
            try (ConcurrencyGate.Permit permit = gate.acquire()) {
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);
        assertThat(gate.inFlight()).isZero();

        ConcurrencyGate.Permit p = gate.acquire();
        p.close();
        p.close();
        assertThat(gate.inFlight()).isZero();
        assertThat(gate.maxConcurrency()).isEqualTo(1);
    }

    @Test
    @DisplayName("슬롯이 없으면 대기하고, 반환되면 들어온다")
    void waits_for_free_slot() throws Exception {
        ConcurrencyGate gate = new ConcurrencyGate(1);
        ConcurrencyGate.Permit held = gate.acquire();
        CountDownLatch admitted = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            try (ConcurrencyGate.Permit permit = gate.acquire()) {
                admitted.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> gate.queueLength() == 1);
        assertThat(admitted.getCount()).isEqualTo(1);

        held.close();
        assertThat(admitted.await(2, TimeUnit.SECONDS)).isTrue();
        waiter.join(2000);
    }

    @Test
    @DisplayName("0 이하 설정은 1로 보정")
    void clamps_to_one() {
        assertThat(new ConcurrencyGate(0).maxConcurrency()).isEqualTo(1);
    }
}
