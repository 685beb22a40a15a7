package quest.gekko.creatorstats.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SingleFlightTest {

    private final SingleFlight<String, Integer> flight = new SingleFlight<>();

    @Test
    @DisplayName("concurrent callers on one key share a single execution")
    void collapsesConcurrentCalls() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Future<Integer> leader = pool.submit(() -> flight.execute("k", () -> {
                executions.incrementAndGet();
                started.countDown();
                await(release);
                return 42;
            }));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            List<Future<Integer>> followers = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                followers.add(pool.submit(() -> flight.execute("k", () -> {
                    executions.incrementAndGet();
                    return -1;
                })));
            }
            // let followers attach before the leader finishes
            Thread.sleep(300);
            release.countDown();

            assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo(42);
            for (Future<Integer> follower : followers) {
                assertThat(follower.get(5, TimeUnit.SECONDS)).isEqualTo(42);
            }
            assertThat(flight.inFlightCount()).isZero();
        } finally {
            pool.shutdownNow();
        }
        assertThat(executions).hasValue(1);
    }

    @Test
    @DisplayName("followers receive the leader's exception")
    void propagatesFailureToFollowers() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Integer> leader = pool.submit(() -> flight.execute("k", () -> {
                started.countDown();
                await(release);
                throw new IllegalStateException("boom");
            }));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            Future<Integer> follower = pool.submit(() -> flight.execute("k", () -> 1));
            Thread.sleep(300);
            release.countDown();

            assertThatThrownBy(() -> leader.get(5, TimeUnit.SECONDS)).hasRootCauseInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> follower.get(5, TimeUnit.SECONDS)).hasRootCauseMessage("boom");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void keyIsReleasedAfterFailure() {
        assertThatThrownBy(() -> flight.execute("k", () -> { throw new IllegalArgumentException("bad"); }))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(flight.inFlightCount()).isZero();
        assertThat(flight.execute("k", () -> 7)).isEqualTo(7);
    }

    @Test
    void distinctKeysDoNotShare() {
        assertThat(flight.execute("a", () -> 1)).isEqualTo(1);
        assertThat(flight.execute("b", () -> 2)).isEqualTo(2);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
