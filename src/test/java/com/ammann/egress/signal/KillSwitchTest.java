/* (C)2026 */
package com.ammann.egress.signal;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class KillSwitchTest {

    @Test
    void watchIsPendingUntilTriggered() {
        KillSwitch killSwitch = new KillSwitch();

        CompletableFuture<Void> watch = killSwitch.watch();

        assertThat(watch).isNotDone();
        assertThat(killSwitch.isTriggered()).isFalse();

        assertThat(killSwitch.trigger()).isTrue();

        assertThat(watch).isCompleted();
        assertThat(killSwitch.isTriggered()).isTrue();
    }

    @Test
    void watchTakenAfterTriggerIsAlreadyComplete() {
        KillSwitch killSwitch = new KillSwitch();
        killSwitch.trigger();

        assertThat(killSwitch.watch()).isCompleted();
    }

    @Test
    void repeatedTriggersAreNoOps() {
        KillSwitch killSwitch = new KillSwitch();

        assertThat(killSwitch.trigger()).isTrue();
        assertThat(killSwitch.trigger()).isFalse();
        assertThat(killSwitch.trigger()).isFalse();
        assertThat(killSwitch.isTriggered()).isTrue();
    }

    @Test
    void cancellingOneWatchDoesNotAffectOthers() {
        KillSwitch killSwitch = new KillSwitch();
        CompletableFuture<Void> first = killSwitch.watch();
        CompletableFuture<Void> second = killSwitch.watch();

        first.cancel(true);
        killSwitch.trigger();

        assertThat(first).isCancelled();
        assertThat(second).isCompleted();
        assertThat(killSwitch.watch()).isCompleted();
    }

    @Test
    void concurrentTriggersTransitionExactlyOnceAndReleaseEveryWatcher() throws Exception {
        KillSwitch killSwitch = new KillSwitch();
        int callers = 16;
        List<CompletableFuture<Void>> watches = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            watches.add(killSwitch.watch());
        }

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(
                        pool.submit(
                                () -> {
                                    go.await();
                                    return killSwitch.trigger();
                                }));
            }
            go.countDown();

            int transitions = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    transitions++;
                }
            }
            assertThat(transitions).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(watches).allSatisfy(watch -> assertThat(watch).isCompleted());
    }
}
