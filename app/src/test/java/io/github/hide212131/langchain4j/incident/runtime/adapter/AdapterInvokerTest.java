package io.github.hide212131.langchain4j.incident.runtime.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AdapterInvokerTest {

    private AdapterInvoker invoker;

    @AfterEach
    void tearDown() {
        if (invoker != null) {
            invoker.close();
        }
    }

    @Test
    @DisplayName("A successful call returns the adapter result")
    void returnsResult() {
        invoker = new AdapterInvoker(Duration.ofSeconds(2), 2, new WorkflowLogger());

        assertThat(invoker.invoke("classifier", () -> "cpu")).isEqualTo("cpu");
    }

    @Test
    @DisplayName("A call exceeding the timeout fails with TIMEOUT and the worker is interrupted")
    void timesOut() throws InterruptedException {
        invoker = new AdapterInvoker(Duration.ofMillis(100), 1, new WorkflowLogger());
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> invoker.invoke("diagnostic", () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }))
                .isInstanceOfSatisfying(AdapterFailure.class, failure -> {
                    assertThat(failure.kind()).isEqualTo(FailureKind.TIMEOUT);
                    assertThat(failure.describe()).isEqualTo("diagnostic timeout: timed out after 100 ms");
                });
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("An AdapterException is reported as FAILED with its message")
    void adapterExceptionIsFailed() {
        invoker = new AdapterInvoker(Duration.ofSeconds(2), 1, new WorkflowLogger());

        assertThatThrownBy(() -> invoker.invoke("planner", () -> {
                    throw new AdapterException("no template for category");
                }))
                .isInstanceOfSatisfying(AdapterFailure.class, failure -> {
                    assertThat(failure.kind()).isEqualTo(FailureKind.FAILED);
                    assertThat(failure.adapter()).isEqualTo("planner");
                    assertThat(failure.getMessage()).isEqualTo("no template for category");
                    assertThat(failure.getCause()).isInstanceOf(AdapterException.class);
                });
    }

    @Test
    @DisplayName("No more than the configured number of calls run at once")
    void boundsConcurrency() {
        invoker = new AdapterInvoker(Duration.ofSeconds(5), 2, new WorkflowLogger());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<CompletableFuture<String>> calls = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String name = "call-" + i;
            calls.add(CompletableFuture.supplyAsync(() -> invoker.invoke(name, () -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    running.decrementAndGet();
                }
                return name;
            })));
        }

        assertThat(calls).extracting(CompletableFuture::join)
                .containsExactly("call-0", "call-1", "call-2", "call-3", "call-4", "call-5");
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    @DisplayName("Time spent waiting for a worker counts against the call timeout")
    void waitForWorkerSharesTimeout() throws InterruptedException {
        invoker = new AdapterInvoker(Duration.ofMillis(500), 1, new WorkflowLogger());
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> busy = CompletableFuture.supplyAsync(() -> invoker.invoke("first", () -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "first";
        }));
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<FailureKind> queued = CompletableFuture.supplyAsync(() -> {
            try {
                invoker.invoke("second", () -> {
                    try {
                        Thread.sleep(400);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "second";
                });
                return null;
            } catch (AdapterFailure failure) {
                return failure.kind();
            }
        });
        Thread.sleep(350);
        release.countDown();

        assertThat(busy.join()).isEqualTo("first");
        assertThat(queued.join()).isEqualTo(FailureKind.TIMEOUT);
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new AdapterInvoker(Duration.ZERO, 1, new WorkflowLogger()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AdapterInvoker(Duration.ofSeconds(1), 0, new WorkflowLogger()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
