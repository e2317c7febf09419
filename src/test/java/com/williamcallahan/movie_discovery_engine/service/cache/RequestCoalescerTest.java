package com.williamcallahan.movie_discovery_engine.service.cache;

import com.williamcallahan.movie_discovery_engine.testutil.CatalogFixtures;
import com.williamcallahan.movie_discovery_engine.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class RequestCoalescerTest {

    private MutableClock clock;
    private RequestCoalescer<String, String> coalescer;
    private Sinks.One<String> gate;
    private AtomicInteger producerCalls;
    private AtomicBoolean upstreamCancelled;
    private Supplier<Mono<String>> producer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        coalescer = new RequestCoalescer<>("test", Duration.ofSeconds(60), 100, clock, CatalogFixtures.metrics());
        gate = Sinks.one();
        producerCalls = new AtomicInteger();
        upstreamCancelled = new AtomicBoolean();
        producer = () -> {
            producerCalls.incrementAndGet();
            return gate.asMono().doOnCancel(() -> upstreamCancelled.set(true));
        };
    }

    @Test
    @DisplayName("concurrent callers for one key share a single producer invocation and its value")
    void concurrentCallersShareOneRequest() {
        List<String> results = new CopyOnWriteArrayList<>();
        IntStream.range(0, 10).forEach(i -> coalescer.coalesce("popular_1", producer).subscribe(results::add));

        assertThat(producerCalls).hasValue(1);
        assertThat(coalescer.pendingCount()).isEqualTo(1);

        gate.tryEmitValue("page");

        assertThat(results).hasSize(10).containsOnly("page");
        assertThat(coalescer.pendingCount()).isZero();
        assertThat(coalescer.cachedCount()).isEqualTo(1);
    }

    @Test
    void everyWaiterReceivesTheSameError() {
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        IntStream.range(0, 3).forEach(i -> coalescer.coalesce("k", producer).subscribe(value -> { }, errors::add));

        IllegalStateException failure = new IllegalStateException("boom");
        gate.tryEmitError(failure);

        assertThat(errors).hasSize(3).allSatisfy(error -> assertThat(error).isSameAs(failure));
        assertThat(coalescer.pendingCount()).isZero();
        assertThat(coalescer.cachedCount()).isZero();
    }

    @Test
    void failuresAreNotMemoized() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Mono<String>> failing = () -> {
            calls.incrementAndGet();
            return Mono.error(new IllegalStateException("down"));
        };

        StepVerifier.create(coalescer.coalesce("k", failing)).expectError(IllegalStateException.class).verify();
        StepVerifier.create(coalescer.coalesce("k", failing)).expectError(IllegalStateException.class).verify();

        assertThat(calls).hasValue(2);
    }

    @Test
    void memoizedValueIsServedUntilItsWindowPasses() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Mono<String>> counting = () -> Mono.just("v" + calls.incrementAndGet());

        StepVerifier.create(coalescer.coalesce("k", Duration.ofSeconds(5), counting)).expectNext("v1").verifyComplete();
        clock.advance(Duration.ofSeconds(4));
        StepVerifier.create(coalescer.coalesce("k", Duration.ofSeconds(5), counting)).expectNext("v1").verifyComplete();
        clock.advance(Duration.ofSeconds(1));
        StepVerifier.create(coalescer.coalesce("k", Duration.ofSeconds(5), counting)).expectNext("v2").verifyComplete();

        assertThat(calls).hasValue(2);
    }

    @Test
    void defaultWindowIsUsedWhenNoneGiven() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Mono<String>> counting = () -> Mono.just("v" + calls.incrementAndGet());

        coalescer.coalesce("k", counting).block();
        clock.advance(Duration.ofSeconds(59));
        coalescer.coalesce("k", counting).block();
        clock.advance(Duration.ofSeconds(2));
        coalescer.coalesce("k", counting).block();

        assertThat(calls).hasValue(2);
    }

    @Test
    void zeroWindowDisablesMemoization() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Mono<String>> counting = () -> Mono.just("v" + calls.incrementAndGet());

        coalescer.coalesce("k", Duration.ZERO, counting).block();
        coalescer.coalesce("k", Duration.ZERO, counting).block();

        assertThat(calls).hasValue(2);
        assertThat(coalescer.cachedCount()).isZero();
    }

    @Test
    void differentKeysDoNotCoalesce() {
        coalescer.coalesce("a", producer).subscribe();
        coalescer.coalesce("b", producer).subscribe();

        assertThat(producerCalls).hasValue(2);
        assertThat(coalescer.pendingCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("one waiter cancelling leaves the shared request running for the others")
    void partialCancellationKeepsUpstreamAlive() {
        List<String> results = new CopyOnWriteArrayList<>();
        Disposable first = coalescer.coalesce("k", producer).subscribe();
        coalescer.coalesce("k", producer).subscribe(results::add);

        first.dispose();

        assertThat(upstreamCancelled).isFalse();
        assertThat(coalescer.pendingCount()).isEqualTo(1);

        gate.tryEmitValue("still delivered");
        assertThat(results).containsExactly("still delivered");
    }

    @Test
    void upstreamIsCancelledWhenEveryWaiterCancels() {
        Disposable first = coalescer.coalesce("k", producer).subscribe();
        Disposable second = coalescer.coalesce("k", producer).subscribe();

        first.dispose();
        second.dispose();

        assertThat(upstreamCancelled).isTrue();
        assertThat(coalescer.pendingCount()).isZero();
        assertThat(coalescer.cachedCount()).isZero();

        coalescer.coalesce("k", producer).subscribe();
        assertThat(producerCalls).hasValue(2);
    }

    @Test
    void cancelKeyFailsEveryWaiterWithCancellation() {
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        coalescer.coalesce("k", producer).subscribe(value -> { }, errors::add);
        coalescer.coalesce("k", producer).subscribe(value -> { }, errors::add);

        assertThat(coalescer.cancel("k")).isTrue();
        assertThat(coalescer.cancel("k")).isFalse();

        assertThat(errors).hasSize(2).allSatisfy(error -> assertThat(error).isInstanceOf(CancellationException.class));
        assertThat(upstreamCancelled).isTrue();
        assertThat(coalescer.pendingCount()).isZero();
    }

    @Test
    void cancelAllCancelsEveryKey() {
        coalescer.coalesce("a", () -> Mono.never()).subscribe(value -> { }, error -> { });
        coalescer.coalesce("b", () -> Mono.never()).subscribe(value -> { }, error -> { });

        assertThat(coalescer.cancelAll()).isEqualTo(2);
        assertThat(coalescer.pendingCount()).isZero();
    }

    @Test
    void lateValueAfterCancelIsNotMemoized() {
        coalescer.coalesce("k", producer).subscribe(value -> { }, error -> { });
        coalescer.cancel("k");

        gate.tryEmitValue("too late");

        assertThat(coalescer.cachedCount()).isZero();
    }

    @Test
    void clearCacheForcesAFreshRequest() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Mono<String>> counting = () -> Mono.just("v" + calls.incrementAndGet());

        coalescer.coalesce("a", counting).block();
        coalescer.coalesce("b", counting).block();
        coalescer.clearCache("a");

        assertThat(coalescer.coalesce("a", counting).block()).isEqualTo("v3");
        assertThat(coalescer.coalesce("b", counting).block()).isEqualTo("v2");

        coalescer.clear();
        assertThat(coalescer.cachedCount()).isZero();
    }

    @Test
    void clearExpiredRemovesOnlyStaleEntries() {
        coalescer.coalesce("short", Duration.ofSeconds(5), () -> Mono.just("s")).block();
        coalescer.coalesce("long", Duration.ofMinutes(5), () -> Mono.just("l")).block();
        clock.advance(Duration.ofSeconds(10));

        assertThat(coalescer.clearExpired()).isEqualTo(1);
        assertThat(coalescer.cachedCount()).isEqualTo(1);
        assertThat(coalescer.clearExpired()).isZero();
    }

    @Test
    void producerThrowingIsDeliveredAsError() {
        StepVerifier.create(coalescer.coalesce("k", () -> {
                throw new IllegalArgumentException("bad request");
            }))
            .expectError(IllegalArgumentException.class)
            .verify();

        assertThat(coalescer.pendingCount()).isZero();
    }

    @Test
    void emptyProducerCompletesEveryWaiterEmpty() {
        StepVerifier.create(coalescer.coalesce("k", Mono::empty)).verifyComplete();
        assertThat(coalescer.pendingCount()).isZero();
        assertThat(coalescer.cachedCount()).isZero();
    }

    @Test
    @DisplayName("callers racing from many threads still trigger exactly one producer call")
    void manyThreadsShareOneRequest() throws Exception {
        int callers = 16;
        List<Mono<String>> monos = IntStream.range(0, callers)
            .mapToObj(i -> coalescer.coalesce("k", producer))
            .toList();
        List<String> results = new CopyOnWriteArrayList<>();
        List<Thread> threads = monos.stream()
            .map(mono -> new Thread(() -> mono.subscribe(results::add)))
            .toList();

        threads.forEach(Thread::start);
        for (Thread thread : threads) {
            thread.join();
        }
        gate.tryEmitValue("shared");

        assertThat(producerCalls).hasValue(1);
        assertThat(results).hasSize(callers).containsOnly("shared");
    }
}
