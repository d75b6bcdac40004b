package com.wishmaster.security;

import com.wishmaster.security.testing.TestTokens;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("InMemoryRefreshTokenRegistry")
class InMemoryRefreshTokenRegistryTest {

    private static final Instant EXPIRES = TestTokens.NOW.plus(Duration.ofDays(1));

    private final InMemoryRefreshTokenRegistry registry = new InMemoryRefreshTokenRegistry(TestTokens.fixedClock());
    private final UUID principalId = UUID.randomUUID();

    @Test
    @DisplayName("hands out distinct increasing ids")
    void distinctIds() {
        long first = registry.register(principalId, EXPIRES);
        long second = registry.register(UUID.randomUUID(), EXPIRES);

        assertThat(second).isGreaterThan(first);
    }

    @Test
    @DisplayName("consumes an id exactly once")
    void consumeOnce() {
        long id = registry.register(principalId, EXPIRES);

        assertThat(registry.consume(principalId, id)).isTrue();
        assertThat(registry.consume(principalId, id)).isFalse();
    }

    @Test
    @DisplayName("does not consume an id under another principal")
    void wrongPrincipal() {
        long id = registry.register(principalId, EXPIRES);

        assertThat(registry.consume(UUID.randomUUID(), id)).isFalse();
        assertThat(registry.consume(principalId, id)).isTrue();
    }

    @Test
    @DisplayName("does not consume an expired id")
    void expired() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(TestTokens.NOW, EXPIRES);
        var timed = new InMemoryRefreshTokenRegistry(clock);
        long id = timed.register(principalId, EXPIRES);

        assertThat(timed.consume(principalId, id)).isFalse();
    }

    @Test
    @DisplayName("prunes expired ids on register")
    void prunes() {
        var early = new InMemoryRefreshTokenRegistry(Clock.fixed(TestTokens.NOW, ZoneOffset.UTC));
        early.register(principalId, TestTokens.NOW);
        early.register(principalId, EXPIRES);

        assertThat(early.activeCount(principalId)).isEqualTo(1);
    }

    @Test
    @DisplayName("forgets a principal once its last id is consumed")
    void dropsEmptyPrincipal() {
        long first = registry.register(principalId, EXPIRES);
        long second = registry.register(principalId, EXPIRES);

        registry.consume(principalId, first);
        assertThat(registry.principalCount()).isEqualTo(1);

        registry.consume(principalId, second);
        assertThat(registry.principalCount()).isZero();
    }

    @Test
    @DisplayName("purgeExpired drops principals whose ids have all expired")
    void purgeExpired() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(TestTokens.NOW);
        var timed = new InMemoryRefreshTokenRegistry(clock);
        UUID returning = UUID.randomUUID();
        timed.register(principalId, TestTokens.NOW.plusSeconds(60));
        timed.register(returning, TestTokens.NOW.plusSeconds(60));
        long live = timed.register(returning, EXPIRES);

        when(clock.instant()).thenReturn(TestTokens.NOW.plusSeconds(60));

        assertThat(timed.purgeExpired()).isEqualTo(1);
        assertThat(timed.principalCount()).isEqualTo(1);
        assertThat(timed.activeCount(returning)).isEqualTo(1);
        assertThat(timed.consume(returning, live)).isTrue();
    }

    @Test
    @DisplayName("registers again after revokeAll")
    void registerAfterRevoke() {
        registry.register(principalId, EXPIRES);
        registry.revokeAll(principalId);

        long id = registry.register(principalId, EXPIRES);

        assertThat(registry.activeCount(principalId)).isEqualTo(1);
        assertThat(registry.consume(principalId, id)).isTrue();
    }

    @Test
    @DisplayName("revokeAll drops every id of the principal only")
    void revokeAll() {
        UUID other = UUID.randomUUID();
        long mine = registry.register(principalId, EXPIRES);
        registry.register(principalId, EXPIRES);
        long theirs = registry.register(other, EXPIRES);

        registry.revokeAll(principalId);

        assertThat(registry.activeCount(principalId)).isZero();
        assertThat(registry.consume(principalId, mine)).isFalse();
        assertThat(registry.consume(other, theirs)).isTrue();
    }

    @Test
    @DisplayName("rejects null arguments on register")
    void rejectsNulls() {
        assertThatThrownBy(() -> registry.register(null, EXPIRES)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(principalId, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("an id registered while revokeAll runs is never stranded")
    void revokeDuringRegister() {
        AtomicReference<Runnable> onTick = new AtomicReference<>(() -> { });
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> {
            onTick.getAndSet(() -> { }).run();
            return TestTokens.NOW;
        });
        var timed = new InMemoryRefreshTokenRegistry(clock);
        timed.register(principalId, EXPIRES);

        onTick.set(() -> timed.revokeAll(principalId));
        long id = timed.register(principalId, EXPIRES);

        assertThat(timed.activeCount(principalId)).isEqualTo(1);
        assertThat(timed.consume(principalId, id)).isTrue();
    }

    @Test
    @DisplayName("concurrent consumers of one id see a single winner")
    void concurrentConsume() throws InterruptedException {
        long id = registry.register(principalId, EXPIRES);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        Set<String> failures = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (registry.consume(principalId, id)) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    failures.add(e.toString());
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        executor.shutdown();

        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(failures).isEmpty();
        assertThat(winners.get()).isEqualTo(1);
    }
}
