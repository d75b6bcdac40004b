package com.wishmaster.security;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link RefreshTokenRegistry}.
 * <p>
 * Ids come from a single monotonically increasing sequence. All mutations of a principal's
 * entry run inside {@code compute}, so a concurrent {@link #revokeAll(UUID)} can never strand a
 * freshly registered id. A principal is dropped from the registry as soon as it has no active
 * ids; {@link #purgeExpired()} sweeps principals that never come back. State is lost on restart,
 * which invalidates every outstanding refresh token.
 */
public class InMemoryRefreshTokenRegistry implements RefreshTokenRegistry {

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentMap<UUID, ConcurrentMap<Long, Instant>> active = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRefreshTokenRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    @Override
    public long register(UUID principalId, Instant expiresAt) {
        if (principalId == null || expiresAt == null) {
            throw new IllegalArgumentException("principalId and expiresAt must not be null");
        }
        long tokenId = sequence.incrementAndGet();
        Instant now = clock.instant();
        active.compute(principalId, (id, tokens) -> {
            ConcurrentMap<Long, Instant> current = tokens == null ? new ConcurrentHashMap<>() : tokens;
            prune(current, now);
            current.put(tokenId, expiresAt);
            return current;
        });
        return tokenId;
    }

    @Override
    public boolean consume(UUID principalId, long tokenId) {
        if (principalId == null) {
            return false;
        }
        Instant now = clock.instant();
        Instant[] consumed = new Instant[1];
        active.computeIfPresent(principalId, (id, tokens) -> {
            consumed[0] = tokens.remove(tokenId);
            prune(tokens, now);
            return tokens.isEmpty() ? null : tokens;
        });
        return consumed[0] != null && now.isBefore(consumed[0]);
    }

    @Override
    public void revokeAll(UUID principalId) {
        active.remove(principalId);
    }

    /**
     * Drops expired ids of every principal, and principals left without active ids.
     *
     * @return number of principals removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (UUID principalId : active.keySet()) {
            boolean[] emptied = new boolean[1];
            active.computeIfPresent(principalId, (id, tokens) -> {
                prune(tokens, now);
                emptied[0] = tokens.isEmpty();
                return emptied[0] ? null : tokens;
            });
            if (emptied[0]) {
                removed++;
            }
        }
        return removed;
    }

    /** Number of principals holding at least one registered id. */
    public int principalCount() {
        return active.size();
    }

    /** Number of active (unconsumed, not yet pruned) tokens of the principal. */
    public int activeCount(UUID principalId) {
        Map<Long, Instant> tokens = active.get(principalId);
        return tokens == null ? 0 : tokens.size();
    }

    private static void prune(ConcurrentMap<Long, Instant> tokens, Instant now) {
        tokens.values().removeIf(expiresAt -> !now.isBefore(expiresAt));
    }
}
