package com.payment.threatintel.intel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides when a cluster rebuild runs and makes sure only one runs at a time across instances.
 * The pending-report counter and the rebuild lock live in Redis; when Redis is unreachable the
 * coordinator falls back to a per-instance counter and lock so reporting never fails on it.
 */
@Slf4j
@Service
public class RebuildCoordinator {

    static final String COUNTER_KEY = "threat-intel:pending-reports";
    static final String LOCK_KEY = "threat-intel:rebuild-lock";

    private static final RedisScript<Long> RELEASE_LOCK = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ClusterRebuildService rebuildService;
    private final int refreshThreshold;
    private final Duration lockTtl;
    private final String instanceId = UUID.randomUUID().toString();

    private final AtomicLong localCounter = new AtomicLong();
    private final ReentrantLock localLock = new ReentrantLock();

    public RebuildCoordinator(StringRedisTemplate redisTemplate,
                              ClusterRebuildService rebuildService,
                              @Value("${threat-intel.clustering.refresh-threshold:10}") int refreshThreshold,
                              @Value("${threat-intel.clustering.rebuild-lock-ttl:PT5M}") Duration lockTtl) {
        this.redisTemplate = redisTemplate;
        this.rebuildService = rebuildService;
        this.refreshThreshold = refreshThreshold;
        this.lockTtl = lockTtl;
    }

    /**
     * Counts one recorded report. When the shared count reaches the refresh threshold the rebuild runs
     * inline on the calling thread.
     */
    public void onEventRecorded() {
        long pending = incrementPending();
        if (pending < refreshThreshold) {
            return;
        }
        log.info("Pending reports reached {} (threshold {}), triggering cluster rebuild", pending, refreshThreshold);
        runExclusive(pending);
    }

    /** Rebuilds now regardless of the pending count. */
    public RebuildSummary forceRebuild() {
        log.info("Forced cluster rebuild requested");
        return runExclusive(currentPending());
    }

    private RebuildSummary runExclusive(long observedPending) {
        if (!localLock.tryLock()) {
            log.debug("Rebuild already running on this instance, skipping");
            return RebuildSummary.skipped();
        }
        try {
            String token = instanceId + ":" + UUID.randomUUID();
            LockState lock = acquireSharedLock(token);
            if (lock == LockState.HELD_ELSEWHERE) {
                log.debug("Rebuild lock held by another instance, skipping");
                return RebuildSummary.skipped();
            }
            try {
                resetPending(observedPending);
                return rebuildService.rebuild();
            } catch (Exception e) {
                log.error("Cluster rebuild failed; previous generation stays current", e);
                return RebuildSummary.failed();
            } finally {
                if (lock == LockState.ACQUIRED) {
                    releaseSharedLock(token);
                }
            }
        } finally {
            localLock.unlock();
        }
    }

    private long incrementPending() {
        try {
            Long value = redisTemplate.opsForValue().increment(COUNTER_KEY);
            if (value != null) {
                return value;
            }
        } catch (Exception e) {
            log.warn("Redis unavailable for pending-report counter, using local counter: {}", e.getMessage());
        }
        return localCounter.incrementAndGet();
    }

    private long currentPending() {
        try {
            String value = redisTemplate.opsForValue().get(COUNTER_KEY);
            return value != null ? Long.parseLong(value) : 0L;
        } catch (Exception e) {
            log.warn("Redis unavailable reading pending-report counter: {}", e.getMessage());
            return localCounter.get();
        }
    }

    /** Subtracts what this rebuild accounts for; reports counted meanwhile stay pending. */
    private void resetPending(long observed) {
        localCounter.updateAndGet(v -> Math.max(0, v - observed));
        if (observed <= 0) return;
        try {
            redisTemplate.opsForValue().increment(COUNTER_KEY, -observed);
        } catch (Exception e) {
            log.warn("Redis unavailable resetting pending-report counter: {}", e.getMessage());
        }
    }

    private LockState acquireSharedLock(String token) {
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY, token, lockTtl);
            return Boolean.TRUE.equals(acquired) ? LockState.ACQUIRED : LockState.HELD_ELSEWHERE;
        } catch (Exception e) {
            log.warn("Redis unavailable for rebuild lock, relying on local lock: {}", e.getMessage());
            return LockState.LOCAL_ONLY;
        }
    }

    private void releaseSharedLock(String token) {
        try {
            redisTemplate.execute(RELEASE_LOCK, List.of(LOCK_KEY), token);
        } catch (Exception e) {
            log.warn("Failed to release rebuild lock, it expires after {}: {}", lockTtl, e.getMessage());
        }
    }

    private enum LockState {
        ACQUIRED,
        HELD_ELSEWHERE,
        LOCAL_ONLY
    }
}
