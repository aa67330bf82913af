package com.github.feedflow.service;

import com.github.feedflow.config.StreamProxyProperties;
import com.github.feedflow.model.ResolvedStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * In-memory, TTL-bounded map from video id to its resolved stream.
 * <p>
 * Concurrent misses for the same id collapse into one resolver call: the first caller
 * registers a pending future and runs the resolver, later callers wait on that future and
 * see the same record or the same exception. Different ids never wait on each other.
 * Freshness is checked on every lookup; the scheduled sweep only frees memory.
 */
@Slf4j
@Component
public class StreamCache {

    private final ConcurrentHashMap<String, ResolvedStream> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<ResolvedStream>> inFlight = new ConcurrentHashMap<>();

    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public StreamCache(StreamProxyProperties properties, Clock clock) {
        this(properties.getCache().getTtl(), clock);
    }

    StreamCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Return the fresh record for {@code videoId}, resolving it at most once across concurrent callers.
     *
     * @param videoId  cache key
     * @param resolver produces a fully populated record; its exceptions propagate to every waiter
     * @return cached or newly resolved record, never partial
     */
    public ResolvedStream getOrResolve(String videoId, Supplier<ResolvedStream> resolver) {
        ResolvedStream cached = entries.get(videoId);
        if (isFresh(cached)) {
            log.debug("Stream cache hit: {}", videoId);
            return cached;
        }

        CompletableFuture<ResolvedStream> pending = new CompletableFuture<>();
        CompletableFuture<ResolvedStream> existing = inFlight.putIfAbsent(videoId, pending);
        if (existing != null) {
            log.debug("Joining in-flight resolution: {}", videoId);
            return await(existing);
        }

        try {
            // Another caller may have finished between our miss and claiming the slot
            cached = entries.get(videoId);
            if (isFresh(cached)) {
                pending.complete(cached);
                return cached;
            }

            log.info("Stream cache miss, resolving: {}", videoId);
            ResolvedStream resolved = resolver.get();
            entries.put(videoId, resolved);
            pending.complete(resolved);
            return resolved;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(videoId, pending);
        }
    }

    /**
     * Drop expired entries. Correctness does not depend on this running.
     */
    @Scheduled(fixedRateString = "${feedflow.cache.sweep-interval-ms:3600000}",
            initialDelayString = "${feedflow.cache.sweep-interval-ms:3600000}")
    public void sweepExpired() {
        int before = entries.size();
        entries.entrySet().removeIf(entry -> !isFresh(entry.getValue()));
        int removed = before - entries.size();
        if (removed > 0) {
            log.info("Swept {} expired stream entries, {} remaining", removed, size());
        }
    }

    public int size() {
        return entries.size();
    }

    boolean isFresh(ResolvedStream stream) {
        if (stream == null || stream.getResolvedAt() == null) {
            return false;
        }
        Instant expiresAt = stream.getResolvedAt().plus(ttl);
        return clock.instant().isBefore(expiresAt);
    }

    private ResolvedStream await(CompletableFuture<ResolvedStream> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for stream resolution", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CompletionException(cause);
        }
    }
}
