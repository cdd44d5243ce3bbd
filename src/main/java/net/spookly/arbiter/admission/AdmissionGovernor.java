package net.spookly.arbiter.admission;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import net.spookly.arbiter.audit.AuditEvent;
import net.spookly.arbiter.audit.AuditSink;
import net.spookly.arbiter.util.RequestPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Governs requests that forward a payload to the provider: rate limiting, caching, batching and
 * timeout-guarded direct calls.
 * <p>
 * All governor state (rate window, cache, batch queue, flush handle, in-flight map) is touched only on
 * a single {@link EventExecutor}. Work suspends only while waiting on the provider or the flush timer;
 * provider completions are handed back to the executor before any state changes.
 */
public final class AdmissionGovernor implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionGovernor.class);

    static final int RETRY_AFTER_SECONDS = 60;

    private final AdmissionPolicy policy;
    private final ProviderClient provider;
    private final IdleStateProvider idleStateProvider;
    private final AuditSink auditSink;
    private final Clock clock;
    private final EventExecutor executor;
    private final boolean ownsExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final RateWindow rateWindow = new RateWindow();
    private final ResponseCache cache = new ResponseCache();
    private final BatchQueue batchQueue = new BatchQueue();
    private final Map<String, CompletableFuture<JsonNode>> inFlight = new HashMap<>();
    // Direct calls and flushed batch items still waiting on the provider.
    private final Set<ResponseGuard> awaitingProvider = new HashSet<>();
    private ScheduledFuture<?> pendingFlush;

    /**
     * Create a governor running on its own single-threaded executor.
     */
    public AdmissionGovernor(AdmissionPolicy policy,
                             ProviderClient provider,
                             IdleStateProvider idleStateProvider,
                             AuditSink auditSink,
                             Clock clock) {
        this(policy, provider, idleStateProvider, auditSink, clock, new DefaultEventExecutor(threadFactory()), true);
    }

    /**
     * Create a governor on a caller-supplied executor; the executor is not shut down on close.
     */
    public AdmissionGovernor(AdmissionPolicy policy,
                             ProviderClient provider,
                             IdleStateProvider idleStateProvider,
                             AuditSink auditSink,
                             Clock clock,
                             EventExecutor executor) {
        this(policy, provider, idleStateProvider, auditSink, clock, executor, false);
    }

    private AdmissionGovernor(AdmissionPolicy policy,
                              ProviderClient provider,
                              IdleStateProvider idleStateProvider,
                              AuditSink auditSink,
                              Clock clock,
                              EventExecutor executor,
                              boolean ownsExecutor) {
        this.policy = policy == null ? AdmissionPolicy.defaults() : policy;
        this.provider = Objects.requireNonNull(provider, "provider");
        this.idleStateProvider = idleStateProvider == null ? IdleStateProvider.ALWAYS_ACTIVE : idleStateProvider;
        this.auditSink = auditSink == null ? AuditSink.NOOP : auditSink;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Admit one request. A null or empty {@code requestKey} passes through untouched; otherwise the
     * returned future completes exactly once with a cached, batched or direct result, or fails with
     * {@link RateLimitExceededException}, {@link AdmissionTimeoutException} or
     * {@link ProviderFailureException}.
     *
     * @param requestKey verbatim payload text used as the cache key
     * @param payload    body forwarded to the provider
     * @param scope      request path; the configured batch endpoint selects the batch path
     */
    public CompletableFuture<AdmissionResult> admit(String requestKey, JsonNode payload, String scope) {
        if (requestKey == null || requestKey.isEmpty()) {
            return CompletableFuture.completedFuture(AdmissionResult.passThrough());
        }
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("admission governor closed"));
        }
        ResponseGuard guard = new ResponseGuard();
        String normalizedScope = RequestPaths.normalizePath(scope);
        runOnLoop(() -> admitOnLoop(requestKey, payload, normalizedScope, guard), List.of(guard));
        return guard.future();
    }

    public AdmissionPolicy policy() {
        return policy;
    }

    /**
     * Snapshot of window, cache and queue sizes.
     */
    public GovernorStats stats() {
        if (executor.inEventLoop()) {
            return statsOnLoop();
        }
        return executor.submit(this::statsOnLoop).syncUninterruptibly().getNow();
    }

    /**
     * Fail every caller still waiting (queued batch items, flushed batches and direct calls), cancel the
     * pending flush and release the executor if owned.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Runnable shutdown = () -> {
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
                pendingFlush = null;
            }
            List<ResponseGuard> waiting = new ArrayList<>();
            for (BatchQueue.Item item : batchQueue.drain()) {
                waiting.add(item.guard());
            }
            waiting.addAll(awaitingProvider);
            awaitingProvider.clear();
            if (!waiting.isEmpty()) {
                Map<String, Object> closing = new LinkedHashMap<>();
                closing.put("pending", waiting.size());
                audit("governor_closed", closing);
                LOGGER.info("Closing admission governor with {} pending callers", waiting.size());
            }
            IllegalStateException error = new IllegalStateException("admission governor closed");
            for (ResponseGuard guard : waiting) {
                guard.fail(error);
            }
        };
        try {
            if (executor.inEventLoop()) {
                shutdown.run();
            } else {
                executor.submit(shutdown).awaitUninterruptibly();
            }
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Admission executor already terminated while closing governor");
        }
        if (ownsExecutor) {
            executor.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    private void admitOnLoop(String requestKey, JsonNode payload, String scope, ResponseGuard guard) {
        if (closed.get()) {
            guard.fail(new IllegalStateException("admission governor closed"));
            return;
        }
        long now = clock.millis();
        IdleState idleState = currentIdleState();
        int limit = idleState.effectiveLimit(policy.rateLimitPerMinute());

        Map<String, Object> received = fields(requestKey, scope);
        received.put("idleState", idleState.label());
        audit("admission_received", received);
        noteTraffic(scope, requestKey);

        if (!rateWindow.tryAcquire(limit, now)) {
            Map<String, Object> limited = fields(requestKey, scope);
            limited.put("rateLimit", limit);
            limited.put("idleState", idleState.label());
            audit("rate_limited", limited);
            LOGGER.info("Rate limited request on {} (limit {} per minute, idle state {})", scope, limit, idleState);
            guard.fail(new RateLimitExceededException(RETRY_AFTER_SECONDS, limit));
            return;
        }

        ResponseCache.CacheEntry cached = cache.getFresh(requestKey, now, policy.cacheTtlMs());
        if (cached != null) {
            Map<String, Object> hit = fields(requestKey, scope);
            hit.put("ageMs", now - cached.timestamp());
            audit("cache_hit", hit);
            guard.respond(new AdmissionResult(AdmissionOutcome.CACHED, requestKey, cached.response()));
            return;
        }

        if (scope.equals(policy.batchEndpointPath())) {
            enqueueBatch(requestKey, payload, scope, guard);
            return;
        }
        callDirect(requestKey, payload, scope, guard, idleState);
    }

    private void enqueueBatch(String requestKey, JsonNode payload, String scope, ResponseGuard guard) {
        int queued = batchQueue.enqueue(new BatchQueue.Item(requestKey, payload, guard));
        Map<String, Object> enqueued = fields(requestKey, scope);
        enqueued.put("queued", queued);
        audit("batch_enqueued", enqueued);
        if (pendingFlush == null) {
            scheduleFlush();
        }
    }

    private void scheduleFlush() {
        pendingFlush = executor.schedule(this::flushBatch, policy.batchWindowMs(), TimeUnit.MILLISECONDS);
    }

    private void flushBatch() {
        pendingFlush = null;
        List<BatchQueue.Item> items = batchQueue.drain();
        if (!items.isEmpty()) {
            List<JsonNode> payloads = new ArrayList<>(items.size());
            List<ResponseGuard> guards = new ArrayList<>(items.size());
            for (BatchQueue.Item item : items) {
                payloads.add(item.payload());
                guards.add(item.guard());
            }
            awaitingProvider.addAll(guards);
            Map<String, Object> flushed = new LinkedHashMap<>();
            flushed.put("batchSize", items.size());
            audit("batch_flushed", flushed);

            CompletableFuture<List<JsonNode>> call = invoke(() -> provider.batch(payloads));
            call.whenComplete((results, error) -> runOnLoop(() -> completeBatch(items, results, error), guards));
        }
        // Items that arrived after the drain get their own timer.
        if (!batchQueue.isEmpty() && pendingFlush == null) {
            scheduleFlush();
        }
    }

    private void completeBatch(List<BatchQueue.Item> items, List<JsonNode> results, Throwable error) {
        for (BatchQueue.Item item : items) {
            awaitingProvider.remove(item.guard());
        }
        ProviderFailureException failure = null;
        if (error != null) {
            Throwable cause = unwrap(error);
            failure = new ProviderFailureException("Batch provider call failed: " + cause.getMessage(), cause, true);
        } else if (results == null || results.size() != items.size()) {
            int count = results == null ? 0 : results.size();
            failure = new ProviderFailureException(
                    "Batch provider returned " + count + " results for " + items.size() + " payloads", null, true);
        }
        if (failure != null) {
            Map<String, Object> failed = new LinkedHashMap<>();
            failed.put("batchSize", items.size());
            failed.put("details", failure.getMessage());
            audit("batch_failed", failed);
            LOGGER.warn("Batch of {} failed: {}", items.size(), failure.getMessage());
            for (BatchQueue.Item item : items) {
                item.guard().fail(failure);
            }
            return;
        }
        long now = clock.millis();
        for (int i = 0; i < items.size(); i++) {
            BatchQueue.Item item = items.get(i);
            JsonNode result = results.get(i);
            cache.put(item.requestKey(), result, now);
            item.guard().respond(new AdmissionResult(AdmissionOutcome.BATCHED, item.requestKey(), result));
        }
    }

    private void callDirect(String requestKey, JsonNode payload, String scope, ResponseGuard guard, IdleState idleState) {
        long timeoutMs = policy.requestTimeoutMs();
        awaitingProvider.add(guard);
        ScheduledFuture<?> timeout = executor.schedule(() -> {
            awaitingProvider.remove(guard);
            if (guard.hasResponded()) {
                return;
            }
            Map<String, Object> timedOut = fields(requestKey, scope);
            timedOut.put("timeoutMs", timeoutMs);
            audit("provider_timeout", timedOut);
            LOGGER.warn("Provider call on {} timed out after {}ms", scope, timeoutMs);
            guard.fail(new AdmissionTimeoutException(timeoutMs));
        }, timeoutMs, TimeUnit.MILLISECONDS);

        CompletableFuture<JsonNode> call = startProviderCall(requestKey, payload, scope);
        call.whenComplete((result, error) -> runOnLoop(
                () -> completeDirect(requestKey, scope, guard, timeout, idleState, result, error),
                List.of(guard)));
    }

    private CompletableFuture<JsonNode> startProviderCall(String requestKey, JsonNode payload, String scope) {
        if (policy.singleFlight()) {
            CompletableFuture<JsonNode> pending = inFlight.get(requestKey);
            if (pending != null) {
                audit("single_flight_joined", fields(requestKey, scope));
                return pending;
            }
        }
        CompletableFuture<JsonNode> call = invoke(() -> provider.call(payload));
        if (policy.singleFlight() && !call.isDone()) {
            inFlight.put(requestKey, call);
            call.whenComplete((result, error) -> runOnLoop(() -> inFlight.remove(requestKey, call), List.of()));
        }
        return call;
    }

    private void completeDirect(String requestKey,
                                String scope,
                                ResponseGuard guard,
                                ScheduledFuture<?> timeout,
                                IdleState idleState,
                                JsonNode result,
                                Throwable error) {
        timeout.cancel(false);
        awaitingProvider.remove(guard);
        if (guard.hasResponded()) {
            Map<String, Object> discarded = fields(requestKey, scope);
            discarded.put("outcome", error == null ? "result" : "error");
            audit("late_result_discarded", discarded);
            return;
        }
        if (error != null) {
            Throwable cause = unwrap(error);
            Map<String, Object> failed = fields(requestKey, scope);
            failed.put("details", cause.getMessage());
            audit("provider_error", failed);
            LOGGER.warn("Provider call on {} failed: {}", scope, cause.getMessage());
            guard.fail(new ProviderFailureException("Provider call failed: " + cause.getMessage(), cause, false));
            return;
        }
        cache.put(requestKey, result, clock.millis());
        Map<String, Object> succeeded = fields(requestKey, scope);
        succeeded.put("idleState", idleState.label());
        audit("provider_request", succeeded);
        guard.respond(new AdmissionResult(AdmissionOutcome.DIRECT, requestKey, result));
    }

    private GovernorStats statsOnLoop() {
        return new GovernorStats(
                rateWindow.size(clock.millis()),
                cache.size(),
                batchQueue.size(),
                pendingFlush != null,
                inFlight.size()
        );
    }

    private IdleState currentIdleState() {
        try {
            IdleState state = idleStateProvider.getState();
            return state == null ? IdleState.ACTIVE : state;
        } catch (RuntimeException e) {
            LOGGER.warn("Idle state lookup failed, assuming active: {}", e.getMessage());
            return IdleState.ACTIVE;
        }
    }

    private void noteTraffic(String scope, String requestKey) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("route", scope);
        meta.put("promptLength", requestKey.length());
        try {
            idleStateProvider.noteTraffic(meta);
        } catch (RuntimeException e) {
            LOGGER.warn("Idle state traffic note failed: {}", e.getMessage());
        }
    }

    private <T> CompletableFuture<T> invoke(ProviderInvocation<T> invocation) {
        try {
            CompletableFuture<T> future = invocation.invoke();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("provider returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void runOnLoop(Runnable task, List<ResponseGuard> guards) {
        if (executor.inEventLoop()) {
            task.run();
            return;
        }
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            IllegalStateException error = new IllegalStateException("admission governor closed", e);
            for (ResponseGuard guard : guards) {
                guard.fail(error);
            }
        }
    }

    private Map<String, Object> fields(String requestKey, String scope) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("scope", scope);
        fields.put("promptLength", requestKey.length());
        return fields;
    }

    private void audit(String name, Map<String, Object> fields) {
        try {
            auditSink.log(AuditEvent.of(name, clock.instant(), fields));
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to emit admission audit event: {}", e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "arbiter-admission");
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    private interface ProviderInvocation<T> {
        CompletableFuture<T> invoke();
    }
}
