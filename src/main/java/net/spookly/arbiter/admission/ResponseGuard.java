package net.spookly.arbiter.admission;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot "already responded" flag in front of a caller's future.
 */
final class ResponseGuard {
    private final AtomicBoolean responded = new AtomicBoolean(false);
    private final CompletableFuture<AdmissionResult> future = new CompletableFuture<>();

    /**
     * @return true if this call produced the response.
     */
    boolean respond(AdmissionResult result) {
        if (!responded.compareAndSet(false, true)) {
            return false;
        }
        future.complete(result);
        return true;
    }

    /**
     * @return true if this call produced the (failed) response.
     */
    boolean fail(Throwable error) {
        if (!responded.compareAndSet(false, true)) {
            return false;
        }
        future.completeExceptionally(error);
        return true;
    }

    boolean hasResponded() {
        return responded.get();
    }

    CompletableFuture<AdmissionResult> future() {
        return future;
    }
}
