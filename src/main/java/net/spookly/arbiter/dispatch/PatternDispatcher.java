package net.spookly.arbiter.dispatch;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import net.spookly.arbiter.audit.AuditEvent;
import net.spookly.arbiter.audit.AuditSink;
import net.spookly.arbiter.binding.Binding;
import net.spookly.arbiter.binding.BindingRegistry;
import net.spookly.arbiter.binding.ConflictPolicy;
import net.spookly.arbiter.binding.ExemptRoute;
import net.spookly.arbiter.util.RequestPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies inbound requests against the binding registry as exempt, uniquely matched,
 * conflicted-and-blocked or conflicted-and-rerouted.
 * <p>
 * When several bindings match, the governing binding is the one with the highest priority; equal
 * priorities are broken by ascending lexical order of binding id ({@link String#compareTo}). Only the
 * governing binding's conflict policy is consulted.
 */
public final class PatternDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(PatternDispatcher.class);

    static final Comparator<Binding> GOVERNING_ORDER = Comparator
            .comparingInt(Binding::priority).reversed()
            .thenComparing(Binding::id);

    private final BindingRegistry registry;
    private final AuditSink auditSink;
    private final Clock clock;

    public PatternDispatcher(BindingRegistry registry, AuditSink auditSink, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.auditSink = auditSink == null ? AuditSink.NOOP : auditSink;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public DispatchDecision dispatch(String method, String path) {
        return dispatch(DispatchRequest.of(method, path));
    }

    public DispatchDecision dispatch(String method, String path, List<String> intentHints) {
        return dispatch(new DispatchRequest(method, path, intentHints));
    }

    /**
     * Decide how a request is governed. Never throws; an internal failure blocks the request.
     */
    public DispatchDecision dispatch(DispatchRequest request) {
        String method = RequestPaths.normalizeMethod(request == null ? null : request.method());
        String path = RequestPaths.normalizePath(request == null ? null : request.path());
        DispatchDecision decision;
        try {
            decision = decide(method, path, request == null ? null : request.intentHints());
        } catch (RuntimeException e) {
            LOGGER.warn("Dispatch failed for {} {}, blocking request", method, path, e);
            decision = new DispatchDecision(DispatchAction.BLOCK, null, false, null, List.of(), null,
                    null, "dispatch_error");
            emit("dispatch_error", decision, method, path, e.getMessage());
            return decision;
        }
        emit("dispatch_decision", decision, method, path, null);
        return decision;
    }

    /**
     * Current content hash of the binding set.
     */
    public String getBindingsVersion() {
        return registry.bindingsVersion();
    }

    private DispatchDecision decide(String method, String path, List<String> intentHints) {
        return decide(registry.snapshot(), method, path, intentHints, true);
    }

    /**
     * Classify against one snapshot. The decision's version is always the version of the snapshot whose
     * bindings produced it; a reroute that observes a newer binding set is decided again against it.
     */
    private DispatchDecision decide(BindingRegistry.Snapshot snapshot,
                                    String method,
                                    String path,
                                    List<String> intentHints,
                                    boolean checkDrift) {
        for (ExemptRoute exempt : snapshot.exemptRoutes()) {
            if (exempt.matches(method, path)) {
                return DispatchDecision.exempt(snapshot.version());
            }
        }

        List<Binding> candidates = new ArrayList<>();
        for (Binding binding : snapshot.bindings()) {
            if (binding.fallback() || !binding.appliesTo(method)) {
                continue;
            }
            if (binding.matchesPath(path)) {
                candidates.add(binding);
            }
        }
        String matchReason = "unique_match";
        if (candidates.isEmpty()) {
            for (Binding binding : snapshot.bindings()) {
                if (!binding.fallback() && binding.appliesTo(method) && binding.matchesIntent(intentHints)) {
                    candidates.add(binding);
                }
            }
            matchReason = "intent_match";
        }
        if (candidates.isEmpty()) {
            Binding fallback = snapshot.fallback();
            return new DispatchDecision(DispatchAction.ALLOW, fallback.id(), false, null,
                    List.of(fallback.id()), fallback.expectedRoute(), snapshot.version(), "fallback");
        }

        List<String> candidateIds = idsOf(candidates);
        if (candidates.size() == 1) {
            Binding only = candidates.get(0);
            return new DispatchDecision(DispatchAction.ALLOW, only.id(), false, null, candidateIds,
                    only.expectedRoute(), snapshot.version(), matchReason);
        }

        List<Binding> ordered = new ArrayList<>(candidates);
        ordered.sort(GOVERNING_ORDER);
        Binding governing = ordered.get(0);
        if (governing.conflictPolicy() instanceof ConflictPolicy.RerouteTo) {
            if (checkDrift && hasDrifted(snapshot, method, path)) {
                return decide(registry.snapshot(), method, path, intentHints, false);
            }
            return new DispatchDecision(DispatchAction.REROUTE, governing.id(), true,
                    governing.rerouteTargetFor(path), candidateIds, governing.expectedRoute(), snapshot.version(),
                    "conflict_rerouted");
        }
        return new DispatchDecision(DispatchAction.BLOCK, governing.id(), true, null, candidateIds,
                governing.expectedRoute(), snapshot.version(), "conflict_blocked");
    }

    private boolean hasDrifted(BindingRegistry.Snapshot snapshot, String method, String path) {
        String routedAgainst = snapshot.version();
        String fresh = registry.refreshBindingsVersion();
        if (routedAgainst.equals(fresh)) {
            return false;
        }
        LOGGER.warn("Bindings version drift while rerouting {} {}: {} -> {}", method, path, routedAgainst, fresh);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("method", method);
        fields.put("path", path);
        fields.put("previousVersion", routedAgainst);
        fields.put("currentVersion", fresh);
        log("bindings_version_drift", fields);
        return true;
    }

    private void emit(String name, DispatchDecision decision, String method, String path, String details) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("action", decision.action().label());
        fields.put("method", method);
        fields.put("path", path);
        fields.put("matchedBindingId", decision.matchedBindingId());
        fields.put("candidateIds", String.join(",", decision.candidateIds()));
        fields.put("conflicted", decision.conflicted());
        fields.put("rerouteTarget", decision.rerouteTarget());
        fields.put("reason", decision.reason());
        fields.put("bindingsVersion", decision.bindingsVersion());
        fields.put("details", details);
        log(name, fields);
    }

    private void log(String name, Map<String, Object> fields) {
        try {
            auditSink.log(AuditEvent.of(name, clock.instant(), fields));
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to emit dispatch audit event: {}", e.getMessage());
        }
    }

    private static List<String> idsOf(List<Binding> bindings) {
        List<String> ids = new ArrayList<>(bindings.size());
        for (Binding binding : bindings) {
            ids.add(binding.id());
        }
        return List.copyOf(ids);
    }
}
