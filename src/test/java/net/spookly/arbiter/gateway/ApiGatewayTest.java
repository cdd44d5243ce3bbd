package net.spookly.arbiter.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import net.spookly.arbiter.admission.AdmissionGovernor;
import net.spookly.arbiter.admission.AdmissionOutcome;
import net.spookly.arbiter.admission.AdmissionPolicy;
import net.spookly.arbiter.admission.ProviderClient;
import net.spookly.arbiter.audit.AuditSink;
import net.spookly.arbiter.binding.BindingRegistry;
import net.spookly.arbiter.config.ArbiterConfig;
import net.spookly.arbiter.config.ConfigLoader;
import net.spookly.arbiter.dispatch.DispatchAction;
import net.spookly.arbiter.dispatch.PatternDispatcher;
import net.spookly.arbiter.dispatch.RouteConflictBlockedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApiGatewayTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AtomicInteger providerCalls = new AtomicInteger();
    private AdmissionGovernor governor;
    private ApiGateway gateway;

    @BeforeEach
    void setUp() {
        ArbiterConfig config = ConfigLoader.parse("""
                dispatch:
                  exemptRoutes:
                    - method: GET
                      exactPath: /status
                  bindings:
                    - id: ask
                      priority: 120
                      methods: [POST]
                      exactPaths: [/ask]
                      conflictPolicy: refresh_then_reroute
                      rerouteTarget: /ask
                    - id: api-shadow
                      priority: 60
                      methods: [GET]
                      pathRegexes: ["^/api/memory"]
                      conflictPolicy: refresh_then_reroute
                      rerouteTarget: /api/memory/v2
                    - id: api-family
                      priority: 50
                      methods: [GET, POST]
                      pathTemplates: ["/api/:resource"]
                      sensitivity: sensitive
                      conflictPolicy: strict_block
                    - id: api-writes
                      priority: 40
                      methods: [POST]
                      pathRegexes: ["^/api/"]
                      conflictPolicy: strict_block
                    - id: catch-all
                      priority: 1
                      methods: [GET, POST]
                      conflictPolicy: strict_block
                      fallback: true
                """, null);
        ProviderClient provider = new ProviderClient() {
            @Override
            public CompletableFuture<JsonNode> call(JsonNode payload) {
                providerCalls.incrementAndGet();
                return CompletableFuture.completedFuture(TextNode.valueOf("answer"));
            }

            @Override
            public CompletableFuture<List<JsonNode>> batch(List<JsonNode> payloads) {
                return CompletableFuture.completedFuture(List.of());
            }
        };
        governor = new AdmissionGovernor(AdmissionPolicy.fromConfig(config), provider, null, AuditSink.NOOP,
                Clock.systemUTC());
        gateway = new ApiGateway(
                new PatternDispatcher(BindingRegistry.fromConfig(config), AuditSink.NOOP, Clock.systemUTC()),
                governor);
    }

    @AfterEach
    void tearDown() {
        governor.close();
    }

    @Test
    void allowedRequestWithPayloadIsAdmitted() throws Exception {
        JsonNode body = MAPPER.createObjectNode().put("prompt", "hi");

        GatewayResult result = gateway.handle(InboundRequest.fromBody("POST", "/ask", body)).get(2, TimeUnit.SECONDS);

        assertEquals("ask", result.decision().matchedBindingId());
        assertEquals(AdmissionOutcome.DIRECT, result.admission().outcome());
        assertEquals("answer", result.admission().response().asText());
        assertEquals(1, providerCalls.get());
    }

    @Test
    void allowedRequestWithoutPayloadPassesThrough() throws Exception {
        GatewayResult result = gateway.handle(InboundRequest.fromBody("GET", "/status", null)).get(2, TimeUnit.SECONDS);

        assertEquals("exempt", result.decision().reason());
        assertTrue(result.admission().isPassThrough());
        assertEquals(0, providerCalls.get());
    }

    @Test
    void blockedRequestFailsWithConflictException() {
        CompletableFuture<GatewayResult> future = gateway.handle(
                new InboundRequest("POST", "/api/memory", List.of(), "hi", null));

        ExecutionException exception = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        RouteConflictBlockedException blocked = assertInstanceOf(RouteConflictBlockedException.class,
                exception.getCause());
        assertEquals("api-family", blocked.governingBindingId());
        assertEquals(0, providerCalls.get());
    }

    @Test
    void reroutedRequestIsNotAdmitted() throws Exception {
        GatewayResult result = gateway.handle(new InboundRequest("GET", "/api/memory", List.of(), "hi", null))
                .get(2, TimeUnit.SECONDS);

        assertEquals(DispatchAction.REROUTE, result.decision().action());
        assertEquals("/api/memory/v2", result.decision().rerouteTarget());
        assertNull(result.admission());
        assertEquals(0, providerCalls.get());
    }
}
