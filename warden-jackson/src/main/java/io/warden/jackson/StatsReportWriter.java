package io.warden.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.warden.core.circuit.CircuitBreaker;
import io.warden.core.circuit.CircuitBreakerRegistry;
import io.warden.core.limit.ConcurrencyLimiter;
import io.warden.core.limit.LimiterRegistry;
import io.warden.core.limit.TokenBucketRateLimiter;
import io.warden.core.registry.CacheRegistry;
import io.warden.core.stats.CacheStats;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the current state of caches, circuit breakers and limiters as JSON,
 * suitable for an admin endpoint.
 *
 * <pre>{@code
 * {
 *   "caches": { "pets": { "hits": 10, "misses": 2, "hit_rate": 0.833, ... } },
 *   "circuit_breakers": { "pet-api": { "state": "CLOSED", ... } },
 *   "rate_limiters": { ... },
 *   "concurrency_limiters": { ... }
 * }
 * }</pre>
 *
 * <p>Registries given as null are left out of the report.</p>
 *
 * @since 1.0.0
 */
public class StatsReportWriter {

    private final ObjectMapper objectMapper;
    private final CacheRegistry caches;
    private final CircuitBreakerRegistry breakers;
    private final LimiterRegistry limiters;

    public StatsReportWriter(CacheRegistry caches, CircuitBreakerRegistry breakers, LimiterRegistry limiters) {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), caches, breakers, limiters);
    }

    public StatsReportWriter(ObjectMapper objectMapper, CacheRegistry caches,
                             CircuitBreakerRegistry breakers, LimiterRegistry limiters) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.caches = caches;
        this.breakers = breakers;
        this.limiters = limiters;
    }

    /**
     * Builds the report tree.
     * @return report root node
     */
    public ObjectNode report() {
        ObjectNode root = objectMapper.createObjectNode();
        if (caches != null) {
            ObjectNode section = root.putObject("caches");
            for (Map.Entry<String, CacheStats.StatsSnapshot> e : caches.aggregateStats().entrySet()) {
                CacheStats.StatsSnapshot s = e.getValue();
                section.putObject(e.getKey())
                        .put("hits", s.hits())
                        .put("misses", s.misses())
                        .put("requests", s.requests())
                        .put("hit_rate", s.hitRate())
                        .put("size", s.size())
                        .put("evictions", s.evictions())
                        .put("entries_created", s.entriesCreated());
            }
        }
        if (breakers != null) {
            ObjectNode section = root.putObject("circuit_breakers");
            for (CircuitBreaker.Snapshot s : breakers.snapshots().values()) {
                section.putObject(s.name())
                        .put("state", s.state().name())
                        .put("failure_count", s.failureCount())
                        .put("success_count", s.successCount())
                        .put("probe_in_flight", s.probeInFlight())
                        .put("rejected_calls", s.rejectedCalls());
            }
        }
        if (limiters != null) {
            ObjectNode rate = root.putObject("rate_limiters");
            for (TokenBucketRateLimiter.Snapshot s : limiters.rateLimiterSnapshots().values()) {
                rate.putObject(s.name())
                        .put("capacity", s.capacity())
                        .put("refill_per_second", s.refillPerSecond())
                        .put("available_tokens", s.availableTokens())
                        .put("granted", s.granted())
                        .put("rejected", s.rejected());
            }
            ObjectNode concurrency = root.putObject("concurrency_limiters");
            for (ConcurrencyLimiter.Snapshot s : limiters.concurrencyLimiterSnapshots().values()) {
                concurrency.putObject(s.name())
                        .put("max_concurrent", s.maxConcurrent())
                        .put("in_flight", s.inFlight())
                        .put("rejected", s.rejected());
            }
        }
        return root;
    }

    public String writeString() {
        try {
            return objectMapper.writeValueAsString(report());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render stats report", e);
        }
    }

    public void writeTo(Writer writer) {
        try {
            objectMapper.writeValue(writer, report());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write stats report", e);
        }
    }
}
