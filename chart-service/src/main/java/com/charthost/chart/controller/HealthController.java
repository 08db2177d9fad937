package com.charthost.chart.controller;

import com.charthost.chart.store.StoreContext;
import io.r2dbc.pool.PoolMetrics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final StoreContext storeContext;
    private final Clock        clock;

    public HealthController(StoreContext storeContext, Clock clock) {
        this.storeContext = storeContext;
        this.clock        = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status",    "ok",
            "mode",      storeContext.mode(),
            "timestamp", clock.instant().toString()));
    }

    @GetMapping("/db-status")
    public ResponseEntity<Map<String, Object>> dbStatus() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ready", storeContext.isRelationalReady());
        body.put("mode", storeContext.mode());
        storeContext.degradedReason().ifPresent(reason -> body.put("reason", reason));
        storeContext.poolMetrics().ifPresent(m -> body.put("pool", poolBody(m)));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/db-test")
    public Mono<ResponseEntity<Object>> dbTest() {
        return storeContext.probe()
            .map(now -> ResponseEntity.ok().<Object>body(Map.of(
                "status",       "ok",
                "databaseTime", now,
                "message",      "Database connection is working")))
            .onErrorResume(ChartErrorResponses::toResponse);
    }

    private static Map<String, Object> poolBody(PoolMetrics m) {
        Map<String, Object> pool = new LinkedHashMap<>();
        pool.put("acquired", m.acquiredSize());
        pool.put("allocated", m.allocatedSize());
        pool.put("idle", m.idleSize());
        pool.put("pendingAcquire", m.pendingAcquireSize());
        pool.put("maxAllocated", m.getMaxAllocatedSize());
        return pool;
    }
}
