package com.yunhwan.error.advice.app.api.analysis;

import com.yunhwan.error.advice.app.api.analysis.dto.AdviceResponse;
import com.yunhwan.error.advice.app.api.analysis.dto.AnalysisStatusResponse;
import com.yunhwan.error.advice.app.api.analysis.dto.ForceBreakerStateRequest;
import com.yunhwan.error.advice.usecase.analysis.AnalysisScheduler;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitBreaker;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitBreakerStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 운영자용 조회/조작 API (캐시, breaker, 큐 metrics).
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/analysis")
public class AnalysisOpsController {

    private final AnalysisScheduler analysisScheduler;
    private final CircuitBreaker adviceCircuitBreaker;

    @GetMapping("/advice/{fingerprint}")
    public ResponseEntity<AdviceResponse> advice(@PathVariable String fingerprint) {
        return analysisScheduler.findAdvice(fingerprint)
                .map(a -> ResponseEntity.ok(AdviceResponse.of(fingerprint, a)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/status")
    public AnalysisStatusResponse status() {
        return new AnalysisStatusResponse(
                analysisScheduler.getQueueSnapshot(),
                analysisScheduler.getAdviceCacheSize(),
                analysisScheduler.getAdviceCacheLimit(),
                adviceCircuitBreaker.getStats()
        );
    }

    @DeleteMapping("/advice")
    public ResponseEntity<Void> clearAdvice() {
        analysisScheduler.clearAdviceCache();
        log.info("[AnalysisOps] advice cache cleared.");
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/advice/purge")
    public Map<String, Integer> purgeExpired() {
        return Map.of("removed", analysisScheduler.purgeExpiredAdvice());
    }

    @PutMapping("/breaker")
    public CircuitBreakerStats forceBreakerState(@Valid @RequestBody ForceBreakerStateRequest req) {
        log.info("[AnalysisOps] force breaker state. target={}", req.state());
        adviceCircuitBreaker.forceState(req.state());
        return adviceCircuitBreaker.getStats();
    }

    @PostMapping("/queue/metrics/start")
    public Map<String, Boolean> startQueueMetrics() {
        return Map.of("started", analysisScheduler.startQueueMetrics());
    }

    @PostMapping("/queue/metrics/stop")
    public Map<String, Boolean> stopQueueMetrics() {
        return Map.of("stopped", analysisScheduler.stopQueueMetrics());
    }

    @PostMapping("/queue/rejects/reset")
    public ResponseEntity<Void> resetRejects() {
        analysisScheduler.resetQueueRejectCount();
        return ResponseEntity.noContent().build();
    }
}
