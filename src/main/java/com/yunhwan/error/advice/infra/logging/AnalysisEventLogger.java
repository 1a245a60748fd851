package com.yunhwan.error.advice.infra.logging;

import com.yunhwan.error.advice.domain.advice.Advice;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitState;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitStateListener;
import com.yunhwan.error.advice.usecase.analysis.queue.QueueSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static net.logstash.logback.argument.StructuredArguments.entries;

@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisEventLogger implements CircuitStateListener {

    public static final String EVENT_ADVICE_READY = "advice_ready";
    public static final String EVENT_ANALYSIS_FAILED = "analysis_failed";
    public static final String EVENT_ANALYSIS_REJECTED = "analysis_rejected";
    public static final String EVENT_CIRCUIT_STATE_CHANGED = "circuit_state_changed";

    private final Clock clock;

    public void adviceReady(String fingerprint, Advice advice, Duration elapsed) {
        Map<String, Object> evt = createBaseEvent(EVENT_ADVICE_READY, fingerprint);
        evt.put("elapsed_ms", elapsed == null ? null : elapsed.toMillis());
        evt.put("advice", mapOfNonNull(
                "model", advice.model(),
                "summary", advice.summary(),
                "size", advice.size()
        ));

        log.info("error_advice_event {}", entries(evt));
    }

    public void analysisFailed(String fingerprint, String reason, Throwable error) {
        Map<String, Object> evt = createBaseEvent(EVENT_ANALYSIS_FAILED, fingerprint);
        evt.put("reason", reason);

        // 원인 체인 중 가장 안쪽 예외까지 함께 남긴다
        Throwable root = rootCause(error);
        evt.put("error", mapOfNonNull(
                "exception", error == null ? null : error.getClass().getSimpleName(),
                "message", error == null ? null : error.getMessage(),
                "root_exception", root == error || root == null ? null : root.getClass().getSimpleName(),
                "root_message", root == error || root == null ? null : root.getMessage()
        ));

        log.warn("error_advice_event {}", entries(evt));
    }

    public void analysisRejected(String fingerprint, QueueSnapshot snapshot) {
        Map<String, Object> evt = createBaseEvent(EVENT_ANALYSIS_REJECTED, fingerprint);
        evt.put("queue", mapOfNonNull(
                "active", snapshot.activeCount(),
                "pending", snapshot.pendingCount(),
                "rejects", snapshot.rejectCount(),
                "max_concurrency", snapshot.maxConcurrency(),
                "max_queue_length", snapshot.maxQueueLength()
        ));

        log.warn("error_advice_event {}", entries(evt));
    }

    @Override
    public void onStateChange(String breakerName, CircuitState from, CircuitState to, String reason) {
        Map<String, Object> evt = createBaseEvent(EVENT_CIRCUIT_STATE_CHANGED, null);
        evt.put("breaker", breakerName);
        evt.put("from_state", String.valueOf(from));
        evt.put("to_state", String.valueOf(to));
        if (reason != null && !reason.isBlank()) evt.put("reason", reason);

        log.info("error_advice_event {}", entries(evt));
    }

    private Map<String, Object> createBaseEvent(String eventType, String fingerprint) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", eventType);
        evt.put("event_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        if (fingerprint != null) evt.put("fingerprint", fingerprint);
        return evt;
    }

    private static Throwable rootCause(Throwable t) {
        Throwable cur = t;
        while (cur != null && cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
        }
        return cur;
    }

    /**
     * EN: Null-safe map builder (skips null values).
     * KR: Map.of 대체 - null 값은 아예 put하지 않는다.
     */
    private Map<String, Object> mapOfNonNull(Object... kv) {
        if (kv.length % 2 != 0) {
            throw new IllegalArgumentException("kv length must be even. length=" + kv.length);
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object k = kv[i];
            Object v = kv[i + 1];
            if (k == null) {
                throw new IllegalArgumentException("key must not be null");
            }
            if (v != null) {
                m.put(String.valueOf(k), v);
            }
        }
        return m;
    }
}
