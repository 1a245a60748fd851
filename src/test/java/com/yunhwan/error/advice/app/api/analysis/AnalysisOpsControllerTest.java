package com.yunhwan.error.advice.app.api.analysis;

import com.yunhwan.error.advice.config.TimeConfig;
import com.yunhwan.error.advice.domain.advice.Advice;
import com.yunhwan.error.advice.usecase.analysis.AnalysisScheduler;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitBreaker;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitBreakerStats;
import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitState;
import com.yunhwan.error.advice.usecase.analysis.queue.QueueSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("api")
@DisplayName("[API] /api/analysis 운영 API")
@WebMvcTest(AnalysisOpsController.class)
@Import(TimeConfig.class)
class AnalysisOpsControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    AnalysisScheduler analysisScheduler;

    @MockBean
    CircuitBreaker adviceCircuitBreaker;

    @Test
    @DisplayName("캐시된 advice는 200, 없으면 404")
    void advice_조회() throws Exception {
        when(analysisScheduler.findAdvice("0123456789abcdef"))
                .thenReturn(Optional.of(new Advice("null deref", "add guard", "stub-rules")));
        when(analysisScheduler.findAdvice("ffffffffffffffff")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/analysis/advice/0123456789abcdef"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("null deref"))
                .andExpect(jsonPath("$.model").value("stub-rules"));

        mockMvc.perform(get("/api/analysis/advice/ffffffffffffffff"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("status는 큐/캐시/breaker 상태를 한 번에 보여준다")
    void 상태_조회() throws Exception {
        when(analysisScheduler.getQueueSnapshot()).thenReturn(new QueueSnapshot(2, 1, 4, 2, 1));
        when(analysisScheduler.getAdviceCacheSize()).thenReturn(7);
        when(analysisScheduler.getAdviceCacheLimit()).thenReturn(50);
        when(adviceCircuitBreaker.getStats()).thenReturn(stats(CircuitState.OPEN));

        mockMvc.perform(get("/api/analysis/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queue.activeCount").value(2))
                .andExpect(jsonPath("$.queue.rejectCount").value(4))
                .andExpect(jsonPath("$.cacheSize").value(7))
                .andExpect(jsonPath("$.cacheLimit").value(50))
                .andExpect(jsonPath("$.breaker.state").value("OPEN"));
    }

    @Test
    @DisplayName("캐시 비우기 204, 만료 정리는 제거 건수를 돌려준다")
    void 캐시_조작() throws Exception {
        when(analysisScheduler.purgeExpiredAdvice()).thenReturn(3);

        mockMvc.perform(delete("/api/analysis/advice"))
                .andExpect(status().isNoContent());
        mockMvc.perform(post("/api/analysis/advice/purge"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(3));

        verify(analysisScheduler).clearAdviceCache();
    }

    @Test
    @DisplayName("breaker 상태 강제 전환")
    void breaker_강제_전환() throws Exception {
        when(adviceCircuitBreaker.getStats()).thenReturn(stats(CircuitState.CLOSED));

        mockMvc.perform(put("/api/analysis/breaker")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"CLOSED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CLOSED"));

        verify(adviceCircuitBreaker).forceState(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("알 수 없는 breaker 상태는 400")
    void breaker_잘못된_상태_400() throws Exception {
        mockMvc.perform(put("/api/analysis/breaker")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"BROKEN\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("큐 metrics on/off, reject 카운터 초기화")
    void 큐_metrics_조작() throws Exception {
        when(analysisScheduler.startQueueMetrics()).thenReturn(true);
        when(analysisScheduler.stopQueueMetrics()).thenReturn(false);

        mockMvc.perform(post("/api/analysis/queue/metrics/start"))
                .andExpect(jsonPath("$.started").value(true));
        mockMvc.perform(post("/api/analysis/queue/metrics/stop"))
                .andExpect(jsonPath("$.stopped").value(false));
        mockMvc.perform(post("/api/analysis/queue/rejects/reset"))
                .andExpect(status().isNoContent());

        verify(analysisScheduler).resetQueueRejectCount();
    }

    private static CircuitBreakerStats stats(CircuitState state) {
        return new CircuitBreakerStats("advice-analyzer", state, 0, null, 0, 0, 0, 5, 30_000);
    }
}
