package com.yunhwan.error.advice.app.analysis;

import com.yunhwan.error.advice.app.api.analysis.dto.ErrorReportRequest;
import com.yunhwan.error.advice.app.api.analysis.dto.ErrorReportResponse;
import com.yunhwan.error.advice.domain.error.CapturedError;
import com.yunhwan.error.advice.usecase.analysis.AnalysisScheduler;
import com.yunhwan.error.advice.usecase.analysis.dto.ScheduleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ErrorReportFacade {

    /**
     * stacktrace 상한 : 분석 큐에 거대한 payload가 쌓이는 걸 방지.
     */
    static final int MAX_STACKTRACE_CHARS = 8_000;

    /**
     * 예외 메시지 상한 : 과도하게 긴 메시지/민감정보 유입 대비.
     */
    static final int MAX_MESSAGE_CHARS = 1_000;

    private final AnalysisScheduler analysisScheduler;

    public ErrorReportResponse report(ErrorReportRequest req) {
        // "수집 정책"은 여기서 적용해서, API payload 변경이 도메인까지 번지는 걸 막는다.
        String message = sanitizeAndTruncate(req.message(), MAX_MESSAGE_CHARS);
        String stacktrace = sanitizeAndTruncate(req.stacktrace(), MAX_STACKTRACE_CHARS);
        String context = sanitizeAndTruncate(req.context(), MAX_MESSAGE_CHARS * 2);

        CapturedError error = CapturedError.of(req.name(), message, req.code(), stacktrace);
        ScheduleResult result = analysisScheduler.scheduleAnalysis(error, context);

        log.debug("[ErrorReportFacade] reported. name={}, status={}, fingerprint={}",
                error.name(), result.status(), result.fingerprint());

        String fingerprint = result.fingerprint() == null ? null : result.fingerprint().value();
        return new ErrorReportResponse(fingerprint, result.status());
    }

    /**
     * 줄바꿈 정규화 후 최대 길이로 절단.
     */
    static String sanitizeAndTruncate(String input, int maxChars) {
        if (input == null) {
            return null;
        }

        String s = normalizeLineEndings(input).trim();
        if (s.isEmpty() || maxChars <= 0) {
            return null;
        }

        return s.length() <= maxChars ? s : s.substring(0, maxChars);
    }

    /**
     * CRLF/CR을 LF로 통일해서 fingerprint 안정성을 높인다.
     */
    private static String normalizeLineEndings(String s) {
        return s.replace("\r\n", "\n").replace("\r", "\n");
    }
}
