package com.yunhwan.error.advice.usecase.analysis.port;

import com.yunhwan.error.advice.domain.advice.Advice;
import com.yunhwan.error.advice.domain.analysis.AnalysisRequest;

public interface AdviceAnalyzer {

    /**
     * @return advice, 만들 수 없으면 null
     * @throws com.yunhwan.error.advice.common.exception.RetryableAnalysisException    일시 장애 (재시도 대상)
     * @throws com.yunhwan.error.advice.common.exception.NonRetryableAnalysisException 입력/설정 문제
     */
    Advice analyze(AnalysisInput input);

    record AnalysisInput(
            String fingerprint,
            String errorName,
            String message,
            String code,
            String stack,
            String context
    ) {
        public static AnalysisInput from(AnalysisRequest request) {
            return new AnalysisInput(
                    request.fingerprint().value(),
                    request.error().name(),
                    request.error().message(),
                    request.error().code(),
                    request.error().stack(),
                    request.context()
            );
        }
    }
}
