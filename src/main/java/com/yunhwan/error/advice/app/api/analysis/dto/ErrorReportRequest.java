package com.yunhwan.error.advice.app.api.analysis.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 에러 리포트 API 요청 DTO
 * - name: 에러 타입 (ex. java.lang.IllegalStateException, TypeError)
 * - code: 앱이 붙인 에러 코드 (optional)
 * - context: 요청 경로 등 부가 정보 (optional, 민감정보 금지)
 */
public record ErrorReportRequest(
        @NotBlank @Size(max = 200) String name,
        String message,
        @Size(max = 100) String code,
        String stacktrace,
        @Size(max = 2_000) String context
) {}
