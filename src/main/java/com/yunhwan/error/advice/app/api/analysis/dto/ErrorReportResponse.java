package com.yunhwan.error.advice.app.api.analysis.dto;

import com.yunhwan.error.advice.usecase.analysis.dto.ScheduleStatus;

public record ErrorReportResponse(
        String fingerprint,
        ScheduleStatus status
) {}
