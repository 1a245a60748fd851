package com.yunhwan.error.advice.app.api.analysis.dto;

import com.yunhwan.error.advice.domain.advice.Advice;

public record AdviceResponse(
        String fingerprint,
        String summary,
        String suggestedAction,
        String model
) {
    public static AdviceResponse of(String fingerprint, Advice advice) {
        return new AdviceResponse(fingerprint, advice.summary(), advice.suggestedAction(), advice.model());
    }
}
