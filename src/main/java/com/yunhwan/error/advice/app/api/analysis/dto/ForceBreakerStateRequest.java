package com.yunhwan.error.advice.app.api.analysis.dto;

import com.yunhwan.error.advice.usecase.analysis.breaker.CircuitState;
import jakarta.validation.constraints.NotNull;

public record ForceBreakerStateRequest(
        @NotNull CircuitState state
) {}
