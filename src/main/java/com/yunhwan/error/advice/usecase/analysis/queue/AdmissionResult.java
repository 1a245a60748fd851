package com.yunhwan.error.advice.usecase.analysis.queue;

public enum AdmissionResult {
    ACCEPTED,
    REJECTED
}
