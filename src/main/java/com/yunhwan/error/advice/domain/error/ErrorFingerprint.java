package com.yunhwan.error.advice.domain.error;

import java.util.Objects;

/**
 * 에러의 정규화된 identity에서 뽑은 고정 길이 dedup 키.
 *
 * @param value    16자리 소문자 hex
 * @param degraded stack 없이 name+message만으로 만든 fallback 여부
 */
public record ErrorFingerprint(String value, boolean degraded) {

    public static final int LENGTH = 16;

    public ErrorFingerprint {
        Objects.requireNonNull(value, "value");
        if (value.length() != LENGTH) {
            throw new IllegalArgumentException("fingerprint must be " + LENGTH + " chars. value=" + value);
        }
    }

    public static ErrorFingerprint of(String value) {
        return new ErrorFingerprint(value, false);
    }

    @Override
    public String toString() {
        return value;
    }
}
