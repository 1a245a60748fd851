package com.yunhwan.error.advice.domain.advice;

import java.time.Instant;

/**
 * advice 캐시 한 건. expiresAt이 null이면 만료되지 않는다.
 */
public record AdviceCacheEntry(
        String fingerprint,
        Advice advice,
        Instant createdAt,
        Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
