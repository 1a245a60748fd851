package com.yunhwan.error.advice.infra.analyzer;

import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * provider 대기 힌트 해석.
 * retry-after-ms(ms) 우선, 없으면 retry-after(초 또는 HTTP-date).
 */
public final class RetryAfterParser {

    static final String RETRY_AFTER_MS = "retry-after-ms";

    private RetryAfterParser() {}

    public static Optional<Duration> parse(HttpHeaders headers, Clock clock) {
        if (headers == null) {
            return Optional.empty();
        }

        OptionalDouble ms = parseNumber(headers.getFirst(RETRY_AFTER_MS));
        if (ms.isPresent() && ms.getAsDouble() > 0) {
            return Optional.of(Duration.ofMillis((long) ms.getAsDouble()));
        }

        String retryAfter = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (retryAfter == null || retryAfter.isBlank()) {
            return Optional.empty();
        }
        String value = retryAfter.trim();

        OptionalDouble secs = parseNumber(value);
        if (secs.isEmpty()) {
            return parseHttpDate(value, clock);
        }
        return secs.getAsDouble() < 0 ? Optional.empty() : Optional.of(Duration.ofMillis((long) (secs.getAsDouble() * 1000)));
    }

    private static OptionalDouble parseNumber(String value) {
        if (value == null || value.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static Optional<Duration> parseHttpDate(String value, Clock clock) {
        try {
            Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration until = Duration.between(clock.instant(), at);
            return Optional.of(until.isNegative() ? Duration.ZERO : until);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
