package com.yunhwan.error.advice.domain.error;

import com.yunhwan.error.advice.common.exception.FingerprintException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.regex.Pattern;

/**
 * 에러 identity(name, 정규화 message, code, 정규화 stack hash)로 fingerprint를 만든다.
 * <p>
 * 절대 예외를 던지지 않는다. 내부 실패 시 name+message만으로 degraded fingerprint를 만든다.
 */
@Slf4j
public class ErrorFingerprinter {

    static final int MAX_MESSAGE_CHARS = 200;
    static final int MAX_STACK_CHARS = 5_000;
    static final int MAX_FRAMES = 5;

    // "(Foo.java:12)", "(app.js:10:5)", "foo.js:10:5" 의 줄/컬럼 번호
    private static final Pattern LINE_COLUMN = Pattern.compile(":\\d+(?::\\d+)?(?=\\)|$)");
    // "/home/app/src/", "C:\\work\\src\\", "file:///srv/app/" 같은 디렉토리 prefix
    private static final Pattern DIRECTORY_PREFIX =
            Pattern.compile("(?:file://)?(?:[A-Za-z]:)?(?:[\\\\/][^\\\\/\\s():]+)*[\\\\/](?=[^\\\\/\\s():]+)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ErrorFingerprint fingerprint(CapturedError error) {
        try {
            if (error == null) {
                return degraded(null, null);
            }
            String basis = String.join("\n",
                    error.name(),
                    normalizeMessage(error.message()),
                    error.code() == null ? "" : error.code(),
                    stackDigest(error.stack()));
            return ErrorFingerprint.of(sha256Hex(basis).substring(0, ErrorFingerprint.LENGTH));
        } catch (Exception e) {
            log.debug("[Fingerprinter] falling back to degraded fingerprint: {}", e.toString());
            return degraded(error == null ? null : error.name(), error == null ? null : error.message());
        }
    }

    String stackDigest(String stack) {
        return sha256Hex(normalizeStack(stack));
    }

    static String normalizeMessage(String message) {
        if (message == null) return "";
        String s = WHITESPACE.matcher(message.replace("\r\n", "\n")).replaceAll(" ").trim();
        return s.length() <= MAX_MESSAGE_CHARS ? s : s.substring(0, MAX_MESSAGE_CHARS);
    }

    /**
     * 상위 frame만 남기고 줄/컬럼 번호와 절대 경로를 제거한다.
     * 호출 깊이가 달라도 같은 논리적 결함이면 같은 결과가 나온다.
     */
    static String normalizeStack(String stack) {
        if (stack == null || stack.isBlank()) return "";
        String bounded = stack.length() <= MAX_STACK_CHARS ? stack : stack.substring(0, MAX_STACK_CHARS);

        StringBuilder sb = new StringBuilder();
        int frames = 0;
        for (String raw : bounded.split("\\R")) {
            String line = raw.trim();
            if (!line.startsWith("at ")) continue;

            String frame = LINE_COLUMN.matcher(line).replaceAll("");
            frame = DIRECTORY_PREFIX.matcher(frame).replaceAll("");
            sb.append(frame).append('\n');

            if (++frames >= MAX_FRAMES) break;
        }
        return sb.toString();
    }

    private ErrorFingerprint degraded(String name, String message) {
        String basis = (name == null ? "" : name) + "\n" + normalizeMessageSafely(message);
        String hex;
        try {
            hex = sha256Hex(basis).substring(0, ErrorFingerprint.LENGTH);
        } catch (Exception e) {
            hex = String.format("%016x", basis.hashCode() & 0xffffffffL);
        }
        return new ErrorFingerprint(hex, true);
    }

    private static String normalizeMessageSafely(String message) {
        try {
            return normalizeMessage(message);
        } catch (Exception e) {
            return "";
        }
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(dig.length * 2);
            for (byte b : dig) hex.append(String.format("%02x", b));
            return hex.toString();
        } catch (Exception e) {
            throw new FingerprintException("sha256 compute failed", e);
        }
    }
}
