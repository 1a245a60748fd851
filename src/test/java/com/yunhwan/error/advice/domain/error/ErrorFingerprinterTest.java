package com.yunhwan.error.advice.domain.error;

import com.yunhwan.error.advice.common.exception.FingerprintException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * fingerprint 안정성 검증.
 * <p>
 * 같은 논리적 결함(이름/메시지/코드/상위 stack frame)은 줄 번호, 설치 경로, 호출 깊이가 달라도
 * 같은 fingerprint를 가져야 하고, 다른 결함은 달라야 한다.
 */
class ErrorFingerprinterTest {

    private final ErrorFingerprinter fingerprinter = new ErrorFingerprinter();

    @Test
    @DisplayName("fingerprint는 16자리 소문자 hex이며 같은 입력이면 항상 같다")
    void 같은_입력_같은_fingerprint() {
        CapturedError error = CapturedError.of("TypeError", "x is undefined", null, jsStack("/srv/app", 10));

        ErrorFingerprint a = fingerprinter.fingerprint(error);
        ErrorFingerprint b = fingerprinter.fingerprint(error);

        assertThat(a.value()).matches("[0-9a-f]{16}");
        assertThat(a).isEqualTo(b);
        assertThat(a.degraded()).isFalse();
    }

    @Test
    @DisplayName("줄/컬럼 번호와 디렉토리만 다른 stack은 같은 fingerprint를 만든다")
    void 줄번호_경로_차이는_무시() {
        CapturedError onServerA = CapturedError.of("TypeError", "x is undefined", null, jsStack("/srv/app", 10));
        CapturedError onServerB = CapturedError.of("TypeError", "x is undefined", null, jsStack("/home/deploy/releases/42", 57));

        assertThat(fingerprinter.fingerprint(onServerA)).isEqualTo(fingerprinter.fingerprint(onServerB));
    }

    @Test
    @DisplayName("Java stack도 줄 번호 차이는 무시된다")
    void 자바_stack_줄번호_무시() {
        String v1 = """
                java.lang.IllegalStateException: boom
                \tat com.example.order.OrderService.place(OrderService.java:41)
                \tat com.example.order.OrderController.create(OrderController.java:22)
                """;
        String v2 = """
                java.lang.IllegalStateException: boom
                \tat com.example.order.OrderService.place(OrderService.java:45)
                \tat com.example.order.OrderController.create(OrderController.java:23)
                """;

        ErrorFingerprint a = fingerprinter.fingerprint(CapturedError.of("java.lang.IllegalStateException", "boom", null, v1));
        ErrorFingerprint b = fingerprinter.fingerprint(CapturedError.of("java.lang.IllegalStateException", "boom", null, v2));

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("상위 5개 frame이 같으면 호출 깊이가 달라도 같은 fingerprint")
    void 상위_frame만_사용() {
        String shallow = frames(5);
        String deep = frames(5) + "    at extra.caller (/srv/app/extra.js:1:1)\n    at more.caller (/srv/app/more.js:2:2)\n";

        ErrorFingerprint a = fingerprinter.fingerprint(CapturedError.of("Error", "m", null, shallow));
        ErrorFingerprint b = fingerprinter.fingerprint(CapturedError.of("Error", "m", null, deep));

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("이름, 메시지, 코드, 호출 위치가 다르면 fingerprint도 다르다")
    void 다른_결함은_다른_fingerprint() {
        CapturedError base = CapturedError.of("TypeError", "x is undefined", null, jsStack("/srv/app", 10));

        ErrorFingerprint baseFp = fingerprinter.fingerprint(base);

        assertThat(fingerprinter.fingerprint(CapturedError.of("RangeError", "x is undefined", null, base.stack())))
                .isNotEqualTo(baseFp);
        assertThat(fingerprinter.fingerprint(CapturedError.of("TypeError", "y is undefined", null, base.stack())))
                .isNotEqualTo(baseFp);
        assertThat(fingerprinter.fingerprint(CapturedError.of("TypeError", "x is undefined", "E_CODE", base.stack())))
                .isNotEqualTo(baseFp);
        assertThat(fingerprinter.fingerprint(CapturedError.of("TypeError", "x is undefined", null,
                "TypeError: x\n    at other.fn (/srv/app/other.js:1:1)\n")))
                .isNotEqualTo(baseFp);
    }

    @Test
    @DisplayName("메시지 공백 차이는 정규화되어 같은 fingerprint가 된다")
    void 메시지_공백_정규화() {
        ErrorFingerprint a = fingerprinter.fingerprint(CapturedError.of("Error", "connection   lost\r\n to db", null, null));
        ErrorFingerprint b = fingerprinter.fingerprint(CapturedError.of("Error", " connection lost to db ", null, null));

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("메시지는 200자 이후 차이를 보지 않는다")
    void 메시지_길이_상한() {
        String prefix = "a".repeat(ErrorFingerprinter.MAX_MESSAGE_CHARS);

        ErrorFingerprint a = fingerprinter.fingerprint(CapturedError.of("Error", prefix + "-tail-1", null, null));
        ErrorFingerprint b = fingerprinter.fingerprint(CapturedError.of("Error", prefix + "-tail-2", null, null));

        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("null/빈 필드, 거대한 입력에도 예외 없이 fingerprint를 만든다")
    void 비정상_입력도_예외_없음() {
        assertThatCode(() -> {
            assertThat(fingerprinter.fingerprint(null).value()).hasSize(ErrorFingerprint.LENGTH);
            assertThat(fingerprinter.fingerprint(CapturedError.of(null, null, null, null)).value()).hasSize(16);
            assertThat(fingerprinter.fingerprint(CapturedError.of("E", "x".repeat(1_000_000), null, "y".repeat(1_000_000)))
                    .value()).hasSize(16);
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("null 에러는 degraded fingerprint가 되고 항상 같은 값이다")
    void null_에러_degraded() {
        ErrorFingerprint a = fingerprinter.fingerprint(null);
        ErrorFingerprint b = fingerprinter.fingerprint(null);

        assertThat(a.degraded()).isTrue();
        assertThat(a.value()).matches("[0-9a-f]{16}");
        assertThat(a).isEqualTo(b);
    }

    @Test
    @DisplayName("내부 실패 시 name+message만으로 degraded fingerprint를 만들고 stack은 무시한다")
    void 내부_실패_degraded_fallback() {
        // Given
        ErrorFingerprinter broken = new ErrorFingerprinter() {
            @Override
            String stackDigest(String stack) {
                throw new FingerprintException("stack digest failed", new IllegalStateException("boom"));
            }
        };
        CapturedError withStackA = CapturedError.of("TypeError", "x is undefined", null, jsStack("/srv/app", 10));
        CapturedError withStackB = CapturedError.of("TypeError", "x is undefined", null, frames(7));
        CapturedError otherMessage = CapturedError.of("TypeError", "y is undefined", null, jsStack("/srv/app", 10));

        // When
        ErrorFingerprint a = broken.fingerprint(withStackA);
        ErrorFingerprint b = broken.fingerprint(withStackB);
        ErrorFingerprint c = broken.fingerprint(otherMessage);

        // Then
        assertThat(a.degraded()).isTrue();
        assertThat(a.value()).matches("[0-9a-f]{16}");
        assertThat(a).isEqualTo(b);
        assertThat(c.value()).isNotEqualTo(a.value());
        assertThat(a.value()).isNotEqualTo(fingerprinter.fingerprint(withStackA).value());
    }

    @Test
    @DisplayName("normalizeStack은 at frame만 남기고 위치 정보를 제거한다")
    void stack_정규화_결과() {
        String stack = """
                TypeError: x is undefined
                    at render (/srv/app/src/view.js:10:5)
                    at Object.<anonymous> (C:\\work\\app\\index.js:3:1)
                """;

        String normalized = ErrorFingerprinter.normalizeStack(stack);

        assertThat(normalized).isEqualTo("at render (view.js)\nat Object.<anonymous> (index.js)\n");
    }

    private static String jsStack(String root, int line) {
        return "TypeError: x is undefined\n"
                + "    at render (" + root + "/src/view.js:" + line + ":5)\n"
                + "    at handle (" + root + "/src/router.js:" + (line + 3) + ":12)\n";
    }

    private static String frames(int n) {
        StringBuilder sb = new StringBuilder("Error: m\n");
        for (int i = 0; i < n; i++) {
            sb.append("    at fn").append(i).append(" (/srv/app/f").append(i).append(".js:").append(i + 1).append(":1)\n");
        }
        return sb.toString();
    }
}
