package com.yunhwan.error.advice.domain.error;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * 분석 파이프라인이 받는 에러의 최소 계약.
 * <p>
 * name은 비어 있으면 "Error", message는 null이면 "",
 * code/stack은 비어 있으면 null로 정규화된다.
 */
public record CapturedError(
        String name,
        String message,
        String code,
        String stack
) {

    static final String DEFAULT_NAME = "Error";

    public CapturedError {
        name = isBlank(name) ? DEFAULT_NAME : name.trim();
        message = message == null ? "" : message;
        code = isBlank(code) ? null : code.trim();
        stack = isBlank(stack) ? null : stack;
    }

    public static CapturedError of(String name, String message, String code, String stack) {
        return new CapturedError(name, message, code, stack);
    }

    public static CapturedError from(Throwable t) {
        if (t == null) {
            return new CapturedError(null, null, null, null);
        }
        String code = (t instanceof CodedError coded) ? coded.errorCode() : null;
        return new CapturedError(t.getClass().getName(), t.getMessage(), code, printStack(t));
    }

    public boolean hasStack() {
        return stack != null;
    }

    private static String printStack(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
