package com.yunhwan.error.advice.infra.analyzer;

import com.yunhwan.error.advice.common.exception.NonRetryableAnalysisException;
import com.yunhwan.error.advice.usecase.analysis.port.AdviceAnalyzer.AnalysisInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 에러 정보를 LLM 프롬프트로 만든다.
 * <p>
 * 1) stack은 상위 20줄만 사용
 * 2) 입력 크기 검증 (초과 시 비재시도 실패)
 * 3) 필드별 길이 제한 + 프롬프트 인젝션성 문자열 제거
 */
@Component
public class AdvicePromptBuilder {

    static final int MAX_STACK_LINES = 20;

    static final int LIMIT_NAME = 200;
    static final int LIMIT_MESSAGE = 1_000;
    static final int LIMIT_CONTEXT = 2_000;
    static final int LIMIT_STACK = 5_000;
    static final int LIMIT_TOTAL = 8_000;

    private static final Pattern MARKUP = Pattern.compile("[<>]");
    private static final Pattern LINE_BREAK = Pattern.compile("[\\r\\n]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern REPEATED_TABS = Pattern.compile("\\t{2,}");
    private static final Pattern REPEATED_SPACES = Pattern.compile(" {3,}");
    private static final Pattern SCRIPT_PROTOCOL = Pattern.compile("(?i)(?:javascript|data|vbscript):");
    private static final Pattern EVENT_HANDLER = Pattern.compile("(?i)on\\w+\\s*=");
    private static final Pattern CSS_EXPRESSION = Pattern.compile("(?i)expression\\s*\\(");
    private static final Pattern LONG_REPEAT = Pattern.compile("(.)\\1{5,}");

    public String build(AnalysisInput input) {
        String stack = topLines(input.stack(), MAX_STACK_LINES);
        validateSizes(input.errorName(), input.message(), input.context(), stack);

        String name = sanitize(orDefault(input.errorName(), "Unknown"), 100);
        String message = sanitize(orDefault(input.message(), "No message"), 500);
        String context = sanitize(orDefault(input.context(), "No context"), 800);
        String sanitizedStack = sanitize(orDefault(stack, "No stack"), 1_500);

        return "Analyze this error and provide debugging advice. "
                + "You must respond with a valid JSON object containing an \"advice\" field with a concise solution. "
                + "Error: " + name + " - " + message
                + (input.code() == null ? "" : " Code: " + sanitize(input.code(), 100))
                + " Context: " + context
                + " Stack: " + sanitizedStack;
    }

    static void validateSizes(String name, String message, String context, String stack) {
        List<String> errors = new ArrayList<>();
        checkLimit(errors, "Error name", name, LIMIT_NAME);
        checkLimit(errors, "Error message", message, LIMIT_MESSAGE);
        checkLimit(errors, "Context", context, LIMIT_CONTEXT);
        checkLimit(errors, "Stack trace", stack, LIMIT_STACK);

        int total = length(name) + length(message) + length(context) + length(stack);
        if (total > LIMIT_TOTAL) {
            errors.add("Total prompt too long: " + total + " > " + LIMIT_TOTAL);
        }

        if (!errors.isEmpty()) {
            throw new NonRetryableAnalysisException("Input validation failed: " + String.join(", ", errors));
        }
    }

    static String sanitize(String input, int maxLength) {
        if (input == null || input.isEmpty()) return "";

        // 자르고 나서 치환 (거대한 입력 방지)
        String s = input.length() > maxLength ? input.substring(0, maxLength) : input;
        s = MARKUP.matcher(s).replaceAll("");
        s = LINE_BREAK.matcher(s).replaceAll(" ");
        s = CONTROL.matcher(s).replaceAll("");
        s = REPEATED_TABS.matcher(s).replaceAll(" ");
        s = REPEATED_SPACES.matcher(s).replaceAll(" ");
        s = SCRIPT_PROTOCOL.matcher(s).replaceAll("");
        s = EVENT_HANDLER.matcher(s).replaceAll("");
        s = CSS_EXPRESSION.matcher(s).replaceAll("");
        s = LONG_REPEAT.matcher(s).replaceAll("$1");
        return s.trim();
    }

    static String topLines(String stack, int maxLines) {
        if (stack == null) return null;
        String[] lines = stack.split("\n", -1);
        if (lines.length <= maxLines) return stack;
        return String.join("\n", List.of(lines).subList(0, maxLines));
    }

    private static void checkLimit(List<String> errors, String label, String value, int limit) {
        if (value != null && value.length() > limit) {
            errors.add(label + " too long: " + value.length() + " > " + limit);
        }
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }

    private static String orDefault(String s, String fallback) {
        return s == null || s.isBlank() ? fallback : s;
    }
}
