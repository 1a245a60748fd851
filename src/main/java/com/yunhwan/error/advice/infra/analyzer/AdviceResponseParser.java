package com.yunhwan.error.advice.infra.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.error.advice.common.exception.NonRetryableAnalysisException;
import com.yunhwan.error.advice.domain.advice.Advice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * chat completion 응답에서 advice를 꺼낸다.
 * 모델 출력이 JSON이 아니면 원문을 그대로 summary로 쓴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdviceResponseParser {

    private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(.*?)\\n?```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    /**
     * @return advice, 모델 출력이 비어 있으면 null
     */
    public Advice parse(String responseBody, String model) {
        String content = extractContent(responseBody);
        if (content == null || content.isBlank()) {
            return null;
        }

        try {
            JsonNode root = objectMapper.readTree(extractJson(content));
            JsonNode advice = root.path("advice");

            if (advice.isTextual()) {
                return new Advice(advice.asText(), textOrNull(root, "suggestedAction"), model);
            }
            if (advice.isObject()) {
                return new Advice(
                        firstText(advice, "summary", "rootCause", "cause"),
                        firstText(advice, "suggestedAction", "solution", "fix"),
                        model);
            }
            if (!advice.isMissingNode() && !advice.isNull()) {
                return new Advice(advice.toString(), null, model);
            }
            log.debug("[AdviceResponseParser] no advice field, using raw content.");
        } catch (Exception e) {
            log.debug("[AdviceResponseParser] content is not JSON, using raw text. err={}", e.getMessage());
        }
        return new Advice(content.trim(), null, model);
    }

    String extractContent(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            return content.isTextual() ? content.asText() : null;
        } catch (Exception e) {
            throw new NonRetryableAnalysisException("unreadable analyzer response: " + e.getMessage(), e);
        }
    }

    /**
     * markdown code block 안의 JSON 또는 본문 중 첫 '{' ~ 마지막 '}'.
     */
    String extractJson(String text) {
        Matcher matcher = JSON_BLOCK_PATTERN.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return text;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            String v = textOrNull(node, f);
            if (v != null) return v;
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() && !v.asText().isBlank() ? v.asText() : null;
    }
}
