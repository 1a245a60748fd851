package com.yunhwan.error.advice.infra.analyzer;

import com.yunhwan.error.advice.common.exception.NonRetryableAnalysisException;
import com.yunhwan.error.advice.common.exception.RetryableAnalysisException;
import com.yunhwan.error.advice.config.ErrorAdviceProperties;
import com.yunhwan.error.advice.domain.advice.Advice;
import com.yunhwan.error.advice.usecase.analysis.port.AdviceAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OpenAI chat completions 기반 analyzer.
 * <p>
 * 429/503/5xx/I-O 오류는 재시도 가능, 그 외 4xx는 비재시도.
 * API key가 없으면 한 번만 경고하고 advice 없음으로 끝낸다.
 */
@Slf4j
public class OpenAiAdviceAnalyzer implements AdviceAnalyzer {

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final RestTemplate restTemplate;
    private final ErrorAdviceProperties.Analyzer props;
    private final AdvicePromptBuilder promptBuilder;
    private final AdviceResponseParser responseParser;
    private final Clock clock;

    private final AtomicBoolean warnedMissingKey = new AtomicBoolean(false);

    public OpenAiAdviceAnalyzer(RestTemplate restTemplate,
                                ErrorAdviceProperties properties,
                                AdvicePromptBuilder promptBuilder,
                                AdviceResponseParser responseParser,
                                Clock clock) {
        this.restTemplate = restTemplate;
        this.props = properties.getAnalyzer();
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.clock = clock;
    }

    @Override
    public Advice analyze(AnalysisInput input) {
        if (!StringUtils.hasText(props.getApiKey())) {
            if (warnedMissingKey.compareAndSet(false, true)) {
                log.warn("[OpenAiAdviceAnalyzer] missing api key (error-advice.analyzer.api-key). analysis disabled.");
            }
            return null;
        }

        String prompt = promptBuilder.build(input);

        Map<String, Object> requestBody = Map.of(
                "model", props.getModel(),
                "max_tokens", props.getMaxTokens(),
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "user", "content", prompt)
                )
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(props.getApiKey());

        log.info("[OpenAiAdviceAnalyzer] requesting advice. fingerprint={}, model={}", input.fingerprint(), props.getModel());

        String body;
        try {
            body = restTemplate.postForObject(completionsUrl(), new HttpEntity<>(requestBody, headers), String.class);
        } catch (HttpStatusCodeException e) {
            throw classify(e);
        } catch (ResourceAccessException e) {
            throw new RetryableAnalysisException("analyzer I/O failure: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new NonRetryableAnalysisException("analyzer client failure: " + e.getMessage(), e);
        }

        Advice advice = responseParser.parse(body, props.getModel());
        if (advice != null) {
            log.info("[OpenAiAdviceAnalyzer] advice received. fingerprint={}, size={}", input.fingerprint(), advice.size());
        }
        return advice;
    }

    RuntimeException classify(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        boolean rateLimited = status == 429 || status == 503;

        if (rateLimited || e.getStatusCode().is5xxServerError()) {
            Duration hint = rateLimited
                    ? RetryAfterParser.parse(e.getResponseHeaders(), clock).orElse(null)
                    : null;
            return new RetryableAnalysisException("analyzer responded " + status, hint, rateLimited, e);
        }
        return new NonRetryableAnalysisException("analyzer rejected request with " + status, e);
    }

    private String completionsUrl() {
        String base = props.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + COMPLETIONS_PATH;
    }
}
