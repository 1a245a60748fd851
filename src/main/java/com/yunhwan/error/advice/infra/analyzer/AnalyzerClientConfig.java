package com.yunhwan.error.advice.infra.analyzer;

import com.yunhwan.error.advice.config.ErrorAdviceProperties;
import com.yunhwan.error.advice.usecase.analysis.port.AdviceAnalyzer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * error-advice.analyzer.type 으로 analyzer 구현을 고른다 (기본 stub).
 */
@Configuration
public class AnalyzerClientConfig {

    @Bean
    @ConditionalOnProperty(name = "error-advice.analyzer.type", havingValue = "stub", matchIfMissing = true)
    public AdviceAnalyzer stubAdviceAnalyzer() {
        return new StubAdviceAnalyzer();
    }

    @Bean
    @ConditionalOnProperty(name = "error-advice.analyzer.type", havingValue = "openai")
    public RestTemplate analyzerRestTemplate(RestTemplateBuilder builder, ErrorAdviceProperties properties) {
        ErrorAdviceProperties.Analyzer props = properties.getAnalyzer();
        return builder
                .setConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "error-advice.analyzer.type", havingValue = "openai")
    public AdviceAnalyzer openAiAdviceAnalyzer(@Qualifier("analyzerRestTemplate") RestTemplate analyzerRestTemplate,
                                               ErrorAdviceProperties properties,
                                               AdvicePromptBuilder promptBuilder,
                                               AdviceResponseParser responseParser,
                                               Clock clock) {
        return new OpenAiAdviceAnalyzer(analyzerRestTemplate, properties, promptBuilder, responseParser, clock);
    }
}
