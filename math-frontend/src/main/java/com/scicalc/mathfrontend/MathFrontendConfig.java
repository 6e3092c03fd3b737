package com.scicalc.mathfrontend;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import com.scicalc.mathfrontend.engine.Dispatcher;
import com.scicalc.mathfrontend.engine.NumericEngine;
import com.scicalc.mathfrontend.engine.SymbolicEngine;
import com.scicalc.mathfrontend.nl.NLSyntaxAnalyzer;
import com.scicalc.mathfrontend.nl.NLTranslator;
import com.scicalc.mathfrontend.symbolic.SymbolicClient;

@Configuration
public class MathFrontendConfig {

    private static final Logger log = LoggerFactory.getLogger(MathFrontendConfig.class);

    @Value("${symbolic.service.url:http://127.0.0.1:5001}")
    private String symbolicServiceUrl;

    @Value("${symbolic.service.connect-timeout-ms:2000}")
    private long connectTimeoutMs;

    @Value("${symbolic.service.read-timeout-ms:30000}")
    private long readTimeoutMs;

    @Bean
    public RestTemplate symbolicRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public SymbolicClient symbolicClient(RestTemplate symbolicRestTemplate) {
        log.info("Symbolic service at {} (connect {} ms, read {} ms)", symbolicServiceUrl, connectTimeoutMs, readTimeoutMs);
        return new SymbolicClient(symbolicRestTemplate, symbolicServiceUrl);
    }

    @Bean
    public NumericEngine numericEngine() {
        return new NumericEngine();
    }

    @Bean
    public SymbolicEngine symbolicEngine(SymbolicClient symbolicClient) {
        return new SymbolicEngine(symbolicClient);
    }

    @Bean
    public Dispatcher dispatcher(NumericEngine numericEngine, SymbolicEngine symbolicEngine) {
        return new Dispatcher(numericEngine, symbolicEngine);
    }

    @Bean
    public NLSyntaxAnalyzer nlSyntaxAnalyzer() {
        return new NLSyntaxAnalyzer();
    }

    @Bean
    public NLTranslator nlTranslator(NLSyntaxAnalyzer nlSyntaxAnalyzer) {
        return new NLTranslator(nlSyntaxAnalyzer);
    }
}
