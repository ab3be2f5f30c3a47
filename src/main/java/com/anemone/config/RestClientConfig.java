package com.anemone.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

@Configuration
public class RestClientConfig {

    static final String HTTP_LOGGER = "com.anemone.http.logging";

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // response bodies are read twice: once for logging, once by the caller
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {

        private static final Logger httpLogger = LoggerFactory.getLogger(HTTP_LOGGER);
        private static final Set<String> SECRET_HEADERS = Set.of("x-api-key", "authorization");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
                throws IOException {
            // OpenAI-compatible local endpoints expect no bearer token at all
            String auth = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
            if (auth != null && (auth.trim().equalsIgnoreCase("Bearer none") || auth.trim().equalsIgnoreCase("Bearer EMPTY"))) {
                request.getHeaders().set(HttpHeaders.AUTHORIZATION, "");
            }

            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            httpLogger.debug("--> {} {} headers={}", request.getMethod(), request.getURI(), redact(request.getHeaders()));
            if (body.length > 0) {
                httpLogger.debug("--> body: {}", new String(body, StandardCharsets.UTF_8));
            }
            ClientHttpResponse response = execution.execute(request, body);
            byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());
            httpLogger.debug("<-- {} {} ({} bytes): {}", response.getStatusCode(), request.getURI(), responseBody.length,
                    new String(responseBody, StandardCharsets.UTF_8));
            return response;
        }

        static HttpHeaders redact(HttpHeaders headers) {
            HttpHeaders copy = new HttpHeaders();
            headers.forEach((name, values) -> {
                if (SECRET_HEADERS.contains(name.toLowerCase())) {
                    copy.add(name, "***");
                } else {
                    copy.addAll(name, values);
                }
            });
            return copy;
        }
    }
}
