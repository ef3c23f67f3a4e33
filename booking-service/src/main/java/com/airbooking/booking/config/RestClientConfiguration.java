package com.airbooking.booking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Outbound HTTP client used for receipt delivery.
 */
@Configuration
public class RestClientConfiguration {

    @Value("${http.client.connect-timeout-ms:3000}")
    private int connectTimeout;

    @Value("${http.client.read-timeout-ms:5000}")
    private int readTimeout;

    @Bean
    public RestTemplate receiptRestTemplate(RestTemplateBuilder builder, ObjectMapper objectMapper) {
        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter(objectMapper);

        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeout))
                .setReadTimeout(Duration.ofMillis(readTimeout))
                .messageConverters(jsonConverter)
                .build();
    }
}
