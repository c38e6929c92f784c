package com.example.KbRag.config;

import com.example.KbRag.service.ResultCache;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class WeatherConfig {

    @Bean
    public RestTemplate weatherRestTemplate(RestTemplateBuilder builder, WeatherProperties properties) {
        return builder
                .connectTimeout(properties.getTimeout())
                .readTimeout(properties.getTimeout())
                .build();
    }

    /**
     * Formatted weather reports, keyed by "location:forecast".
     */
    @Bean
    public ResultCache<String, String> weatherCache(WeatherProperties properties) {
        return new ResultCache<>("weather", properties.getCacheTtl(), properties.getCacheSize());
    }
}
