package com.example.KbRag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Open-Meteo lookups for the weather agent. The API needs no key.
 */
@Data
@ConfigurationProperties(prefix = "rag.weather")
public class WeatherProperties {

    private boolean enabled = true;

    private String baseUrl = "https://api.open-meteo.com/v1/forecast";
    private String geocodeUrl = "https://geocoding-api.open-meteo.com/v1/search";

    /** "celsius" or "fahrenheit". */
    private String temperatureUnit = "celsius";

    private Duration timeout = Duration.ofSeconds(10);
    private Duration cacheTtl = Duration.ofMinutes(15);
    private long cacheSize = 200;

    private String systemPromptLocation = "classpath:prompts/weather_system_prompt.txt";
}
