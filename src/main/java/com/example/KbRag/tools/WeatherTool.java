package com.example.KbRag.tools;

import com.example.KbRag.service.WeatherService;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Description;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.util.function.Function;

/**
 * Weather function exposed to Spring AI as a tool. Failures are reported to the model as text.
 */
@Component(WeatherToolDefinition.NAME)
@ConditionalOnProperty(prefix = "rag.weather", name = "enabled", havingValue = "true", matchIfMissing = true)
@Description("""
        Météo actuelle pour un lieu (ville ou "latitude,longitude"), avec en option la prévision
        sur 24 heures. Utilise cet outil pour toute question sur la météo, la température ou le vent.
        """)
@RequiredArgsConstructor
public class WeatherTool implements Function<WeatherTool.Request, WeatherTool.Response> {

    private static final Logger log = LoggerFactory.getLogger(WeatherTool.class);

    private final WeatherService weatherService;

    public record Request(
            @JsonPropertyDescription("Ville (ex. \"Bruxelles\") ou \"latitude,longitude\" (ex. \"50.85,4.35\")")
            String location,
            @JsonPropertyDescription("true pour ajouter la prévision des prochaines 24 heures")
            boolean includeForecast
    ) {
    }

    public record Response(String result) {
    }

    @Override
    public Response apply(Request request) {
        if (request == null || request.location() == null || request.location().isBlank()) {
            return new Response("Lieu manquant pour la recherche météo.");
        }

        String location = request.location();
        try {
            return new Response(weatherService.currentWeather(location, request.includeForecast()));
        } catch (ResourceAccessException e) {
            log.error("Weather API unreachable for {}", location, e);
            return new Response("Impossible d'obtenir la météo pour " + location + " (délai dépassé).");
        } catch (RuntimeException e) {
            log.error("Weather tool error for {}", location, e);
            return new Response("Impossible d'obtenir la météo pour " + location + " : " + e.getMessage());
        }
    }
}
