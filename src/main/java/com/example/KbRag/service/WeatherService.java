package com.example.KbRag.service;

import com.example.KbRag.config.WeatherProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Current conditions (and optionally a 24h outlook) from Open-Meteo, for a city name
 * or a "latitude,longitude" pair. Reports are cached for {@code rag.weather.cache-ttl}.
 */
@Service
public class WeatherService {

    private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

    private static final Pattern COORDINATES =
            Pattern.compile("^\\s*(-?\\d{1,3}(?:\\.\\d+)?)\\s*,\\s*(-?\\d{1,3}(?:\\.\\d+)?)\\s*$");

    /** WMO weather interpretation codes. */
    private static final Map<Integer, String> WEATHER_CODES = Map.ofEntries(
            Map.entry(0, "ciel dégagé"),
            Map.entry(1, "plutôt dégagé"),
            Map.entry(2, "partiellement nuageux"),
            Map.entry(3, "couvert"),
            Map.entry(45, "brouillard"),
            Map.entry(48, "brouillard givrant"),
            Map.entry(51, "bruine légère"),
            Map.entry(53, "bruine modérée"),
            Map.entry(55, "bruine dense"),
            Map.entry(61, "pluie faible"),
            Map.entry(63, "pluie modérée"),
            Map.entry(65, "pluie forte"),
            Map.entry(71, "neige faible"),
            Map.entry(73, "neige modérée"),
            Map.entry(75, "neige forte"),
            Map.entry(80, "averses faibles"),
            Map.entry(81, "averses modérées"),
            Map.entry(82, "averses violentes"),
            Map.entry(95, "orage"),
            Map.entry(96, "orage avec grêle légère"),
            Map.entry(99, "orage avec forte grêle")
    );

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final WeatherProperties properties;
    private final ResultCache<String, String> cache;

    public WeatherService(
            @Qualifier("weatherRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            WeatherProperties properties,
            @Qualifier("weatherCache") ResultCache<String, String> cache
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.cache = cache;
    }

    /**
     * @throws IllegalArgumentException when the location is empty or cannot be geocoded
     * @throws IllegalStateException    when Open-Meteo answers with something unreadable
     */
    public String currentWeather(String location, boolean includeForecast) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Location must not be empty");
        }

        String cacheKey = location.strip().toLowerCase(Locale.ROOT) + ":" + includeForecast;
        Optional<String> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            log.info("Weather cache hit for {}", location);
            return cached.get();
        }

        Place place = resolve(location.strip());

        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .queryParam("latitude", place.latitude())
                .queryParam("longitude", place.longitude())
                .queryParam("current", "temperature_2m,relative_humidity_2m,weather_code,wind_speed_10m")
                .queryParam("temperature_unit", properties.getTemperatureUnit())
                .queryParam("wind_speed_unit", "kmh");
        if (includeForecast) {
            uri.queryParam("hourly", "temperature_2m,weather_code")
                    .queryParam("forecast_hours", 24);
        }

        JsonNode data = fetch(uri.encode().build().toUri());
        JsonNode current = data.path("current");
        if (current.isMissingNode()) {
            throw new IllegalStateException("Open-Meteo response has no current conditions");
        }

        String unit = "fahrenheit".equalsIgnoreCase(properties.getTemperatureUnit()) ? "°F" : "°C";
        StringBuilder report = new StringBuilder()
                .append(place.name()).append(" : ")
                .append(current.path("temperature_2m").asText()).append(unit).append(", ")
                .append(describe(current.path("weather_code").asInt(-1))).append(", ")
                .append("humidité ").append(current.path("relative_humidity_2m").asText()).append("%, ")
                .append("vent ").append(current.path("wind_speed_10m").asText()).append(" km/h");

        if (includeForecast) {
            JsonNode temperatures = data.path("hourly").path("temperature_2m");
            if (temperatures.isArray() && !temperatures.isEmpty()) {
                double max = Double.NEGATIVE_INFINITY;
                double min = Double.POSITIVE_INFINITY;
                for (int i = 0; i < Math.min(24, temperatures.size()); i++) {
                    double t = temperatures.get(i).asDouble();
                    max = Math.max(max, t);
                    min = Math.min(min, t);
                }
                report.append("\nPrévision 24h : max ").append(max).append(unit)
                        .append(", min ").append(min).append(unit);
            }
        }

        String formatted = report.toString();
        cache.put(cacheKey, formatted);
        log.info("Weather fetched for {}: {}", location, formatted);
        return formatted;
    }

    static String describe(int weatherCode) {
        return WEATHER_CODES.getOrDefault(weatherCode, "code météo " + weatherCode);
    }

    private Place resolve(String location) {
        Matcher coordinates = COORDINATES.matcher(location);
        if (coordinates.matches()) {
            double latitude = Double.parseDouble(coordinates.group(1));
            double longitude = Double.parseDouble(coordinates.group(2));
            String name = String.format(Locale.ROOT, "%.2f°, %.2f°", latitude, longitude);
            return new Place(name, latitude, longitude);
        }

        URI uri = UriComponentsBuilder.fromUriString(properties.getGeocodeUrl())
                .queryParam("name", location)
                .queryParam("count", 1)
                .queryParam("language", "fr")
                .queryParam("format", "json")
                .encode()
                .build()
                .toUri();

        JsonNode results = fetch(uri).path("results");
        if (!results.isArray() || results.isEmpty()) {
            throw new IllegalArgumentException("Lieu introuvable : " + location);
        }
        JsonNode first = results.get(0);
        return new Place(first.path("name").asText(location),
                first.path("latitude").asDouble(),
                first.path("longitude").asDouble());
    }

    private JsonNode fetch(URI uri) {
        String body = restTemplate.getForObject(uri, String.class);
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("Empty response from " + uri.getHost());
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable response from " + uri.getHost(), e);
        }
    }

    private record Place(String name, double latitude, double longitude) {
    }
}
