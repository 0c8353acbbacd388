package com.smartbin.infrastructure.thingspeak;

import com.fasterxml.jackson.databind.JsonNode;
import com.smartbin.domain.port.SensorFeedClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Optional;

/**
 * Cliente del feed de un canal ThingSpeak. Lee solo la última entrada
 * ({@code results=1}) y toma el peso del campo {@code field1}.
 */
@Component
@Slf4j
public class ThingSpeakClient implements SensorFeedClient {

    private final RestTemplate restTemplate;

    @Value("${thingspeak.base-url:https://api.thingspeak.com/channels}")
    private String baseUrl;

    @Value("${thingspeak.channel-id:}")
    private String channelId;

    @Value("${thingspeak.read-api-key:}")
    private String readApiKey;

    public ThingSpeakClient(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public Optional<FeedEntry> fetchLatest() {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment(channelId, "feeds.json")
                .queryParam("api_key", readApiKey)
                .queryParam("results", 1)
                .build()
                .toUri();

        JsonNode body;
        try {
            body = restTemplate.getForObject(uri, JsonNode.class);
        } catch (RestClientException e) {
            log.error("Error consultando ThingSpeak (canal {}): {}", channelId, e.getMessage());
            return Optional.empty();
        }

        return parseLatest(body);
    }

    /**
     * Extrae la primera entrada de {@code feeds}, si existe y tiene un peso
     * numérico.
     */
    Optional<FeedEntry> parseLatest(JsonNode body) {
        if (body == null || !body.path("feeds").isArray() || body.path("feeds").isEmpty()) {
            log.warn("Feed de ThingSpeak sin entradas (canal {})", channelId);
            return Optional.empty();
        }

        JsonNode feed = body.path("feeds").get(0);
        String createdAt = feed.path("created_at").asText(null);
        String field1 = feed.path("field1").asText(null);

        if (createdAt == null || field1 == null) {
            log.warn("Entrada de ThingSpeak incompleta: {}", feed);
            return Optional.empty();
        }

        double weight;
        try {
            weight = Double.parseDouble(field1.trim());
        } catch (NumberFormatException e) {
            log.warn("Valor field1 no numérico en ThingSpeak: '{}'", field1);
            return Optional.empty();
        }
        // parseDouble acepta "NaN" e "Infinity"
        if (!Double.isFinite(weight)) {
            log.warn("Valor field1 no finito en ThingSpeak: '{}'", field1);
            return Optional.empty();
        }
        return Optional.of(new FeedEntry(weight, createdAt, channelId));
    }
}
