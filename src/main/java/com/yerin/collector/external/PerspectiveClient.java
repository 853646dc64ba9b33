package com.yerin.collector.external;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Perspective comment analyzer API.
 */
@Component
public class PerspectiveClient {

    private final RestClient restClient;

    public PerspectiveClient(RestClient.Builder builder,
                             @Value("${collector.perspective.api-url:https://commentanalyzer.googleapis.com}") String apiUrl,
                             @Value("${collector.perspective.timeout:10s}") Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());
        this.restClient = builder.baseUrl(apiUrl).requestFactory(requestFactory).build();
    }

    public JsonNode analyze(String apiKey, String text, List<String> attributes) throws RestClientException {
        Map<String, Object> requested = new LinkedHashMap<>();
        attributes.forEach(a -> requested.put(a, Map.of()));
        Map<String, Object> body = Map.of(
                "comment", Map.of("text", text),
                "requestedAttributes", requested
        );
        JsonNode response = restClient.post()
                .uri(uri -> uri.path("/v1alpha1/comments:analyze").queryParam("key", apiKey).build())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class);
        if (response == null) throw new RestClientException("empty Perspective response");
        return response;
    }
}
