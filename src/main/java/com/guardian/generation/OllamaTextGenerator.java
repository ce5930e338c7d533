package com.guardian.generation;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls {@code POST /api/generate} on an Ollama-compatible backend in
 * non-streaming mode and returns the {@code response} field.
 */
public class OllamaTextGenerator implements TextGenerator {

    private final RestTemplate rest;
    private final URI endpoint;
    private final String model;
    private final int maxTokens;

    public OllamaTextGenerator(RestTemplate rest, String baseUrl, String model, int maxTokens) {
        this.rest = rest;
        this.endpoint = URI.create(baseUrl.replaceAll("/+$", "") + "/api/generate");
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public String generate(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", Map.of("num_predict", maxTokens));

        RequestEntity<Map<String, Object>> request = RequestEntity.post(endpoint)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .body(body);
        ResponseEntity<JsonNode> response = rest.exchange(request, JsonNode.class);

        JsonNode payload = response.getBody();
        if (payload == null || !payload.hasNonNull("response")) {
            throw new GenerationFailedException("backend response has no 'response' field");
        }
        return payload.get("response").asText().strip();
    }
}
