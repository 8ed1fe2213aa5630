package com.specdrift.equivalence;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(ExternalProviderEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String provider;
    private final String apiKey;
    private final EmbeddingService fallback;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String apiKey,
            EmbeddingService fallback) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.provider = provider;
        this.apiKey = apiKey;
        this.fallback = fallback;
    }

    @Override
    public float[] embed(String text) {
        try {
            String payload = mapper.writeValueAsString(Map.of("input", text == null ? "" : text));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    log.warn("Embedding provider {} answered HTTP {}; using {}", provider, response.code(), fallback.version());
                    return fallback.embed(text);
                }
                JsonNode vectorNode = mapper.readTree(body.string()).path("embedding");
                if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                    log.warn("Embedding provider {} returned no embedding array; using {}", provider, fallback.version());
                    return fallback.embed(text);
                }
                float[] vector = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    vector[i] = (float) vectorNode.get(i).asDouble();
                }
                return vector;
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Embedding provider {} at {} failed; using {}", provider, endpoint, fallback.version(), e);
            return fallback.embed(text);
        }
    }

    @Override
    public int dimension() {
        return fallback.dimension();
    }

    @Override
    public String version() {
        return "external-" + provider + "-v1";
    }
}
