package com.specdrift.equivalence;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingServices.class);
    static final int LOCAL_DIMENSION = 384;

    private EmbeddingServices() {
    }

    public static EmbeddingService sharedLocalModel() {
        return SharedLocalModel.INSTANCE;
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient) {
        return fromEnvironment(httpClient, System.getenv());
    }

    static EmbeddingService fromEnvironment(OkHttpClient httpClient, Map<String, String> environment) {
        EmbeddingService local = sharedLocalModel();
        String endpoint = environment.get("SPECDRIFT_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return local;
        }
        String provider = environment.getOrDefault("SPECDRIFT_EMBEDDING_PROVIDER", "custom");
        String apiKey = environment.get("SPECDRIFT_EMBEDDING_API_KEY");
        log.info("Using external embedding provider {} at {}", provider, endpoint);
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, apiKey, local);
    }

    private static final class SharedLocalModel {
        private static final EmbeddingService INSTANCE = create();

        private static EmbeddingService create() {
            EmbeddingService model = new LocalModelEmbeddingService(LOCAL_DIMENSION);
            log.debug("Initialized shared embedding model {} dimension={}", model.version(), model.dimension());
            return model;
        }
    }
}
